package im.arun.legisindex.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.legisindex.Fixtures;
import im.arun.legisindex.util.ExecutorProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LegisIndexCLI Tests")
class LegisIndexCLITest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @AfterEach
    void tearDown() {
        ExecutorProvider.shutdown();
    }

    @Test
    @DisplayName("should write the parsed document of a single file")
    void shouldWriteJson_whenInputIsAFile() throws IOException {
        Path input = write("act-en.xml", "A-0.6.xml");
        Path output = tempDir.resolve("A-0.6.json");

        int exitCode = execute("--input", input.toString(), "--output", output.toString());

        assertThat(exitCode).isZero();
        JsonNode json = mapper.readTree(output.toFile());
        assertThat(json.get("type").asText()).isEqualTo("act");
        assertThat(json.get("act").get("actId").asText()).isEqualTo("A-0.6");
        assertThat(json.get("sections")).hasSize(18);
    }

    @Test
    @DisplayName("should parse a corpus directory and report failed files")
    void shouldWriteOneFilePerDocument_whenInputIsACorpus() throws IOException {
        Path corpus = tempDir.resolve("corpus");
        Files.createDirectories(corpus.resolve("eng/acts"));
        Files.createDirectories(corpus.resolve("fra/lois"));
        Files.writeString(corpus.resolve("eng/acts/A-0.6.xml"), Fixtures.read("act-en.xml"));
        Files.writeString(corpus.resolve("eng/acts/B-1.xml"), Fixtures.read("invalid-root.xml"));
        Files.writeString(corpus.resolve("fra/lois/A-0.6.xml"), Fixtures.read("act-fr.xml"));
        Path config = tempDir.resolve("config.yaml");
        Files.writeString(config, "log_directory: " + tempDir.resolve("logs") + "\nper_file_timeout_seconds: 30\n");
        Path output = tempDir.resolve("out");

        int exitCode = execute("--input", corpus.toString(), "--output", output.toString(),
                "--config", config.toString(), "--threads", "2");

        assertThat(exitCode).isEqualTo(1);
        assertThat(output.resolve("en/A-0.6.json")).exists();
        assertThat(output.resolve("fr/A-0.6.json")).exists();
        assertThat(output.resolve("en/B-1.json")).doesNotExist();
        assertThat(mapper.readTree(output.resolve("fr/A-0.6.json").toFile()).get("language").asText())
                .isEqualTo("fr");
    }

    @Test
    @DisplayName("should only parse the requested language of a corpus")
    void shouldFilterCorpus_whenLanguageIsGiven() throws IOException {
        Path corpus = tempDir.resolve("corpus");
        Files.createDirectories(corpus.resolve("eng/acts"));
        Files.createDirectories(corpus.resolve("fra/lois"));
        Files.writeString(corpus.resolve("eng/acts/B-1.xml"), Fixtures.read("invalid-root.xml"));
        Files.writeString(corpus.resolve("fra/lois/A-0.6.xml"), Fixtures.read("act-fr.xml"));
        Path config = tempDir.resolve("config.yaml");
        Files.writeString(config, "write_run_log: false\n");
        Path output = tempDir.resolve("out");

        int exitCode = execute("--input", corpus.toString(), "--language", "fr", "--output", output.toString(),
                "--config", config.toString());

        assertThat(exitCode).isZero();
        assertThat(output.resolve("fr/A-0.6.json")).exists();
    }

    @Test
    @DisplayName("should fail on a missing input, an unknown language or an invalid document")
    void shouldReturnError_whenArgumentsOrInputAreInvalid() throws IOException {
        Path invalid = write("invalid-root.xml", "bill.xml");
        Path valid = write("act-en.xml", "A-0.6.xml");

        assertThat(execute("--input", tempDir.resolve("missing.xml").toString())).isEqualTo(1);
        assertThat(execute("--input", valid.toString(), "--language", "de")).isEqualTo(1);
        assertThat(execute("--input", invalid.toString())).isEqualTo(1);
        assertThat(execute()).isEqualTo(2);
    }

    private int execute(String... args) {
        return new CommandLine(new LegisIndexCLI()).execute(args);
    }

    private Path write(String fixture, String name) throws IOException {
        Path path = tempDir.resolve(name);
        Files.writeString(path, Fixtures.read(fixture));
        return path;
    }
}
