package im.arun.legisindex.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonLogger Tests")
class JsonLoggerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should write every entry to the run file")
    void shouldWriteEntries_whenLogging() throws Exception {
        JsonLogger logger = new JsonLogger(tempDir.resolve("logs"), "batch run");

        logger.info("Batch started", Map.of("files", 2));
        logger.error("Parse failed", Map.of("file", "a.xml", "error", "Unknown document type"));

        assertThat(logger.getLogPath().getFileName().toString()).startsWith("batch-run_").endsWith(".json");
        assertThat(Files.exists(logger.getLogPath())).isTrue();
        JsonNode json = new ObjectMapper().readTree(logger.getLogPath().toFile());
        assertThat(json).hasSize(2);
        assertThat(json.get(0).get("level").asText()).isEqualTo("INFO");
        assertThat(json.get(0).get("files").asInt()).isEqualTo(2);
        assertThat(json.get(1).get("error").asText()).isEqualTo("Unknown document type");
        assertThat(logger.getEntries()).hasSize(2);
    }
}
