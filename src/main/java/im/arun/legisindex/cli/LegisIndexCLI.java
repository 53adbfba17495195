package im.arun.legisindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.legisindex.config.ConfigLoader;
import im.arun.legisindex.config.LegisIndexConfig;
import im.arun.legisindex.exception.LegislationParseException;
import im.arun.legisindex.model.Language;
import im.arun.legisindex.model.LegislationFile;
import im.arun.legisindex.model.LegislationType;
import im.arun.legisindex.model.ParsedDocument;
import im.arun.legisindex.service.BatchParseService;
import im.arun.legisindex.service.BatchResult;
import im.arun.legisindex.service.DocumentSink;
import im.arun.legisindex.service.LegislationFileScanner;
import im.arun.legisindex.service.LegislationParser;
import im.arun.legisindex.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for LegisIndex using Picocli.
 *
 * <p>Given a file, parses it and prints or writes its JSON. Given a corpus directory,
 * parses every file found under it and writes one JSON file per document to
 * {@code <output>/<language>/<id>.json}.
 */
@Command(
    name = "legisindex",
    description = "Parse Justice Canada legislation XML into sections, content trees, defined terms and references",
    mixinStandardHelpOptions = true,
    version = "LegisIndex 1.0"
)
public class LegisIndexCLI implements Callable<Integer> {

    @Option(names = {"--input"}, description = "XML file, or corpus directory holding eng/ and fra/", required = true)
    private String input;

    @Option(names = {"--type"}, description = "Only parse this document type in a corpus (act/regulation)")
    private String type;

    @Option(names = {"--language"}, description = "Document language (en/fr); read from the file when omitted")
    private String language;

    @Option(names = {"--limit"}, description = "Maximum number of corpus files to parse")
    private Integer limit;

    @Option(names = {"--output"}, description = "Output JSON file (single file) or directory (corpus)")
    private String outputPath;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--threads"}, description = "Worker threads for corpus parsing")
    private Integer threads;

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public Integer call() throws Exception {
        Path inputPath = Paths.get(input);
        if (!Files.exists(inputPath)) {
            System.err.println("Error: input not found: " + input);
            return 1;
        }

        Language lang;
        LegislationType docType;
        try {
            lang = parseLanguage(language);
            docType = type != null ? LegislationType.fromValue(type) : null;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (threads != null) {
            overrides.put("threads", threads);
        }
        LegisIndexConfig config = new ConfigLoader(configPath).load(overrides);
        LegislationParser parser = new LegislationParser(config);

        if (Files.isDirectory(inputPath)) {
            return parseCorpus(inputPath, docType, lang, config, parser);
        }
        return parseSingle(inputPath, lang, parser);
    }

    private int parseSingle(Path file, Language lang, LegislationParser parser) throws IOException {
        ParsedDocument document;
        try {
            document = parser.parseFile(file, lang);
        } catch (LegislationParseException e) {
            System.err.println("Error parsing " + file + ": " + e.getMessage());
            return 1;
        }

        String json = mapper.writeValueAsString(document);
        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), json);
            System.out.println("Output written to: " + outputPath);
        } else {
            System.out.println(json);
        }
        return 0;
    }

    private int parseCorpus(Path base, LegislationType docType, Language lang, LegisIndexConfig config,
                            LegislationParser parser) throws IOException {
        List<LegislationFile> files = new LegislationFileScanner().scan(base, docType, limit, lang);
        if (files.isEmpty()) {
            System.err.println("Error: no legislation files found under " + base);
            return 1;
        }

        ExecutorProvider.configure(config.getThreads());
        Path outputDir = outputPath != null ? Paths.get(outputPath) : null;
        DocumentSink sink = (file, document) -> {
            if (outputDir != null) {
                Path target = outputDir.resolve(file.getLanguage().getCode()).resolve(file.getId() + ".json");
                Files.createDirectories(target.getParent());
                mapper.writeValue(target.toFile(), document);
            }
        };

        System.out.println("LegisIndex - parsing " + files.size() + " files from " + base);
        BatchResult result = new BatchParseService(parser, config).run(files, sink);
        System.out.println("Parsed " + result.getSucceeded() + " of " + result.getTotal() + " files");
        for (BatchResult.Failure failure : result.getFailures()) {
            System.err.println("  FAILED " + failure.getPath() + ": " + failure.getMessage());
        }
        return result.hasFailures() ? 1 : 0;
    }

    private static Language parseLanguage(String value) {
        if (value == null) {
            return null;
        }
        switch (value.toLowerCase()) {
            case "en":
                return Language.EN;
            case "fr":
                return Language.FR;
            default:
                throw new IllegalArgumentException("Unknown language: " + value);
        }
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new LegisIndexCLI()).execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
