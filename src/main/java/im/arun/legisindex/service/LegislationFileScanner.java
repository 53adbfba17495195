package im.arun.legisindex.service;

import im.arun.legisindex.model.Language;
import im.arun.legisindex.model.LegislationFile;
import im.arun.legisindex.model.LegislationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds legislation files in a checkout of the Justice Canada XML corpus, which keeps
 * one directory per language and document type:
 * {@code eng/acts}, {@code eng/regulations}, {@code fra/lois} and {@code fra/reglements}.
 */
public class LegislationFileScanner {
    private static final Logger logger = LoggerFactory.getLogger(LegislationFileScanner.class);

    private static final List<Source> SOURCES = List.of(
            new Source("eng/acts", LegislationType.ACT, Language.EN),
            new Source("eng/regulations", LegislationType.REGULATION, Language.EN),
            new Source("fra/lois", LegislationType.ACT, Language.FR),
            new Source("fra/reglements", LegislationType.REGULATION, Language.FR));

    /**
     * Lists {@code *.xml} files, sorted by name within each directory.
     *
     * @param type     only this document type, or null for both
     * @param limit    maximum number of files over all directories, or null for no limit
     * @param language only this language, or null for both
     */
    public List<LegislationFile> scan(Path base, LegislationType type, Integer limit, Language language)
            throws IOException {
        List<LegislationFile> files = new ArrayList<>();
        for (Source source : SOURCES) {
            if ((type != null && type != source.type) || (language != null && language != source.language)) {
                continue;
            }
            Path dir = base.resolve(source.directory);
            if (!Files.isDirectory(dir)) {
                logger.debug("Skipping missing directory {}", dir);
                continue;
            }
            for (Path path : xmlFiles(dir)) {
                if (limit != null && files.size() >= limit) {
                    return files;
                }
                String name = path.getFileName().toString();
                files.add(new LegislationFile(path, source.type, source.language,
                        name.substring(0, name.length() - ".xml".length())));
            }
        }
        logger.info("Found {} legislation files under {}", files.size(), base);
        return files;
    }

    private List<Path> xmlFiles(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".xml"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static final class Source {
        private final String directory;
        private final LegislationType type;
        private final Language language;

        private Source(String directory, LegislationType type, Language language) {
            this.directory = directory;
            this.type = type;
            this.language = language;
        }
    }
}
