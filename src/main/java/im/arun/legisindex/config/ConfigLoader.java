package im.arun.legisindex.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final LegisIndexConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private LegisIndexConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), LegisIndexConfig.class);
                }
                logger.warn("Config file {} not found, falling back to bundled config.yaml", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, LegisIndexConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new LegisIndexConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new LegisIndexConfig();
        }
    }

    public LegisIndexConfig load() {
        return load(null);
    }

    public LegisIndexConfig load(Map<String, Object> userOptions) {
        LegisIndexConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "cross_reference_types":
                    case "crossReferenceTypes":
                        config.setCrossReferenceTypes(parseList(value));
                        break;
                    case "emphasis_pairing":
                    case "emphasisPairing":
                        config.setEmphasisPairing(parseBoolean(value));
                        break;
                    case "emphasis_max_words":
                    case "emphasisMaxWords":
                        config.setEmphasisMaxWords(parseInt(value));
                        break;
                    case "emphasis_max_length":
                    case "emphasisMaxLength":
                        config.setEmphasisMaxLength(parseInt(value));
                        break;
                    case "heading_records":
                    case "headingRecords":
                        config.setHeadingRecords(parseBoolean(value));
                        break;
                    case "threads":
                        config.setThreads(parseInt(value));
                        break;
                    case "per_file_timeout_seconds":
                    case "perFileTimeoutSeconds":
                        config.setPerFileTimeoutSeconds(parseInt(value));
                        break;
                    case "log_directory":
                    case "logDirectory":
                        if (value instanceof String) config.setLogDirectory((String) value);
                        break;
                    case "write_run_log":
                    case "writeRunLog":
                        config.setWriteRunLog(parseBoolean(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (IllegalArgumentException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private int parseInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            return Integer.parseInt(((String) value).trim());
        }
        throw new IllegalArgumentException("not a number: " + value);
    }

    private List<String> parseList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                result.add(String.valueOf(item).trim());
            }
        } else if (value instanceof String) {
            for (String item : ((String) value).split(",")) {
                if (!item.isBlank()) {
                    result.add(item.trim());
                }
            }
        } else {
            throw new IllegalArgumentException("not a list: " + value);
        }
        return result;
    }

    private LegisIndexConfig copyConfig(LegisIndexConfig source) {
        LegisIndexConfig copy = new LegisIndexConfig();
        copy.setCrossReferenceTypes(new ArrayList<>(source.getCrossReferenceTypes()));
        copy.setEmphasisPairing(source.isEmphasisPairing());
        copy.setEmphasisMaxWords(source.getEmphasisMaxWords());
        copy.setEmphasisMaxLength(source.getEmphasisMaxLength());
        copy.setHeadingRecords(source.isHeadingRecords());
        copy.setThreads(source.getThreads());
        copy.setPerFileTimeoutSeconds(source.getPerFileTimeoutSeconds());
        copy.setLogDirectory(source.getLogDirectory());
        copy.setWriteRunLog(source.isWriteRunLog());
        return copy;
    }
}
