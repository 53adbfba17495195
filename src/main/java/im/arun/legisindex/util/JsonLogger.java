package im.arun.legisindex.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates per-file batch outcomes and writes them as a JSON array to
 * {@code <logDirectory>/<runName>_<timestamp>.json}. The file is rewritten after every
 * entry so an interrupted run still leaves a usable log.
 */
public class JsonLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonLogger.class);
    private final Path logPath;
    private final List<Map<String, Object>> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonLogger(Path logDirectory, String runName) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String logFileName = String.format("%s_%s.json", sanitize(runName), timestamp);

        try {
            Files.createDirectories(logDirectory);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}", logDirectory, e);
        }

        this.logPath = logDirectory.resolve(logFileName);
    }

    private String sanitize(String runName) {
        if (runName == null || runName.isBlank()) {
            return "run";
        }
        return runName.replaceAll("[/\\\\:\\s]+", "-");
    }

    public synchronized void info(String message, Map<String, ?> fields) {
        log("INFO", message, fields);
    }

    public synchronized void error(String message, Map<String, ?> fields) {
        log("ERROR", message, fields);
    }

    public synchronized List<Map<String, Object>> getEntries() {
        return List.copyOf(logData);
    }

    public Path getLogPath() {
        return logPath;
    }

    private void log(String level, String message, Map<String, ?> fields) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("message", message);
        if (fields != null) {
            entry.putAll(fields);
        }
        logData.add(entry);
        writeToFile();
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), logData);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }
}
