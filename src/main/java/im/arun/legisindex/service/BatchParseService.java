package im.arun.legisindex.service;

import im.arun.legisindex.config.LegisIndexConfig;
import im.arun.legisindex.exception.LegislationParseException;
import im.arun.legisindex.model.LegislationFile;
import im.arun.legisindex.model.ParsedDocument;
import im.arun.legisindex.util.ExecutorProvider;
import im.arun.legisindex.util.JsonLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Parses many files in parallel on the shared worker pool. Each file is an independent
 * task; a malformed file, an I/O error or a timeout is logged and recorded, and the
 * remaining files carry on.
 */
public class BatchParseService {
    private static final Logger logger = LoggerFactory.getLogger(BatchParseService.class);

    private final LegislationParser parser;
    private final LegisIndexConfig config;
    private final ExecutorService executor;

    public BatchParseService(LegislationParser parser, LegisIndexConfig config) {
        this(parser, config, ExecutorProvider.getExecutor());
    }

    public BatchParseService(LegislationParser parser, LegisIndexConfig config, ExecutorService executor) {
        this.parser = parser;
        this.config = config;
        this.executor = executor;
    }

    public BatchResult run(List<LegislationFile> files, DocumentSink sink) {
        JsonLogger runLog = config.isWriteRunLog()
                ? new JsonLogger(Paths.get(config.getLogDirectory()), "batch")
                : null;
        List<BatchResult.Failure> failures = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger succeeded = new AtomicInteger();

        logger.info("Parsing {} files", files.size());
        if (runLog != null) {
            runLog.info("Batch started", Map.of("files", files.size()));
        }

        List<CompletableFuture<Void>> futures = files.stream()
                .map(file -> parseAsync(file)
                        .thenAccept(document -> deliver(file, document, sink))
                        .<Void>handle((ignored, error) -> {
                            if (error == null) {
                                succeeded.incrementAndGet();
                                return null;
                            }
                            String message = describe(unwrap(error));
                            logger.warn("Failed to parse {}: {}", file.getPath(), message);
                            failures.add(new BatchResult.Failure(file.getPath().toString(), message));
                            if (runLog != null) {
                                Map<String, Object> fields = new LinkedHashMap<>();
                                fields.put("file", file.getPath().toString());
                                fields.put("error", message);
                                runLog.error("Parse failed", fields);
                            }
                            return null;
                        }))
                .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        BatchResult result = new BatchResult(files.size(), succeeded.get(), List.copyOf(failures));
        logger.info("Parsed {} of {} files, {} failed", result.getSucceeded(), result.getTotal(),
                result.getFailures().size());
        if (runLog != null) {
            runLog.info("Batch finished", Map.of(
                    "files", result.getTotal(),
                    "succeeded", result.getSucceeded(),
                    "failed", result.getFailures().size()));
        }
        return result;
    }

    private CompletableFuture<ParsedDocument> parseAsync(LegislationFile file) {
        CompletableFuture<ParsedDocument> future = CompletableFuture.supplyAsync(() -> parse(file), executor);
        int timeout = config.getPerFileTimeoutSeconds();
        // The timeout only abandons the result; the worker finishes the file in the background
        return timeout > 0 ? future.orTimeout(timeout, TimeUnit.SECONDS) : future;
    }

    private ParsedDocument parse(LegislationFile file) {
        try {
            ParsedDocument document = parser.parseFile(file.getPath(), file.getLanguage());
            logger.debug("Parsed {}: {} sections", file.getPath(), document.getSections().size());
            return document;
        } catch (IOException | LegislationParseException e) {
            throw new CompletionException(e);
        }
    }

    private void deliver(LegislationFile file, ParsedDocument document, DocumentSink sink) {
        try {
            sink.accept(file, document);
        } catch (IOException e) {
            throw new CompletionException(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Timed out after " + config.getPerFileTimeoutSeconds() + "s";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
