package im.arun.legisindex.service;

import im.arun.legisindex.model.LegislationFile;
import im.arun.legisindex.model.ParsedDocument;

import java.io.IOException;

/**
 * Receives each successfully parsed document of a batch. Called from worker threads,
 * so implementations must be thread-safe.
 */
@FunctionalInterface
public interface DocumentSink {
    void accept(LegislationFile file, ParsedDocument document) throws IOException;
}
