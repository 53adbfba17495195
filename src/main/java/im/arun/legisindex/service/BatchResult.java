package im.arun.legisindex.service;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a batch run. Failed files do not stop the batch; they are listed here.
 */
@Value
public class BatchResult {
    int total;
    int succeeded;
    List<Failure> failures;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Value
    public static class Failure {
        String path;
        String message;
    }
}
