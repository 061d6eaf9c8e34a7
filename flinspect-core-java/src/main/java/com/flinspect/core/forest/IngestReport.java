package com.flinspect.core.forest;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-file outcome of one {@link ParseForest#ingest} run, in input order.
 */
public record IngestReport(List<FileOutcome> outcomes) {

    /**
     * @param message null on success, the failure reason otherwise
     */
    public record FileOutcome(String file, boolean succeeded, int units, int callSites, String message) {

        static FileOutcome success(String file, int units, int callSites) {
            return new FileOutcome(file, true, units, callSites, null);
        }

        static FileOutcome failure(String file, String message) {
            return new FileOutcome(file, false, 0, 0, message);
        }
    }

    public IngestReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<FileOutcome> succeeded() {
        List<FileOutcome> result = new ArrayList<>();
        for (FileOutcome o : outcomes) {
            if (o.succeeded()) result.add(o);
        }
        return result;
    }

    public List<FileOutcome> failed() {
        List<FileOutcome> result = new ArrayList<>();
        for (FileOutcome o : outcomes) {
            if (!o.succeeded()) result.add(o);
        }
        return result;
    }

    public boolean allSucceeded() {
        return failed().isEmpty();
    }
}
