package io.crontask.core.history;

import java.io.IOException;

public interface RunHistoryStore {
    int MAX_LIMIT = 200;

    void append(ExecutionRecord record) throws IOException;

    /** Newest first; records with the same run time come back in reverse insertion order. */
    RunPage query(String jobId, int limit, int offset) throws IOException;

    static void checkRange(int limit, int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidQueryRangeException("limit must be 1-" + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new InvalidQueryRangeException("offset must be >= 0");
        }
    }
}
