package io.crontask.core.history;

import java.util.List;

public record RunPage(
    long total,
    int limit,
    int offset,
    List<ExecutionRecord> items
) {
    public RunPage {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
