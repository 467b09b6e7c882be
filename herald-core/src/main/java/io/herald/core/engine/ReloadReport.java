package io.herald.core.engine;

import java.util.List;

public record ReloadReport(int loaded, List<Long> failedIds) {
    public ReloadReport {
        failedIds = List.copyOf(failedIds);
    }

    public int failed() {
        return failedIds.size();
    }
}
