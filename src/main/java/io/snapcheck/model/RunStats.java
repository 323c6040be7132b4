package io.snapcheck.model;

import java.util.ArrayList;
import java.util.List;

public record RunStats(
        long total,
        long newCount,
        long updated,
        long rejected,
        long skipped
) {
    public static final RunStats EMPTY = new RunStats(0L, 0L, 0L, 0L, 0L);

    /**
     * Renders non-zero counters in the order new, updated, rejected, skipped,
     * e.g. {@code "2 new, 1 updated, 3 skipped"}. Empty when every counter is zero.
     */
    public String summary() {
        List<String> parts = new ArrayList<>();
        if (newCount != 0L) {
            parts.add(newCount + " new");
        }
        if (updated != 0L) {
            parts.add(updated + " updated");
        }
        if (rejected != 0L) {
            parts.add(rejected + " rejected");
        }
        if (skipped != 0L) {
            parts.add(skipped + " skipped");
        }
        return String.join(", ", parts);
    }
}
