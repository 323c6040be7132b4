package io.snapcheck.staging;

import java.util.List;
import java.util.Set;

public record CommitResult(
        List<String> committed,
        Set<String> notSaved,
        boolean dryRun
) {
    public boolean ok() {
        return notSaved.isEmpty();
    }
}
