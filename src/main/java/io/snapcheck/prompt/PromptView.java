package io.snapcheck.prompt;

import io.snapcheck.model.Assertion;
import io.snapcheck.model.DecisionRecord;

import java.util.List;

public record PromptView(
        Assertion assertion,
        String original,
        String proposed,
        String diff,
        int candidateIndex,
        int candidateCount,
        List<DecisionRecord> history
) {
    public boolean hasAlternatives() {
        return candidateCount > 1;
    }
}
