package io.snapcheck.storage;

import io.snapcheck.model.DecisionRecord;
import io.snapcheck.model.PatchOutcome;

import java.util.List;

/**
 * Per call-site record of past reconciliation outcomes.
 */
public interface DecisionHistory {
    DecisionHistory NONE = new DecisionHistory() {
        @Override
        public List<DecisionRecord> recent(String file, String testName, int limit) {
            return List.of();
        }

        @Override
        public void record(PatchOutcome outcome, String pattern, long seq) {
        }
    };

    List<DecisionRecord> recent(String file, String testName, int limit);

    void record(PatchOutcome outcome, String pattern, long seq);
}
