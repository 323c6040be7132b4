package io.snapcheck.prompt;

import io.snapcheck.model.Action;
import io.snapcheck.model.Decision;

/**
 * Answers every prompt with the same decision, for unattended runs.
 */
public final class PolicyPrompter implements Prompter {
    public static final PolicyPrompter ACCEPT_ALL = new PolicyPrompter(Decision.ACCEPT);
    public static final PolicyPrompter REJECT_ALL = new PolicyPrompter(Decision.REJECT);

    private final Decision decision;

    private PolicyPrompter(Decision decision) {
        this.decision = decision;
    }

    public static Prompter forAction(Action action, Prompter interactive) {
        return switch (action) {
            case ACCEPT -> ACCEPT_ALL;
            case REJECT -> REJECT_ALL;
            case PROMPT -> interactive;
        };
    }

    @Override
    public Decision prompt(PromptView view) {
        return decision;
    }
}
