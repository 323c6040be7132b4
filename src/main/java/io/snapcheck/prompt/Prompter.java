package io.snapcheck.prompt;

import io.snapcheck.model.Decision;

/**
 * Asks for a decision on one proposed change. Only ever invoked from the coordinator thread.
 */
public interface Prompter {
    Decision prompt(PromptView view);
}
