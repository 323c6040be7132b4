package io.snapcheck.model;

/**
 * How a decision is obtained for an assertion.
 */
public enum Action {
    PROMPT("prompt"),
    ACCEPT("accept"),
    REJECT("reject");

    private final String label;

    Action(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Action fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PROMPT;
        }
        for (Action value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.label.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown action: " + raw);
    }
}
