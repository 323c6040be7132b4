package io.snapcheck.model;

/**
 * Form regenerated call-site code takes after an accepted decision.
 */
public enum Target {
    AUTO_ASSERT("auto_assert"),
    ASSERT("assert");

    private final String label;

    Target(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Target fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO_ASSERT;
        }
        String value = raw.trim().replace('-', '_');
        for (Target target : values()) {
            if (target.name().equalsIgnoreCase(value) || target.label.equalsIgnoreCase(value)) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unknown target: " + raw);
    }
}
