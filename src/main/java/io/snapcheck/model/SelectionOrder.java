package io.snapcheck.model;

/**
 * Order in which eligible pending requests are picked by the coordinator.
 */
public enum SelectionOrder {
    LIFO,
    FIFO;

    public static SelectionOrder fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return LIFO;
        }
        for (SelectionOrder value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown selection order: " + raw);
    }
}
