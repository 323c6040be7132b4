package io.snapcheck.diff;

/**
 * Renders a human-readable diff between the current and proposed source of a call site.
 */
public interface DiffRenderer {
    String render(String before, String after);
}
