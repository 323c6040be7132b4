package io.snapcheck.rewrite;

/**
 * Parsed form of an {@code AutoAssert.that(...)} call site.
 *
 * @param prefix          text before the call chain, indentation included
 * @param valueExpression the expression passed to {@code that(...)}
 * @param expected        decoded expectation passed to {@code matches(...)}, {@code null} when absent
 * @param suffix          text after the call chain, usually {@code ";"}
 */
public record CallSite(
        String prefix,
        String valueExpression,
        String expected,
        String suffix
) {
    public boolean hasExpectation() {
        return expected != null;
    }

    public String indent() {
        int i = 0;
        while (i < prefix.length() && (prefix.charAt(i) == ' ' || prefix.charAt(i) == '\t')) {
            i++;
        }
        return prefix.substring(0, i);
    }
}
