package io.snapcheck.rewrite;

import io.snapcheck.model.Target;

/**
 * Reads and rewrites the source text of an assertion call site.
 */
public interface CallSiteRewriter {
    /**
     * @throws IllegalArgumentException when {@code code} holds no recognizable call site
     */
    CallSite parse(String code);

    /**
     * Returns {@code code} with its expectation replaced by {@code pattern}, in the form {@code target} asks for.
     */
    String rewrite(String code, String pattern, Target target);
}
