package com.pagewright.core.compiler;

import com.pagewright.core.rep.Representation;

/**
 * Compilation steps for a representation, typically a chain of
 * {@code filter}, {@code layout} and {@code snapshot} calls.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * CompilationRule rule = rep -> {
 *     rep.filter("markdown");
 *     rep.layout(defaultLayout, "erb", Map.of());
 * };
 * }</pre>
 */
@FunctionalInterface
public interface CompilationRule {

    /**
     * Applies the rule.
     *
     * @param rep representation to compile
     */
    void apply(Representation rep);
}
