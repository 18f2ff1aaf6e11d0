package com.querytrace.engine.session;

/**
 * Host value-to-text conversion used for bind values. Never called for null parameters.
 */
@FunctionalInterface
public interface ValueRenderer {

    String toText(BindParameter parameter) throws RenderException;

    static ValueRenderer stringValueOf() {
        return p -> String.valueOf(p.value());
    }
}
