package com.querytrace.engine.session;

/** Raised by a {@link ValueRenderer} that cannot convert a value to text. */
public class RenderException extends Exception {
    public RenderException(String message) { super(message); }
    public RenderException(String message, Throwable cause) { super(message, cause); }
}
