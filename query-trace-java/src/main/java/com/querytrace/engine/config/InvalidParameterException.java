package com.querytrace.engine.config;

/**
 * Thrown when a trace setting is given a value outside its accepted range.
 * The setting that was being changed keeps its previous value.
 */
public class InvalidParameterException extends RuntimeException {
    public InvalidParameterException(String message) { super(message); }
}
