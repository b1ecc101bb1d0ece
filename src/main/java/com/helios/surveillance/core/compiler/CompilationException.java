package com.helios.surveillance.core.compiler;

/**
 * Thrown when a filter tree cannot be compiled.
 *
 * A RuntimeException so callers compiling many profiles can catch it per profile
 * without threading a checked exception through the predicate builders.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
