package com.libragraph.cadence.core.error;

import java.util.List;

/**
 * Caller-supplied input was rejected. Carries the names of the offending fields
 * so that the caller can be told exactly what to fix.
 */
public class ValidationException extends RuntimeException {

    private final List<String> fields;

    public ValidationException(String message, List<String> fields) {
        super(message);
        this.fields = List.copyOf(fields);
    }

    public ValidationException(String message, String field) {
        this(message, List.of(field));
    }

    public List<String> fields() {
        return fields;
    }
}
