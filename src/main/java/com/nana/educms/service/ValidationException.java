package com.nana.educms.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ValidationException — Service Layer Checked Exception
 *
 * <p>Raised when a student submitted for create or update breaks one or more
 * business rules. Every violated rule is reported at once: the exception
 * carries a {@code Map<String, String>} of field name to message, in the
 * order the rules were checked (required fields and length limits first,
 * uniqueness last).
 *
 * <p>FIELD KEY CONVENTION:
 * Keys are {@link com.nana.educms.domain.Student} property names
 * ({@code "studentId"}, {@code "email"}, {@code "phoneNumber"}, ...) so a
 * caller can map each error back to the input that caused it.
 *
 * <p>Checked because the caller is expected to recover by correcting the
 * input; nothing has been staged or saved when it is thrown.
 */
public class ValidationException extends Exception {

    /** Field name → message, insertion-ordered. */
    private final Map<String, String> fieldErrors;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /**
     * @param fieldErrors map of field name to error message; must not be null
     */
    public ValidationException(Map<String, String> fieldErrors) {
        super(buildMessage(fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(
                new LinkedHashMap<>(fieldErrors));
    }

    /**
     * Single-field failure.
     *
     * @param fieldName    the name of the invalid field
     * @param errorMessage the human-readable error description
     */
    public ValidationException(String fieldName, String errorMessage) {
        super(fieldName + ": " + errorMessage);
        Map<String, String> map = new LinkedHashMap<>();
        map.put(fieldName, errorMessage);
        this.fieldErrors = Collections.unmodifiableMap(map);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return an unmodifiable, insertion-ordered map of field name → error message */
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public boolean hasError(String fieldName) {
        return fieldErrors.containsKey(fieldName);
    }

    /**
     * @param fieldName the field to look up
     * @return the error message for that field, or null if it has none
     */
    public String getError(String fieldName) {
        return fieldErrors.get(fieldName);
    }

    public boolean isEmpty() {
        return fieldErrors.isEmpty();
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    /**
     * Joins all field errors into one line for {@link Exception#getMessage()},
     * e.g. {@code "Validation failed: name: Name is required.; email: Email is required."}.
     */
    private static String buildMessage(Map<String, String> errors) {
        if (errors == null || errors.isEmpty()) {
            return "Validation failed with no specific field errors.";
        }
        StringBuilder sb = new StringBuilder("Validation failed: ");
        errors.forEach((field, msg) ->
                sb.append(field).append(": ").append(msg).append("; "));
        sb.setLength(sb.length() - 2);
        return sb.toString();
    }
}
