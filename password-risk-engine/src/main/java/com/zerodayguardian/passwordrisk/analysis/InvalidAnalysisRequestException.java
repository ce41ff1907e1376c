package com.zerodayguardian.passwordrisk.analysis;

/**
 * Thrown when an analysis request is structurally invalid. Password content
 * itself is never invalid.
 *
 * @author Naveed Gung
 */
public class InvalidAnalysisRequestException extends RuntimeException {

    private final String field;

    public InvalidAnalysisRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
