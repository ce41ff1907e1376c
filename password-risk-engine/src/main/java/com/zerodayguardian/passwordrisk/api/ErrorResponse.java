package com.zerodayguardian.passwordrisk.api;

/**
 * Error body for rejected requests.
 *
 * @author Naveed Gung
 */
public record ErrorResponse(String code, String message) {
}
