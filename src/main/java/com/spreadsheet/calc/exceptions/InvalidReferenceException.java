package com.spreadsheet.calc.exceptions;

/**
 * Thrown when text that should be an A1-style reference is malformed,
 * for example "1A", "A0" or "A$".
 */
public class InvalidReferenceException extends RuntimeException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
