package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a formula cannot be tokenized or parsed, calls a function
 * with the wrong arguments, or applies arithmetic to a non-number.
 */
public class FormulaException extends RuntimeException {
    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
