package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.CellAddress;

/**
 * Thrown while evaluating a formula that reaches a cell whose evaluation
 * is already in progress (a cell referencing itself, or a multi-cell loop).
 * Never escapes the evaluator: it becomes a CIRCULAR_REFERENCE result.
 */
public class CircularReferenceException extends RuntimeException {
    // The in-progress cell the loop leads back to
    private final CellAddress cycleStart;

    public CircularReferenceException(String message, CellAddress cycleStart) {
        super(message);
        this.cycleStart = cycleStart;
    }

    public CellAddress getCycleStart() {
        return cycleStart;
    }
}
