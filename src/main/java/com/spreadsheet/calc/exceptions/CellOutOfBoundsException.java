package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a caller addresses a cell outside the sheet's rows and columns.
 * For example, "Cell AA1 is outside the 100x26 sheet".
 */
public class CellOutOfBoundsException extends RuntimeException {
    public CellOutOfBoundsException(String message) {
        super(message);
    }
}
