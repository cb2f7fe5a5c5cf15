package com.spreadsheet.calc.models;

/**
 * Why an evaluation failed, together with the sentinel text shown in the cell.
 */
public enum ErrorKind {
    INVALID_REFERENCE("#ERROR!"),
    CIRCULAR_REFERENCE("#ERROR!"),
    FORMULA_ERROR("#ERROR!"),
    LOOKUP_NOT_FOUND("#N/A");

    public static final String ERROR_TEXT = "#ERROR!";
    public static final String NOT_AVAILABLE_TEXT = "#N/A";

    private final String displayText;

    ErrorKind(String displayText) {
        this.displayText = displayText;
    }

    public String getDisplayText() {
        return displayText;
    }
}
