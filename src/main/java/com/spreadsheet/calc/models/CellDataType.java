package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Enumerates what a cell currently holds:
 * STRING, NUMBER, BOOLEAN, FORMULA, or ERROR (a formula whose last evaluation failed).
 */
public enum CellDataType {
    STRING,
    NUMBER,
    BOOLEAN,
    FORMULA,
    ERROR;

    /**
     * Allows case-insensitive JSON input.
     * For example, "number" -> NUMBER, "Formula" -> FORMULA.
     */
    @JsonCreator
    public static CellDataType fromValue(String value) {
        return CellDataType.valueOf(value.toUpperCase());
    }
}
