package com.spreadsheet.calc.models;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its position (row, col), both 0-based
 * - rawValue: null (empty), a String, a Double, a Boolean, or formula text starting with "="
 * - displayValue: the text shown to the user (result of formula evaluation)
 * - dataType: what the cell currently holds
 * - decimalPlaces: optional number format, null means default formatting
 */
public class Cell {
    private int row;
    private int col;
    private Object rawValue;
    private String displayValue = "";
    private CellDataType dataType = CellDataType.STRING;
    private Integer decimalPlaces;

    public Cell(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public Cell(int row, int col, Object rawValue) {
        this(row, col);
        this.rawValue = rawValue;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    // Structural edits renumber cells in place
    public void setPosition(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public Object getRawValue() {
        return rawValue;
    }

    public void setRawValue(Object rawValue) {
        this.rawValue = rawValue;
    }

    public String getDisplayValue() {
        return displayValue;
    }

    public void setDisplayValue(String displayValue) {
        this.displayValue = displayValue;
    }

    public CellDataType getDataType() {
        return dataType;
    }

    public void setDataType(CellDataType dataType) {
        this.dataType = dataType;
    }

    public Integer getDecimalPlaces() {
        return decimalPlaces;
    }

    public void setDecimalPlaces(Integer decimalPlaces) {
        this.decimalPlaces = decimalPlaces;
    }

    public boolean isFormula() {
        return rawValue instanceof String && ((String) rawValue).startsWith("=");
    }

    public boolean isEmpty() {
        return rawValue == null || "".equals(rawValue);
    }

    /**
     * The formula text, or null when this cell does not hold a formula.
     */
    public String getFormula() {
        return isFormula() ? (String) rawValue : null;
    }

    @Override
    public String toString() {
        return CellAddress.of(row, col) + "=" + rawValue;
    }
}
