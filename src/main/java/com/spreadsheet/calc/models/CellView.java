package com.spreadsheet.calc.models;

/**
 * What the API returns for a single cell.
 */
public class CellView {
    private final String address;
    private final Object rawValue;
    private final String displayValue;
    private final CellDataType dataType;
    private final Integer decimalPlaces;

    public CellView(String address, Cell cell) {
        this.address = address;
        this.rawValue = cell.getRawValue();
        this.displayValue = cell.getDisplayValue();
        this.dataType = cell.getDataType();
        this.decimalPlaces = cell.getDecimalPlaces();
    }

    public String getAddress() {
        return address;
    }

    public Object getRawValue() {
        return rawValue;
    }

    public String getDisplayValue() {
        return displayValue;
    }

    public CellDataType getDataType() {
        return dataType;
    }

    public Integer getDecimalPlaces() {
        return decimalPlaces;
    }
}
