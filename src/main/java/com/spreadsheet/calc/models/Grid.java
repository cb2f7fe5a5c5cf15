package com.spreadsheet.calc.models;

/**
 * The view of a sheet that the engine borrows for the length of one call.
 * Implementations own the cells; the engine reads raw values and writes back
 * computed display values, and never keeps a reference after returning.
 */
public interface Grid extends CellStyleAccessor {

    /**
     * Returns the cell at (row, col), or null when the position is outside the grid.
     */
    Cell getCell(int row, int col);

    /**
     * Write-back of an evaluation result for the cell at (row, col).
     */
    void setCellComputed(int row, int col, String displayValue, CellDataType dataType);

    int getRowCount();

    int getColCount();

    default boolean isInBounds(int row, int col) {
        return row >= 0 && col >= 0 && row < getRowCount() && col < getColCount();
    }

    /**
     * Formatting comes from the cell itself unless an implementation keeps styles elsewhere.
     */
    @Override
    default Integer getDecimalPlaces(int row, int col) {
        Cell cell = getCell(row, col);
        return cell == null ? null : cell.getDecimalPlaces();
    }
}
