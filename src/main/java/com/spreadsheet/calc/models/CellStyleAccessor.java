package com.spreadsheet.calc.models;

/**
 * Supplies per-cell display formatting to the recalculation engine.
 */
@FunctionalInterface
public interface CellStyleAccessor {

    /**
     * Number of fractional digits to show for (row, col), or null for default formatting.
     */
    Integer getDecimalPlaces(int row, int col);
}
