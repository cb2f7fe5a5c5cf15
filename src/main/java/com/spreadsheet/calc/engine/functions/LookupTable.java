package com.spreadsheet.calc.engine.functions;

import com.spreadsheet.calc.models.EvaluationResult;

import java.util.List;

/**
 * A range argument laid out as rows for VLOOKUP.
 * Only the part of the range inside the grid is held; every cell past the grid is
 * blank, so a range running off the sheet keeps its full width and height without
 * materialising the empty tail.
 */
public final class LookupTable {

    private final List<List<EvaluationResult>> rows;
    private final int width;
    private final int height;

    public LookupTable(List<List<EvaluationResult>> rows, int width, int height) {
        this.rows = rows;
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Rows worth scanning in order: the stored rows, then a single blank row standing for
     * all rows past the grid (they are indistinguishable).
     */
    public int getScanRowCount() {
        return height > rows.size() ? rows.size() + 1 : rows.size();
    }

    /**
     * Value at a 0-based (row, col) position of the table; blank outside the stored part.
     */
    public EvaluationResult get(int row, int col) {
        if (row < rows.size()) {
            List<EvaluationResult> values = rows.get(row);
            if (col < values.size()) {
                return values.get(col);
            }
        }
        return EvaluationResult.text("");
    }
}
