package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.calc.engine.reference.ReferenceResolver;

import java.util.Objects;

/**
 * A zero-based (row, col) position in a grid, optionally carrying the
 * absolute markers ($) it was written with.
 * Two addresses are equal only if their markers match too;
 * use {@link #toRelative()} when the position alone matters (map keys, graph nodes).
 */
public final class CellAddress {
    private final int row;
    private final int col;
    private final boolean absoluteRow;
    private final boolean absoluteCol;

    public CellAddress(int row, int col, boolean absoluteRow, boolean absoluteCol) {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Negative cell coordinates: (" + row + ", " + col + ")");
        }
        this.row = row;
        this.col = col;
        this.absoluteRow = absoluteRow;
        this.absoluteCol = absoluteCol;
    }

    public static CellAddress of(int row, int col) {
        return new CellAddress(row, col, false, false);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public boolean isAbsoluteRow() {
        return absoluteRow;
    }

    public boolean isAbsoluteCol() {
        return absoluteCol;
    }

    public CellAddress withRow(int newRow) {
        return new CellAddress(newRow, col, absoluteRow, absoluteCol);
    }

    public CellAddress withCol(int newCol) {
        return new CellAddress(row, newCol, absoluteRow, absoluteCol);
    }

    public CellAddress toRelative() {
        if (!absoluteRow && !absoluteCol) {
            return this;
        }
        return of(row, col);
    }

    public boolean samePosition(int otherRow, int otherCol) {
        return row == otherRow && col == otherCol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && col == that.col
                && absoluteRow == that.absoluteRow && absoluteCol == that.absoluteCol;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col, absoluteRow, absoluteCol);
    }

    /**
     * A1 text, e.g. "B5" or "$B$5".
     */
    @JsonValue
    @Override
    public String toString() {
        return ReferenceResolver.addressToText(this);
    }
}
