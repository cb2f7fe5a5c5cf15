package com.spreadsheet.calc.models;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A rectangular span of cells, e.g. A1:C10.
 * The corners may be given in any order; iteration always runs
 * row-major from the top-left to the bottom-right corner.
 * Every call to {@link #iterator()} starts a fresh walk.
 */
public final class CellRange implements Iterable<CellAddress> {
    private final CellAddress start;
    private final CellAddress end;

    public CellRange(CellAddress start, CellAddress end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public int getMinRow() {
        return Math.min(start.getRow(), end.getRow());
    }

    public int getMaxRow() {
        return Math.max(start.getRow(), end.getRow());
    }

    public int getMinCol() {
        return Math.min(start.getCol(), end.getCol());
    }

    public int getMaxCol() {
        return Math.max(start.getCol(), end.getCol());
    }

    public int getHeight() {
        return getMaxRow() - getMinRow() + 1;
    }

    public int getWidth() {
        return getMaxCol() - getMinCol() + 1;
    }

    public boolean contains(int row, int col) {
        return row >= getMinRow() && row <= getMaxRow()
                && col >= getMinCol() && col <= getMaxCol();
    }

    @Override
    public Iterator<CellAddress> iterator() {
        final int minRow = getMinRow();
        final int maxRow = getMaxRow();
        final int minCol = getMinCol();
        final int maxCol = getMaxCol();
        return new Iterator<CellAddress>() {
            private int row = minRow;
            private int col = minCol;

            @Override
            public boolean hasNext() {
                return row <= maxRow;
            }

            @Override
            public CellAddress next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                CellAddress next = CellAddress.of(row, col);
                if (++col > maxCol) {
                    col = minCol;
                    row++;
                }
                return next;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
