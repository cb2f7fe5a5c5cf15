package com.spreadsheet.calc.models;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet held in memory:
 * - Has a unique ID
 * - A rowCount x colCount block of Cells, created empty up front
 * - Structural edits (insert/delete/move of rows and columns) that renumber cells in place
 * - A read/write lock so concurrent requests see whole edits only
 */
public class Sheet implements Grid {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    // Every cell is allocated up front, so both dimensions are bounded
    public static final int MAX_ROWS = 10_000;
    public static final int MAX_COLUMNS = 256;

    private final long id;
    // rows.get(r).get(c) is the cell at (r, c)
    private final List<List<Cell>> rows = new ArrayList<>();
    private int colCount;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(int rowCount, int colCount) {
        if (rowCount < 1 || colCount < 1) {
            throw new IllegalArgumentException("A sheet needs at least one row and one column");
        }
        if (rowCount > MAX_ROWS || colCount > MAX_COLUMNS) {
            throw new IllegalArgumentException("A sheet holds at most " + MAX_ROWS + " rows and "
                    + MAX_COLUMNS + " columns, got " + rowCount + " x " + colCount);
        }
        this.id = ID_GENERATOR.getAndIncrement();
        this.colCount = colCount;
        for (int r = 0; r < rowCount; r++) {
            rows.add(newRow(r));
        }
    }

    public long getId() {
        return id;
    }

    @Override
    public Cell getCell(int row, int col) {
        if (!isInBounds(row, col)) {
            return null;
        }
        return rows.get(row).get(col);
    }

    @Override
    public void setCellComputed(int row, int col, String displayValue, CellDataType dataType) {
        Cell cell = getCell(row, col);
        if (cell != null) {
            cell.setDisplayValue(displayValue);
            cell.setDataType(dataType);
        }
    }

    @Override
    public int getRowCount() {
        return rows.size();
    }

    @Override
    public int getColCount() {
        return colCount;
    }

    public List<List<Cell>> getRows() {
        return rows;
    }

    // ------------------------
    // Structural edits
    // ------------------------

    /**
     * Inserts an empty row so that it gets index 'atIndex'; atIndex == rowCount appends.
     */
    public void insertRow(int atIndex) {
        checkIndex(atIndex, getRowCount() + 1, "row");
        if (getRowCount() >= MAX_ROWS) {
            throw new IllegalArgumentException("Cannot insert a row: sheet already has " + MAX_ROWS + " rows");
        }
        rows.add(atIndex, newRow(atIndex));
        renumber();
    }

    public void deleteRow(int atIndex) {
        checkIndex(atIndex, getRowCount(), "row");
        if (getRowCount() <= 1) {
            throw new IllegalArgumentException("Cannot delete the last remaining row");
        }
        rows.remove(atIndex);
        renumber();
    }

    public void moveRow(int fromIndex, int toIndex) {
        checkIndex(fromIndex, getRowCount(), "row");
        checkIndex(toIndex, getRowCount(), "row");
        rows.add(toIndex, rows.remove(fromIndex));
        renumber();
    }

    public void insertColumn(int atIndex) {
        checkIndex(atIndex, colCount + 1, "column");
        if (colCount >= MAX_COLUMNS) {
            throw new IllegalArgumentException("Cannot insert a column: sheet already has " + MAX_COLUMNS + " columns");
        }
        for (int r = 0; r < rows.size(); r++) {
            rows.get(r).add(atIndex, new Cell(r, atIndex));
        }
        colCount++;
        renumber();
    }

    public void deleteColumn(int atIndex) {
        checkIndex(atIndex, colCount, "column");
        if (colCount <= 1) {
            throw new IllegalArgumentException("Cannot delete the last remaining column");
        }
        for (List<Cell> row : rows) {
            row.remove(atIndex);
        }
        colCount--;
        renumber();
    }

    public void moveColumn(int fromIndex, int toIndex) {
        checkIndex(fromIndex, colCount, "column");
        checkIndex(toIndex, colCount, "column");
        for (List<Cell> row : rows) {
            row.add(toIndex, row.remove(fromIndex));
        }
        renumber();
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    private List<Cell> newRow(int rowIndex) {
        List<Cell> row = new ArrayList<>(colCount);
        for (int c = 0; c < colCount; c++) {
            row.add(new Cell(rowIndex, c));
        }
        return row;
    }

    private void renumber() {
        for (int r = 0; r < rows.size(); r++) {
            List<Cell> row = rows.get(r);
            for (int c = 0; c < row.size(); c++) {
                row.get(c).setPosition(r, c);
            }
        }
    }

    private static void checkIndex(int index, int limit, String axis) {
        if (index < 0 || index >= limit) {
            throw new IllegalArgumentException("Invalid " + axis + " index: " + index);
        }
    }
}
