package com.spreadsheet.calc.engine.recalc;

import com.spreadsheet.calc.models.CellAddress;

import java.util.Set;

/**
 * What one call to {@link RecalculationEngine#recalculate} did.
 */
public class RecalculationSummary {
    private final int formulaCells;
    private final int passes;
    private final int updatedCells;
    private final boolean converged;
    private final Set<CellAddress> cyclicCells;

    public RecalculationSummary(int formulaCells, int passes, int updatedCells,
                                boolean converged, Set<CellAddress> cyclicCells) {
        this.formulaCells = formulaCells;
        this.passes = passes;
        this.updatedCells = updatedCells;
        this.converged = converged;
        this.cyclicCells = cyclicCells;
    }

    public int getFormulaCells() {
        return formulaCells;
    }

    public int getPasses() {
        return passes;
    }

    // Counts every write-back, so a cell that changed in two passes counts twice
    public int getUpdatedCells() {
        return updatedCells;
    }

    /**
     * False if the last pass still changed something when the pass cap was hit.
     */
    public boolean isConverged() {
        return converged;
    }

    public Set<CellAddress> getCyclicCells() {
        return cyclicCells;
    }
}
