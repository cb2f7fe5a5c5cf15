package com.spreadsheet.calc.engine.recalc;

import com.spreadsheet.calc.engine.parser.FormulaParser;
import com.spreadsheet.calc.engine.parser.ReferenceCollector;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which formula cells read which other cells, built from a snapshot of a grid.
 * - Forward adjacency: formula cell -> non-empty cells it references
 * - Reverse adjacency: cell -> formula cells that reference it
 * Knows the order in which formula cells can be evaluated (referenced cells first)
 * and which formula cells sit on a reference cycle.
 */
public class DependencyGraph {
    private static final Logger logger = LoggerFactory.getLogger(DependencyGraph.class);

    // Formula cells in row-major order
    private final List<CellAddress> formulaCells = new ArrayList<>();
    private final Map<CellAddress, Set<CellAddress>> dependencyGraphForward = new LinkedHashMap<>();
    private final Map<CellAddress, Set<CellAddress>> dependencyGraphReverse = new LinkedHashMap<>();

    private List<CellAddress> evaluationOrder;
    private Set<CellAddress> cyclicCells;

    /**
     * Scans every formula in the grid. Formulas that do not parse have no dependencies.
     */
    public static DependencyGraph build(Grid grid, FormulaParser parser) {
        DependencyGraph graph = new DependencyGraph();
        for (int r = 0; r < grid.getRowCount(); r++) {
            for (int c = 0; c < grid.getColCount(); c++) {
                Cell cell = grid.getCell(r, c);
                if (cell == null || !cell.isFormula()) {
                    continue;
                }
                CellAddress source = CellAddress.of(r, c);
                graph.addFormulaCell(source);
                List<CellRange> references;
                try {
                    references = ReferenceCollector.collect(parser.parse(cell.getFormula()));
                } catch (RuntimeException e) {
                    logger.debug("Skipping dependencies of {}: {}", source, e.getMessage());
                    continue;
                }
                for (CellRange range : references) {
                    graph.addRange(grid, source, range);
                }
            }
        }
        return graph;
    }

    public void addFormulaCell(CellAddress cell) {
        formulaCells.add(cell);
        dependencyGraphForward.putIfAbsent(cell, new LinkedHashSet<>());
        invalidate();
    }

    /**
     * Adds a reference from 'source' -> 'target' in the forward graph,
     * and the reverse graph from 'target' -> 'source'.
     */
    public void addDependency(CellAddress source, CellAddress target) {
        dependencyGraphForward
                .computeIfAbsent(source, k -> new LinkedHashSet<>())
                .add(target);
        dependencyGraphReverse
                .computeIfAbsent(target, k -> new LinkedHashSet<>())
                .add(source);
        invalidate();
    }

    // Off-grid and empty cells never change a result's dependencies, so they get no edge
    private void addRange(Grid grid, CellAddress source, CellRange range) {
        int maxRow = Math.min(range.getMaxRow(), grid.getRowCount() - 1);
        int maxCol = Math.min(range.getMaxCol(), grid.getColCount() - 1);
        for (int r = range.getMinRow(); r <= maxRow; r++) {
            for (int c = range.getMinCol(); c <= maxCol; c++) {
                Cell target = grid.getCell(r, c);
                if (target != null && !target.isEmpty()) {
                    addDependency(source, CellAddress.of(r, c));
                }
            }
        }
    }

    public Map<CellAddress, Set<CellAddress>> getForwardGraph() {
        return Collections.unmodifiableMap(dependencyGraphForward);
    }

    public Map<CellAddress, Set<CellAddress>> getReverseGraph() {
        return Collections.unmodifiableMap(dependencyGraphReverse);
    }

    public List<CellAddress> getFormulaCells() {
        return Collections.unmodifiableList(formulaCells);
    }

    /**
     * Formula cells such that every formula cell appears after the formula cells it reads.
     * Cells on a cycle appear together, in no particular order among themselves.
     */
    public List<CellAddress> getEvaluationOrder() {
        analyze();
        return evaluationOrder;
    }

    /**
     * Formula cells that can reach themselves through references, including self-references.
     */
    public Set<CellAddress> getCyclicCells() {
        analyze();
        return cyclicCells;
    }

    private void invalidate() {
        evaluationOrder = null;
        cyclicCells = null;
    }

    /**
     * Tarjan's strongly connected components over the forward graph. Components are
     * completed only after everything they reference, which is exactly evaluation order.
     * Iterative, so long reference chains cannot overflow the stack.
     */
    private void analyze() {
        if (evaluationOrder != null) {
            return;
        }
        List<CellAddress> order = new ArrayList<>(formulaCells.size());
        Set<CellAddress> cyclic = new LinkedHashSet<>();
        Map<CellAddress, Integer> index = new HashMap<>();
        Map<CellAddress, Integer> lowLink = new HashMap<>();
        Deque<CellAddress> stack = new ArrayDeque<>();
        Set<CellAddress> onStack = new HashSet<>();
        int nextIndex = 0;

        for (CellAddress root : formulaCells) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            work.push(new Frame(root, successors(root)));
            index.put(root, nextIndex);
            lowLink.put(root, nextIndex);
            nextIndex++;
            stack.push(root);
            onStack.add(root);

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.next < frame.successors.size()) {
                    CellAddress successor = frame.successors.get(frame.next++);
                    if (!dependencyGraphForward.containsKey(successor)) {
                        continue; // not a formula cell
                    }
                    if (!index.containsKey(successor)) {
                        index.put(successor, nextIndex);
                        lowLink.put(successor, nextIndex);
                        nextIndex++;
                        stack.push(successor);
                        onStack.add(successor);
                        work.push(new Frame(successor, successors(successor)));
                    } else if (onStack.contains(successor)) {
                        lowLink.put(frame.cell, Math.min(lowLink.get(frame.cell), index.get(successor)));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    CellAddress parent = work.peek().cell;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.cell)));
                }
                if (lowLink.get(frame.cell).equals(index.get(frame.cell))) {
                    List<CellAddress> component = new ArrayList<>();
                    CellAddress member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.cell));
                    if (component.size() > 1 || successors(frame.cell).contains(frame.cell)) {
                        cyclic.addAll(component);
                    }
                    order.addAll(component);
                }
            }
        }
        evaluationOrder = Collections.unmodifiableList(order);
        cyclicCells = Collections.unmodifiableSet(cyclic);
    }

    private List<CellAddress> successors(CellAddress cell) {
        Set<CellAddress> targets = dependencyGraphForward.get(cell);
        return targets == null ? Collections.emptyList() : new ArrayList<>(targets);
    }

    private static final class Frame {
        private final CellAddress cell;
        private final List<CellAddress> successors;
        private int next;

        Frame(CellAddress cell, List<CellAddress> successors) {
            this.cell = cell;
            this.successors = successors;
        }
    }
}
