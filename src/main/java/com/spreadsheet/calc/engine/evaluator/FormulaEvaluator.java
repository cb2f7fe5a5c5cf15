package com.spreadsheet.calc.engine.evaluator;

import com.spreadsheet.calc.engine.functions.FormulaFunction;
import com.spreadsheet.calc.engine.functions.FunctionContext;
import com.spreadsheet.calc.engine.functions.FunctionLibrary;
import com.spreadsheet.calc.engine.functions.LookupTable;
import com.spreadsheet.calc.engine.parser.BinaryOperator;
import com.spreadsheet.calc.engine.parser.Expr;
import com.spreadsheet.calc.engine.parser.FormulaParser;
import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.FormulaException;
import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.ErrorKind;
import com.spreadsheet.calc.models.EvaluationResult;
import com.spreadsheet.calc.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Evaluates formula text against a grid.
 * Referenced formula cells are evaluated recursively; a reference back to a cell whose
 * evaluation is still in progress is a circular reference. No failure escapes as an
 * exception: every one becomes an error result.
 */
public class FormulaEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final FormulaParser parser;
    private final FunctionLibrary functions;

    public FormulaEvaluator(FormulaParser parser, FunctionLibrary functions) {
        this.parser = parser;
        this.functions = functions;
    }

    public EvaluationContext newContext(Grid grid) {
        return new EvaluationContext(grid, parser);
    }

    /**
     * Evaluates {@code formulaText} as if it were the content of (row, col).
     */
    public EvaluationResult evaluate(String formulaText, Grid grid, int row, int col) {
        return evaluate(formulaText, newContext(grid), row, col);
    }

    public EvaluationResult evaluate(String formulaText, EvaluationContext context, int row, int col) {
        CellAddress address = CellAddress.of(row, col);
        try {
            return computeFormula(formulaText, context, address);
        } catch (CircularReferenceException e) {
            logger.debug("Circular reference while evaluating {} at {}: {}", formulaText, address, e.getMessage());
            return EvaluationResult.error(ErrorKind.CIRCULAR_REFERENCE);
        } catch (StackOverflowError e) {
            logger.debug("Reference chain too deep while evaluating {} at {}", formulaText, address);
            return EvaluationResult.error(ErrorKind.FORMULA_ERROR);
        }
    }

    /**
     * Value of the cell at (row, col), reusing and recording results in {@code context}.
     * Formula cells on a cycle yield CIRCULAR_REFERENCE.
     */
    public EvaluationResult evaluateCell(EvaluationContext context, int row, int col) {
        CellAddress address = CellAddress.of(row, col);
        EvaluationResult known = context.getResult(address);
        if (known != null) {
            return known;
        }
        Cell cell = context.getGrid().getCell(row, col);
        if (cell == null || !cell.isFormula()) {
            return cell == null ? EvaluationResult.number(0d) : Values.fromLiteral(cell.getRawValue());
        }
        EvaluationResult result = evaluate(cell.getFormula(), context, row, col);
        context.putResult(address, result);
        return result;
    }

    /**
     * Parses and walks one formula with {@code address} on the evaluation stack.
     * Circular references propagate so that the outermost formula reports them.
     */
    private EvaluationResult computeFormula(String formulaText, EvaluationContext context, CellAddress address) {
        boolean entered = context.enter(address);
        try {
            Expr expr = context.parse(formulaText);
            return expr.accept(new Walker(context, address));
        } catch (FormulaException e) {
            logger.debug("Formula {} at {} failed: {}", formulaText, address, e.getMessage());
            return EvaluationResult.error(ErrorKind.FORMULA_ERROR);
        } catch (InvalidReferenceException e) {
            logger.debug("Formula {} at {} has a bad reference: {}", formulaText, address, e.getMessage());
            return EvaluationResult.error(ErrorKind.INVALID_REFERENCE);
        } catch (ArithmeticException | IllegalArgumentException | IndexOutOfBoundsException e) {
            logger.debug("Formula {} at {} failed unexpectedly", formulaText, address, e);
            return EvaluationResult.error(ErrorKind.FORMULA_ERROR);
        } finally {
            if (entered) {
                context.exit(address);
            }
        }
    }

    /**
     * Value read through a reference from inside a formula.
     * A cell whose own formula loops back to it reads as a CIRCULAR_REFERENCE value, so the
     * referencing formula can still aggregate or fall back. Cells that only lie on a loop
     * closing further up the stack are recorded as circular and the loop keeps unwinding.
     */
    private EvaluationResult referencedValue(EvaluationContext context, int row, int col) {
        CellAddress address = CellAddress.of(row, col);
        EvaluationResult known = context.getResult(address);
        if (known != null) {
            return known;
        }
        Cell cell = context.getGrid().getCell(row, col);
        if (cell == null || cell.isEmpty()) {
            return EvaluationResult.number(0d);
        }
        if (!cell.isFormula()) {
            return Values.fromLiteral(cell.getRawValue());
        }
        if (context.isInProgress(address)) {
            throw new CircularReferenceException("Cell " + address + " depends on itself", address);
        }
        EvaluationResult result;
        try {
            result = computeFormula(cell.getFormula(), context, address);
        } catch (CircularReferenceException e) {
            context.putResult(address, EvaluationResult.error(ErrorKind.CIRCULAR_REFERENCE));
            if (!e.getCycleStart().samePosition(row, col)) {
                throw e;
            }
            logger.debug("Cell {} is on a circular reference", address);
            return context.getResult(address);
        }
        context.putResult(address, result);
        return result;
    }

    /**
     * Walks one formula's AST on behalf of the cell at {@code current}.
     */
    private final class Walker implements Expr.Visitor<EvaluationResult>, FunctionContext {
        private final EvaluationContext context;
        private final CellAddress current;

        Walker(EvaluationContext context, CellAddress current) {
            this.context = context;
            this.current = current;
        }

        @Override
        public EvaluationResult visitNumber(Expr.NumberLiteral node) {
            return EvaluationResult.number(node.getValue());
        }

        @Override
        public EvaluationResult visitString(Expr.StringLiteral node) {
            return EvaluationResult.text(node.getValue());
        }

        @Override
        public EvaluationResult visitReference(Expr.Reference node) {
            CellAddress target = node.getAddress();
            if (target.samePosition(current.getRow(), current.getCol())) {
                throw new CircularReferenceException("Cell " + current + " references itself", current);
            }
            return referencedValue(context, target.getRow(), target.getCol());
        }

        @Override
        public EvaluationResult visitRange(Expr.RangeReference node) {
            throw new FormulaException("Range " + node + " can only be used as a function argument");
        }

        @Override
        public EvaluationResult visitFunctionCall(Expr.FunctionCall node) {
            FormulaFunction function = functions.lookup(node.getName());
            if (function == null) {
                throw new FormulaException("Unknown function: " + node.getName());
            }
            return function.apply(node.getArguments(), this);
        }

        @Override
        public EvaluationResult visitBinary(Expr.Binary node) {
            EvaluationResult left = node.getLeft().accept(this);
            EvaluationResult right = node.getRight().accept(this);
            if (node.getOperator().isComparison()) {
                return EvaluationResult.bool(compare(node.getOperator(), left, right));
            }
            double a = Values.requireNumber(left);
            double b = Values.requireNumber(right);
            double value;
            switch (node.getOperator()) {
                case ADD:
                    value = a + b;
                    break;
                case SUBTRACT:
                    value = a - b;
                    break;
                case MULTIPLY:
                    value = a * b;
                    break;
                case DIVIDE:
                    if (b == 0d) {
                        throw new FormulaException("Division by zero");
                    }
                    value = a / b;
                    break;
                default:
                    throw new FormulaException("Unsupported operator " + node.getOperator());
            }
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new FormulaException("Numeric overflow in " + node);
            }
            return EvaluationResult.number(value);
        }

        @Override
        public EvaluationResult visitNegate(Expr.Negate node) {
            return EvaluationResult.number(-Values.requireNumber(node.getOperand().accept(this)));
        }

        /**
         * Numbers compare numerically. Otherwise only = and &lt;&gt; apply, as case-insensitive text;
         * ordering a non-number is false.
         */
        private boolean compare(BinaryOperator operator, EvaluationResult left, EvaluationResult right) {
            Double a = Values.toNumber(left);
            Double b = Values.toNumber(right);
            if (a == null || b == null) {
                boolean equal = Values.toText(left).equalsIgnoreCase(Values.toText(right));
                switch (operator) {
                    case EQUAL:
                        return equal;
                    case NOT_EQUAL:
                        return !equal;
                    default:
                        return false;
                }
            }
            switch (operator) {
                case EQUAL:
                    return a.doubleValue() == b.doubleValue();
                case NOT_EQUAL:
                    return a.doubleValue() != b.doubleValue();
                case LESS:
                    return a < b;
                case LESS_EQUAL:
                    return a <= b;
                case GREATER:
                    return a > b;
                case GREATER_EQUAL:
                    return a >= b;
                default:
                    throw new FormulaException("Not a comparison: " + operator);
            }
        }

        // ---- FunctionContext ----

        @Override
        public EvaluationResult evaluate(Expr argument) {
            return argument.accept(this);
        }

        @Override
        public List<EvaluationResult> values(Expr argument) {
            if (argument instanceof Expr.RangeReference) {
                List<EvaluationResult> values = new ArrayList<>();
                CellRange range = clip(((Expr.RangeReference) argument).getRange());
                if (range != null) {
                    for (CellAddress address : range) {
                        if (!isBlank(address)) {
                            values.add(referencedValue(context, address.getRow(), address.getCol()));
                        }
                    }
                }
                return values;
            }
            if (argument instanceof Expr.Reference && isBlank(((Expr.Reference) argument).getAddress())) {
                return Collections.emptyList();
            }
            return Collections.singletonList(argument.accept(this));
        }

        @Override
        public double[] numbers(Expr argument) {
            if (argument instanceof Expr.RangeReference) {
                CellRange range = clip(((Expr.RangeReference) argument).getRange());
                if (range == null) {
                    return new double[0];
                }
                double[] numbers = new double[range.getHeight() * range.getWidth()];
                int i = 0;
                for (CellAddress address : range) {
                    numbers[i++] = Values.toNumberOrZero(referencedValue(context, address.getRow(), address.getCol()));
                }
                return numbers;
            }
            if (argument instanceof Expr.Reference) {
                CellAddress address = ((Expr.Reference) argument).getAddress();
                if (!context.getGrid().isInBounds(address.getRow(), address.getCol())) {
                    return new double[0];
                }
            }
            return new double[] {Values.toNumberOrZero(argument.accept(this))};
        }

        @Override
        public int countBlanks(Expr argument) {
            CellRange range = clip(asRange(argument));
            if (range == null) {
                return 0;
            }
            int blanks = 0;
            for (CellAddress address : range) {
                if (isBlank(address)) {
                    blanks++;
                }
            }
            return blanks;
        }

        @Override
        public LookupTable table(Expr argument) {
            if (!(argument instanceof Expr.RangeReference)) {
                throw new FormulaException("Expected a range but got " + argument);
            }
            CellRange range = ((Expr.RangeReference) argument).getRange();
            CellRange inGrid = clip(range);
            List<List<EvaluationResult>> rows = new ArrayList<>();
            if (inGrid != null) {
                for (int r = inGrid.getMinRow(); r <= inGrid.getMaxRow(); r++) {
                    List<EvaluationResult> row = new ArrayList<>(inGrid.getWidth());
                    for (int c = inGrid.getMinCol(); c <= inGrid.getMaxCol(); c++) {
                        row.add(isBlank(CellAddress.of(r, c))
                                ? EvaluationResult.text("")
                                : referencedValue(context, r, c));
                    }
                    rows.add(row);
                }
            }
            return new LookupTable(rows, range.getWidth(), range.getHeight());
        }

        @Override
        public boolean condition(Expr argument) {
            try {
                return Values.isTruthy(argument.accept(this));
            } catch (FormulaException | InvalidReferenceException e) {
                return false;
            }
        }

        private boolean isBlank(CellAddress address) {
            Cell cell = context.getGrid().getCell(address.getRow(), address.getCol());
            return cell == null || cell.isEmpty();
        }

        /**
         * The part of {@code range} inside the grid, or null when they do not overlap.
         */
        private CellRange clip(CellRange range) {
            if (range == null) {
                return null;
            }
            Grid grid = context.getGrid();
            int maxRow = Math.min(range.getMaxRow(), grid.getRowCount() - 1);
            int maxCol = Math.min(range.getMaxCol(), grid.getColCount() - 1);
            if (range.getMinRow() > maxRow || range.getMinCol() > maxCol) {
                return null;
            }
            if (maxRow == range.getMaxRow() && maxCol == range.getMaxCol()) {
                return range;
            }
            return new CellRange(CellAddress.of(range.getMinRow(), range.getMinCol()), CellAddress.of(maxRow, maxCol));
        }

        private CellRange asRange(Expr argument) {
            if (argument instanceof Expr.RangeReference) {
                return ((Expr.RangeReference) argument).getRange();
            }
            if (argument instanceof Expr.Reference) {
                CellAddress address = ((Expr.Reference) argument).getAddress();
                return new CellRange(address, address);
            }
            return null;
        }
    }
}
