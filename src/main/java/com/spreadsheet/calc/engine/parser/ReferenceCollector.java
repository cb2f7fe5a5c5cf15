package com.spreadsheet.calc.engine.parser;

import com.spreadsheet.calc.models.CellRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Gathers every cell and range an expression reads.
 * Single references come back as 1x1 ranges.
 */
public final class ReferenceCollector implements Expr.Visitor<Void> {

    private final List<CellRange> ranges = new ArrayList<>();

    private ReferenceCollector() {
    }

    public static List<CellRange> collect(Expr expr) {
        ReferenceCollector collector = new ReferenceCollector();
        expr.accept(collector);
        return collector.ranges;
    }

    @Override
    public Void visitNumber(Expr.NumberLiteral node) {
        return null;
    }

    @Override
    public Void visitString(Expr.StringLiteral node) {
        return null;
    }

    @Override
    public Void visitReference(Expr.Reference node) {
        ranges.add(new CellRange(node.getAddress(), node.getAddress()));
        return null;
    }

    @Override
    public Void visitRange(Expr.RangeReference node) {
        ranges.add(node.getRange());
        return null;
    }

    @Override
    public Void visitFunctionCall(Expr.FunctionCall node) {
        for (Expr argument : node.getArguments()) {
            argument.accept(this);
        }
        return null;
    }

    @Override
    public Void visitBinary(Expr.Binary node) {
        node.getLeft().accept(this);
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitNegate(Expr.Negate node) {
        node.getOperand().accept(this);
        return null;
    }
}
