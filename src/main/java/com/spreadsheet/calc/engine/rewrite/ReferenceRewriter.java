package com.spreadsheet.calc.engine.rewrite;

import com.spreadsheet.calc.engine.parser.Token;
import com.spreadsheet.calc.engine.parser.TokenType;
import com.spreadsheet.calc.engine.parser.Tokenizer;
import com.spreadsheet.calc.engine.reference.ReferenceResolver;
import com.spreadsheet.calc.exceptions.FormulaException;
import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.Grid;
import com.spreadsheet.calc.models.StructuralEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Keeps formula references pointing at the same data when rows or columns are
 * inserted, deleted or moved. Only reference tokens are rewritten; everything else
 * in the formula (spacing, string literals, case) is kept byte for byte, and so are
 * the $ markers of rewritten references.
 * A reference to a deleted line becomes "#REF!", which no longer parses and so
 * evaluates to "#ERROR!".
 */
public class ReferenceRewriter {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceRewriter.class);

    public static final String DELETED_REFERENCE = "#REF!";

    public String rewriteForRowOp(String formulaText, StructuralEdit edit) {
        return rewrite(formulaText, Axis.ROW, edit);
    }

    public String rewriteForColOp(String formulaText, StructuralEdit edit) {
        return rewrite(formulaText, Axis.COLUMN, edit);
    }

    /**
     * Rewrites for the row at {@code fromIndex} being moved to {@code toIndex}.
     */
    public String rewriteForRowOp(String formulaText, int fromIndex, int toIndex) {
        return rewriteForRowOp(formulaText, StructuralEdit.move(fromIndex, toIndex));
    }

    public String rewriteForColOp(String formulaText, int fromIndex, int toIndex) {
        return rewriteForColOp(formulaText, StructuralEdit.move(fromIndex, toIndex));
    }

    /**
     * Rewrites every formula cell of the grid in place.
     *
     * @return number of formulas that changed
     */
    public int rewriteGrid(Grid grid, Axis axis, StructuralEdit edit) {
        int rewritten = 0;
        for (int r = 0; r < grid.getRowCount(); r++) {
            for (int c = 0; c < grid.getColCount(); c++) {
                Cell cell = grid.getCell(r, c);
                if (cell == null || !cell.isFormula()) {
                    continue;
                }
                String formula = cell.getFormula();
                String updated = rewrite(formula, axis, edit);
                if (!updated.equals(formula)) {
                    cell.setRawValue(updated);
                    rewritten++;
                }
            }
        }
        logger.debug("{} {} rewrote {} formula(s)", axis, edit, rewritten);
        return rewritten;
    }

    public String rewrite(String formulaText, Axis axis, StructuralEdit edit) {
        if (formulaText == null || !formulaText.trim().startsWith("=")) {
            return formulaText;
        }
        int bodyStart = formulaText.indexOf('=') + 1;
        String body = formulaText.substring(bodyStart);
        List<Token> tokens;
        try {
            tokens = Tokenizer.tokenize(body);
        } catch (FormulaException e) {
            // Broken formulas stay as typed
            logger.debug("Not rewriting unparsable formula {}: {}", formulaText, e.getMessage());
            return formulaText;
        }

        StringBuilder out = new StringBuilder(formulaText.length() + 8);
        out.append(formulaText, 0, bodyStart);
        int copied = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.is(TokenType.REFERENCE)) {
                continue;
            }
            String replacement;
            int end;
            if (isRangeAt(tokens, i)) {
                Token last = tokens.get(i + 2);
                replacement = rewriteRange(token, last, axis, edit);
                end = last.getEnd();
                i += 2;
            } else {
                replacement = rewriteSingle(token, axis, edit);
                end = token.getEnd();
            }
            if (replacement != null) {
                out.append(body, copied, token.getStart()).append(replacement);
                copied = end;
            }
        }
        out.append(body, copied, body.length());
        return out.toString();
    }

    private static boolean isRangeAt(List<Token> tokens, int i) {
        return i + 2 < tokens.size()
                && tokens.get(i + 1).is(TokenType.COLON)
                && tokens.get(i + 2).is(TokenType.REFERENCE);
    }

    /**
     * @return the new reference text, or null to keep the token as written
     */
    private String rewriteSingle(Token token, Axis axis, StructuralEdit edit) {
        CellAddress address = parse(token);
        if (address == null) {
            return null;
        }
        int position = positionOf(address, axis);
        int moved = edit.remap(position);
        if (moved == StructuralEdit.REMOVED) {
            return DELETED_REFERENCE;
        }
        return moved == position ? null : ReferenceResolver.addressToText(withPosition(address, axis, moved));
    }

    /**
     * Deleting a line inside a range shrinks it; deleting a range's only line removes it.
     */
    private String rewriteRange(Token first, Token last, Axis axis, StructuralEdit edit) {
        CellAddress start = parse(first);
        CellAddress end = parse(last);
        if (start == null || end == null) {
            return null;
        }
        int startPos = positionOf(start, axis);
        int endPos = positionOf(end, axis);
        int newStart;
        int newEnd;
        if (edit.getKind() == StructuralEdit.Kind.DELETE) {
            int deleted = edit.getIndex();
            if (startPos == deleted && endPos == deleted) {
                return DELETED_REFERENCE;
            }
            newStart = shrinkEndpoint(startPos, endPos, deleted, edit);
            newEnd = shrinkEndpoint(endPos, startPos, deleted, edit);
        } else {
            newStart = edit.remap(startPos);
            newEnd = edit.remap(endPos);
        }
        if (newStart == startPos && newEnd == endPos) {
            return null;
        }
        return ReferenceResolver.addressToText(withPosition(start, axis, newStart)) + ":"
                + ReferenceResolver.addressToText(withPosition(end, axis, newEnd));
    }

    // The deleted line was this endpoint: the far end pulls back by one, the near end stays put
    private static int shrinkEndpoint(int position, int otherPosition, int deleted, StructuralEdit edit) {
        if (position != deleted) {
            return edit.remap(position);
        }
        return position > otherPosition ? position - 1 : position;
    }

    private static CellAddress parse(Token token) {
        try {
            return ReferenceResolver.textToAddress(token.getText());
        } catch (InvalidReferenceException e) {
            return null;
        }
    }

    private static int positionOf(CellAddress address, Axis axis) {
        return axis == Axis.ROW ? address.getRow() : address.getCol();
    }

    private static CellAddress withPosition(CellAddress address, Axis axis, int position) {
        return axis == Axis.ROW ? address.withRow(position) : address.withCol(position);
    }
}
