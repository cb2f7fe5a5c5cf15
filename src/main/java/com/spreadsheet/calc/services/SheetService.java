package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.engine.evaluator.FormulaEvaluator;
import com.spreadsheet.calc.engine.evaluator.Values;
import com.spreadsheet.calc.engine.format.DisplayFormatter;
import com.spreadsheet.calc.engine.parser.FormulaParser;
import com.spreadsheet.calc.engine.recalc.DependencyGraph;
import com.spreadsheet.calc.engine.recalc.RecalculationEngine;
import com.spreadsheet.calc.engine.recalc.RecalculationSummary;
import com.spreadsheet.calc.engine.reference.ReferenceResolver;
import com.spreadsheet.calc.engine.rewrite.Axis;
import com.spreadsheet.calc.engine.rewrite.ReferenceRewriter;
import com.spreadsheet.calc.exceptions.CellOutOfBoundsException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellDataType;
import com.spreadsheet.calc.models.CellView;
import com.spreadsheet.calc.models.EvaluationResult;
import com.spreadsheet.calc.models.Sheet;
import com.spreadsheet.calc.models.StructuralEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Main business logic for creating sheets, setting cell values,
 * structural edits, and keeping every formula's display value current.
 * Every write takes the sheet's write lock and ends with a full recalculation.
 */
@Service
public class SheetService {
    private static final Logger logger = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final FormulaParser parser;
    private final FormulaEvaluator evaluator;
    private final DisplayFormatter formatter;
    private final RecalculationEngine recalculationEngine;
    private final ReferenceRewriter rewriter;
    private final EngineProperties properties;

    public SheetService(FormulaParser parser, FormulaEvaluator evaluator, DisplayFormatter formatter,
                        RecalculationEngine recalculationEngine, ReferenceRewriter rewriter,
                        EngineProperties properties) {
        this.parser = parser;
        this.evaluator = evaluator;
        this.formatter = formatter;
        this.recalculationEngine = recalculationEngine;
        this.rewriter = rewriter;
        this.properties = properties;
    }

    /**
     * Creates an empty sheet and returns its ID. Missing dimensions fall back to the configured defaults.
     */
    public long createSheet(Integer rows, Integer columns) {
        int rowCount = rows != null ? rows : properties.getSheet().getDefaultRows();
        int colCount = columns != null ? columns : properties.getSheet().getDefaultColumns();
        Sheet sheet = new Sheet(rowCount, colCount);
        sheets.put(sheet.getId(), sheet);
        logger.info("Created sheet {} ({} x {})", sheet.getId(), rowCount, colCount);
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    /**
     * Sets a cell's raw input and recalculates the sheet.
     * Input starting with "=" is a formula; TRUE/FALSE are booleans; decimal text is a number;
     * blank input clears the cell; anything else is text.
     * Formula errors never throw here, the cell just shows "#ERROR!" or "#N/A".
     */
    public RecalculationSummary setCellValue(long sheetId, String a1, String rawValue) {
        return write(sheetId, sheet -> {
            Cell cell = locate(sheet, a1);
            applyInput(cell, rawValue);
        });
    }

    public RecalculationSummary setDecimalPlaces(long sheetId, String a1, int decimalPlaces) {
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("decimalPlaces must not be negative, got " + decimalPlaces);
        }
        return write(sheetId, sheet -> {
            Cell cell = locate(sheet, a1);
            cell.setDecimalPlaces(decimalPlaces);
            refreshLiteral(cell);
        });
    }

    public RecalculationSummary clearDecimalPlaces(long sheetId, String a1) {
        return write(sheetId, sheet -> {
            Cell cell = locate(sheet, a1);
            cell.setDecimalPlaces(null);
            refreshLiteral(cell);
        });
    }

    /**
     * Returns A1 -> display value for every non-empty cell, in row-major order.
     */
    public Map<String, String> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Map<String, String> data = new LinkedHashMap<>();
            for (int r = 0; r < sheet.getRowCount(); r++) {
                for (int c = 0; c < sheet.getColCount(); c++) {
                    Cell cell = sheet.getCell(r, c);
                    if (!cell.isEmpty()) {
                        data.put(ReferenceResolver.addressToText(CellAddress.of(r, c)), cell.getDisplayValue());
                    }
                }
            }
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public CellView getCell(long sheetId, String a1) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Cell cell = locate(sheet, a1);
            return new CellView(ReferenceResolver.addressToText(CellAddress.of(cell.getRow(), cell.getCol())), cell);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Evaluates a formula against the sheet without storing it, as if it were typed at 'at'.
     * The result is formatted with the decimal places of the 'at' cell.
     */
    public String evaluate(long sheetId, String formula, String at) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Cell origin = locate(sheet, at == null || at.isBlank() ? "A1" : at);
            EvaluationResult result = evaluator.evaluate(formula, sheet, origin.getRow(), origin.getCol());
            return formatter.format(result, sheet.getDecimalPlaces(origin.getRow(), origin.getCol()));
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    // ------------------------
    // Structural edits
    // ------------------------

    public RecalculationSummary insertRow(long sheetId, int index) {
        return structural(sheetId, Axis.ROW, StructuralEdit.insert(index), sheet -> sheet.insertRow(index));
    }

    public RecalculationSummary deleteRow(long sheetId, int index) {
        return structural(sheetId, Axis.ROW, StructuralEdit.delete(index), sheet -> sheet.deleteRow(index));
    }

    public RecalculationSummary moveRow(long sheetId, int fromIndex, int toIndex) {
        return structural(sheetId, Axis.ROW, StructuralEdit.move(fromIndex, toIndex),
                sheet -> sheet.moveRow(fromIndex, toIndex));
    }

    public RecalculationSummary insertColumn(long sheetId, int index) {
        return structural(sheetId, Axis.COLUMN, StructuralEdit.insert(index), sheet -> sheet.insertColumn(index));
    }

    public RecalculationSummary deleteColumn(long sheetId, int index) {
        return structural(sheetId, Axis.COLUMN, StructuralEdit.delete(index), sheet -> sheet.deleteColumn(index));
    }

    public RecalculationSummary moveColumn(long sheetId, int fromIndex, int toIndex) {
        return structural(sheetId, Axis.COLUMN, StructuralEdit.move(fromIndex, toIndex),
                sheet -> sheet.moveColumn(fromIndex, toIndex));
    }

    // ------------------------
    // Dependency graph views
    // ------------------------

    /**
     * For each formula cell, the non-empty cells it references.
     */
    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        return dependencyView(sheetId, true);
    }

    /**
     * For each referenced cell, the formula cells that read it.
     */
    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        return dependencyView(sheetId, false);
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private RecalculationSummary write(long sheetId, Consumer<Sheet> change) {
        Sheet sheet = getSheet(sheetId);

        // Prevent race conditions among multiple writers
        sheet.getLock().writeLock().lock();
        try {
            change.accept(sheet);
            return recalculationEngine.recalculate(sheet);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    private RecalculationSummary structural(long sheetId, Axis axis, StructuralEdit edit, Consumer<Sheet> change) {
        return write(sheetId, sheet -> {
            change.accept(sheet);
            int rewritten = rewriter.rewriteGrid(sheet, axis, edit);
            logger.info("Sheet {}: {} {}, {} formula(s) rewritten", sheet.getId(), axis, edit, rewritten);
        });
    }

    private Map<String, Set<String>> dependencyView(long sheetId, boolean forward) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            DependencyGraph graph = DependencyGraph.build(sheet, parser);
            Map<CellAddress, Set<CellAddress>> edges = forward ? graph.getForwardGraph() : graph.getReverseGraph();
            Map<String, Set<String>> view = new LinkedHashMap<>();
            for (Map.Entry<CellAddress, Set<CellAddress>> entry : edges.entrySet()) {
                Set<String> targets = new LinkedHashSet<>();
                for (CellAddress target : entry.getValue()) {
                    targets.add(ReferenceResolver.addressToText(target));
                }
                view.put(ReferenceResolver.addressToText(entry.getKey()), targets);
            }
            return view;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Resolves an A1 reference to a cell of the sheet.
     * Malformed text throws InvalidReferenceException, positions outside the sheet CellOutOfBoundsException.
     */
    private Cell locate(Sheet sheet, String a1) {
        CellAddress address = ReferenceResolver.textToAddress(a1.trim().toUpperCase());
        Cell cell = sheet.getCell(address.getRow(), address.getCol());
        if (cell == null) {
            throw new CellOutOfBoundsException("Cell " + a1 + " is outside the sheet ("
                    + sheet.getRowCount() + " rows x " + sheet.getColCount() + " columns)");
        }
        return cell;
    }

    private void applyInput(Cell cell, String rawValue) {
        String trimmed = rawValue == null ? "" : rawValue.trim();
        if (trimmed.isEmpty()) {
            cell.setRawValue(null);
        } else if (trimmed.startsWith("=")) {
            cell.setRawValue(trimmed);
        } else if ("TRUE".equalsIgnoreCase(trimmed) || "FALSE".equalsIgnoreCase(trimmed)) {
            cell.setRawValue(Boolean.valueOf(trimmed.toLowerCase()));
        } else if (Values.isDecimal(trimmed)) {
            cell.setRawValue(Double.valueOf(trimmed));
        } else {
            cell.setRawValue(rawValue);
        }
        refreshLiteral(cell);
    }

    // Formula cells get their display value from recalculation
    private void refreshLiteral(Cell cell) {
        Object raw = cell.getRawValue();
        if (cell.isFormula()) {
            cell.setDataType(CellDataType.FORMULA);
        } else if (raw == null) {
            cell.setDisplayValue("");
            cell.setDataType(CellDataType.STRING);
        } else if (raw instanceof Boolean) {
            cell.setDisplayValue(formatter.formatBoolean((Boolean) raw));
            cell.setDataType(CellDataType.BOOLEAN);
        } else if (raw instanceof Number) {
            cell.setDisplayValue(formatter.formatNumber(((Number) raw).doubleValue(), cell.getDecimalPlaces()));
            cell.setDataType(CellDataType.NUMBER);
        } else {
            cell.setDisplayValue(raw.toString());
            cell.setDataType(CellDataType.STRING);
        }
    }
}
