package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.engine.recalc.RecalculationSummary;
import com.spreadsheet.calc.models.CellView;
import com.spreadsheet.calc.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for spreadsheet Sheets.
 * "/sheet" is the base path; cells are addressed in A1 notation.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Optional JSON body { "rows": 10, "columns": 5 }; missing sizes use the configured defaults.
     * Returns the new sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) Map<String, Integer> request) {
        Integer rows = request == null ? null : request.get("rows");
        Integer columns = request == null ? null : request.get("columns");
        long sheetId = sheetService.createSheet(rows, columns);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}/cell/{a1}
     * Body: raw input as plain text, e.g. "42", "hello" or "=SUM(A1:A5)".
     * A bad formula is not an error here; the cell shows "#ERROR!".
     * A malformed or out-of-sheet address is a 400.
     */
    @PutMapping("/{sheetId}/cell/{a1}")
    public ResponseEntity<RecalculationSummary> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String a1,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(sheetService.setCellValue(sheetId, a1, rawValue));
    }

    @PutMapping("/{sheetId}/cell/{a1}/decimalPlaces/{decimalPlaces}")
    public ResponseEntity<RecalculationSummary> setDecimalPlaces(
            @PathVariable long sheetId,
            @PathVariable String a1,
            @PathVariable int decimalPlaces
    ) {
        return ResponseEntity.ok(sheetService.setDecimalPlaces(sheetId, a1, decimalPlaces));
    }

    @DeleteMapping("/{sheetId}/cell/{a1}/decimalPlaces")
    public ResponseEntity<RecalculationSummary> clearDecimalPlaces(@PathVariable long sheetId, @PathVariable String a1) {
        return ResponseEntity.ok(sheetService.clearDecimalPlaces(sheetId, a1));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the display value of every non-empty cell: { "A1": "10", "B1": "20", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, String>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    @GetMapping("/{sheetId}/cell/{a1}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String a1) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, a1));
    }

    /**
     * POST /sheet/{sheetId}/evaluate?at=B2
     * Body: formula text. Evaluates it against the sheet without storing it.
     */
    @PostMapping("/{sheetId}/evaluate")
    public ResponseEntity<String> evaluate(
            @PathVariable long sheetId,
            @RequestParam(required = false) String at,
            @RequestBody String formula
    ) {
        return ResponseEntity.ok(sheetService.evaluate(sheetId, formula, at));
    }

    // Rows and columns are 0-based here

    @PostMapping("/{sheetId}/rows/{index}")
    public ResponseEntity<RecalculationSummary> insertRow(@PathVariable long sheetId, @PathVariable int index) {
        return ResponseEntity.ok(sheetService.insertRow(sheetId, index));
    }

    @DeleteMapping("/{sheetId}/rows/{index}")
    public ResponseEntity<RecalculationSummary> deleteRow(@PathVariable long sheetId, @PathVariable int index) {
        return ResponseEntity.ok(sheetService.deleteRow(sheetId, index));
    }

    @PostMapping("/{sheetId}/rows/{fromIndex}/move/{toIndex}")
    public ResponseEntity<RecalculationSummary> moveRow(
            @PathVariable long sheetId,
            @PathVariable int fromIndex,
            @PathVariable int toIndex
    ) {
        return ResponseEntity.ok(sheetService.moveRow(sheetId, fromIndex, toIndex));
    }

    @PostMapping("/{sheetId}/columns/{index}")
    public ResponseEntity<RecalculationSummary> insertColumn(@PathVariable long sheetId, @PathVariable int index) {
        return ResponseEntity.ok(sheetService.insertColumn(sheetId, index));
    }

    @DeleteMapping("/{sheetId}/columns/{index}")
    public ResponseEntity<RecalculationSummary> deleteColumn(@PathVariable long sheetId, @PathVariable int index) {
        return ResponseEntity.ok(sheetService.deleteColumn(sheetId, index));
    }

    @PostMapping("/{sheetId}/columns/{fromIndex}/move/{toIndex}")
    public ResponseEntity<RecalculationSummary> moveColumn(
            @PathVariable long sheetId,
            @PathVariable int fromIndex,
            @PathVariable int toIndex
    ) {
        return ResponseEntity.ok(sheetService.moveColumn(sheetId, fromIndex, toIndex));
    }

    /**
     * GET /sheet/{sheetId}/dependencies
     * For each formula cell => the set of cells it references.
     */
    @GetMapping("/{sheetId}/dependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencies(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/dependents
     * For each referenced cell => the set of formula cells that read it.
     */
    @GetMapping("/{sheetId}/dependents")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencies(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }
}
