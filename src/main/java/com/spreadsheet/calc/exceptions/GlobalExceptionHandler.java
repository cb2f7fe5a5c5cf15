package com.spreadsheet.calc.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches custom exceptions from anywhere in the controllers or services,
 * returning user-friendly error JSON with an HTTP 4xx code instead of 500.
 * Formula evaluation errors never get here; they show up as "#ERROR!" / "#N/A" cell values.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidReferenceException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_REFERENCE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CellOutOfBoundsException.class)
    public ResponseEntity<ErrorResponse> handleCellOutOfBounds(CellOutOfBoundsException ex) {
        ErrorResponse error = new ErrorResponse("CELL_OUT_OF_BOUNDS", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_REQUEST", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("SHEET_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        logger.error("Unhandled exception", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
