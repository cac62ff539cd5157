package com.spreadsheet.drilldown.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns the typed failures of the drill-down and naming services into
 * error JSON. Cycles and external references never get here: they are node markers.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException ex) {
        return ErrorResponse.respond(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return ErrorResponse.respond(HttpStatus.NOT_FOUND, "SHEET_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(DependencyNodeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNodeNotFound(DependencyNodeNotFoundException ex) {
        return ErrorResponse.respond(HttpStatus.NOT_FOUND, "NODE_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidCellAddressException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAddress(InvalidCellAddressException ex) {
        return ErrorResponse.respond(HttpStatus.BAD_REQUEST, "INVALID_CELL_ADDRESS", ex.getMessage());
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidConfiguration(InvalidConfigurationException ex) {
        return ErrorResponse.respond(HttpStatus.BAD_REQUEST, "INVALID_CONFIGURATION", ex.getMessage());
    }

    @ExceptionHandler(WorkbookUnreadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(WorkbookUnreadableException ex) {
        return ErrorResponse.respond(HttpStatus.UNPROCESSABLE_ENTITY, "WORKBOOK_UNREADABLE", ex.getMessage());
    }

    /**
     * Malformed JSON bodies, including unknown naming modes or AI statuses.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ErrorResponse.respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        logger.error("Unhandled error", ex);
        return ErrorResponse.respond(HttpStatus.INTERNAL_SERVER_ERROR, "SERVER_ERROR", ex.getMessage());
    }
}
