package com.spreadsheet.drilldown.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Error body returned by every failing endpoint; status mirrors the HTTP status.
 * For example:
 * {
 *   "status": 422,
 *   "code": "WORKBOOK_UNREADABLE",
 *   "message": "Workbook could not be opened: ..."
 * }
 */
public class ErrorResponse {
    private final int status;
    private final String code;
    private final String message;

    public ErrorResponse(int status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message == null ? code : message;
    }

    public static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return new ResponseEntity<>(new ErrorResponse(status.value(), code, message), status);
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
