package com.spreadsheet.drilldown.exceptions;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GlobalExceptionHandler: status, code and message of each error body.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void testNotFoundErrors() {
        ResponseEntity<ErrorResponse> session = handler.handleSessionNotFound(
                new SessionNotFoundException("Session not found: abc"));
        assertEquals(HttpStatus.NOT_FOUND, session.getStatusCode());
        assertEquals(404, session.getBody().getStatus());
        assertEquals("SESSION_NOT_FOUND", session.getBody().getCode());
        assertEquals("Session not found: abc", session.getBody().getMessage());

        ResponseEntity<ErrorResponse> node = handler.handleNodeNotFound(
                new DependencyNodeNotFoundException("No node x"));
        assertEquals("NODE_NOT_FOUND", node.getBody().getCode());
        assertEquals(404, node.getBody().getStatus());
    }

    @Test
    void testUnreadableWorkbookIs422() {
        ResponseEntity<ErrorResponse> response = handler.handleUnreadable(
                new WorkbookUnreadableException("Workbook could not be opened: truncated zip"));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals(422, response.getBody().getStatus());
        assertEquals("WORKBOOK_UNREADABLE", response.getBody().getCode());
        assertEquals("Workbook could not be opened: truncated zip", response.getBody().getMessage());
    }

    @Test
    void testBadInputIs400() {
        ResponseEntity<ErrorResponse> address = handler.handleInvalidAddress(
                new InvalidCellAddressException("Invalid cell address '1A'"));
        assertEquals(HttpStatus.BAD_REQUEST, address.getStatusCode());
        assertEquals("INVALID_CELL_ADDRESS", address.getBody().getCode());

        ResponseEntity<ErrorResponse> config = handler.handleInvalidConfiguration(
                new InvalidConfigurationException("Label row 99 is outside the used area"));
        assertEquals(400, config.getBody().getStatus());
        assertEquals("INVALID_CONFIGURATION", config.getBody().getCode());
    }

    /**
     * Exceptions without a message still produce a readable body.
     */
    @Test
    void testUnexpectedErrorWithoutMessage() {
        ResponseEntity<ErrorResponse> response = handler.handleGeneric(new NullPointerException());

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals(500, response.getBody().getStatus());
        assertEquals("SERVER_ERROR", response.getBody().getCode());
        assertEquals("SERVER_ERROR", response.getBody().getMessage());
    }
}
