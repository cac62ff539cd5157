package com.spreadsheet.drilldown.services;

import com.spreadsheet.drilldown.config.DrillDownProperties;
import com.spreadsheet.drilldown.exceptions.SessionNotFoundException;
import com.spreadsheet.drilldown.exceptions.WorkbookUnreadableException;
import com.spreadsheet.drilldown.models.NamingMode;
import com.spreadsheet.drilldown.models.SessionInfo;
import com.spreadsheet.drilldown.workbook.InMemoryWorkbookAccessor;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionServiceTest {

    private DrillDownProperties properties;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        properties = new DrillDownProperties();
        sessionService = new SessionService(properties);
    }

    @Test
    void testCreateFromUploadedBytes() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            workbook.createSheet("Inputs");
            workbook.createSheet("Model");
            workbook.write(out);
        }

        SessionInfo info = sessionService.createSession("model.xlsx", new ByteArrayInputStream(out.toByteArray()));

        assertNotNull(info.getSessionId());
        assertEquals("model.xlsx", info.getFilename());
        assertEquals(List.of("Inputs", "Model"), info.getSheets());
        assertNotNull(info.getUploadTime());
        assertEquals(List.of("Inputs", "Model"), sessionService.listSheets(info.getSessionId()));
    }

    /**
     * Garbage bytes are rejected and no session is created.
     */
    @Test
    void testUnreadableUpload() {
        byte[] garbage = "definitely not a spreadsheet".getBytes(StandardCharsets.UTF_8);

        assertThrows(WorkbookUnreadableException.class,
                () -> sessionService.createSession("notes.txt", new ByteArrayInputStream(garbage)));
        assertEquals(0, sessionService.getSessionCount());
    }

    @Test
    void testCloseSession() {
        InMemoryWorkbookAccessor workbook = new InMemoryWorkbookAccessor().addSheet("Sheet1");
        String sessionId = sessionService.createSession("a.xlsx", workbook).getSessionId();

        sessionService.closeSession(sessionId);

        assertTrue(workbook.isClosed());
        assertThrows(SessionNotFoundException.class, () -> sessionService.getSession(sessionId));
        assertThrows(SessionNotFoundException.class, () -> sessionService.closeSession(sessionId));
    }

    /**
     * Sessions are fully independent of each other.
     */
    @Test
    void testSessionsAreIsolated() {
        properties.setDefaultNamingMode(NamingMode.GENERATED);
        String first = sessionService.createSession("a.xlsx", new InMemoryWorkbookAccessor().addSheet("A"))
                .getSessionId();
        String second = sessionService.createSession("b.xlsx", new InMemoryWorkbookAccessor().addSheet("B"))
                .getSessionId();

        assertNotEquals(first, second);
        assertEquals(List.of("A"), sessionService.listSheets(first));
        assertEquals(List.of("B"), sessionService.listSheets(second));
        assertEquals(NamingMode.GENERATED, sessionService.getSession(first).getNamingMode());

        sessionService.closeAll();
        assertEquals(0, sessionService.getSessionCount());
    }

    /**
     * Once a read fails, the session refuses further work.
     */
    @Test
    void testUnreadableWorkbookMarksSessionUnusable() {
        String sessionId = sessionService.createSession("a.xlsx", new InMemoryWorkbookAccessor().addSheet("A"))
                .getSessionId();

        assertThrows(WorkbookUnreadableException.class, () -> sessionService.withSession(sessionId, session -> {
            throw new WorkbookUnreadableException("disk gone");
        }));

        assertFalse(sessionService.getSession(sessionId).isUsable());
        WorkbookUnreadableException ex = assertThrows(WorkbookUnreadableException.class,
                () -> sessionService.listSheets(sessionId));
        assertEquals("disk gone", ex.getMessage());
    }

    @Test
    void testUnknownSession() {
        assertThrows(SessionNotFoundException.class, () -> sessionService.getSessionInfo("missing"));
    }
}
