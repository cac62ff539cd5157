package com.spreadsheet.drilldown.services;

import com.spreadsheet.drilldown.config.DrillDownProperties;
import com.spreadsheet.drilldown.exceptions.SessionNotFoundException;
import com.spreadsheet.drilldown.exceptions.SheetNotFoundException;
import com.spreadsheet.drilldown.exceptions.WorkbookUnreadableException;
import com.spreadsheet.drilldown.models.AnalysisSession;
import com.spreadsheet.drilldown.models.SessionInfo;
import com.spreadsheet.drilldown.workbook.PoiWorkbookAccessor;
import com.spreadsheet.drilldown.workbook.WorkbookAccessor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Holds every open analysis session, keyed by session ID.
 * Work on one session is serialized through its lock; different sessions never contend.
 */
@Service
public class SessionService {

    private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

    // All sessions live here in memory; the uploaded file is never written to disk
    private final Map<String, AnalysisSession> sessions = new ConcurrentHashMap<>();

    private final DrillDownProperties properties;

    public SessionService(DrillDownProperties properties) {
        this.properties = properties;
    }

    /**
     * Opens the uploaded workbook and registers a new session for it.
     * Throws WorkbookUnreadableException (and creates nothing) if the file can't be parsed.
     */
    public SessionInfo createSession(String filename, InputStream content) {
        return createSession(filename, PoiWorkbookAccessor.open(content));
    }

    public SessionInfo createSession(String filename, WorkbookAccessor workbook) {
        String sessionId = UUID.randomUUID().toString();
        AnalysisSession session = new AnalysisSession(sessionId, filename, workbook,
                properties.getDefaultNamingMode());
        sessions.put(sessionId, session);
        logger.info("Opened session {} for '{}'", sessionId, filename);
        return toInfo(session);
    }

    /**
     * Retrieves a session by ID. Throws if not found.
     */
    public AnalysisSession getSession(String sessionId) {
        AnalysisSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        return session;
    }

    public SessionInfo getSessionInfo(String sessionId) {
        return withSession(sessionId, this::toInfo);
    }

    public List<String> listSheets(String sessionId) {
        return withSession(sessionId, session -> session.getWorkbook().listSheets());
    }

    /**
     * Runs an action while holding the session's lock.
     * An unreadable workbook marks the session unusable; later calls fail fast.
     */
    public <T> T withSession(String sessionId, Function<AnalysisSession, T> action) {
        AnalysisSession session = getSession(sessionId);

        session.getLock().lock();
        try {
            if (!session.isUsable()) {
                throw new WorkbookUnreadableException(session.getUnusableReason());
            }
            return action.apply(session);
        } catch (WorkbookUnreadableException ex) {
            if (session.isUsable()) {
                logger.error("Session {} is no longer usable: {}", sessionId, ex.getMessage());
                session.markUnusable(ex.getMessage());
            }
            throw ex;
        } finally {
            session.getLock().unlock();
        }
    }

    /**
     * Throws SheetNotFoundException unless the session's workbook has the sheet.
     */
    public void requireSheet(AnalysisSession session, String sheet) {
        if (!session.getWorkbook().hasSheet(sheet)) {
            throw new SheetNotFoundException("Sheet '" + sheet + "' not found in workbook");
        }
    }

    /**
     * Closes the workbook handle and drops all state of the session.
     */
    public void closeSession(String sessionId) {
        AnalysisSession session = getSession(sessionId);

        session.getLock().lock();
        try {
            sessions.remove(sessionId);
            session.getWorkbook().close();
            logger.info("Closed session {}", sessionId);
        } finally {
            session.getLock().unlock();
        }
    }

    public int getSessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            try {
                closeSession(sessionId);
            } catch (SessionNotFoundException ex) {
                logger.debug("Session {} already closed", sessionId);
            }
        }
    }

    private SessionInfo toInfo(AnalysisSession session) {
        return new SessionInfo(session.getId(), session.getFilename(), session.getUploadTime(),
                session.getWorkbook().listSheets());
    }
}
