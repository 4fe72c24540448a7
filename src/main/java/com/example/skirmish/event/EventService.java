package com.example.skirmish.event;

import com.example.skirmish.combat.CombatException;
import com.example.skirmish.combat.CombatException.ErrorKind;
import com.example.skirmish.combat.CombatStorageException;
import com.example.skirmish.combat.InvalidEventTypeException;
import com.example.skirmish.combat.RoundStatus;
import com.example.skirmish.model.EventType;
import com.example.skirmish.model.RoleplayEvent;
import com.example.skirmish.persistence.CombatRoundDAO;
import com.example.skirmish.persistence.Database;
import com.example.skirmish.persistence.EventDAO;
import com.example.skirmish.persistence.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Opens and closes role-play events. A location runs at most one active event;
 * rounds created there while it is open are numbered within the event.
 */
public class EventService {
    private static final Logger logger = LoggerFactory.getLogger(EventService.class);

    private final Database db;
    private final EventDAO eventDAO;
    private final CombatRoundDAO roundDAO;
    private final SessionContextProvider sessions;

    public EventService(Database db, SessionContextProvider sessions) {
        this(db, new EventDAO(db), new CombatRoundDAO(db), sessions);
    }

    public EventService(Database db, EventDAO eventDAO, CombatRoundDAO roundDAO, SessionContextProvider sessions) {
        this.db = db;
        this.eventDAO = eventDAO;
        this.roundDAO = roundDAO;
        this.sessions = sessions;
    }

    /**
     * Open an event at a location.
     *
     * @param type lore, duel or quest (case-insensitive)
     * @param sessionId session to attach to, or null for the location's active session
     * @throws InvalidEventTypeException for any other type
     * @throws CombatException kind EVENT_ALREADY_ACTIVE if the location has an open event
     */
    public RoleplayEvent createEvent(String title, String type, int locationId, int createdBy,
                                     Integer sessionId, String description) {
        EventType eventType = EventType.fromString(type);
        if (eventType == null) {
            throw new InvalidEventTypeException(type);
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Event title is required");
        }
        Integer session = sessionId != null ? sessionId : sessions.resolveActiveSession(locationId);
        try {
            RoleplayEvent event = db.inTransaction("create event at location " + locationId,
                    c -> eventDAO.insert(c, title.trim(), description, eventType, locationId, session, createdBy));
            logger.info("[EventService] Opened {} event {} '{}' at location {}",
                    eventType.key(), event.getId(), event.getTitle(), locationId);
            return event;
        } catch (CombatStorageException e) {
            if (e.getCause() instanceof SQLException && Database.isUniqueViolation((SQLException) e.getCause())) {
                throw new CombatException(ErrorKind.EVENT_ALREADY_ACTIVE,
                        "Location " + locationId + " already has an active event");
            }
            throw e;
        }
    }

    public Optional<RoleplayEvent> getActiveEvent(int locationId) {
        return eventDAO.findActiveByLocation(locationId);
    }

    /**
     * Close an active event, storing a summary of its rounds.
     *
     * @return the closed event
     */
    public RoleplayEvent closeEvent(int eventId, int closedBy) {
        return db.inTransaction("close event " + eventId, c -> {
            RoleplayEvent event = eventDAO.findById(c, eventId)
                    .orElseThrow(() -> new CombatException(ErrorKind.NOT_FOUND, "Event " + eventId + " not found"));
            if (!event.isActive()) {
                throw new CombatException(ErrorKind.EVENT_NOT_ACTIVE, "Event " + eventId + " is already closed");
            }
            Map<RoundStatus, Integer> counts = roundDAO.countByStatusForEvent(c, eventId);
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("totalRounds", counts.values().stream().mapToInt(Integer::intValue).sum());
            summary.put("resolvedRounds", counts.get(RoundStatus.RESOLVED));
            summary.put("cancelledRounds", counts.get(RoundStatus.CANCELLED));
            summary.put("openRounds", counts.get(RoundStatus.ACTIVE) + counts.get(RoundStatus.RESOLVING));

            if (!eventDAO.close(c, eventId, closedBy, JsonColumns.write(summary))) {
                throw new CombatException(ErrorKind.EVENT_NOT_ACTIVE, "Event " + eventId + " is already closed");
            }
            logger.info("[EventService] Closed event {} ({} rounds)", eventId, summary.get("totalRounds"));
            return eventDAO.findById(c, eventId).orElseThrow();
        });
    }
}
