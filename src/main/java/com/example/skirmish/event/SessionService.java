package com.example.skirmish.event;

import com.example.skirmish.combat.CombatStorageException;
import com.example.skirmish.model.GameSession;
import com.example.skirmish.persistence.Database;
import com.example.skirmish.persistence.SessionDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Sessions backed by the {@code game_session} table. A location with no active session
 * gets one named "Auto-created for Location &lt;id&gt;"; the table allows only one active
 * session per location, so concurrent callers end up sharing it.
 */
public class SessionService implements SessionContextProvider {
    private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

    private static final int CREATE_ATTEMPTS = 5;

    private final Database db;
    private final SessionDAO sessionDAO;

    public SessionService(Database db) {
        this(db, new SessionDAO(db));
    }

    public SessionService(Database db, SessionDAO sessionDAO) {
        this.db = db;
        this.sessionDAO = sessionDAO;
    }

    /**
     * @throws CombatStorageException if the session still cannot be read or created after
     *         {@value #CREATE_ATTEMPTS} attempts
     */
    @Override
    public int resolveActiveSession(int locationId) {
        for (int attempt = 1; ; attempt++) {
            try {
                return db.inTransaction("resolve session for location " + locationId, c -> {
                    Optional<GameSession> existing = sessionDAO.findActiveByLocation(c, locationId);
                    if (existing.isPresent()) {
                        return existing.get().getId();
                    }
                    GameSession created = sessionDAO.create(c, "Auto-created for Location " + locationId, locationId);
                    logger.info("[SessionService] Created session {} for location {}", created.getId(), locationId);
                    return created.getId();
                });
            } catch (CombatStorageException e) {
                // Another caller created the location's session first; read theirs on the next pass
                if (attempt < CREATE_ATTEMPTS && isCreateConflict(e)) {
                    logger.debug("[SessionService] session for location {} created concurrently, retrying ({}/{})",
                            locationId, attempt, CREATE_ATTEMPTS);
                    continue;
                }
                throw e;
            }
        }
    }

    private static boolean isCreateConflict(CombatStorageException e) {
        if (!(e.getCause() instanceof SQLException)) return false;
        SQLException sql = (SQLException) e.getCause();
        return Database.isUniqueViolation(sql) || Database.isLockConflict(sql);
    }

    public Optional<GameSession> getActiveSession(int locationId) {
        return sessionDAO.findActiveByLocation(locationId);
    }
}
