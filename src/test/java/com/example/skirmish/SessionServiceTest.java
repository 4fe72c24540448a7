package com.example.skirmish;

import com.example.skirmish.combat.CombatStorageException;
import com.example.skirmish.event.SessionService;
import com.example.skirmish.persistence.Database;
import com.example.skirmish.persistence.SessionDAO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SessionService Tests")
class SessionServiceTest {

    private static final int LOCATION = 12;

    private Database db;
    private SessionDAO sessionDAO;
    private SessionService sessions;

    @BeforeEach
    void setUp() {
        db = CombatFixtures.freshDatabase();
        sessionDAO = new SessionDAO(db);
        sessions = new SessionService(db, sessionDAO);
    }

    private int sessionCount(int locationId) {
        return db.withConnection("count sessions", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM game_session WHERE location_id = ?")) {
                ps.setInt(1, locationId);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    return rs.getInt(1);
                }
            }
        });
    }

    // ========================================================================
    // Resolution
    // ========================================================================

    @Test
    @DisplayName("A location without a session gets one, and keeps it")
    void createsOnce() {
        int first = sessions.resolveActiveSession(LOCATION);
        int second = sessions.resolveActiveSession(LOCATION);

        assertEquals(first, second);
        assertEquals(1, sessionCount(LOCATION));
        assertEquals("Auto-created for Location 12", sessions.getActiveSession(LOCATION).orElseThrow().getName());
    }

    @Test
    @DisplayName("Each location gets its own session")
    void perLocation() {
        int here = sessions.resolveActiveSession(LOCATION);
        int there = sessions.resolveActiveSession(LOCATION + 1);

        assertNotEquals(here, there);
    }

    // ========================================================================
    // One active session per location
    // ========================================================================

    @Test
    @DisplayName("The table refuses a second active session for a location")
    void secondActiveSessionRejected() {
        sessionDAO.create("Evening scene", LOCATION);

        CombatStorageException e = assertThrows(CombatStorageException.class,
                () -> sessionDAO.create("Duplicate scene", LOCATION));

        assertTrue(Database.isUniqueViolation((SQLException) e.getCause()));
        assertEquals(1, sessionCount(LOCATION));
    }

    @Test
    @DisplayName("Concurrent callers share a single new session")
    void concurrentResolveSharesSession() throws Exception {
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return sessions.resolveActiveSession(LOCATION);
                }));
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS), "workers did not finish");
        } finally {
            pool.shutdownNow();
        }

        Set<Integer> ids = new HashSet<>();
        for (Future<Integer> f : futures) {
            ids.add(f.get());
        }
        assertEquals(1, ids.size());
        assertEquals(1, sessionCount(LOCATION));
    }
}
