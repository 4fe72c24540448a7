package com.example.skirmish.persistence;

import com.example.skirmish.combat.CombatStorageException;
import com.example.skirmish.util.CombatSettings;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Connection settings plus the helpers DAOs and services use to run JDBC work,
 * either on a fresh auto-commit connection or inside one transaction.
 */
public class Database {

    /** Unique key / primary key violation. */
    public static final String SQLSTATE_UNIQUE_VIOLATION = "23505";
    /** Serialization failure / deadlock. */
    public static final String SQLSTATE_SERIALIZATION_FAILURE = "40001";
    /** H2: lock wait timed out. */
    public static final int H2_LOCK_TIMEOUT = 50200;
    /** H2: row changed by another transaction. */
    public static final int H2_CONCURRENT_UPDATE = 90131;

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    private final String url;
    private final String user;
    private final String password;

    public Database() {
        this(CombatSettings.getInstance());
    }

    public Database(CombatSettings settings) {
        this(settings.getDbUrl(), settings.getDbUser(), settings.getDbPassword());
    }

    public Database(String url) {
        this(url, "sa", "");
    }

    public Database(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    public String getUrl() {
        return url;
    }

    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Run work on its own auto-commit connection.
     */
    public <T> T withConnection(String operation, SqlWork<T> work) {
        try (Connection c = getConnection()) {
            return work.run(c);
        } catch (SQLException e) {
            throw new CombatStorageException(operation, e);
        }
    }

    /**
     * Run work in a single transaction. Commits when the work returns, rolls back on
     * any exception and rethrows it (SQL failures wrapped as {@link CombatStorageException}).
     */
    public <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection c = getConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(c, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new CombatStorageException(operation, e);
        }
    }

    private static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException re) {
            cause.addSuppressed(re);
        }
    }

    public static boolean isUniqueViolation(SQLException e) {
        return SQLSTATE_UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    public static boolean isLockConflict(SQLException e) {
        return e.getErrorCode() == H2_LOCK_TIMEOUT
                || e.getErrorCode() == H2_CONCURRENT_UPDATE
                || SQLSTATE_SERIALIZATION_FAILURE.equals(e.getSQLState());
    }
}
