package com.example.skirmish.persistence;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each DAO's table setup once per database URL for the life of the JVM.
 * Keys combine the DAO name with the URL so separate databases (tests use one
 * in-memory database each) all get their schema.
 */
public final class MigrationManager {

    private static final Set<String> executed = ConcurrentHashMap.newKeySet();

    private MigrationManager() { }

    /**
     * Run {@code migration} unless a migration with the same key already ran.
     * A migration that throws is not recorded, so the next caller retries it.
     */
    public static void ensureMigration(String key, Runnable migration) {
        if (key == null) key = "default";
        if (executed.contains(key)) return;
        synchronized (MigrationManager.class) {
            if (executed.contains(key)) return;
            migration.run();
            executed.add(key);
        }
    }

    public static String keyFor(String daoName, Database db) {
        return daoName + "@" + db.getUrl();
    }
}
