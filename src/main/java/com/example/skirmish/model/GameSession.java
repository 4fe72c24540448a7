package com.example.skirmish.model;

import java.time.Instant;

/**
 * A play session at a location. Rounds hang off the session active at their location.
 */
public class GameSession {
    private final int id;
    private final String name;
    private final int locationId;
    private final boolean active;
    private final Instant createdAt;

    public GameSession(int id, String name, int locationId, boolean active, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.locationId = locationId;
        this.active = active;
        this.createdAt = createdAt;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public int getLocationId() { return locationId; }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }
}
