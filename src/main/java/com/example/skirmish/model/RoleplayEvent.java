package com.example.skirmish.model;

import java.time.Instant;

/**
 * A role-play event (lore scene, duel, quest) running at a location.
 * At most one event per location is active at a time.
 */
public class RoleplayEvent {

    public enum Status { ACTIVE, CLOSED }

    private final int id;
    private final String title;
    private final String description;
    private final EventType type;
    private final int locationId;
    private final Integer sessionId;
    private final Status status;
    private final int createdBy;
    private final Integer closedBy;
    private final Instant createdAt;
    private final Instant closedAt;
    private final String summaryJson;

    public RoleplayEvent(int id, String title, String description, EventType type, int locationId,
                         Integer sessionId, Status status, int createdBy, Integer closedBy,
                         Instant createdAt, Instant closedAt, String summaryJson) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.type = type;
        this.locationId = locationId;
        this.sessionId = sessionId;
        this.status = status;
        this.createdBy = createdBy;
        this.closedBy = closedBy;
        this.createdAt = createdAt;
        this.closedAt = closedAt;
        this.summaryJson = summaryJson;
    }

    public int getId() { return id; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public EventType getType() { return type; }
    public int getLocationId() { return locationId; }
    public Integer getSessionId() { return sessionId; }
    public Status getStatus() { return status; }
    public boolean isActive() { return status == Status.ACTIVE; }
    public int getCreatedBy() { return createdBy; }
    public Integer getClosedBy() { return closedBy; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getClosedAt() { return closedAt; }

    /** Closing summary as stored JSON, null while the event is active. */
    public String getSummaryJson() { return summaryJson; }
}
