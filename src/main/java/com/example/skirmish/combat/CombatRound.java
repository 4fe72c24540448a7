package com.example.skirmish.combat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A bundle of simultaneous actions at one location, resolved together.
 *
 * Round numbers count up per event when the round belongs to an event,
 * otherwise per location among rounds with no event.
 */
public class CombatRound {
    private final long id;
    private final int roundNumber;
    private final int locationId;
    private final Integer sessionId;
    private final Integer eventId;
    private final RoundStatus status;
    private final int createdBy;
    private final Integer resolvedBy;
    private final RoundResolution resolution;
    private final Instant createdAt;
    private final Instant resolvedAt;
    private final List<CombatAction> actions;

    public CombatRound(long id, int roundNumber, int locationId, Integer sessionId, Integer eventId,
                       RoundStatus status, int createdBy, Integer resolvedBy, RoundResolution resolution,
                       Instant createdAt, Instant resolvedAt, List<CombatAction> actions) {
        this.id = id;
        this.roundNumber = roundNumber;
        this.locationId = locationId;
        this.sessionId = sessionId;
        this.eventId = eventId;
        this.status = status;
        this.createdBy = createdBy;
        this.resolvedBy = resolvedBy;
        this.resolution = resolution;
        this.createdAt = createdAt;
        this.resolvedAt = resolvedAt;
        this.actions = actions != null ? new ArrayList<>(actions) : new ArrayList<>();
    }

    public CombatRound withActions(List<CombatAction> actions) {
        return new CombatRound(id, roundNumber, locationId, sessionId, eventId, status, createdBy,
                resolvedBy, resolution, createdAt, resolvedAt, actions);
    }

    /**
     * Scope key for round numbering: {@code event:<id>} or {@code location:<id>}.
     */
    public static String scopeKey(int locationId, Integer eventId) {
        return eventId != null ? "event:" + eventId : "location:" + locationId;
    }

    public long getId() { return id; }
    public int getRoundNumber() { return roundNumber; }
    public int getLocationId() { return locationId; }
    public Integer getSessionId() { return sessionId; }
    public Integer getEventId() { return eventId; }
    public RoundStatus getStatus() { return status; }
    public boolean isActive() { return status == RoundStatus.ACTIVE; }
    public int getCreatedBy() { return createdBy; }
    public Integer getResolvedBy() { return resolvedBy; }

    /** Stored resolution payload, null until the round is resolved. */
    public RoundResolution getResolution() { return resolution; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getResolvedAt() { return resolvedAt; }
    public List<CombatAction> getActions() { return Collections.unmodifiableList(actions); }

    @Override
    public String toString() {
        return "CombatRound{id=" + id + ", number=" + roundNumber + ", location=" + locationId
                + ", event=" + eventId + ", status=" + status.getKey() + "}";
    }
}
