package com.example.skirmish.combat;

/**
 * Base type for every failure the combat core reports to its callers.
 *
 * Each subclass maps to one {@link ErrorKind}. Messages carry the round and
 * character involved but never SQL or driver details.
 */
public class CombatException extends RuntimeException {

    public enum ErrorKind {
        ROUND_NOT_ACTIVE,
        DUPLICATE_ACTION,
        TARGET_NOT_FOUND,
        INSUFFICIENT_RESOURCE,
        NO_ACTIONS_TO_RESOLVE,
        LOCATION_REQUIRED,
        INVALID_EVENT_TYPE,
        EVENT_ALREADY_ACTIVE,
        EVENT_NOT_ACTIVE,
        CONCURRENT_RESOLUTION_CONFLICT,
        INVALID_OUTCOME,
        NOT_FOUND,
        STORAGE
    }

    private final ErrorKind kind;
    private final Long roundId;
    private final Integer characterId;

    public CombatException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public CombatException(ErrorKind kind, String message, Long roundId, Integer characterId) {
        this(kind, message, roundId, characterId, null);
    }

    public CombatException(ErrorKind kind, String message, Long roundId, Integer characterId, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.roundId = roundId;
        this.characterId = characterId;
    }

    public ErrorKind getKind() { return kind; }

    /** Round involved, or null when the failure is not tied to a round. */
    public Long getRoundId() { return roundId; }

    /** Character involved, or null. */
    public Integer getCharacterId() { return characterId; }
}
