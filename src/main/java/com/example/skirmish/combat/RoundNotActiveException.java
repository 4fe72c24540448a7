package com.example.skirmish.combat;

/**
 * The round does not exist or is no longer accepting actions / resolution.
 */
public class RoundNotActiveException extends CombatException {

    public RoundNotActiveException(long roundId) {
        super(ErrorKind.ROUND_NOT_ACTIVE, "Combat round " + roundId + " not found or not active", roundId, null);
    }

    protected RoundNotActiveException(ErrorKind kind, String message, long roundId, Throwable cause) {
        super(kind, message, roundId, null, cause);
    }
}
