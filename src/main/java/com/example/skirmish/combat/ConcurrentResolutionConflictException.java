package com.example.skirmish.combat;

/**
 * Another resolver holds the round; this one gave up waiting for it.
 */
public class ConcurrentResolutionConflictException extends RoundNotActiveException {

    public ConcurrentResolutionConflictException(long roundId, Throwable cause) {
        super(ErrorKind.CONCURRENT_RESOLUTION_CONFLICT,
                "Combat round " + roundId + " is being resolved by another request", roundId, cause);
    }
}
