package com.example.skirmish.event;

/**
 * Supplies the session a new round belongs to.
 */
public interface SessionContextProvider {

    /**
     * Id of the active session at a location, creating one if there is none.
     */
    int resolveActiveSession(int locationId);
}
