package com.example.skirmish.combat;

import com.example.skirmish.persistence.CombatRoundDAO;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal round lifecycle moves, applied to the store as conditional updates.
 *
 * <pre>
 * active    -> resolving | resolved | cancelled
 * resolving -> resolved | cancelled
 * resolved, cancelled: terminal
 * </pre>
 */
public class RoundStateMachine {

    private static final Map<RoundStatus, Set<RoundStatus>> TRANSITIONS = new EnumMap<>(RoundStatus.class);

    static {
        TRANSITIONS.put(RoundStatus.ACTIVE, EnumSet.of(RoundStatus.RESOLVING, RoundStatus.RESOLVED, RoundStatus.CANCELLED));
        TRANSITIONS.put(RoundStatus.RESOLVING, EnumSet.of(RoundStatus.RESOLVED, RoundStatus.CANCELLED));
        TRANSITIONS.put(RoundStatus.RESOLVED, EnumSet.noneOf(RoundStatus.class));
        TRANSITIONS.put(RoundStatus.CANCELLED, EnumSet.noneOf(RoundStatus.class));
    }

    private final CombatRoundDAO roundDAO;

    public RoundStateMachine(CombatRoundDAO roundDAO) {
        this.roundDAO = roundDAO;
    }

    public static boolean canTransition(RoundStatus from, RoundStatus to) {
        if (from == null || to == null) return false;
        return TRANSITIONS.get(from).contains(to);
    }

    public static Set<RoundStatus> getValidNextStates(RoundStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.get(from));
    }

    public static boolean isTerminal(RoundStatus status) {
        return TRANSITIONS.get(status).isEmpty();
    }

    /**
     * Move a round from {@code from} to {@code to} if it is still in {@code from}.
     * Entering a terminal state stamps the actor and time.
     *
     * @return false when the round was not in {@code from} (missing, or changed by someone else)
     * @throws IllegalStateException if the move is not a legal transition
     */
    public boolean transition(Connection c, long roundId, RoundStatus from, RoundStatus to,
                              Integer actorId, String resolutionJson) throws SQLException {
        if (!canTransition(from, to)) {
            throw new IllegalStateException("Invalid round transition: " + from.getKey() + " -> " + to.getKey());
        }
        boolean terminal = isTerminal(to);
        int updated = roundDAO.compareAndSetStatus(c, roundId, from, to,
                terminal ? actorId : null,
                terminal ? Instant.now() : null,
                resolutionJson);
        return updated > 0;
    }
}
