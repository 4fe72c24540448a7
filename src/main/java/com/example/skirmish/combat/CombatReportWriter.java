package com.example.skirmish.combat;

import com.example.skirmish.persistence.EngineLogDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a resolved round for players and appends it to the engine log.
 */
public class CombatReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(CombatReportWriter.class);

    public static final String LOG_TYPE = "effect";
    public static final String ACTOR = "System";

    private final EngineLogDAO engineLogDAO;

    public CombatReportWriter(EngineLogDAO engineLogDAO) {
        this.engineLogDAO = engineLogDAO;
    }

    public String formatReport(CombatRound round, List<CombatAction> actions, RoundResolution resolution) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== ROUND ").append(round.getRoundNumber()).append(" RESOLUTION ===\n");

        sb.append("\nSubmitted actions:\n");
        for (CombatAction a : actions) {
            sb.append("- ").append(a.getCharacterName()).append(" used ").append(a.getSkillName())
              .append(" on ").append(ClashNarrator.targetLabel(a))
              .append(" (Output: ").append(a.getFinalOutput())
              .append(", ").append(a.getRollQuality().getLabel()).append(")\n");
        }

        if (!resolution.getClashes().isEmpty()) {
            sb.append("\nClashes:\n");
            for (RoundResolution.Clash clash : resolution.getClashes()) {
                sb.append("- ").append(clash.getResolution()).append('\n');
            }
        }
        if (!resolution.getIndependentActions().isEmpty()) {
            sb.append("\nIndependent actions:\n");
            for (RoundResolution.IndependentAction ia : resolution.getIndependentActions()) {
                sb.append("- ").append(ia.getDetails()).append('\n');
            }
        }

        RoundResolution.Summary summary = resolution.getSummary();
        sb.append("\n").append(summary.getTotalActions()).append(" actions, ")
          .append(summary.getClashCount()).append(" clashes, ")
          .append(summary.getIndependentCount()).append(" independent.");
        return sb.toString();
    }

    /**
     * Append the round's report to the engine log.
     *
     * @return the log entry id
     */
    public long writeRoundResolution(CombatRound round, List<CombatAction> actions, RoundResolution resolution) {
        List<String> effects = new ArrayList<>();
        for (RoundResolution.Clash clash : resolution.getClashes()) {
            for (String e : clash.getEffects()) {
                if (!effects.contains(e)) effects.add(e);
            }
        }
        long id = engineLogDAO.insert(round.getSessionId(), round.getLocationId(), LOG_TYPE, ACTOR, null, null,
                null, effects, formatReport(round, actions, resolution), resolution);
        logger.debug("[CombatReportWriter] round {} report written as log entry {}", round.getId(), id);
        return id;
    }
}
