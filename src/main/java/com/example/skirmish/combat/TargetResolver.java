package com.example.skirmish.combat;

import com.example.skirmish.model.GameCharacter;
import com.example.skirmish.model.Skill;
import com.example.skirmish.persistence.CharacterDAO;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Works out who a skill lands on from its target mode and the identifier the caster typed.
 * An identifier matches a character id, a user id, or a name (case-insensitive).
 */
public class TargetResolver {
    private final CharacterDAO characterDAO;

    public TargetResolver(CharacterDAO characterDAO) {
        this.characterDAO = characterDAO;
    }

    /**
     * @return the target, or null for skills that take none
     * @throws TargetNotFoundException when the skill needs another character and none matches
     */
    public GameCharacter resolve(Connection c, GameCharacter caster, Skill skill, String targetIdentifier)
            throws SQLException {
        String identifier = targetIdentifier == null ? null : targetIdentifier.trim();
        boolean blank = identifier == null || identifier.isEmpty();
        switch (skill.getTarget()) {
            case SELF:
                return caster;
            case NONE:
                return null;
            case ANY:
                return blank ? caster : lookup(c, caster, identifier);
            case OTHER:
            default:
                if (blank) {
                    throw new TargetNotFoundException(skill.getName() + " requires a target other than yourself",
                            caster.getId(), availableTargets(c, caster));
                }
                GameCharacter target = lookup(c, caster, identifier);
                if (target.getId() == caster.getId()) {
                    throw new TargetNotFoundException(skill.getName() + " requires a target other than yourself",
                            caster.getId(), availableTargets(c, caster));
                }
                return target;
        }
    }

    private GameCharacter lookup(Connection c, GameCharacter caster, String identifier) throws SQLException {
        GameCharacter found = characterDAO.findActiveByIdentifier(c, identifier).orElse(null);
        if (found == null) {
            throw new TargetNotFoundException("Target '" + identifier + "' not found",
                    caster.getId(), availableTargets(c, caster));
        }
        return found;
    }

    private List<String> availableTargets(Connection c, GameCharacter caster) throws SQLException {
        return characterDAO.listActive(c).stream()
                .filter(ch -> ch.getId() != caster.getId())
                .map(GameCharacter::describeForTargeting)
                .collect(Collectors.toList());
    }
}
