package org.hexarena.runtime.skill;

/**
 * Thrown by a skill that cannot be activated in the current board state, for example when there is
 * no free tile for a companion. The engine cleans up the partial activation and reports failure to
 * the enclosing transaction.
 */
public class SkillActivationException extends Exception {

    public SkillActivationException(String message) {
        super(message);
    }
}
