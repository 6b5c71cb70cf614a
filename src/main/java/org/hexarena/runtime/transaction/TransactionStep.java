package org.hexarena.runtime.transaction;

import java.util.function.BooleanSupplier;

/**
 * One step of a transaction: an action reporting success, paired with the action that undoes it.
 * <p>
 * A step that reports failure must leave no effects of its own; only steps that succeeded are
 * rolled back.
 *
 * @param description human-readable name used in log output
 * @param apply       performs the step and returns {@code true} on success
 * @param rollback    undoes a successful {@code apply}
 */
public record TransactionStep(String description, BooleanSupplier apply, Runnable rollback) {

    private static final Runnable NOTHING = () -> { };

    /**
     * Creates a step without a rollback, for steps whose effects are undone by nested steps or that
     * have none.
     */
    public static TransactionStep of(String description, BooleanSupplier apply) {
        return new TransactionStep(description, apply, NOTHING);
    }

    @Override
    public String toString() {
        return description;
    }
}
