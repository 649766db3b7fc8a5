package io.tick4j.core;

/**
 * Result of reconciling stored job records with the registered job set.
 *
 * inserted : records created for newly registered ids
 * deleted  : orphan records removed because their id is no longer registered
 */
public record ReconcileResult(
        long inserted,
        long deleted
) {

    public static ReconcileResult empty() {
        return new ReconcileResult(0, 0);
    }

    public boolean hasEffect() {
        return inserted > 0 || deleted > 0;
    }
}
