package com.pcat.sync.reconcile;

/**
 * Outcome of one reconciliation pass.
 *
 * @param created   new identifiers written with create
 * @param updated   existing identifiers rewritten because their content changed
 * @param unchanged descriptors identical to the catalog entry (no store call)
 * @param failed    create/update calls that failed and were skipped
 */
public record ReconcileResult(int created, int updated, int unchanged, int failed) {

    public static final ReconcileResult EMPTY = new ReconcileResult(0, 0, 0, 0);

    public int processed() {
        return created + updated + unchanged + failed;
    }

    /** True when the pass issued no successful writes. */
    public boolean isNoOp() {
        return created == 0 && updated == 0;
    }
}
