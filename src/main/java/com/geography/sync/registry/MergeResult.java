package com.geography.sync.registry;

import java.util.List;

/**
 * Outcome of folding one canonical unit into another.
 *
 * @param nestedMerges same-named children of the secondary that were merged into the primary's children first
 */
public record MergeResult(String primaryId, String secondaryId, List<String> repointedTenantUnitIds,
                          List<String> reparentedChildIds, int nestedMerges) {

    public MergeResult {
        repointedTenantUnitIds = List.copyOf(repointedTenantUnitIds);
        reparentedChildIds = List.copyOf(reparentedChildIds);
    }
}
