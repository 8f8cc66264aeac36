package com.raditha.approx.search;

import java.util.List;

/**
 * One row of the search report. Measurement fields are null when the variant was never
 * measured.
 */
public record VariantResult(
        String identityHash,
        List<Integer> modifiedLines,
        NodeStatus status,
        String reason,
        Double error,
        Double energy,
        Double latency,
        Double energyRatio,
        Double cost,
        boolean fromCache) {

    public VariantResult {
        modifiedLines = modifiedLines == null ? List.of() : List.copyOf(modifiedLines);
    }

    static VariantResult of(TreeNode node) {
        return new VariantResult(node.getIdentityHash(), node.getModifications(), node.getStatus(),
                node.getReason(), node.getError(), node.getEnergy(), node.getLatency(),
                node.getEnergyRatio(), node.getCost(), node.isFromCache());
    }
}
