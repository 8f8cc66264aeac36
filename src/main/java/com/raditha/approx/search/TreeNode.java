package com.raditha.approx.search;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One subset of modified lines in the search tree. Only the thread coordinating the
 * search mutates nodes.
 */
public class TreeNode {

    private final List<Integer> modifications;
    private NodeStatus status = NodeStatus.PENDING;
    private String identityHash;
    private Path variantPath;
    private Double error;
    private Double energy;
    private Double latency;
    private Double energyRatio;
    private Double cost;
    private String reason;
    private boolean fromCache;

    public TreeNode(List<Integer> modifications) {
        this.modifications = List.copyOf(modifications);
    }

    public List<Integer> getModifications() {
        return modifications;
    }

    public int getLevel() {
        return modifications.size();
    }

    public boolean isRoot() {
        return modifications.isEmpty();
    }

    /**
     * {@code original} for the root, otherwise {@code mod_<line>_<line>...}.
     */
    public String getName() {
        if (isRoot()) {
            return "original";
        }
        return modifications.stream()
                .map(String::valueOf)
                .collect(Collectors.joining("_", "mod_", ""));
    }

    public NodeStatus getStatus() {
        return status;
    }

    public void setStatus(NodeStatus status) {
        this.status = status;
    }

    public String getIdentityHash() {
        return identityHash;
    }

    public void setIdentityHash(String identityHash) {
        this.identityHash = identityHash;
    }

    public Path getVariantPath() {
        return variantPath;
    }

    public void setVariantPath(Path variantPath) {
        this.variantPath = variantPath;
    }

    public Double getError() {
        return error;
    }

    public Double getEnergy() {
        return energy;
    }

    public Double getLatency() {
        return latency;
    }

    public Double getEnergyRatio() {
        return energyRatio;
    }

    public Double getCost() {
        return cost;
    }

    public void setMeasurements(double error, double energy, double latency, double energyRatio, double cost) {
        this.error = error;
        this.energy = energy;
        this.latency = latency;
        this.energyRatio = energyRatio;
        this.cost = cost;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public void setFromCache(boolean fromCache) {
        this.fromCache = fromCache;
    }

    @Override
    public String toString() {
        return getName() + "[" + status + "]";
    }
}
