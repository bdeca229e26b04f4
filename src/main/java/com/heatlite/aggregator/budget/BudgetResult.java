package com.heatlite.aggregator.budget;

import com.heatlite.aggregator.model.HeatmapArtifact;
import com.heatlite.aggregator.model.Resolution;

import java.util.List;

/**
 * Outcome of the budget loop.
 *
 * @param artifact   the accepted artifact
 * @param bytes      its canonical encoding; this is what gets written
 * @param resolution resolution that produced the artifact
 * @param attempts   every aggregation pass, in order
 * @param budgetMet  false when the coarsest allowed resolution was still over budget
 */
public record BudgetResult(
    HeatmapArtifact artifact,
    byte[] bytes,
    Resolution resolution,
    List<Attempt> attempts,
    boolean budgetMet
) {
    public record Attempt(Resolution resolution, int features, long bytes) {}

    public BudgetResult {
        attempts = List.copyOf(attempts);
    }

    public double sizeMb() {
        return bytes.length / (1024.0 * 1024.0);
    }
}
