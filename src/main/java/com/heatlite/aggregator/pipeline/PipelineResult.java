package com.heatlite.aggregator.pipeline;

import com.heatlite.aggregator.budget.BudgetResult;
import com.heatlite.aggregator.columns.ResolvedColumns;
import com.heatlite.aggregator.metrics.RunStats;
import com.heatlite.aggregator.model.GridType;
import com.heatlite.aggregator.model.TimeWindow;

import java.nio.file.Path;
import java.util.List;

public record PipelineResult(
    Path output,
    ResolvedColumns columns,
    List<TimeWindow> windows,
    GridType grid,
    BudgetResult budget,
    RunStats stats
) {}
