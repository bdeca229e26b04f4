package com.heatlite.aggregator.pipeline;

import com.heatlite.aggregator.aggregate.Aggregator;
import com.heatlite.aggregator.aggregate.WindowBuckets;
import com.heatlite.aggregator.budget.BudgetController;
import com.heatlite.aggregator.budget.BudgetResult;
import com.heatlite.aggregator.columns.ColumnResolver;
import com.heatlite.aggregator.columns.ResolvedColumns;
import com.heatlite.aggregator.config.AggregationConfig;
import com.heatlite.aggregator.error.InvalidRangeException;
import com.heatlite.aggregator.io.ArtifactWriter;
import com.heatlite.aggregator.io.EventTable;
import com.heatlite.aggregator.io.EventTableReader;
import com.heatlite.aggregator.metrics.RunStats;
import com.heatlite.aggregator.model.EventRecord;
import com.heatlite.aggregator.model.GridType;
import com.heatlite.aggregator.model.TimeWindow;
import com.heatlite.aggregator.spatial.SpatialIndexer;
import com.heatlite.aggregator.spatial.SpatialIndexers;
import com.heatlite.aggregator.time.WindowBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * One batch run: load, resolve columns, filter, window, aggregate under the size
 * budget, write.
 *
 * Every fatal condition is raised before the output file is touched.
 */
public class HeatmapPipeline {

    private static final Logger log = LoggerFactory.getLogger(HeatmapPipeline.class);

    private final Function<GridType, SpatialIndexer> indexerSelector;

    public HeatmapPipeline() {
        this(SpatialIndexers::select);
    }

    public HeatmapPipeline(Function<GridType, SpatialIndexer> indexerSelector) {
        this.indexerSelector = indexerSelector;
    }

    public PipelineResult run(AggregationConfig config) {
        var stats = new RunStats();

        EventTable table = EventTableReader.read(config.input());
        ResolvedColumns columns = ColumnResolver.resolve(table.header());
        log.info("Using columns: {}", columns);

        List<EventRecord> records = ValidityFilter.apply(table, columns, stats);
        log.info("Valid rows: {} ({} excluded: {} bad date, {} bad coordinates)",
            records.size(), stats.getRowsExcluded(), stats.getBadDates(), stats.getBadCoordinates());

        if (records.isEmpty()) {
            throw new InvalidRangeException("No valid rows after filtering (" + stats.getRowsRead() + " rows read)");
        }
        IntSummaryStatistics years = records.stream().mapToInt(EventRecord::year).summaryStatistics();
        List<TimeWindow> windows = WindowBuilder.build(years.getMin(), years.getMax(), config.yearsPerWindow());
        log.info("Created {} time windows: {}-{}", windows.size(), years.getMin(), years.getMax());

        SpatialIndexer indexer = indexerSelector.apply(config.grid());

        if (config.conusOnly()) {
            records = BoundingBox.CONUS.filter(records, stats);
            log.info("Filtered to CONUS: {} rows", records.size());
        }

        WindowBuckets buckets = WindowBuckets.of(records, windows);

        BudgetResult budget;
        log.info("Aggregating incidents...");
        try (var aggregator = new Aggregator(config.threads())) {
            budget = BudgetController.fromConfig(aggregator, indexer, config, stats)
                .run(buckets, config.initialResolution(indexer.gridType()));
        }

        ArtifactWriter.write(config.output(), budget.bytes());

        log.info("Final size: {}MB, features: {}, windows: {}, grid: {} (resolution: {})",
            String.format(Locale.ROOT, "%.1f", budget.sizeMb()),
            budget.artifact().features().size(), windows.size(),
            indexer.gridType().wireName(), budget.resolution().value());
        log.info("Run stats: {}", stats.summary());

        return new PipelineResult(config.output(), columns, windows, indexer.gridType(), budget, stats);
    }
}
