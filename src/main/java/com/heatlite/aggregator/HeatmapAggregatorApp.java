package com.heatlite.aggregator;

import com.heatlite.aggregator.config.AggregationConfig;
import com.heatlite.aggregator.config.CommandLineOptions;
import com.heatlite.aggregator.config.UsageException;
import com.heatlite.aggregator.error.HeatmapException;
import com.heatlite.aggregator.pipeline.HeatmapPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: aggregates a CSV of point events into the heatmap JSON artifact.
 *
 * Exit codes: 0 success (also when the size budget could not be met),
 * 1 pipeline failure, 2 bad command line.
 */
public class HeatmapAggregatorApp {

    private static final Logger log = LoggerFactory.getLogger(HeatmapAggregatorApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, new HeatmapPipeline()));
    }

    static int run(String[] args, HeatmapPipeline pipeline) {
        if (CommandLineOptions.isHelpRequested(args)) {
            System.out.print(CommandLineOptions.USAGE);
            return EXIT_OK;
        }

        AggregationConfig config;
        try {
            config = CommandLineOptions.parse(args);
        } catch (UsageException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.print(CommandLineOptions.USAGE);
            return EXIT_USAGE;
        }

        try {
            pipeline.run(config);
            return EXIT_OK;
        } catch (HeatmapException e) {
            log.error("Aggregation failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
