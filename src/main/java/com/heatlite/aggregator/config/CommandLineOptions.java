package com.heatlite.aggregator.config;

import com.heatlite.aggregator.model.GridType;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Parses {@code --flag value} style arguments into an {@link AggregationConfig}.
 */
public final class CommandLineOptions {

    public static final String USAGE = """
        Usage: heatlite-aggregator --csv <path> [options]

          --csv <path>              input CSV table (required)
          --out <path>              output JSON (default dist/aggregates.json)
          --grid h3|bin             spatial grid (default h3, falls back to bin without H3)
          --h3-res <int>            starting H3 resolution (default 6)
          --h3-min-res <int>        coarsest H3 resolution when shrinking output (default 5)
          --bin-size <float>        grid bin size in degrees (default 0.1)
          --max-bin-size <float>    largest bin size when shrinking output (default 0.2)
          --years-per-window <int>  years per time window (default 3)
          --conus-only[=true|false] keep only the continental US
          --max-size-mb <float>     output size budget in MB (default 50)
          --max-attempts <int>      aggregation passes before giving up on the budget (default 8)
          --threads <int>           aggregation threads (default: CPUs or HEATMAP_THREADS)
          --help                    print this message
        """;

    private static final Set<String> VALUE_FLAGS = Set.of(
        "--csv", "--out", "--grid", "--h3-res", "--h3-min-res", "--bin-size",
        "--max-bin-size", "--years-per-window", "--max-size-mb", "--max-attempts", "--threads");

    private static final String CONUS_ONLY = "--conus-only";
    private static final Set<String> HELP = Set.of("--help", "-h");
    private static final Set<String> SWITCHES = Set.of(CONUS_ONLY, "--help", "-h");

    private CommandLineOptions() {}

    /**
     * True when {@code --help} or {@code -h} appears as an option, not as the value
     * of another option. Unknown options are ignored here and reported by {@link #parse}.
     */
    public static boolean isHelpRequested(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (HELP.contains(arg)) {
                return true;
            }
            if (VALUE_FLAGS.contains(arg)) {
                i++;
            }
        }
        return false;
    }

    public static AggregationConfig parse(String[] args) {
        Map<String, String> values = scan(args);

        String csv = values.get("--csv");
        if (csv == null || csv.isBlank()) {
            throw new UsageException("--csv is required");
        }

        var builder = AggregationConfig.builder(Path.of(csv));
        if (values.containsKey("--out")) builder.output(Path.of(values.get("--out")));
        if (values.containsKey("--grid")) builder.grid(parseGrid(values.get("--grid")));
        if (values.containsKey("--h3-res")) builder.h3Resolution(parseInt(values, "--h3-res"));
        if (values.containsKey("--h3-min-res")) builder.h3MinResolution(parseInt(values, "--h3-min-res"));
        if (values.containsKey("--bin-size")) builder.binSize(parseDouble(values, "--bin-size"));
        if (values.containsKey("--max-bin-size")) builder.maxBinSize(parseDouble(values, "--max-bin-size"));
        if (values.containsKey("--years-per-window")) builder.yearsPerWindow(parseInt(values, "--years-per-window"));
        if (values.containsKey("--max-size-mb")) builder.maxSizeMb(parseDouble(values, "--max-size-mb"));
        if (values.containsKey("--max-attempts")) builder.maxAttempts(parseInt(values, "--max-attempts"));
        if (values.containsKey("--threads")) builder.threads(parseInt(values, "--threads"));
        builder.conusOnly(values.containsKey(CONUS_ONLY));

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage(), e);
        }
    }

    private static Map<String, String> scan(String[] args) {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            // --flag=value form
            int eq = flag.indexOf('=');
            if (flag.startsWith("--") && eq > 0) {
                String name = flag.substring(0, eq);
                String value = flag.substring(eq + 1);
                if (CONUS_ONLY.equals(name)) {
                    if (parseSwitch(name, value)) {
                        values.put(name, "true");
                    } else {
                        values.remove(name);
                    }
                } else if (VALUE_FLAGS.contains(name)) {
                    values.put(name, value);
                } else {
                    throw new UsageException("Unknown option: " + name);
                }
            } else if (SWITCHES.contains(flag)) {
                values.put(flag, "true");
            } else if (VALUE_FLAGS.contains(flag)) {
                if (i + 1 >= args.length) {
                    throw new UsageException("Missing value for " + flag);
                }
                values.put(flag, args[++i]);
            } else {
                throw new UsageException("Unknown option: " + flag);
            }
        }
        return values;
    }

    private static boolean parseSwitch(String flag, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new UsageException(flag + " expects true or false, got '" + value + "'");
    }

    private static GridType parseGrid(String value) {
        try {
            return GridType.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage(), e);
        }
    }

    private static int parseInt(Map<String, String> values, String flag) {
        try {
            return Integer.parseInt(values.get(flag).trim());
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects an integer, got '" + values.get(flag) + "'", e);
        }
    }

    private static double parseDouble(Map<String, String> values, String flag) {
        try {
            return Double.parseDouble(values.get(flag).trim());
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects a number, got '" + values.get(flag) + "'", e);
        }
    }
}
