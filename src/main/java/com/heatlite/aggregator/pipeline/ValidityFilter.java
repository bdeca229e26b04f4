package com.heatlite.aggregator.pipeline;

import com.heatlite.aggregator.columns.ResolvedColumns;
import com.heatlite.aggregator.io.EventTable;
import com.heatlite.aggregator.metrics.RunStats;
import com.heatlite.aggregator.model.EventRecord;
import com.heatlite.aggregator.time.TemporalNormalizer;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns raw rows into {@link EventRecord}s, dropping rows with an unparseable date
 * or a missing/out-of-range coordinate. Dropped rows are counted, never raised.
 */
public final class ValidityFilter {

    private ValidityFilter() {}

    public static List<EventRecord> apply(EventTable table, ResolvedColumns columns, RunStats stats) {
        stats.recordRowsRead(table.size());
        List<Optional<LocalDate>> dates =
            TemporalNormalizer.normalize(table.column(columns.dateIndex()), columns.yearOnly());

        var records = new ArrayList<EventRecord>(table.size());
        List<String[]> rows = table.rows();
        for (int i = 0; i < rows.size(); i++) {
            Optional<LocalDate> date = dates.get(i);
            if (date.isEmpty()) {
                stats.recordBadDate();
                continue;
            }
            String[] row = rows.get(i);
            OptionalDouble lat = parseCoordinate(EventTable.cell(row, columns.latitudeIndex()));
            OptionalDouble lon = parseCoordinate(EventTable.cell(row, columns.longitudeIndex()));
            if (lat.isEmpty() || lon.isEmpty()
                    || !EventRecord.isValidCoordinate(lat.getAsDouble(), lon.getAsDouble())) {
                stats.recordBadCoordinate();
                continue;
            }
            records.add(new EventRecord(lat.getAsDouble(), lon.getAsDouble(), date.get()));
        }
        return records;
    }

    static OptionalDouble parseCoordinate(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
