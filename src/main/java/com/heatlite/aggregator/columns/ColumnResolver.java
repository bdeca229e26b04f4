package com.heatlite.aggregator.columns;

import com.heatlite.aggregator.error.MissingColumnException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the latitude, longitude and date columns out of a table header.
 *
 * For each logical field the first alias (in {@link LogicalField#aliases()} order)
 * that appears in the header wins, regardless of where the column sits in the header.
 */
public final class ColumnResolver {

    private ColumnResolver() {}

    public static ResolvedColumns resolve(List<String> header) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            // duplicate header names: keep the leftmost
            positions.putIfAbsent(header.get(i), i);
        }

        String lat = firstPresent(LogicalField.LATITUDE, positions);
        String lon = firstPresent(LogicalField.LONGITUDE, positions);
        String date = firstPresent(LogicalField.DATE, positions);

        return new ResolvedColumns(
            lat, positions.get(lat),
            lon, positions.get(lon),
            date, positions.get(date),
            LogicalField.YEAR_ALIAS.equals(date));
    }

    private static String firstPresent(LogicalField field, Map<String, Integer> positions) {
        for (String alias : field.aliases()) {
            if (positions.containsKey(alias)) {
                return alias;
            }
        }
        throw new MissingColumnException(field.label(), field.aliases());
    }
}
