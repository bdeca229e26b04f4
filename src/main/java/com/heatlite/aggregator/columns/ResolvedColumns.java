package com.heatlite.aggregator.columns;

/**
 * Header names and positions of the resolved latitude, longitude and date columns.
 *
 * @param yearOnly true when the date column holds bare years ({@code year} alias)
 */
public record ResolvedColumns(
    String latitude, int latitudeIndex,
    String longitude, int longitudeIndex,
    String date, int dateIndex,
    boolean yearOnly
) {
    @Override
    public String toString() {
        return "lat=" + latitude + ", lon=" + longitude + ", date=" + date;
    }
}
