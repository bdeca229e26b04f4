package com.heatlite.aggregator.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A single point event that survived the validity filter.
 *
 * @param latitude  WGS84 latitude in [-90, 90]
 * @param longitude WGS84 longitude in [-180, 180]
 * @param eventDate calendar date of the event (July 1 when only a year was known)
 */
public record EventRecord(double latitude, double longitude, LocalDate eventDate) {

    public EventRecord {
        Objects.requireNonNull(eventDate, "eventDate");
        if (!isValidCoordinate(latitude, longitude)) {
            throw new IllegalArgumentException(
                "Coordinate out of range: (" + latitude + ", " + longitude + ")");
        }
    }

    public int year() {
        return eventDate.getYear();
    }

    public static boolean isValidCoordinate(double lat, double lon) {
        return Double.isFinite(lat) && Double.isFinite(lon)
            && lat >= -90.0 && lat <= 90.0
            && lon >= -180.0 && lon <= 180.0;
    }
}
