package com.heatlite.aggregator.time;

import com.heatlite.aggregator.error.InvalidRangeException;
import com.heatlite.aggregator.model.TimeWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an inclusive year range into consecutive windows of a fixed length.
 * The last window is cut short at {@code maxYear} when the range does not divide evenly.
 */
public final class WindowBuilder {

    private WindowBuilder() {}

    public static List<TimeWindow> build(int minYear, int maxYear, int windowLength) {
        if (windowLength < 1) {
            throw new IllegalArgumentException("Years per window must be >= 1, got " + windowLength);
        }
        if (minYear > maxYear) {
            throw new InvalidRangeException(
                "Empty year range: min year " + minYear + " is after max year " + maxYear);
        }

        var windows = new ArrayList<TimeWindow>();
        int start = minYear;
        while (start <= maxYear) {
            // long arithmetic so windowLength near Integer.MAX_VALUE cannot overflow
            int end = (int) Math.min((long) start + windowLength - 1, maxYear);
            windows.add(new TimeWindow(start, end));
            if (end == maxYear) {
                break;
            }
            start = end + 1;
        }
        return List.copyOf(windows);
    }
}
