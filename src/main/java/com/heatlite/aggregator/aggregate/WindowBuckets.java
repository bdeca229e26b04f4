package com.heatlite.aggregator.aggregate;

import com.heatlite.aggregator.model.EventRecord;
import com.heatlite.aggregator.model.TimeWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records pre-sorted into their time window once, so each aggregation pass
 * touches every record exactly once instead of rescanning per window.
 */
public final class WindowBuckets {

    private final List<TimeWindow> windows;
    private final List<List<EventRecord>> buckets;

    private WindowBuckets(List<TimeWindow> windows, List<List<EventRecord>> buckets) {
        this.windows = windows;
        this.buckets = buckets;
    }

    /**
     * @param windows sorted, non-overlapping windows; records outside every window are ignored
     */
    public static WindowBuckets of(List<EventRecord> records, List<TimeWindow> windows) {
        var buckets = new ArrayList<List<EventRecord>>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            buckets.add(new ArrayList<>());
        }
        for (EventRecord record : records) {
            int idx = indexOf(windows, record.year());
            if (idx >= 0) {
                buckets.get(idx).add(record);
            }
        }
        var frozen = new ArrayList<List<EventRecord>>(buckets.size());
        for (List<EventRecord> bucket : buckets) {
            frozen.add(Collections.unmodifiableList(bucket));
        }
        return new WindowBuckets(List.copyOf(windows), List.copyOf(frozen));
    }

    public List<TimeWindow> windows() {
        return windows;
    }

    public List<EventRecord> recordsIn(int windowIndex) {
        return buckets.get(windowIndex);
    }

    public int totalRecords() {
        return buckets.stream().mapToInt(List::size).sum();
    }

    // binary search on window start
    static int indexOf(List<TimeWindow> windows, int year) {
        int lo = 0;
        int hi = windows.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            TimeWindow w = windows.get(mid);
            if (year < w.start()) {
                hi = mid - 1;
            } else if (year > w.end()) {
                lo = mid + 1;
            } else {
                return mid;
            }
        }
        return -1;
    }
}
