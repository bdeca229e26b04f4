package com.heatlite.aggregator.metrics;

import java.util.concurrent.atomic.LongAdder;

/**
 * Row-level counters for one run. Excluded rows are only ever reported here, in aggregate.
 */
public class RunStats {

    private final LongAdder rowsRead         = new LongAdder();
    private final LongAdder badDates         = new LongAdder();
    private final LongAdder badCoordinates   = new LongAdder();
    private final LongAdder outsideBounds    = new LongAdder();
    private final LongAdder aggregationPasses = new LongAdder();

    public void recordRowsRead(long n)      { rowsRead.add(n); }
    public void recordBadDate()             { badDates.increment(); }
    public void recordBadCoordinate()       { badCoordinates.increment(); }
    public void recordOutsideBounds(long n) { outsideBounds.add(n); }
    public void recordAggregationPass()     { aggregationPasses.increment(); }

    public long getRowsRead()          { return rowsRead.sum(); }
    public long getBadDates()          { return badDates.sum(); }
    public long getBadCoordinates()    { return badCoordinates.sum(); }
    public long getOutsideBounds()     { return outsideBounds.sum(); }
    public long getAggregationPasses() { return aggregationPasses.sum(); }

    /** Rows dropped by the validity filter (bad date or bad coordinates). */
    public long getRowsExcluded() {
        return getBadDates() + getBadCoordinates();
    }

    public long getValidRows() {
        return getRowsRead() - getRowsExcluded();
    }

    public String summary() {
        return String.format(
            "rows read=%d, valid=%d, excluded=%d (bad date=%d, bad coordinates=%d), outside bounds=%d, passes=%d",
            getRowsRead(), getValidRows(), getRowsExcluded(),
            getBadDates(), getBadCoordinates(), getOutsideBounds(), getAggregationPasses());
    }
}
