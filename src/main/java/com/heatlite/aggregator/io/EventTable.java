package com.heatlite.aggregator.io;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw CSV contents: header plus rows of untyped cells. Read-only once loaded.
 */
public record EventTable(List<String> header, List<String[]> rows) {

    public EventTable {
        header = List.copyOf(header);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    /** Values of one column; short rows yield {@code null}. */
    public List<String> column(int index) {
        var values = new ArrayList<String>(rows.size());
        for (String[] row : rows) {
            values.add(cell(row, index));
        }
        return values;
    }

    public static String cell(String[] row, int index) {
        return index < row.length ? row[index] : null;
    }
}
