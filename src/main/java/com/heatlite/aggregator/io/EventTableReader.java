package com.heatlite.aggregator.io;

import com.heatlite.aggregator.error.InputFormatException;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Loads a headed CSV file fully into memory. Quoting follows RFC 4180, so
 * backslashes in cells are kept as-is.
 */
public final class EventTableReader {

    private static final Logger log = LoggerFactory.getLogger(EventTableReader.class);

    private static final char BOM = '\uFEFF';

    private EventTableReader() {}

    public static EventTable read(Path path) {
        log.info("Loading data from {}...", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            EventTable table = read(reader);
            log.info("Loaded {} rows", table.size());
            return table;
        } catch (NoSuchFileException e) {
            throw new InputFormatException("Input file not found: " + path, e);
        } catch (IOException e) {
            throw new InputFormatException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    public static EventTable read(Reader source) throws IOException {
        try (CSVReader csv = new CSVReaderBuilder(source)
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            String[] header = csv.readNext();
            if (header == null) {
                throw new InputFormatException("Input has no header row");
            }
            if (header.length > 0 && !header[0].isEmpty() && header[0].charAt(0) == BOM) {
                header[0] = header[0].substring(1);
            }

            List<String[]> rows = new ArrayList<>();
            String[] row;
            while ((row = csv.readNext()) != null) {
                // skip blank lines
                if (row.length == 1 && row[0].isBlank()) {
                    continue;
                }
                rows.add(row);
            }
            return new EventTable(Arrays.asList(header), rows);
        } catch (CsvValidationException e) {
            throw new InputFormatException("Malformed CSV at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
    }
}
