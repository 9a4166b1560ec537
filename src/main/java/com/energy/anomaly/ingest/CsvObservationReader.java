package com.energy.anomaly.ingest;

import com.energy.anomaly.exception.DataException;
import com.energy.anomaly.model.Feature;
import com.energy.anomaly.model.Observation;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads metering readings from a CSV file with a header row.
 *
 * Feature columns are matched by name (see {@link Feature#fromHeader(String)}); other
 * columns are ignored. Blank or non-numeric feature cells are read as missing ({@code NaN}).
 * When the file has no {@code date} column, or a date cell is blank, the reading gets
 * the load timestamp, which is the same for every row of one load.
 */
@Component
public class CsvObservationReader {

    private static final Logger log = LoggerFactory.getLogger(CsvObservationReader.class);

    static final String DATE_COLUMN = "date";

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    // yyyy-MM-dd with optional time (space or 'T' separated), or dd/MM/yyyy with optional time
    private static final DateTimeFormatter DATE_FORMAT = new DateTimeFormatterBuilder()
            .appendOptional(DateTimeFormatter.ofPattern("uuuu-MM-dd[['T'][' ']HH:mm[:ss]]"))
            .appendOptional(DateTimeFormatter.ofPattern("dd/MM/uuuu[' 'HH:mm[:ss]]"))
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter(Locale.ROOT);

    private final CsvMapper csvMapper = new CsvMapper();
    private final Clock clock;

    public CsvObservationReader(Clock clock) {
        this.clock = clock;
    }

    /**
     * Reads the file as bytes so that Jackson detects the encoding and skips a
     * leading byte-order mark.
     */
    public List<Observation> read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new DataException("File not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(csvReader().readValues(in));
        } catch (IOException e) {
            throw new DataException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    public List<Observation> read(Reader source) {
        try {
            return read(csvReader().readValues(source));
        } catch (IOException e) {
            throw new DataException("Malformed CSV input: " + e.getMessage(), e);
        }
    }

    private ObjectReader csvReader() {
        return csvMapper
                .readerFor(Map.class)
                .with(CsvSchema.emptySchema().withHeader())
                .with(CsvParser.Feature.TRIM_SPACES)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    private List<Observation> read(MappingIterator<Map<String, String>> iterator) {
        List<Map<String, String>> rows = new ArrayList<>();
        CsvSchema header;
        try (MappingIterator<Map<String, String>> it = iterator) {
            while (it.hasNextValue()) {
                rows.add(it.nextValue());
            }
            // header is known once the parser has started
            header = (CsvSchema) it.getParser().getSchema();
        } catch (IOException | RuntimeException e) {
            throw new DataException("Malformed CSV input: " + e.getMessage(), e);
        }
        return toObservations(header, rows);
    }

    private List<Observation> toObservations(CsvSchema header, List<Map<String, String>> rows) {
        Map<Feature, String> featureColumns = new EnumMap<>(Feature.class);
        String dateColumn = null;
        for (CsvSchema.Column column : header) {
            String key = column.getName();
            // text decoded before parsing keeps a byte-order mark on the first header
            String name = key.startsWith(BYTE_ORDER_MARK) ? key.substring(1) : key;
            Feature.fromHeader(name).ifPresent(f -> featureColumns.putIfAbsent(f, key));
            if (DATE_COLUMN.equals(name.trim().toLowerCase(Locale.ROOT))) {
                dateColumn = key;
            }
        }
        for (Feature feature : Feature.values()) {
            if (!featureColumns.containsKey(feature)) {
                throw new DataException("Missing required column '" + feature.getColumnName() + "'");
            }
        }

        LocalDateTime loadTimestamp = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        if (dateColumn == null) {
            log.info("No '{}' column; using load time {} for all rows", DATE_COLUMN, loadTimestamp);
        }

        List<Observation> observations = new ArrayList<>(rows.size());
        int lineNumber = 1;
        for (Map<String, String> row : rows) {
            lineNumber++;
            LocalDateTime timestamp = loadTimestamp;
            if (dateColumn != null) {
                String cell = row.get(dateColumn);
                if (cell != null && !cell.isBlank()) {
                    timestamp = parseTimestamp(cell.trim(), lineNumber);
                }
            }
            observations.add(Observation.builder()
                    .timestamp(timestamp)
                    .usageKwh(parseNumber(row.get(featureColumns.get(Feature.USAGE))))
                    .co2Tco2(parseNumber(row.get(featureColumns.get(Feature.EMISSIONS))))
                    .powerFactor(parseNumber(row.get(featureColumns.get(Feature.POWER_FACTOR))))
                    .build());
        }
        log.info("Loaded {} rows", observations.size());
        return observations;
    }

    static double parseNumber(String cell) {
        if (cell == null || cell.isBlank()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(cell.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static LocalDateTime parseTimestamp(String cell, int lineNumber) {
        try {
            return LocalDateTime.parse(cell, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new DataException("Unparseable date '" + cell + "' on line " + lineNumber, e);
        }
    }
}
