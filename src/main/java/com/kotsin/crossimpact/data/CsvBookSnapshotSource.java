package com.kotsin.crossimpact.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.kotsin.crossimpact.config.AnalysisConfig;
import com.kotsin.crossimpact.domain.model.BookLevel;
import com.kotsin.crossimpact.domain.model.BookSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CsvBookSnapshotSource - Reads {@code <inputDir>/<SYMBOL>.csv} market-by-price exports.
 *
 * Header columns:
 * - {@code timestamp} or {@code ts_event}: ISO-8601 date-time (offset optional, UTC assumed)
 *   or integer epoch nanoseconds
 * - {@code symbol} (optional, defaults to the file's symbol)
 * - per level k = 0..4: {@code bid_px_0k, bid_sz_0k, ask_px_0k, ask_sz_0k}
 *   (alias: {@code bid_price_n, bid_vol_n, ask_price_n, ask_vol_n} with n = k + 1)
 *
 * A level with a missing, empty or non-numeric column ends the reported depth of that row
 * (non-numeric values are logged). Fractional sizes are rounded to whole units with a warning.
 */
@Component
@Slf4j
public class CsvBookSnapshotSource implements BookSnapshotSource {

    private static final String[] TIMESTAMP_COLUMNS = {"timestamp", "ts_event", "ts_recv"};

    private final CsvMapper csvMapper = new CsvMapper();
    private final Path inputDir;

    @Autowired
    public CsvBookSnapshotSource(AnalysisConfig config) {
        this(Paths.get(config.getRunner().getInputDir()));
    }

    public CsvBookSnapshotSource(Path inputDir) {
        this.inputDir = inputDir;
    }

    @Override
    public List<BookSnapshot> load(String symbol) {
        Path file = inputDir.resolve(symbol + ".csv");
        if (!Files.exists(file)) {
            throw new SnapshotLoadException(symbol, "file not found: " + file);
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<BookSnapshot> snapshots = new ArrayList<>();
        int line = 1;
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
            .with(schema)
            .readValues(file.toFile())) {
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                line++;
                snapshots.add(toSnapshot(symbol, row, line));
            }
        } catch (IOException e) {
            throw new SnapshotLoadException(symbol, "failed to read " + file + " near line " + line, e);
        } catch (RuntimeJsonMappingException e) {
            // MappingIterator wraps row-level CSV errors (e.g. too many columns) unchecked
            throw new SnapshotLoadException(symbol, "malformed row in " + file + " near line " + (line + 1)
                + ": " + e.getMessage(), e);
        }

        log.info("[CSV] {} loaded {} snapshots from {}", symbol, snapshots.size(), file);
        return snapshots;
    }

    BookSnapshot toSnapshot(String symbol, Map<String, String> row, int line) {
        String rowSymbol = row.get("symbol");
        BookSnapshot.BookSnapshotBuilder builder = BookSnapshot.builder()
            .symbol(isBlank(rowSymbol) ? symbol : rowSymbol.trim())
            .timestamp(parseTimestamp(symbol, timestampValue(row), line));

        for (int k = 0; k < BookSnapshot.MAX_LEVELS; k++) {
            Double bidPx = number(symbol, line, row, String.format("bid_px_%02d", k), "bid_price_" + (k + 1));
            Double bidSz = number(symbol, line, row, String.format("bid_sz_%02d", k), "bid_vol_" + (k + 1));
            Double askPx = number(symbol, line, row, String.format("ask_px_%02d", k), "ask_price_" + (k + 1));
            Double askSz = number(symbol, line, row, String.format("ask_sz_%02d", k), "ask_vol_" + (k + 1));
            if (bidPx == null || bidSz == null || askPx == null || askSz == null
                || bidPx.isNaN() || askPx.isNaN() || bidSz.isNaN() || askSz.isNaN()) {
                break;
            }
            builder.level(BookLevel.of(bidPx, size(symbol, line, k, bidSz), askPx, size(symbol, line, k, askSz)));
        }
        return builder.build();
    }

    private static String timestampValue(Map<String, String> row) {
        for (String column : TIMESTAMP_COLUMNS) {
            String value = row.get(column);
            if (!isBlank(value)) {
                return value.trim();
            }
        }
        return null;
    }

    static Instant parseTimestamp(String symbol, String value, int line) {
        if (value == null) {
            throw new SnapshotLoadException(symbol, "line " + line + " has no timestamp");
        }
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                long nanos = Long.parseLong(value);
                return Instant.ofEpochSecond(nanos / 1_000_000_000L, nanos % 1_000_000_000L);
            } catch (NumberFormatException e) {
                throw new SnapshotLoadException(symbol, "line " + line + " has out-of-range epoch timestamp '" + value + "'", e);
            }
        }
        String iso = value.replace(' ', 'T');
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new SnapshotLoadException(symbol, "line " + line + " has unparseable timestamp '" + value + "'", e);
            }
        }
    }

    /**
     * Column value (or its alias) as a number; null when absent, NaN when unparseable
     */
    private static Double number(String symbol, int line, Map<String, String> row, String column, String alias) {
        String name = column;
        String value = row.get(column);
        if (isBlank(value)) {
            name = alias;
            value = row.get(alias);
        }
        if (isBlank(value)) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("[CSV] {} line {} column {} has non-numeric value '{}', depth ends here", symbol, line, name, value);
            return Double.NaN;
        }
    }

    private static long size(String symbol, int line, int k, double value) {
        long rounded = Math.round(value);
        if (rounded != value) {
            log.warn("[CSV] {} line {} level {} size {} is fractional, rounded to {}", symbol, line, k + 1, value, rounded);
        }
        return rounded;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
