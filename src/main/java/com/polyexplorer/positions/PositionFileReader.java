package com.polyexplorer.positions;

import com.polyexplorer.core.error.ParseFailure;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.data.http.HttpClientEx;
import com.polyexplorer.model.Position;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads trader positions from a comma-separated file with a header row. Columns are located by
 * header name; {@code first_entry_block} is optional.
 */
public final class PositionFileReader {
    private static final Logger LOG = LogManager.getLogger(PositionFileReader.class);

    static final List<String> REQUIRED_COLUMNS = List.of(
            "trader_address", "token_id", "market_id", "side", "shares_held", "avg_entry_price");
    static final String FIRST_ENTRY_BLOCK = "first_entry_block";
    static final String NOT_A_NUMBER = "not a decimal number";

    private final HttpClientEx http;

    public PositionFileReader(HttpClientEx http) {
        this.http = http;
    }

    public List<Position> read(Path path) {
        List<Position> positions = parse(http.readLocalFile(path));
        LOG.info("read {} positions from {}", positions.size(), path);
        return positions;
    }

    List<Position> parse(String text) {
        String[] lines = (text == null ? "" : text).split("\\R");
        int headerLine = nextContentLine(lines, 0);
        if (headerLine < 0) {
            throw new PipelineException(new ParseFailure.MissingField("header"));
        }
        String[] header = splitRow(lines[headerLine]);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            columns.put(header[i].toLowerCase(Locale.ROOT), i);
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new PipelineException(new ParseFailure.MissingField(required));
            }
        }

        List<Position> out = new ArrayList<>();
        for (int i = nextContentLine(lines, headerLine + 1); i >= 0; i = nextContentLine(lines, i + 1)) {
            String row = "row " + (i + 1);
            String[] cells = splitRow(lines[i]);
            if (cells.length != header.length) {
                throw new PipelineException(new ParseFailure.InvalidArrayLength(row, header.length, cells.length));
            }
            Integer blockCol = columns.get(FIRST_ENTRY_BLOCK);
            out.add(Position.builder()
                    .traderAddress(requireText(cells, columns, "trader_address", row))
                    .tokenId(requireText(cells, columns, "token_id", row))
                    .marketId(requireText(cells, columns, "market_id", row))
                    .side(requireText(cells, columns, "side", row))
                    .sharesHeld(parseDouble(cells[columns.get("shares_held")], row + ".shares_held"))
                    .avgEntryPrice(parseDouble(cells[columns.get("avg_entry_price")], row + ".avg_entry_price"))
                    .firstEntryBlock(blockCol == null ? null : parseBlock(cells[blockCol], row + "." + FIRST_ENTRY_BLOCK))
                    .build());
        }
        return out;
    }

    private static int nextContentLine(String[] lines, int from) {
        for (int i = from; i < lines.length; i++) {
            String line = lines[i].trim();
            if (!line.isEmpty() && !line.startsWith("#")) {
                return i;
            }
        }
        return -1;
    }

    private static String[] splitRow(String line) {
        String[] cells = line.split(",", -1);
        for (int i = 0; i < cells.length; i++) {
            cells[i] = cells[i].trim();
        }
        return cells;
    }

    private static String requireText(String[] cells, Map<String, Integer> columns, String column, String row) {
        String value = cells[columns.get(column)];
        if (value.isEmpty()) {
            throw new PipelineException(new ParseFailure.MissingField(row + "." + column));
        }
        return value;
    }

    private static double parseDouble(String raw, String field) {
        try {
            double value = Double.parseDouble(raw);
            if (!Double.isFinite(value)) {
                throw new PipelineException(new ParseFailure.InvalidNumber(field, raw, "not a finite number"));
            }
            return value;
        } catch (NumberFormatException e) {
            throw new PipelineException(new ParseFailure.InvalidNumber(field, raw, NOT_A_NUMBER), e);
        }
    }

    private static Long parseBlock(String raw, String field) {
        if (raw.isEmpty()) {
            return null;
        }
        try {
            long value = Long.parseLong(raw);
            if (value < 0) {
                throw new PipelineException(new ParseFailure.InvalidNumber(field, raw, "block number is negative"));
            }
            return value;
        } catch (NumberFormatException e) {
            throw new PipelineException(new ParseFailure.InvalidNumber(field, raw, "not a whole number"), e);
        }
    }
}
