package com.polyexplorer.positions;

import com.polyexplorer.config.Config;
import com.polyexplorer.core.error.ParseFailure;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.core.error.Stage;
import com.polyexplorer.core.error.TransportFailure;
import com.polyexplorer.data.http.HttpClientEx;
import com.polyexplorer.model.Position;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PositionFileReaderTest {

    private static final String HEADER = "trader_address,token_id,market_id,side,shares_held,avg_entry_price,first_entry_block";

    @TempDir
    Path dir;

    private final PositionFileReader reader =
            new PositionFileReader(new HttpClientEx(Config.fromProperties(Path.of("."), Map.of())));

    @Test
    void readShouldParseRowsAndSkipBlankAndCommentLines() throws IOException {
        Path csv = write(HEADER + "\n"
                + "# exported 2024-12-10\n"
                + "0xaaa,101,0xcond,YES,150.5,0.55,61234567\n"
                + "\n"
                + "0xbbb, 102 ,0xcond,no,20,0.40,\n");

        List<Position> positions = reader.read(csv);

        assertEquals(2, positions.size());
        Position first = positions.get(0);
        assertEquals("0xaaa", first.getTraderAddress());
        assertEquals(150.5, first.getSharesHeld(), 1e-9);
        assertEquals(61234567L, first.getFirstEntryBlock());
        assertEquals("0xaaa@101", first.positionId());
        Position second = positions.get(1);
        assertEquals("102", second.getTokenId());
        assertEquals("no", second.getSide());
        assertNull(second.getFirstEntryBlock());
    }

    @Test
    void optionalBlockColumnMayBeAbsent() {
        List<Position> positions = reader.parse(
                "side,trader_address,token_id,market_id,shares_held,avg_entry_price\nYES,0xaaa,101,m,1,0.5\n");

        assertEquals("YES", positions.get(0).getSide());
        assertNull(positions.get(0).getFirstEntryBlock());
    }

    @Test
    void missingFileShouldBeTransportReadError() {
        Path missing = dir.resolve("none.csv");

        PipelineException e = assertThrows(PipelineException.class, () -> reader.read(missing));

        assertEquals(Stage.HTTP, e.stage());
        assertInstanceOf(TransportFailure.ResponseReadError.class, e.failure().failure());
    }

    @Test
    void missingColumnShouldBeMissingField() {
        PipelineException e = assertThrows(PipelineException.class,
                () -> reader.parse("trader_address,token_id,market_id,side,avg_entry_price\n"));

        assertEquals(new ParseFailure.MissingField("shares_held"), e.failure().failure());
    }

    @Test
    void emptyInputShouldMissHeader() {
        PipelineException e = assertThrows(PipelineException.class, () -> reader.parse("\n\n"));

        assertEquals(new ParseFailure.MissingField("header"), e.failure().failure());
    }

    @Test
    void wrongCellCountShouldBeInvalidArrayLength() {
        PipelineException e = assertThrows(PipelineException.class,
                () -> reader.parse(HEADER + "\n0xaaa,101,m,YES,1\n"));

        assertEquals(new ParseFailure.InvalidArrayLength("row 2", 7, 5), e.failure().failure());
    }

    @Test
    void badNumbersShouldBeInvalidNumber() {
        PipelineException shares = assertThrows(PipelineException.class,
                () -> reader.parse(HEADER + "\n0xaaa,101,m,YES,many,0.5,\n"));
        PipelineException block = assertThrows(PipelineException.class,
                () -> reader.parse(HEADER + "\n0xaaa,101,m,YES,1,0.5,-4\n"));

        ParseFailure.InvalidNumber sharesFailure = assertInstanceOf(ParseFailure.InvalidNumber.class, shares.failure().failure());
        assertEquals("row 2.shares_held", sharesFailure.fieldName());
        assertEquals("many", sharesFailure.rawValue());
        assertEquals(PositionFileReader.NOT_A_NUMBER, sharesFailure.reason());
        assertEquals("row 2.first_entry_block",
                assertInstanceOf(ParseFailure.InvalidNumber.class, block.failure().failure()).fieldName());
    }

    @Test
    void hugeNumericCellShouldYieldBoundedMessage() {
        String cell = "9x".repeat(10050);

        PipelineException e = assertThrows(PipelineException.class,
                () -> reader.parse(HEADER + "\n0xaaa,101,m,YES," + cell + ",0.5,\n"));

        ParseFailure.InvalidNumber failure = assertInstanceOf(ParseFailure.InvalidNumber.class, e.failure().failure());
        assertEquals(PositionFileReader.NOT_A_NUMBER, failure.reason());
        assertTrue(e.getMessage().length() <= 1000, "message length " + e.getMessage().length());
    }

    @Test
    void emptyRequiredCellShouldBeMissingField() {
        PipelineException e = assertThrows(PipelineException.class,
                () -> reader.parse(HEADER + "\n,101,m,YES,1,0.5,\n"));

        assertEquals(new ParseFailure.MissingField("row 2.trader_address"), e.failure().failure());
    }

    private Path write(String content) throws IOException {
        Path file = dir.resolve("positions.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
