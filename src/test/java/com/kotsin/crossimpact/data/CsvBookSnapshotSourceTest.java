package com.kotsin.crossimpact.data;

import com.kotsin.crossimpact.domain.model.BookSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CSV Snapshot Loading Tests")
class CsvBookSnapshotSourceTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Reads MBP-style columns with ISO timestamps")
    void testLoadMbpColumns() throws IOException {
        Files.writeString(dir.resolve("AAPL.csv"), String.join("\n",
            "ts_event,symbol,bid_px_00,bid_sz_00,ask_px_00,ask_sz_00,bid_px_01,bid_sz_01,ask_px_01,ask_sz_01",
            "2024-03-01T14:30:00.5Z,AAPL,180.10,300,180.12,200,180.09,500,180.13,400",
            "2024-03-01 14:31:00,AAPL,180.11,100,180.12,250,,,,",
            ""));

        List<BookSnapshot> snapshots = new CsvBookSnapshotSource(dir).load("AAPL");

        assertEquals(2, snapshots.size());
        BookSnapshot first = snapshots.get(0);
        assertEquals(Instant.parse("2024-03-01T14:30:00.500Z"), first.getTimestamp());
        assertEquals(2, first.levelCount());
        assertEquals(180.09, first.level(2).getBidPrice(), 1e-12);
        assertEquals(400, first.level(2).getAskSize());

        BookSnapshot second = snapshots.get(1);
        assertEquals(Instant.parse("2024-03-01T14:31:00Z"), second.getTimestamp(), "No offset means UTC");
        assertEquals(1, second.levelCount(), "Empty level columns end the depth");
        assertEquals("AAPL", second.getSymbol());
    }

    @Test
    @DisplayName("Reads alias columns and epoch-nanosecond timestamps")
    void testLoadAliasColumns() throws IOException {
        Files.writeString(dir.resolve("MSFT.csv"), String.join("\n",
            "timestamp,bid_price_1,bid_vol_1,ask_price_1,ask_vol_1",
            "1709303400000000000,400.00,10,400.05,12"));

        List<BookSnapshot> snapshots = new CsvBookSnapshotSource(dir).load("MSFT");

        assertEquals(1, snapshots.size());
        assertEquals(Instant.ofEpochSecond(1709303400L), snapshots.get(0).getTimestamp());
        assertEquals("MSFT", snapshots.get(0).getSymbol(), "Symbol defaults to the file name");
        assertEquals(400.025, snapshots.get(0).midPrice(), 1e-9);
    }

    @Test
    @DisplayName("Missing file and bad timestamp raise SnapshotLoadException")
    void testLoadFailures() throws IOException {
        CsvBookSnapshotSource source = new CsvBookSnapshotSource(dir);

        SnapshotLoadException missing = assertThrows(SnapshotLoadException.class, () -> source.load("NVDA"));
        assertEquals("NVDA", missing.getSymbol());

        Files.writeString(dir.resolve("TSLA.csv"), String.join("\n",
            "timestamp,bid_px_00,bid_sz_00,ask_px_00,ask_sz_00",
            "yesterday,1,1,2,2"));
        assertThrows(SnapshotLoadException.class, () -> source.load("TSLA"));
    }

    @Test
    @DisplayName("Row with more fields than the header raises SnapshotLoadException with its line")
    void testMalformedRow() throws IOException {
        Files.writeString(dir.resolve("AMZN.csv"), String.join("\n",
            "timestamp,bid_px_00,bid_sz_00,ask_px_00,ask_sz_00",
            "2024-03-01T14:30:00Z,180.10,300,180.12,200",
            "2024-03-01T14:31:00Z,180.10,300,180.12,200,EXTRA"));

        SnapshotLoadException e = assertThrows(SnapshotLoadException.class,
            () -> new CsvBookSnapshotSource(dir).load("AMZN"));

        assertEquals("AMZN", e.getSymbol());
        assertTrue(e.getMessage().contains("line 3"), e.getMessage());
    }

    @Test
    @DisplayName("Epoch timestamp beyond the long range raises SnapshotLoadException")
    void testEpochOverflow() throws IOException {
        Files.writeString(dir.resolve("META.csv"), String.join("\n",
            "ts_event,bid_px_00,bid_sz_00,ask_px_00,ask_sz_00",
            "99999999999999999999,500.00,10,500.05,12"));

        SnapshotLoadException e = assertThrows(SnapshotLoadException.class,
            () -> new CsvBookSnapshotSource(dir).load("META"));

        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    @DisplayName("Non-numeric level value ends the depth; fractional sizes are rounded")
    void testNonNumericAndFractionalValues() throws IOException {
        Files.writeString(dir.resolve("GOOG.csv"), String.join("\n",
            "timestamp,bid_px_00,bid_sz_00,ask_px_00,ask_sz_00,bid_px_01,bid_sz_01,ask_px_01,ask_sz_01",
            "2024-03-01T14:30:00Z,140.00,10.6,140.02,7.2,n/a,5,140.03,5"));

        List<BookSnapshot> snapshots = new CsvBookSnapshotSource(dir).load("GOOG");

        assertEquals(1, snapshots.get(0).levelCount());
        assertEquals(11, snapshots.get(0).level(1).getBidSize());
        assertEquals(7, snapshots.get(0).level(1).getAskSize());
    }
}
