package com.kotsin.crossimpact.domain.calculator;

import com.kotsin.crossimpact.domain.model.BookLevel;
import com.kotsin.crossimpact.domain.model.BookSnapshot;
import com.kotsin.crossimpact.domain.model.LevelOFIRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-level Cont-Kukanov-Stoikov OFI.
 */
@DisplayName("Level OFI Calculation Tests")
class LevelOFICalculatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T14:30:00Z");

    @Test
    @DisplayName("Bid price up with other fields equal: OFI(1) = new bid size")
    void testBidPriceUp() {
        BookSnapshot prev = snapshot("AAPL", 0, 100.00, 500, 100.02, 400);
        BookSnapshot curr = snapshot("AAPL", 1, 100.01, 300, 100.02, 400);

        LevelOFIRecord record = LevelOFICalculator.calculate(prev, curr);

        assertEquals(300.0, record.level(1), 1e-12, "Improved bid contributes its full new size");
        assertEquals(curr.getTimestamp(), record.getTimestamp());
        assertEquals("AAPL", record.getSymbol());
    }

    @Test
    @DisplayName("Identical snapshots: OFI = 0 at every level")
    void testNoChange() {
        BookSnapshot prev = fiveLevelSnapshot(0);
        BookSnapshot curr = fiveLevelSnapshot(1);

        LevelOFIRecord record = LevelOFICalculator.calculate(prev, curr);

        assertEquals(5, record.depth());
        for (int n = 1; n <= 5; n++) {
            assertEquals(0.0, record.level(n), 1e-12, "Level " + n + " should be flat");
        }
        assertEquals(0, record.getMissingLevels());
    }

    @Test
    @DisplayName("Bid price down: contribution is minus the previous bid size")
    void testBidPriceDown() {
        BookSnapshot prev = snapshot("AAPL", 0, 100.00, 500, 100.02, 400);
        BookSnapshot curr = snapshot("AAPL", 1, 99.99, 800, 100.02, 400);

        assertEquals(-500.0, LevelOFICalculator.calculate(prev, curr).level(1), 1e-12);
    }

    @Test
    @DisplayName("Ask side is mirrored: lower ask adds supply, higher ask removes it")
    void testAskMirrored() {
        BookLevel prev = BookLevel.of(100.00, 500, 100.02, 400);

        assertEquals(250.0, LevelOFICalculator.askContribution(prev, BookLevel.of(100.00, 500, 100.01, 250)), 1e-12);
        assertEquals(-400.0, LevelOFICalculator.askContribution(prev, BookLevel.of(100.00, 500, 100.03, 250)), 1e-12);
        assertEquals(-150.0, LevelOFICalculator.askContribution(prev, BookLevel.of(100.00, 500, 100.02, 250)), 1e-12);

        // Ask depletion at an unchanged price is buying pressure
        BookSnapshot s0 = snapshot("AAPL", 0, 100.00, 500, 100.02, 400);
        BookSnapshot s1 = snapshot("AAPL", 1, 100.00, 500, 100.02, 250);
        assertEquals(150.0, LevelOFICalculator.calculate(s0, s1).level(1), 1e-12);
    }

    @Test
    @DisplayName("Hand-computed level-1 sequence")
    void testHandComputedSequence() {
        List<BookSnapshot> snapshots = List.of(
            snapshot("AAPL", 0, 100.00, 500, 101.00, 500),
            snapshot("AAPL", 1, 100.00, 600, 101.00, 500),   // bid +100
            snapshot("AAPL", 2, 100.00, 550, 101.00, 500),   // bid -50
            snapshot("AAPL", 3, 100.00, 550, 101.00, 500),   // flat
            snapshot("AAPL", 4, 100.00, 550, 101.00, 480),   // ask -20 -> +20
            snapshot("AAPL", 5, 100.00, 550, 101.00, 500));  // ask +20 -> -20

        List<LevelOFIRecord> series = LevelOFICalculator.calculateSeries(snapshots);

        double[] expected = {100, -50, 0, 20, -20};
        assertEquals(5, series.size(), "n snapshots give n-1 records");
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], series.get(i).level(1), 1e-12, "record " + i);
            assertEquals(snapshots.get(i + 1).getTimestamp(), series.get(i).getTimestamp());
        }
    }

    @Test
    @DisplayName("Levels absent in either snapshot contribute 0 and are counted")
    void testMissingLevels() {
        BookSnapshot prev = BookSnapshot.builder()
            .symbol("MSFT").timestamp(T0)
            .level(BookLevel.of(400.00, 100, 400.05, 100))
            .level(BookLevel.of(399.95, 200, 400.10, 200))
            .level(BookLevel.of(399.90, 300, 400.15, 300))
            .build();
        BookSnapshot curr = BookSnapshot.builder()
            .symbol("MSFT").timestamp(T0.plusSeconds(60))
            .level(BookLevel.of(400.00, 150, 400.05, 100))
            .level(BookLevel.of(399.95, 200, 400.10, 200))
            .build();

        LevelOFIRecord record = LevelOFICalculator.calculate(prev, curr);

        assertEquals(50.0, record.level(1), 1e-12);
        assertEquals(0.0, record.level(3), 1e-12, "Level 3 missing in current snapshot");
        assertEquals(0.0, record.level(5), 1e-12);
        assertEquals(3, record.getMissingLevels());
    }

    @Test
    @DisplayName("Empty and single-snapshot series produce no records")
    void testShortSeries() {
        assertTrue(LevelOFICalculator.calculateSeries(List.of()).isEmpty());
        assertTrue(LevelOFICalculator.calculateSeries(List.of(fiveLevelSnapshot(0))).isEmpty());
    }

    @Test
    @DisplayName("Non-increasing timestamps are rejected")
    void testRejectsNonMonotonicSeries() {
        List<BookSnapshot> snapshots = new ArrayList<>();
        snapshots.add(fiveLevelSnapshot(1));
        snapshots.add(fiveLevelSnapshot(1));

        assertThrows(IllegalArgumentException.class, () -> LevelOFICalculator.calculateSeries(snapshots));
    }

    @Test
    @DisplayName("Snapshots of different symbols cannot be differenced")
    void testRejectsMixedSymbols() {
        assertThrows(IllegalArgumentException.class, () -> LevelOFICalculator.calculate(
            snapshot("AAPL", 0, 100.00, 500, 100.02, 400),
            snapshot("MSFT", 1, 100.00, 500, 100.02, 400)));
    }

    private static BookSnapshot snapshot(String symbol, int minute, double bidPx, long bidSz, double askPx, long askSz) {
        return BookSnapshot.builder()
            .symbol(symbol)
            .timestamp(T0.plusSeconds(60L * minute))
            .level(BookLevel.of(bidPx, bidSz, askPx, askSz))
            .build();
    }

    private static BookSnapshot fiveLevelSnapshot(int minute) {
        BookSnapshot.BookSnapshotBuilder builder = BookSnapshot.builder()
            .symbol("AAPL")
            .timestamp(T0.plusSeconds(60L * minute));
        for (int n = 0; n < 5; n++) {
            builder.level(BookLevel.of(100.00 - n * 0.01, 100L * (n + 1), 100.02 + n * 0.01, 100L * (n + 1)));
        }
        return builder.build();
    }
}
