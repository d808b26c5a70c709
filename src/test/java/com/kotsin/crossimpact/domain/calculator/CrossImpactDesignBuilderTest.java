package com.kotsin.crossimpact.domain.calculator;

import com.kotsin.crossimpact.domain.model.DesignRow;
import com.kotsin.crossimpact.domain.model.ImpactMode;
import com.kotsin.crossimpact.domain.model.PriceChangeRecord;
import com.kotsin.crossimpact.domain.model.ReturnConvention;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Design Matrix Alignment Tests")
class CrossImpactDesignBuilderTest {

    private static final Instant T0 = Instant.parse("2024-03-01T14:30:00Z");
    private static final Duration H = Duration.ofMinutes(1);

    private CrossImpactDesignBuilder builder;
    private Map<String, NavigableMap<Instant, Double>> composite;

    @BeforeEach
    void setUp() {
        builder = new CrossImpactDesignBuilder();
        composite = new TreeMap<>();
        composite.put("AAA", series(0.0, 0, 1, 2, 3, 4));
        composite.put("BBB", series(100.0, 0, 1, 2, 3, 5));   // T0+4m missing
        composite.put("CCC", series(100.0, 0, 1, 2, 3, 4, 5));
    }

    @Test
    @DisplayName("Contemporaneous rows exist only where every symbol has OFI")
    void testContemporaneousIntersection() {
        List<PriceChangeRecord> returns = returns("AAA", 0, 1, 2, 3, 4);

        List<DesignRow> rows = builder.build(composite, "AAA", returns, H, ImpactMode.CONTEMPORANEOUS);

        assertEquals(4, rows.size(), "T0+4m dropped because BBB has no OFI there");
        DesignRow first = rows.get(0);
        assertEquals(T0, first.getTimestamp());
        assertEquals(0.0, first.getSelfOfi(), 0.0);
        assertEquals(List.of("BBB", "CCC"), new ArrayList<>(first.getCrossOfi().keySet()));
        assertEquals(100.0, first.getTargetReturn(), 0.0);
        assertEquals(ImpactMode.CONTEMPORANEOUS, first.getMode());
    }

    @Test
    @DisplayName("Lagged rows pair the return at t with OFI at t-h")
    void testLaggedAlignment() {
        List<PriceChangeRecord> returns = returns("AAA", 0, 1, 2, 3, 4);

        List<DesignRow> rows = builder.build(composite, "AAA", returns, H, ImpactMode.LAGGED);

        assertEquals(4, rows.size(), "No OFI before T0");
        DesignRow last = rows.get(3);
        assertEquals(T0.plusSeconds(240), last.getTimestamp());
        assertEquals(3.0, last.getSelfOfi(), 0.0, "OFI at T0+3m");
        assertEquals(103.0, last.getCrossOfi().get("BBB"), 0.0);
        assertEquals(104.0, last.getTargetReturn(), 0.0);
    }

    @Test
    @DisplayName("Rows come back ordered by timestamp")
    void testOrdering() {
        List<PriceChangeRecord> returns = returns("AAA", 3, 0, 2, 1);

        List<DesignRow> rows = builder.build(composite, "AAA", returns, H, ImpactMode.CONTEMPORANEOUS);

        for (int i = 1; i < rows.size(); i++) {
            assertTrue(rows.get(i).getTimestamp().isAfter(rows.get(i - 1).getTimestamp()));
        }
    }

    @Test
    @DisplayName("Missing target series or mismatched returns are rejected")
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class,
            () -> builder.build(composite, "ZZZ", List.of(), H, ImpactMode.CONTEMPORANEOUS));
        assertThrows(IllegalArgumentException.class,
            () -> builder.build(composite, "AAA", returns("BBB", 0), H, ImpactMode.CONTEMPORANEOUS));
        assertThrows(IllegalArgumentException.class,
            () -> builder.build(composite, "AAA", returns("AAA", 0), Duration.ofMinutes(5), ImpactMode.CONTEMPORANEOUS));
    }

    @Test
    @DisplayName("Cross symbols are the sorted universe without the target")
    void testCrossSymbols() {
        assertEquals(List.of("AAA", "CCC"), CrossImpactDesignBuilder.crossSymbols(List.of("CCC", "BBB", "AAA"), "BBB"));
        assertTrue(CrossImpactDesignBuilder.crossSymbols(List.of("AAA"), "AAA").isEmpty());
    }

    /** Composite OFI at minute m equals offset + m. */
    private static NavigableMap<Instant, Double> series(double offset, int... minutes) {
        NavigableMap<Instant, Double> series = new TreeMap<>();
        for (int m : minutes) {
            series.put(T0.plusSeconds(60L * m), offset + m);
        }
        return series;
    }

    private static List<PriceChangeRecord> returns(String symbol, int... minutes) {
        List<PriceChangeRecord> list = new ArrayList<>();
        for (int m : minutes) {
            list.add(PriceChangeRecord.builder()
                .symbol(symbol)
                .timestamp(T0.plusSeconds(60L * m))
                .horizon(H)
                .priceChange(100.0 + m)
                .convention(ReturnConvention.PRICE_DIFFERENCE)
                .build());
        }
        return list;
    }
}
