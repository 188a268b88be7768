package org.causalcalc;

import org.causalcalc.model.ClockSnapshot;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClockSnapshotTest {

    @Test
    void formatsInLexicographicOrder() {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("Server2", 1);
        m.put("Client", 4);
        m.put("Server1", 0);
        assertEquals("{Client:4, Server1:0, Server2:1}", ClockSnapshot.of(m).format());
        assertEquals("{}", ClockSnapshot.empty().format());
    }

    @Test
    void copiesItsInput() {
        Map<String, Integer> m = new HashMap<>(Map.of("A", 1));
        ClockSnapshot s = ClockSnapshot.of(m);
        m.put("A", 99);
        assertEquals(1, s.valueOf("A"));
    }

    @Test
    void rejectsNegativeOrNullCounters() {
        assertThrows(IllegalArgumentException.class, () -> ClockSnapshot.of(Map.of("A", -1)));
        Map<String, Integer> withNull = new HashMap<>();
        withNull.put("A", null);
        assertThrows(IllegalArgumentException.class, () -> ClockSnapshot.of(withNull));
    }

    @Test
    void valueSemanticsAndTotals() {
        ClockSnapshot a = ClockSnapshot.of(Map.of("A", 1, "B", 2));
        ClockSnapshot b = ClockSnapshot.of(new LinkedHashMap<>(Map.of("B", 2, "A", 1)));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(3L, a.total());
        assertEquals(0, a.valueOf("C"));
        assertTrue(ClockSnapshot.of(null).isEmpty());
    }
}
