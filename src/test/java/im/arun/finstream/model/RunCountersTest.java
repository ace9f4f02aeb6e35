package im.arun.finstream.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunCountersTest {

    @Test
    void sequencesStartAtOneAndAreIndependent() {
        RunCounters counters = new RunCounters();

        assertEquals(1, counters.nextRowId());
        assertEquals(1, counters.nextValueId());
        assertEquals(2, counters.nextValueId());
        assertEquals(2, counters.nextRowId());

        assertEquals(2, counters.rowsEmitted());
        assertEquals(2, counters.valuesEmitted());
    }
}
