package io.snapcheck.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RunStatsTest {

    @Test
    void summaryOmitsZeroCategories() {
        Assertions.assertEquals("2 new, 1 updated, 3 skipped", new RunStats(6L, 2L, 1L, 0L, 3L).summary());
        Assertions.assertEquals("1 rejected", new RunStats(1L, 0L, 0L, 1L, 0L).summary());
        Assertions.assertEquals("", RunStats.EMPTY.summary());
    }

    @Test
    void enumParsingIsCaseInsensitiveAndStrict() {
        Assertions.assertEquals(Target.ASSERT, Target.fromString("assert"));
        Assertions.assertEquals(Target.AUTO_ASSERT, Target.fromString("auto-assert"));
        Assertions.assertEquals(Action.ACCEPT, Action.fromString("ACCEPT"));
        Assertions.assertEquals(SelectionOrder.FIFO, SelectionOrder.fromString("fifo"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Action.fromString("maybe"));
    }
}
