package io.kothsync.model;

import io.kothsync.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class StatsDeltaTest {

    @Test
    void readsStatsSubObjectWithMissingFieldsAsZero() throws Exception {
        StatsDelta delta = StatsDelta.fromDocument(Jsons.parse("{\"hp\":1,\"stats\":{\"kills\":3,\"captures\":1}}"));

        Assertions.assertEquals(new StatsDelta(0L, 3L, 0L, 1L), delta);
    }

    @Test
    void documentsWithoutStatsObjectYieldNoDelta() throws Exception {
        Assertions.assertNull(StatsDelta.fromDocument(null));
        Assertions.assertNull(StatsDelta.fromDocument(Jsons.parse("{\"hp\":1}")));
        Assertions.assertNull(StatsDelta.fromDocument(Jsons.parse("{\"stats\":[1,2]}")));
        Assertions.assertTrue(StatsDelta.fromDocument(Jsons.parse("{\"stats\":{}}")).isEmpty());
    }

    @Test
    void plusAddsFieldwise() {
        Assertions.assertEquals(new StatsDelta(5L, 1L, 2L, 3L),
                StatsDelta.playtime(5L).plus(new StatsDelta(0L, 1L, 2L, 3L)));
    }
}
