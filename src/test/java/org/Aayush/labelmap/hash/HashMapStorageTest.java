package org.Aayush.labelmap.hash;

import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.testutil.LabelFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("HashMapStorage Tests")
class HashMapStorageTest {

    @Test
    @DisplayName("Dense random workload keeps one entry per coordinate")
    void testRandomWorkload() {
        HashMapStorage storage = new HashMapStorage();
        List<Entry> entries = LabelFixtures.uniform(5_000, 200, 2026L);
        Set<Long> distinct = new HashSet<>();
        for (Entry entry : entries) {
            storage.add(entry);
            distinct.add(((long) entry.x() << 32) | entry.y());
        }

        assertEquals(distinct.size(), storage.size());
        assertEquals(distinct.size(), storage.listAll().size());
        // Later labels win on repeated coordinates.
        Entry last = entries.get(entries.size() - 1);
        assertEquals(last.label(), storage.get(last.x(), last.y()).label());
    }

    @Test
    @DisplayName("Coordinates near the integer boundary do not alias")
    void testLargeMapBoundary() {
        HashMapStorage storage = new HashMapStorage(Integer.MAX_VALUE);
        storage.add(Entry.of(Integer.MAX_VALUE - 1, 0, "right"));
        storage.add(Entry.of(0, Integer.MAX_VALUE - 1, "top"));

        assertEquals("right", storage.get(Integer.MAX_VALUE - 1, 0).label());
        assertEquals("top", storage.get(0, Integer.MAX_VALUE - 1).label());
        assertTrue(storage.getWithinRadius(Integer.MAX_VALUE - 1).isEmpty());
        assertEquals(2, storage.getWithinRadius(Integer.MAX_VALUE).size());
    }
}
