package org.Aayush.labelmap.testutil;

import org.Aayush.labelmap.core.Entry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brute-force oracle: a plain map with predicate scans and no validation.
 * Callers only feed it operations the storage under test accepted.
 */
public final class ReferenceStorage {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private static String key(int x, int y) {
        return x + ":" + y;
    }

    public boolean add(Entry entry) {
        return entries.put(key(entry.x(), entry.y()), entry) == null;
    }

    public Entry get(int x, int y) {
        return entries.get(key(x, y));
    }

    public boolean remove(int x, int y) {
        return entries.remove(key(x, y)) != null;
    }

    public int size() {
        return entries.size();
    }

    public List<Entry> listAll() {
        return new ArrayList<>(entries.values());
    }

    public List<Entry> inRegion(int minX, int minY, int maxX, int maxY) {
        List<Entry> result = new ArrayList<>();
        for (Entry e : entries.values()) {
            if (e.x() >= minX && e.x() <= maxX && e.y() >= minY && e.y() <= maxY) {
                result.add(e);
            }
        }
        return result;
    }

    public List<Entry> withinRadius(int radius) {
        long limit = (long) radius * radius;
        List<Entry> result = new ArrayList<>();
        for (Entry e : entries.values()) {
            if ((long) e.x() * e.x() + (long) e.y() * e.y() < limit) {
                result.add(e);
            }
        }
        return result;
    }

    public List<Entry> withinRadius(int centerX, int centerY, int radius) {
        long limit = (long) radius * radius;
        List<Entry> result = new ArrayList<>();
        for (Entry e : entries.values()) {
            long dx = (long) e.x() - centerX;
            long dy = (long) e.y() - centerY;
            if (dx * dx + dy * dy <= limit) {
                result.add(e);
            }
        }
        return result;
    }
}
