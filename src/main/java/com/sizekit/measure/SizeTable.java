package com.sizekit.measure;

import java.util.List;
import java.util.Objects;

/**
 * Ordinal press-on nail sizes and the millimeter band each one covers.
 * <p>
 * Entries are ordered by size; a larger size number is a narrower nail.
 */
public final class SizeTable {

    /**
     * @param size  Ordinal size, 0 is the widest
     * @param minMm Inclusive lower bound
     * @param maxMm Exclusive upper bound (inclusive for the widest entry)
     * @param label Typical digit for this width
     */
    public record Entry(int size, double minMm, double maxMm, String label) {
        public Entry {
            if (!(minMm < maxMm)) {
                throw new IllegalArgumentException("Size " + size + ": minMm must be < maxMm");
            }
            Objects.requireNonNull(label, "label");
        }

        public double midpointMm() {
            return (minMm + maxMm) / 2.0;
        }

        boolean contains(double mm) {
            return mm >= minMm && mm < maxMm;
        }

        double distanceTo(double mm) {
            if (mm < minMm) return minMm - mm;
            if (mm >= maxMm) return mm - maxMm;
            return 0.0;
        }
    }

    public static final SizeTable DEFAULT = new SizeTable(List.of(
            new Entry(0, 16.0, 18.0, "Large thumbs"),
            new Entry(1, 15.0, 16.0, "Standard thumbs"),
            new Entry(2, 14.0, 15.0, "Large index/thumbs"),
            new Entry(3, 13.0, 14.0, "Index finger"),
            new Entry(4, 12.0, 13.0, "Index/middle finger"),
            new Entry(5, 11.0, 12.0, "Middle finger"),
            new Entry(6, 10.0, 11.0, "Middle/ring finger"),
            new Entry(7, 9.0, 10.0, "Ring finger"),
            new Entry(8, 8.0, 9.0, "Ring/pinky finger"),
            new Entry(9, 7.0, 8.0, "Pinky finger"),
            new Entry(10, 6.0, 7.0, "Small pinky"),
            new Entry(11, 5.0, 6.0, "Very small pinky")
    ));

    private final List<Entry> entries;

    /**
     * @throws IllegalArgumentException when the entries are empty, not strictly increasing in
     *         size, or overlap / increase in millimeters
     */
    public SizeTable(List<Entry> entries) {
        Objects.requireNonNull(entries, "entries");
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Size table needs at least one entry");
        }
        for (int i = 1; i < entries.size(); i++) {
            Entry prev = entries.get(i - 1);
            Entry cur = entries.get(i);
            if (cur.size() <= prev.size()) {
                throw new IllegalArgumentException("Sizes must be strictly increasing at size " + cur.size());
            }
            if (cur.maxMm() > prev.minMm()) {
                throw new IllegalArgumentException("Size " + cur.size() + " overlaps size " + prev.size());
            }
        }
        this.entries = List.copyOf(entries);
    }

    /**
     * Size whose band contains {@code mm}; otherwise the nearest band, which clamps values
     * beyond either end of the table.
     */
    public int mmToSize(double mm) {
        if (Double.isNaN(mm)) {
            throw new IllegalArgumentException("mm must be a number");
        }
        Entry widest = entries.get(0);
        Entry narrowest = entries.get(entries.size() - 1);
        if (mm >= widest.maxMm()) {
            return widest.size();
        }
        if (mm < narrowest.minMm()) {
            return narrowest.size();
        }
        Entry nearest = widest;
        double nearestDistance = Double.POSITIVE_INFINITY;
        for (Entry e : entries) {
            if (e.contains(mm)) {
                return e.size();
            }
            double d = e.distanceTo(mm);
            if (d < nearestDistance) {
                nearestDistance = d;
                nearest = e;
            }
        }
        return nearest.size();
    }

    /**
     * @throws IllegalArgumentException for a size not in the table
     */
    public Entry sizeToMm(int size) {
        for (Entry e : entries) {
            if (e.size() == size) return e;
        }
        throw new IllegalArgumentException("Unknown size " + size);
    }

    public List<Entry> entries() {
        return entries;
    }
}
