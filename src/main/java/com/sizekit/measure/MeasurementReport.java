package com.sizekit.measure;

import java.util.Locale;

/**
 * Plain-text summary of both hands, suitable for sharing or pasting.
 */
public final class MeasurementReport {

    private MeasurementReport() {
    }

    public static String format(HandMeasurement left, HandMeasurement right) {
        StringBuilder sb = new StringBuilder();
        sb.append("My Nail Sizes (SizeKit)\n\n");
        sb.append(formatHand("LEFT HAND", left));
        sb.append('\n');
        sb.append(formatHand("RIGHT HAND", right));
        sb.append("\nMeasured with SizeKit\n");
        return sb.toString();
    }

    /**
     * One title line, then one {@code "<Digit>: Size <n> (<mm>mm)"} line per nail.
     */
    public static String formatHand(String title, HandMeasurement hand) {
        StringBuilder sb = new StringBuilder(title).append('\n');
        for (NailMeasurement m : hand.nails()) {
            sb.append(String.format(Locale.ROOT, "%s: Size %d (%.1fmm)\n",
                    m.digit().displayName(), m.size(), m.roundedMm()));
        }
        return sb.toString();
    }
}
