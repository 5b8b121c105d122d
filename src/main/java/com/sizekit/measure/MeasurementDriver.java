package com.sizekit.measure;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI driver: measures the nails in one photo and prints the calibration and per-nail sizes.
 * <p>
 * Usage: {@code MeasurementDriver <image> <landmarks.txt> [handConfidence]}
 * <p>
 * The landmark file holds one point per line as {@code x y} or {@code x,y}, in pixel
 * coordinates and hand-landmark order. Blank lines and lines starting with {@code #} are ignored.
 */
public class MeasurementDriver {

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: MeasurementDriver <image> <landmarks.txt> [handConfidence]");
            System.exit(2);
        }

        Path image = Path.of(args[0]);
        List<Point> landmarks = parseLandmarks(Files.readAllLines(Path.of(args[1])));
        double confidence = args.length > 2 ? Double.parseDouble(args[2]) : 1.0;

        NailSizer sizer = new NailSizer();
        System.out.printf("Measuring %s (%d landmarks, confidence %.2f)%n", image, landmarks.size(), confidence);

        long start = System.nanoTime();
        DetectionResult<HandMeasurement> result = sizer.measure(image, landmarks, confidence);
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

        if (result.isFailure()) {
            System.err.printf("Measurement failed: %s (%s)%n", result.failure(), result.message());
            System.exit(1);
        }

        HandMeasurement hand = result.value();
        Calibration cal = hand.calibration();
        System.out.printf("Calibration: %.3f px/mm (card %.1f px = %.2f mm)%n",
                cal.pixelsPerMm(), cal.referenceWidthPixels(), cal.referenceWidthMm());
        System.out.println("-----------------------------------------------------------");
        System.out.printf("%-8s | %8s | %8s | %8s | %4s | %5s%n", "Digit", "Pixels", "Chord", "Curved", "Size", "Conf");
        for (NailMeasurement m : hand.nails()) {
            System.out.printf("%-8s | %8.1f | %8.2f | %8.2f | %4d | %5.2f%n",
                    m.digit().displayName(), m.widthPixels(), m.chordMm(), m.curvedMm(), m.size(), m.confidence());
        }
        System.out.println("-----------------------------------------------------------");
        System.out.printf("Mean %.2f mm, sizes %.1f avg, range %d%n", hand.meanMm(), hand.meanSize(), hand.sizeRange());

        for (String issue : new MeasurementValidator().validate(hand)) {
            System.out.println("WARN: " + issue);
        }
        System.out.printf("Done in %.1f ms%n", elapsedMs);
    }

    /**
     * @throws IOException when a line is not a pair of numbers
     */
    static List<Point> parseLandmarks(List<String> lines) throws IOException {
        List<Point> points = new ArrayList<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;

            String[] parts = line.split("[,\\s]+");
            if (parts.length != 2) {
                throw new IOException("Line " + lineNo + ": expected 'x y' or 'x,y', got '" + line + "'");
            }
            try {
                points.add(new Point(Double.parseDouble(parts[0]), Double.parseDouble(parts[1])));
            } catch (NumberFormatException e) {
                throw new IOException("Line " + lineNo + ": not a number in '" + line + "'", e);
            }
        }
        return points;
    }
}
