package com.di.countnova.store;

import java.util.regex.Pattern;

/**
 * Renders {@link Predicate} trees as Pilosa Query Language (PQL) calls.
 *
 * <pre>
 *   Bitmap("pickup_year", 2013)             → Bitmap(frame="pickup_year", rowID=2013)
 *   Intersect(Bitmap(..), Bitmap(..))       → Intersect(Bitmap(...), Bitmap(...))
 *   count(p)                                → Count(p)
 *   topN("passenger_count", 10, p)          → TopN(p, frame="passenger_count", n=10)
 * </pre>
 */
public final class PqlWriter {

    private static final Pattern FRAME_NAME = Pattern.compile("^[a-z][a-z0-9_-]{0,63}$");

    private PqlWriter() {
    }

    public static String count(Predicate predicate) {
        return "Count(" + write(predicate) + ")";
    }

    /**
     * @param filter optional; {@code null} ranks over all records
     */
    public static String topN(String frame, int n, Predicate filter) {
        validateFrame(frame);
        if (n <= 0) {
            throw new IllegalArgumentException("TopN n must be positive, got " + n);
        }
        StringBuilder sb = new StringBuilder("TopN(");
        if (filter != null) {
            sb.append(write(filter)).append(", ");
        }
        return sb.append("frame=\"").append(frame).append("\", n=").append(n).append(')').toString();
    }

    public static String write(Predicate predicate) {
        StringBuilder sb = new StringBuilder();
        append(sb, predicate);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Predicate predicate) {
        if (predicate instanceof Predicate.Bitmap bitmap) {
            validateFrame(bitmap.dimension());
            if (bitmap.value() < 0) {
                throw new IllegalArgumentException("rowID must be non-negative, got " + bitmap.value());
            }
            sb.append("Bitmap(frame=\"").append(bitmap.dimension())
              .append("\", rowID=").append(bitmap.value()).append(')');
        } else if (predicate instanceof Predicate.Intersect intersect) {
            sb.append("Intersect(");
            for (int i = 0; i < intersect.operands().size(); i++) {
                if (i > 0) sb.append(", ");
                append(sb, intersect.operands().get(i));
            }
            sb.append(')');
        } else {
            throw new IllegalArgumentException("Unsupported predicate type: "
                    + (predicate == null ? "null" : predicate.getClass().getName()));
        }
    }

    private static void validateFrame(String frame) {
        if (frame == null || !FRAME_NAME.matcher(frame).matches()) {
            throw new IllegalArgumentException("Invalid frame name: " + frame);
        }
    }
}
