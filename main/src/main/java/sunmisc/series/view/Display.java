package sunmisc.series.view;

import sunmisc.series.Series;

import java.util.StringJoiner;

/**
 * Debug rendering of a series: a short prefix and a continuation marker,
 * e.g. {@code [1, 1, 1 / 2, ...]}.
 */
public final class Display<T> {
    private static final int DEFAULT_LENGTH = 3;
    private final Series<T> series;
    private final int length;

    public Display(final Series<T> series) {
        this(series, DEFAULT_LENGTH);
    }

    public Display(final Series<T> series, final int length) {
        this.series = series;
        this.length = length;
    }

    @Override
    public String toString() {
        final StringJoiner builder = new StringJoiner(", ", "[", "]");
        for (final T coefficient : new Prefix<>(this.series, this.length).value()) {
            builder.add(String.valueOf(coefficient));
        }
        builder.add("...");
        return builder.toString();
    }
}
