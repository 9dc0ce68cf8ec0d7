package sunmisc.series.view;

import sunmisc.series.Series;
import sunmisc.series.lazy.Scalar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The first {@code count} coefficients of a series. Forces exactly that
 * many coefficients and nothing beyond them.
 */
public final class Prefix<T> implements Scalar<List<T>, RuntimeException> {
    private final Series<T> series;
    private final int count;

    public Prefix(final Series<T> series, final int count) {
        this.series = series;
        this.count = count;
    }

    @Override
    public List<T> value() {
        if (this.count <= 0) {
            return List.of();
        }
        final List<T> coefficients = new ArrayList<>(this.count);
        Series<T> cursor = this.series;
        coefficients.add(cursor.head());
        for (int i = 1; i < this.count; ++i) {
            cursor = cursor.tail();
            coefficients.add(cursor.head());
        }
        return Collections.unmodifiableList(coefficients);
    }
}
