package sunmisc.series.func;

import sunmisc.series.Cons;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.ring.Ring;

/**
 * d/dx: coefficient n is (n + 1) * a(n + 1).
 */
public final class Derivative<T> extends SeriesEnvelope<T> {

    public Derivative(final Ring<T> ring, final Series<T> origin) {
        super(() -> new Weighted<>(ring, origin.tail(), ring.one()));
    }

    // the counter n is a ring element, built by adding one
    private static final class Weighted<T> extends SeriesEnvelope<T> {

        Weighted(final Ring<T> ring, final Series<T> origin, final T n) {
            super(() -> new Cons<>(
                    ring.multiply(n, origin.head()),
                    () -> new Weighted<>(ring, origin.tail(), ring.add(n, ring.one())))
            );
        }
    }
}
