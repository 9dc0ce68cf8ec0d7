package sunmisc.series.func;

import sunmisc.series.Cons;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.ring.Ring;

/**
 * The antiderivative with a zero constant term: coefficient n + 1 is
 * a(n) / (n + 1).
 *
 * <p>The argument is not read until the tail is, so the argument may be a
 * fixpoint that contains this integral.
 */
public final class Integral<T> extends SeriesEnvelope<T> {

    public Integral(final Ring<T> ring, final Series<T> origin) {
        super(() -> new Cons<>(
                ring.zero(),
                () -> new Divided<>(ring, origin, ring.one()))
        );
    }

    private static final class Divided<T> extends SeriesEnvelope<T> {

        Divided(final Ring<T> ring, final Series<T> origin, final T n) {
            super(() -> new Cons<>(
                    ring.divide(origin.head(), n),
                    () -> new Divided<>(ring, origin.tail(), ring.add(n, ring.one())))
            );
        }
    }
}
