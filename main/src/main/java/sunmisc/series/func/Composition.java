package sunmisc.series.func;

import sunmisc.series.Cons;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.conv.Product;
import sunmisc.series.exceptions.NonConvergentException;
import sunmisc.series.lazy.Scalar;
import sunmisc.series.ring.Ring;

/**
 * f(g(x)) = f0 + g(x) * F(g(x)), where F is the tail of f.
 *
 * <p>The inner series must have a zero constant term, this is checked
 * on construction.
 */
public final class Composition<T> extends SeriesEnvelope<T> {

    public Composition(final Ring<T> ring,
                       final Series<T> outer,
                       final Series<T> inner) {
        super(compose(ring, outer, inner));
    }

    private static <T> Scalar<Series<T>, RuntimeException> compose(
            final Ring<T> ring,
            final Series<T> outer,
            final Series<T> inner) {
        final T constant = inner.head();
        if (!ring.isZero(constant)) {
            throw new NonConvergentException("compose with", constant);
        }
        return () -> new Cons<>(
                outer.head(),
                () -> new Product<>(
                        ring,
                        inner.tail(),
                        new Composition<>(ring, outer.tail(), inner))
        );
    }
}
