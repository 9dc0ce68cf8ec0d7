package sunmisc.series.func;

import sunmisc.series.Cons;
import sunmisc.series.Fixpoint;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.arith.One;
import sunmisc.series.conv.Quotient;
import sunmisc.series.exceptions.NonConvergentException;
import sunmisc.series.lazy.Scalar;
import sunmisc.series.ring.Ring;

/**
 * The compositional inverse r of f, so that f(r(x)) = x.
 *
 * <p>Writing f = x*F gives x = r*F(r), hence r = x / F(r): r is a fixpoint
 * with a zero constant term and tail 1 / F(r). The series must have a zero
 * constant term and a nonzero linear term; the former is checked on
 * construction, the latter fails as a non-exact division on first read of
 * the tail.
 */
public final class Reversion<T> extends SeriesEnvelope<T> {

    public Reversion(final Ring<T> ring, final Series<T> series) {
        super(revert(ring, series));
    }

    private static <T> Scalar<Series<T>, RuntimeException> revert(
            final Ring<T> ring,
            final Series<T> series) {
        final T constant = series.head();
        if (!ring.isZero(constant)) {
            throw new NonConvergentException("revert", constant);
        }
        final Fixpoint<T> inverse = new Fixpoint<>("revert");
        inverse.bind(new Cons<>(
                ring.zero(),
                () -> new Quotient<>(
                        ring,
                        new One<>(ring),
                        new Composition<>(ring, series.tail(), inverse)))
        );
        return () -> inverse;
    }
}
