package sunmisc.series.conv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sunmisc.series.Cons;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.arith.Difference;
import sunmisc.series.arith.Scaled;
import sunmisc.series.exceptions.NonExactDivisionException;
import sunmisc.series.ring.Ring;

/**
 * Series division f / g.
 *
 * <p>Leading zeros shared by both operands are cancelled first (a common
 * factor of x). After that the divisor must have a nonzero constant term,
 * otherwise {@link NonExactDivisionException} is thrown when the coefficient
 * is demanded. Each next coefficient solves f = q*g one term further:
 * q0 = f0 / g0 and the rest is (F - q0*G) / g.
 *
 * <p>If both operands are zero from some point on, the cancellation never
 * ends and reading the quotient does not terminate.
 */
public final class Quotient<T> extends SeriesEnvelope<T> {
    private static final Logger LOG = LoggerFactory.getLogger(Quotient.class);

    public Quotient(final Ring<T> ring,
                    final Series<T> dividend,
                    final Series<T> divisor) {
        super(() -> {
            Series<T> f = dividend, g = divisor;
            int cancelled = 0;
            while (ring.isZero(f.head()) && ring.isZero(g.head())) {
                f = f.tail();
                g = g.tail();
                ++cancelled;
            }
            if (cancelled > 0) {
                LOG.trace("Cancelled common factor x^{}", cancelled);
            }
            if (ring.isZero(g.head())) {
                throw new NonExactDivisionException(f.head(), cancelled);
            }
            final T q = ring.divide(f.head(), g.head());
            final Series<T> num = f, den = g;
            return new Cons<>(q, () -> new Quotient<>(
                    ring,
                    new Difference<>(ring, num.tail(), new Scaled<>(ring, q, den.tail())),
                    den)
            );
        });
    }
}
