package sunmisc.series.fix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sunmisc.series.Cons;
import sunmisc.series.Fixpoint;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.arith.One;
import sunmisc.series.arith.Sum;
import sunmisc.series.conv.Quotient;
import sunmisc.series.exceptions.NoSquareRootException;
import sunmisc.series.func.Derivative;
import sunmisc.series.func.Integral;
import sunmisc.series.lazy.Scalar;
import sunmisc.series.ring.Ring;

/**
 * Square root of a series.
 *
 * <ul>
 *     <li>f = x^2 * g: the root is x * sqrt(g);</li>
 *     <li>f0 = 1: the root q solves q = 1 + integral(f' / 2q),
 *     which follows from differentiating q^2 = f;</li>
 *     <li>anything else throws {@link NoSquareRootException}.</li>
 * </ul>
 * The first level is decided on construction, deeper levels when the
 * corresponding coefficients are read.
 */
public final class SquareRoot<T> extends SeriesEnvelope<T> {
    private static final Logger LOG = LoggerFactory.getLogger(SquareRoot.class);

    public SquareRoot(final Ring<T> ring, final Series<T> origin) {
        super(root(ring, origin));
    }

    private static <T> Scalar<Series<T>, RuntimeException> root(
            final Ring<T> ring,
            final Series<T> origin) {
        final T leading = origin.head();
        if (ring.isZero(leading)) {
            final Series<T> rest = origin.tail();
            final T next = rest.head();
            if (!ring.isZero(next)) {
                throw new NoSquareRootException(leading, next);
            }
            LOG.trace("Factoring x^2 out of the square root argument");
            return () -> new Cons<>(
                    ring.zero(),
                    () -> new SquareRoot<>(ring, rest.tail())
            );
        } else if (ring.isOne(leading)) {
            final Fixpoint<T> root = new Fixpoint<>("sqrt");
            root.bind(new Sum<>(
                    ring,
                    new One<>(ring),
                    new Integral<>(ring, new Quotient<>(
                            ring,
                            new Derivative<>(ring, origin),
                            new Sum<>(ring, root, root))))
            );
            return () -> root;
        }
        throw new NoSquareRootException(leading);
    }
}
