package sunmisc.series.conv;

import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.arith.One;
import sunmisc.series.lazy.Scalar;
import sunmisc.series.ring.Ring;

/**
 * f^n for n >= 0 by repeated multiplication.
 */
public final class Power<T> extends SeriesEnvelope<T> {

    public Power(final Ring<T> ring, final int exponent, final Series<T> base) {
        super(expand(ring, exponent, base));
    }

    private static <T> Scalar<Series<T>, RuntimeException> expand(
            final Ring<T> ring,
            final int exponent,
            final Series<T> base) {
        if (exponent < 0) {
            throw new UnsupportedOperationException(
                    "Negative exponents not supported: " + exponent
            );
        }
        return () -> exponent == 0
                ? new One<>(ring)
                : new Product<>(ring, base, new Power<>(ring, exponent - 1, base));
    }
}
