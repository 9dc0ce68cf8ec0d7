package sunmisc.series.fix;

import sunmisc.series.Fixpoint;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.arith.One;
import sunmisc.series.arith.Sum;
import sunmisc.series.func.Integral;
import sunmisc.series.lazy.Scalar;
import sunmisc.series.ring.Ring;

/**
 * e^x as the solution of exp = 1 + integral(exp).
 */
public final class Exp<T> extends SeriesEnvelope<T> {

    public Exp(final Ring<T> ring) {
        super(define(ring));
    }

    private static <T> Scalar<Series<T>, RuntimeException> define(final Ring<T> ring) {
        final Fixpoint<T> exp = new Fixpoint<>("exp");
        exp.bind(new Sum<>(ring, new One<>(ring), new Integral<>(ring, exp)));
        return () -> exp;
    }
}
