package sunmisc.series.fix;

import sunmisc.series.Fixpoint;
import sunmisc.series.Series;
import sunmisc.series.arith.Difference;
import sunmisc.series.arith.One;
import sunmisc.series.conv.Quotient;
import sunmisc.series.func.Integral;
import sunmisc.series.ring.Ring;

/**
 * sin, cos and tan over one ring. sin and cos are defined by each other:
 * sin = integral(cos), cos = 1 - integral(sin).
 */
public final class Trigonometry<T> {
    private final Series<T> sin, cos, tan;

    public Trigonometry(final Ring<T> ring) {
        final Fixpoint<T> sine = new Fixpoint<>("sin");
        final Fixpoint<T> cosine = new Fixpoint<>("cos");
        sine.bind(new Integral<>(ring, cosine));
        cosine.bind(new Difference<>(
                ring,
                new One<>(ring),
                new Integral<>(ring, sine))
        );
        this.sin = sine;
        this.cos = cosine;
        this.tan = new Quotient<>(ring, sine, cosine);
    }

    public Series<T> sin() {
        return this.sin;
    }

    public Series<T> cos() {
        return this.cos;
    }

    public Series<T> tan() {
        return this.tan;
    }
}
