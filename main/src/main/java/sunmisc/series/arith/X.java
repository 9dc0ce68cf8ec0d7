package sunmisc.series.arith;

import sunmisc.series.Cons;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.ring.Ring;

/**
 * The identity series 0 + 1*x, neutral for composition.
 */
public final class X<T> extends SeriesEnvelope<T> {

    public X(final Ring<T> ring) {
        super(() -> new Cons<>(ring.zero(), () -> new One<>(ring)));
    }
}
