package sunmisc.series.arith;

import sunmisc.series.Cons;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.ring.Ring;

/**
 * Every coefficient multiplied by the same constant.
 */
public final class Scaled<T> extends SeriesEnvelope<T> {

    public Scaled(final Ring<T> ring, final T factor, final Series<T> origin) {
        super(() -> new Cons<>(
                ring.multiply(factor, origin.head()),
                () -> new Scaled<>(ring, factor, origin.tail()))
        );
    }
}
