package sunmisc.series.arith;

import sunmisc.series.Cons;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.ring.Ring;

public final class Negated<T> extends SeriesEnvelope<T> {

    public Negated(final Ring<T> ring, final Series<T> origin) {
        super(() -> new Cons<>(
                ring.negate(origin.head()),
                () -> new Negated<>(ring, origin.tail()))
        );
    }
}
