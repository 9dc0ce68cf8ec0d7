package sunmisc.series.arith;

import sunmisc.series.Cons;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.ring.Ring;

public final class Sum<T> extends SeriesEnvelope<T> {

    public Sum(final Ring<T> ring, final Series<T> left, final Series<T> right) {
        super(() -> new Cons<>(
                ring.add(left.head(), right.head()),
                () -> new Sum<>(ring, left.tail(), right.tail()))
        );
    }
}
