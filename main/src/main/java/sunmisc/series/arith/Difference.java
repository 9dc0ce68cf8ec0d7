package sunmisc.series.arith;

import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.ring.Ring;

public final class Difference<T> extends SeriesEnvelope<T> {

    public Difference(final Ring<T> ring,
                      final Series<T> left,
                      final Series<T> right) {
        super(() -> new Sum<>(ring, left, new Negated<>(ring, right)));
    }
}
