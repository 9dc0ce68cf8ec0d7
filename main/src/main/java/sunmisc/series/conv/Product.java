package sunmisc.series.conv;

import sunmisc.series.Cons;
import sunmisc.series.Series;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.arith.Scaled;
import sunmisc.series.arith.Sum;
import sunmisc.series.ring.Ring;

/**
 * Convolution of two series, unfolded one coefficient at a time:
 * (f0 + x*F)(g) = f0*g0 + x*(f0*G + F*g).
 */
public final class Product<T> extends SeriesEnvelope<T> {

    public Product(final Ring<T> ring,
                   final Series<T> left,
                   final Series<T> right) {
        super(() -> {
            final T f0 = left.head();
            return new Cons<>(
                    ring.multiply(f0, right.head()),
                    () -> new Sum<>(
                            ring,
                            new Scaled<>(ring, f0, right.tail()),
                            new Product<>(ring, left.tail(), right))
            );
        });
    }
}
