package sunmisc.series.view;

import sunmisc.series.Series;
import sunmisc.series.lazy.Scalar;
import sunmisc.series.ring.Ring;

import java.util.List;

/**
 * The truncated sum a0 + a1*p + ... + a(n-1)*p^(n-1), folded Horner-style.
 */
public final class Evaluation<T> implements Scalar<T, RuntimeException> {
    private final Ring<T> ring;
    private final Series<T> series;
    private final int terms;
    private final T point;

    public Evaluation(final Ring<T> ring,
                      final Series<T> series,
                      final int terms,
                      final T point) {
        this.ring = ring;
        this.series = series;
        this.terms = terms;
        this.point = point;
    }

    @Override
    public T value() {
        final List<T> coefficients = new Prefix<>(this.series, this.terms).value();
        T acc = this.ring.zero();
        for (int i = coefficients.size() - 1; i >= 0; --i) {
            acc = this.ring.add(
                    coefficients.get(i),
                    this.ring.multiply(this.point, acc)
            );
        }
        return acc;
    }
}
