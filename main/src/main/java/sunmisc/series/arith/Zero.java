package sunmisc.series.arith;

import sunmisc.series.Series;
import sunmisc.series.ring.Ring;

/**
 * 0 + 0*x + 0*x^2 + ... as a single node that is its own tail.
 */
public final class Zero<T> implements Series<T> {
    private final T zero;

    public Zero(final Ring<T> ring) {
        this.zero = ring.zero();
    }

    @Override
    public T head() {
        return this.zero;
    }

    @Override
    public Series<T> tail() {
        return this;
    }
}
