package sunmisc.series;

import sunmisc.series.lazy.RacyLazy;
import sunmisc.series.lazy.Scalar;

/**
 * A materialized coefficient followed by a suspended, memoized tail.
 */
public final class Cons<T> implements Series<T> {
    private final T head;
    private final Scalar<Series<T>, RuntimeException> tail;

    public Cons(final T head, final Scalar<Series<T>, RuntimeException> tail) {
        this.head = head;
        this.tail = new RacyLazy<>(tail);
    }

    @Override
    public T head() {
        return this.head;
    }

    @Override
    public Series<T> tail() {
        return this.tail.value();
    }
}
