package sunmisc.series;

import sunmisc.series.lazy.RacyLazy;
import sunmisc.series.lazy.Scalar;

/**
 * Base of every series operator. Construction does no coefficient work:
 * the recipe producing the first node runs on the first read and is cached.
 */
public abstract class SeriesEnvelope<T> implements Series<T> {
    private final Scalar<Series<T>, RuntimeException> origin;

    protected SeriesEnvelope(final Scalar<Series<T>, RuntimeException> origin) {
        this.origin = new RacyLazy<>(origin);
    }

    @Override
    public final T head() {
        return this.origin.value().head();
    }

    @Override
    public final Series<T> tail() {
        return this.origin.value().tail();
    }
}
