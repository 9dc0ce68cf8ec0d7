package sunmisc.series;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sunmisc.series.exceptions.UnboundFixpointException;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A placeholder for a series defined in terms of itself.
 *
 * <p>Create the placeholder, build the defining expression around it, then
 * {@link #bind(Series)} it exactly once:
 * <pre>{@code
 * Fixpoint<T> exp = new Fixpoint<>("exp");
 * exp.bind(new Sum<>(ring, new One<>(ring), new Integral<>(ring, exp)));
 * }</pre>
 * Reading the placeholder before it is bound throws
 * {@link UnboundFixpointException}. The defining expression is the only
 * strong path from the placeholder to its coefficients, the back reference
 * is an ordinary cycle for the collector.
 */
public final class Fixpoint<T> implements Series<T> {
    private static final Logger LOG = LoggerFactory.getLogger(Fixpoint.class);
    private final AtomicReference<Series<T>> definition = new AtomicReference<>();
    private final String name;

    public Fixpoint() {
        this("fixpoint");
    }

    public Fixpoint(final String name) {
        this.name = name;
    }

    public Fixpoint<T> bind(final Series<T> series) {
        Objects.requireNonNull(series);
        if (!this.definition.compareAndSet(null, series)) {
            throw new IllegalStateException(
                    String.format("Fixpoint '%s' is already bound", this.name)
            );
        }
        LOG.debug("Bound fixpoint '{}'", this.name);
        return this;
    }

    public boolean bound() {
        return this.definition.get() != null;
    }

    @Override
    public T head() {
        return this.defined().head();
    }

    @Override
    public Series<T> tail() {
        return this.defined().tail();
    }

    private Series<T> defined() {
        final Series<T> series = this.definition.get();
        if (series == null) {
            throw new UnboundFixpointException(this.name);
        }
        return series;
    }

    @Override
    public String toString() {
        return this.bound() ? this.name : this.name + " (unbound)";
    }
}
