package sunmisc.series.lazy;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;

/*
 * Compute-once cell without blocking. Racing first callers may run the
 * recipe more than once; the first published result wins and every caller
 * returns it. The recipe must be pure and must not return null.
 */
public final class RacyLazy<V, E extends Throwable> implements Lazy<V, E> {
    private volatile Scalar<V, E> scalar;
    private volatile V outcome;

    public RacyLazy(final Scalar<V, E> scalar) {
        this.scalar = Objects.requireNonNull(scalar);
    }

    @Override
    public V value() throws E {
        final V res = this.outcome;
        if (res != null) {
            return res;
        }
        final Scalar<V, E> origin = this.scalar;
        if (origin == null) {
            // the recipe is dropped only after publication
            return this.outcome;
        }
        final V computed = Objects.requireNonNull(
                origin.value(),
                "A lazy value must not be null"
        );
        if (OUTCOME.compareAndSet(this, null, computed)) {
            this.scalar = null;
            return computed;
        }
        return this.outcome;
    }

    @Override
    public boolean completed() {
        return this.outcome != null;
    }

    @Override
    public String toString() {
        final V res = this.outcome;
        return res == null ? "uninitialized" : res.toString();
    }

    // VarHandle mechanics
    private static final VarHandle OUTCOME;
    static {
        try {
            MethodHandles.Lookup l = MethodHandles.lookup();
            OUTCOME = l.findVarHandle(RacyLazy.class, "outcome", Object.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }
}
