package sunmisc.series.lazy;

/**
 * A scalar whose value is computed at most once and then cached.
 */
public interface Lazy<V, E extends Throwable> extends Scalar<V, E> {

    boolean completed();

}
