package sunmisc.series.lazy;

/**
 * A suspended computation. Series tails are scalars that produce the rest
 * of the series when asked.
 */
@FunctionalInterface
public interface Scalar<V, E extends Throwable> {

    V value() throws E;
}
