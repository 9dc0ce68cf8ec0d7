package sunmisc.series;

/**
 * A formal power series a0 + a1*x + a2*x^2 + ...
 *
 * <p>Implementations are immutable: {@link #head()} is stable and
 * {@link #tail()} returns the same instance on every call. Only the prefix
 * that callers actually read is ever computed.
 *
 * @param <T> coefficient type
 */
public interface Series<T> {

    /**
     * @return the constant term a0
     */
    T head();

    /**
     * @return the series a1 + a2*x + a3*x^2 + ...
     */
    Series<T> tail();
}
