package sunmisc.series.ring;

import org.jetbrains.annotations.NotNull;

/**
 * Coefficient arithmetic used by every series operator. Division is only
 * ever applied to a nonzero divisor.
 *
 * @param <T> coefficient type
 */
public interface Ring<T> {

    @NotNull T zero();

    @NotNull T one();

    @NotNull T add(@NotNull T a, @NotNull T b);

    @NotNull T negate(@NotNull T a);

    @NotNull T multiply(@NotNull T a, @NotNull T b);

    @NotNull T divide(@NotNull T a, @NotNull T b);

    boolean equal(@NotNull T a, @NotNull T b);

    default @NotNull T subtract(@NotNull T a, @NotNull T b) {
        return this.add(a, this.negate(b));
    }

    default boolean isZero(@NotNull T a) {
        return this.equal(a, this.zero());
    }

    default boolean isOne(@NotNull T a) {
        return this.equal(a, this.one());
    }
}
