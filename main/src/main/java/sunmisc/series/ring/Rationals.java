package sunmisc.series.ring;

import org.apache.commons.numbers.fraction.BigFraction;
import org.jetbrains.annotations.NotNull;

/**
 * Exact rationals backed by Commons Numbers {@link BigFraction}.
 */
public final class Rationals implements Ring<BigFraction> {

    @Override
    public @NotNull BigFraction zero() {
        return BigFraction.ZERO;
    }

    @Override
    public @NotNull BigFraction one() {
        return BigFraction.ONE;
    }

    @Override
    public @NotNull BigFraction add(@NotNull BigFraction a, @NotNull BigFraction b) {
        return a.add(b);
    }

    @Override
    public @NotNull BigFraction negate(@NotNull BigFraction a) {
        return a.negate();
    }

    @Override
    public @NotNull BigFraction multiply(@NotNull BigFraction a, @NotNull BigFraction b) {
        return a.multiply(b);
    }

    @Override
    public @NotNull BigFraction divide(@NotNull BigFraction a, @NotNull BigFraction b) {
        return a.divide(b);
    }

    @Override
    public boolean equal(@NotNull BigFraction a, @NotNull BigFraction b) {
        return a.equals(b);
    }

    @Override
    public @NotNull BigFraction subtract(@NotNull BigFraction a, @NotNull BigFraction b) {
        return a.subtract(b);
    }

    @Override
    public boolean isZero(@NotNull BigFraction a) {
        return a.signum() == 0;
    }

    @Override
    public String toString() {
        return "Q";
    }
}
