package sunmisc.series;

import org.jetbrains.annotations.NotNull;
import sunmisc.series.arith.Constant;
import sunmisc.series.arith.Difference;
import sunmisc.series.arith.Negated;
import sunmisc.series.arith.OfSequence;
import sunmisc.series.arith.One;
import sunmisc.series.arith.Scaled;
import sunmisc.series.arith.Sum;
import sunmisc.series.arith.X;
import sunmisc.series.arith.Zero;
import sunmisc.series.conv.Power;
import sunmisc.series.conv.Product;
import sunmisc.series.conv.Quotient;
import sunmisc.series.fix.Exp;
import sunmisc.series.fix.SquareRoot;
import sunmisc.series.fix.Trigonometry;
import sunmisc.series.func.Composition;
import sunmisc.series.func.Derivative;
import sunmisc.series.func.Integral;
import sunmisc.series.func.Reversion;
import sunmisc.series.lazy.Scalar;
import sunmisc.series.ring.Ring;
import sunmisc.series.view.Display;
import sunmisc.series.view.Evaluation;
import sunmisc.series.view.Prefix;

import java.util.List;
import java.util.Objects;

/**
 * Every series operation over one coefficient ring.
 *
 * <pre>{@code
 * PowerSeries<BigFraction> ps = new PowerSeries<>(new Rationals());
 * ps.take(5, ps.exp()); // [1, 1, 1 / 2, 1 / 6, 1 / 24]
 * }</pre>
 *
 * Nothing here computes coefficients eagerly, except the checks on leading
 * coefficients done by {@link #compose}, {@link #revert}, {@link #sqrt}
 * and the sign check of {@link #power}. The transcendental series are
 * created once per instance, so their computed prefix is shared.
 *
 * @param <T> coefficient type
 */
public final class PowerSeries<T> {
    private final Ring<T> ring;
    private final Series<T> exp;
    private final Trigonometry<T> trigonometry;

    public PowerSeries(@NotNull final Ring<T> ring) {
        this.ring = Objects.requireNonNull(ring);
        this.exp = new Exp<>(ring);
        this.trigonometry = new Trigonometry<>(ring);
    }

    public Ring<T> ring() {
        return this.ring;
    }

    public Series<T> cons(final T head,
                          final Scalar<Series<T>, RuntimeException> tail) {
        return new Cons<>(head, tail);
    }

    public Series<T> zero() {
        return new Zero<>(this.ring);
    }

    public Series<T> one() {
        return new One<>(this.ring);
    }

    public Series<T> constant(final T constant) {
        return new Constant<>(this.ring, constant);
    }

    /**
     * @return the series x, neutral for {@link #compose}
     */
    public Series<T> x() {
        return new X<>(this.ring);
    }

    @SafeVarargs
    public final Series<T> of(final T... coefficients) {
        return new OfSequence<>(this.ring, coefficients);
    }

    public Series<T> of(final List<T> coefficients) {
        return new OfSequence<>(this.ring, coefficients);
    }

    public Series<T> negate(final Series<T> series) {
        return new Negated<>(this.ring, series);
    }

    public Series<T> scale(final T factor, final Series<T> series) {
        return new Scaled<>(this.ring, factor, series);
    }

    public Series<T> add(final Series<T> left, final Series<T> right) {
        return new Sum<>(this.ring, left, right);
    }

    public Series<T> add(final T constant, final Series<T> series) {
        return new Sum<>(this.ring, this.constant(constant), series);
    }

    public Series<T> sub(final Series<T> left, final Series<T> right) {
        return new Difference<>(this.ring, left, right);
    }

    public Series<T> sub(final T constant, final Series<T> series) {
        return new Difference<>(this.ring, this.constant(constant), series);
    }

    public Series<T> multiply(final Series<T> left, final Series<T> right) {
        return new Product<>(this.ring, left, right);
    }

    public Series<T> multiply(final T constant, final Series<T> series) {
        return new Product<>(this.ring, this.constant(constant), series);
    }

    /**
     * Does not terminate when both operands are zero from some coefficient
     * on, see {@link Quotient}.
     */
    public Series<T> divide(final Series<T> dividend, final Series<T> divisor) {
        return new Quotient<>(this.ring, dividend, divisor);
    }

    public Series<T> divide(final T constant, final Series<T> divisor) {
        return new Quotient<>(this.ring, this.constant(constant), divisor);
    }

    public Series<T> power(final int exponent, final Series<T> base) {
        return new Power<>(this.ring, exponent, base);
    }

    /**
     * @return outer(inner(x))
     */
    public Series<T> compose(final Series<T> outer, final Series<T> inner) {
        return new Composition<>(this.ring, outer, inner);
    }

    public Series<T> revert(final Series<T> series) {
        return new Reversion<>(this.ring, series);
    }

    public Series<T> derivative(final Series<T> series) {
        return new Derivative<>(this.ring, series);
    }

    public Series<T> integral(final Series<T> series) {
        return new Integral<>(this.ring, series);
    }

    public Series<T> exp() {
        return this.exp;
    }

    public Series<T> sin() {
        return this.trigonometry.sin();
    }

    public Series<T> cos() {
        return this.trigonometry.cos();
    }

    public Series<T> tan() {
        return this.trigonometry.tan();
    }

    public Series<T> sqrt(final Series<T> series) {
        return new SquareRoot<>(this.ring, series);
    }

    public List<T> take(final int count, final Series<T> series) {
        return new Prefix<>(series, count).value();
    }

    public T eval(final int terms, final T point, final Series<T> series) {
        return new Evaluation<>(this.ring, series, terms, point).value();
    }

    public String display(final Series<T> series) {
        return new Display<>(series).toString();
    }
}
