package sunmisc.series.arith;

import org.apache.commons.numbers.fraction.BigFraction;
import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import sunmisc.series.Series;
import sunmisc.series.ring.Rationals;
import sunmisc.series.ring.Ring;
import sunmisc.series.view.Prefix;

import java.util.List;

import static sunmisc.series.Fractions.q;
import static sunmisc.series.Fractions.qs;

public final class ArithmeticTest {
    private final Ring<BigFraction> ring = new Rationals();
    private final Series<BigFraction> f = new OfSequence<>(this.ring, qs("1", "-2", "1/3", "4"));
    private final Series<BigFraction> g = new OfSequence<>(this.ring, qs("0", "5", "-1/2"));
    private final Series<BigFraction> h = new OfSequence<>(this.ring, qs("7/2", "0", "0", "1", "1"));

    @Test
    public void constants() {
        MatcherAssert.assertThat(
                take(new Zero<>(this.ring), 4),
                CoreMatchers.equalTo(qs("0", "0", "0", "0"))
        );
        MatcherAssert.assertThat(
                take(new One<>(this.ring), 4),
                CoreMatchers.equalTo(qs("1", "0", "0", "0"))
        );
        MatcherAssert.assertThat(
                take(new Constant<>(this.ring, q(-3, 4)), 3),
                CoreMatchers.equalTo(qs("-3/4", "0", "0"))
        );
        MatcherAssert.assertThat(
                take(new X<>(this.ring), 4),
                CoreMatchers.equalTo(qs("0", "1", "0", "0"))
        );
    }

    @Test
    public void sequenceIsPaddedWithZeros() {
        MatcherAssert.assertThat(
                take(new OfSequence<>(this.ring, q(1), q(2)), 5),
                CoreMatchers.equalTo(qs("1", "2", "0", "0", "0"))
        );
        MatcherAssert.assertThat(
                take(new OfSequence<>(this.ring, List.of()), 2),
                CoreMatchers.equalTo(qs("0", "0"))
        );
    }

    @Test
    public void negateAndScale() {
        MatcherAssert.assertThat(
                take(new Negated<>(this.ring, this.f), 5),
                CoreMatchers.equalTo(qs("-1", "2", "-1/3", "-4", "0"))
        );
        MatcherAssert.assertThat(
                take(new Scaled<>(this.ring, q(3), this.f), 5),
                CoreMatchers.equalTo(qs("3", "-6", "1", "12", "0"))
        );
    }

    @Test
    public void sumAndDifference() {
        MatcherAssert.assertThat(
                take(new Sum<>(this.ring, this.f, this.g), 4),
                CoreMatchers.equalTo(qs("1", "3", "-1/6", "4"))
        );
        MatcherAssert.assertThat(
                take(new Difference<>(this.ring, this.f, this.g), 4),
                CoreMatchers.equalTo(qs("1", "-7", "5/6", "4"))
        );
        MatcherAssert.assertThat(
                "f - f must vanish",
                take(new Difference<>(this.ring, this.f, this.f), 6),
                CoreMatchers.equalTo(take(new Zero<>(this.ring), 6))
        );
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 3, 6})
    public void additionLaws(final int n) {
        MatcherAssert.assertThat(
                "Addition must commute",
                take(new Sum<>(this.ring, this.f, this.g), n),
                CoreMatchers.equalTo(take(new Sum<>(this.ring, this.g, this.f), n))
        );
        MatcherAssert.assertThat(
                "Addition must associate",
                take(new Sum<>(this.ring, new Sum<>(this.ring, this.f, this.g), this.h), n),
                CoreMatchers.equalTo(take(new Sum<>(this.ring, this.f, new Sum<>(this.ring, this.g, this.h)), n))
        );
        MatcherAssert.assertThat(
                "Zero must be neutral",
                take(new Sum<>(this.ring, this.f, new Zero<>(this.ring)), n),
                CoreMatchers.equalTo(take(this.f, n))
        );
    }

    private static List<BigFraction> take(final Series<BigFraction> series, final int n) {
        return new Prefix<>(series, n).value();
    }
}
