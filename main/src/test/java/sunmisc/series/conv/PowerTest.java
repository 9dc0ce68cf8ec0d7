package sunmisc.series.conv;

import org.apache.commons.numbers.fraction.BigFraction;
import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import sunmisc.series.Series;
import sunmisc.series.arith.OfSequence;
import sunmisc.series.arith.One;
import sunmisc.series.arith.X;
import sunmisc.series.ring.Rationals;
import sunmisc.series.ring.Ring;
import sunmisc.series.view.Prefix;

import java.util.List;

import static sunmisc.series.Fractions.qs;

public final class PowerTest {
    private final Ring<BigFraction> ring = new Rationals();

    @Test
    public void zeroExponentGivesOne() {
        final Series<BigFraction> f = new OfSequence<>(this.ring, qs("3", "1/2", "-7"));
        MatcherAssert.assertThat(
                take(new Power<>(this.ring, 0, f), 5),
                CoreMatchers.equalTo(take(new One<>(this.ring), 5))
        );
    }

    @Test
    public void cubeOfX() {
        MatcherAssert.assertThat(
                take(new Power<>(this.ring, 3, new X<>(this.ring)), 5),
                CoreMatchers.equalTo(qs("0", "0", "0", "1", "0"))
        );
    }

    @Test
    public void binomial() {
        MatcherAssert.assertThat(
                take(new Power<>(this.ring, 4, new OfSequence<>(this.ring, qs("1", "1"))), 6),
                CoreMatchers.equalTo(qs("1", "4", "6", "4", "1", "0"))
        );
    }

    @Test
    public void rejectsNegativeExponent() {
        final UnsupportedOperationException ex = Assertions.assertThrows(
                UnsupportedOperationException.class,
                () -> new Power<>(this.ring, -1, new X<>(this.ring))
        );
        MatcherAssert.assertThat(ex.getMessage(), CoreMatchers.containsString("-1"));
    }

    private static List<BigFraction> take(final Series<BigFraction> series, final int n) {
        return new Prefix<>(series, n).value();
    }
}
