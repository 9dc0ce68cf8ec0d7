package sunmisc.series.view;

import org.apache.commons.numbers.fraction.BigFraction;
import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import sunmisc.series.Cons;
import sunmisc.series.Series;
import sunmisc.series.arith.OfSequence;
import sunmisc.series.ring.Rationals;

import java.util.List;

import static sunmisc.series.Fractions.q;
import static sunmisc.series.Fractions.qs;

public final class PrefixTest {

    @Test
    public void nonPositiveCountIsEmpty() {
        final Series<BigFraction> series = new OfSequence<>(new Rationals(), q(1));
        MatcherAssert.assertThat(new Prefix<>(series, 0).value(), Matchers.empty());
        MatcherAssert.assertThat(new Prefix<>(series, -3).value(), Matchers.empty());
    }

    @Test
    public void forcesNothingBeyondThePrefix() {
        final Series<BigFraction> guarded = new Cons<>(
                q(1),
                () -> new Cons<>(q(2), () -> {
                    throw new AssertionError("third coefficient was forced");
                })
        );
        MatcherAssert.assertThat(
                new Prefix<>(guarded, 2).value(),
                CoreMatchers.equalTo(qs("1", "2"))
        );
    }

    @Test
    public void isUnmodifiable() {
        final List<BigFraction> prefix = new Prefix<>(
                new OfSequence<>(new Rationals(), q(1), q(2)), 2
        ).value();
        Assertions.assertThrows(UnsupportedOperationException.class, () -> prefix.add(q(3)));
    }
}
