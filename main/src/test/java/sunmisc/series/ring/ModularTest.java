package sunmisc.series.ring;

import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.Test;

public final class ModularTest {
    private final Modular gf = new Modular(65537);

    @Test
    public void multipliesPastIntRange() {
        MatcherAssert.assertThat(
                "65536 is -1 modulo 65537, its square is 1",
                this.gf.multiply(65536, 65536),
                CoreMatchers.equalTo(1)
        );
    }

    @Test
    public void addsAndNegatesNearPrime() {
        MatcherAssert.assertThat(
                this.gf.add(65536, 65536),
                CoreMatchers.equalTo(65535)
        );
        MatcherAssert.assertThat(
                this.gf.negate(65536),
                CoreMatchers.equalTo(1)
        );
    }

    @Test
    public void dividesByLargeElement() {
        MatcherAssert.assertThat(
                this.gf.divide(1, 65536),
                CoreMatchers.equalTo(65536)
        );
    }
}
