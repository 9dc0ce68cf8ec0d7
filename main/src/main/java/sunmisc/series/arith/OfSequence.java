package sunmisc.series.arith;

import sunmisc.series.Cons;
import sunmisc.series.SeriesEnvelope;
import sunmisc.series.ring.Ring;

import java.util.List;

/**
 * A polynomial: the given coefficients followed by zeros.
 */
public final class OfSequence<T> extends SeriesEnvelope<T> {

    @SafeVarargs
    public OfSequence(final Ring<T> ring, final T... coefficients) {
        this(ring, List.of(coefficients));
    }

    public OfSequence(final Ring<T> ring, final List<T> coefficients) {
        this(ring, List.copyOf(coefficients), 0);
    }

    private OfSequence(final Ring<T> ring,
                       final List<T> coefficients,
                       final int from) {
        super(() -> from < coefficients.size()
                ? new Cons<>(
                        coefficients.get(from),
                        () -> new OfSequence<>(ring, coefficients, from + 1))
                : new Zero<>(ring)
        );
    }
}
