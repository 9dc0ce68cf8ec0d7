package sunmisc.series.exceptions;

/**
 * Composition and reversion need an argument without a constant term,
 * otherwise every output coefficient depends on infinitely many inputs.
 */
public final class NonConvergentException extends UnsupportedOperationException {

    public NonConvergentException(final String operation, final Object constant) {
        super(String.format(
                "Cannot %s a series with a nonzero constant term: %s",
                operation, constant)
        );
    }
}
