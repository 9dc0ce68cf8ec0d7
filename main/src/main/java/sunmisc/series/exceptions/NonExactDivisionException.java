package sunmisc.series.exceptions;

/**
 * The divisor's leading coefficient is zero while the dividend's is not,
 * so the quotient is not a power series.
 */
public final class NonExactDivisionException extends ArithmeticException {

    public NonExactDivisionException(final Object dividend, final int cancelled) {
        super(String.format(
                "Division is not exact: dividend coefficient %s over a zero divisor coefficient (after cancelling x^%d)",
                dividend, cancelled)
        );
    }
}
