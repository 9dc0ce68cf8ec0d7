package sunmisc.series.exceptions;

public final class NoSquareRootException extends UnsupportedOperationException {

    public NoSquareRootException(final Object leading, final Object next) {
        super(String.format(
                "Can't compute square root of a series starting with %s, %s",
                leading, next)
        );
    }

    public NoSquareRootException(final Object leading) {
        super(String.format(
                "Can't compute square root of a series starting with %s",
                leading)
        );
    }
}
