package sunmisc.series.exceptions;

public final class UnboundFixpointException extends IllegalStateException {

    public UnboundFixpointException(final String name) {
        super(String.format(
                "Fixpoint '%s' was read before its definition was bound",
                name)
        );
    }
}
