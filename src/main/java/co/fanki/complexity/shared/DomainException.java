package co.fanki.complexity.shared;

/**
 * Base exception for errors that abort a ranking run.
 *
 * <p>Carries an error code so that entry points (REST, MCP, command line)
 * can report the failure without parsing the message.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Default error code when none is given. */
    public static final String DOMAIN_ERROR = "DOMAIN_ERROR";

    /** The source root does not exist or is not a directory. */
    public static final String SOURCE_ROOT_NOT_FOUND = "SOURCE_ROOT_NOT_FOUND";

    /** The source root exists but could not be enumerated. */
    public static final String SOURCE_ROOT_UNREADABLE =
            "SOURCE_ROOT_UNREADABLE";

    /** The ranking run was interrupted while waiting for its workers. */
    public static final String RANKING_INTERRUPTED = "RANKING_INTERRUPTED";

    private final String errorCode;

    /**
     * Creates a new domain exception with a message.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, DOMAIN_ERROR);
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
