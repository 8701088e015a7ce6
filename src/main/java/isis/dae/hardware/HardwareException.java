package isis.dae.hardware;

/**
 * Thrown when a round trip to the acquisition electronics fails.
 *
 * Counting acquisitions are not idempotent, so callers surface this
 * immediately rather than retrying the request.
 */
public class HardwareException extends Exception
{
    private static final long serialVersionUID = 1L;

    public HardwareException(final String message)
    {
        super(message);
    }

    public HardwareException(final String message, final Throwable cause)
    {
        super(message, cause);
    }
}
