package isis.dae.acquisition;

/**
 * Fatal error for the scan point being acquired.  Never retried; the
 * scanning engine decides whether the scan continues.
 */
public class AcquisitionError extends Exception
{

    public AcquisitionError()
    {
    }

    public AcquisitionError(final String message)
    {
        super(message);
    }

    public AcquisitionError(final String message, final Throwable cause)
    {
        super(message, cause);
    }

    public AcquisitionError(final Throwable cause)
    {
        super(cause);
    }
}
