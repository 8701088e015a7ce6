package isis.dae.acquisition;

/**
 * The acquisition is configured in a way that can never work, for example
 * asking for more spectrum data than the hardware will return.
 */
public class ConfigurationError extends AcquisitionError
{
    public ConfigurationError(final String message)
    {
        super(message);
    }

    public ConfigurationError(final String message, final Throwable cause)
    {
        super(message, cause);
    }
}
