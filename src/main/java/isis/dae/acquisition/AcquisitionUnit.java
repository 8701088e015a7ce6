package isis.dae.acquisition;

/**
 * What a controller opens for each scan point.
 */
public enum AcquisitionUnit
{
    /** A separate run per point. */
    RUN,
    /** One run for the scan, a new period per point. */
    PERIOD;
}
