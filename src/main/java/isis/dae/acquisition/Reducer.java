package isis.dae.acquisition;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.PublishesSignals;

/**
 * Turns the raw data of a finished scan point into published values.
 */
public interface Reducer
    extends PublishesSignals
{
    /**
     * Verify the hardware can satisfy this reducer before any data is
     * taken.
     *
     * @throws ConfigurationError if it cannot
     */
    void checkConfiguration(IDaeHardware hardware)
        throws AcquisitionError, InterruptedException;

    /**
     * Reduce the data of the point which has just stopped counting.  Either
     * every published value is replaced or none is.
     */
    void reduceData(IDaeHardware hardware)
        throws AcquisitionError, InterruptedException;
}
