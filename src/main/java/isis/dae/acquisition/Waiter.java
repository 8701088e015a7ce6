package isis.dae.acquisition;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.PublishesSignals;

/**
 * Decides when a scan point has collected enough statistics.
 */
public interface Waiter
    extends PublishesSignals
{
    /**
     * Block until the stopping condition holds.
     *
     * @throws InterruptedException if the acquisition is cancelled
     */
    void awaitCompletion(IDaeHardware hardware)
        throws AcquisitionError, InterruptedException;
}
