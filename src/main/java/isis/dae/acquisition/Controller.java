package isis.dae.acquisition;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.PublishesSignals;

/**
 * Decides how runs or periods are opened and closed around each scan
 * point.  Controllers are the only strategies allowed to change run or
 * period state.
 */
public interface Controller
    extends PublishesSignals
{
    /**
     * @return the unit opened by {@link #startCounting(IDaeHardware)}
     */
    AcquisitionUnit getAcquisitionUnit();

    /**
     * Called once before the first point.
     */
    void setup(IDaeHardware hardware)
        throws AcquisitionError, InterruptedException;

    /**
     * Open a run or period and wait until the hardware is counting.
     */
    void startCounting(IDaeHardware hardware)
        throws AcquisitionError, InterruptedException;

    /**
     * Close the unit opened by the last
     * {@link #startCounting(IDaeHardware)}.
     */
    void stopCounting(IDaeHardware hardware)
        throws AcquisitionError, InterruptedException;

    /**
     * Called once after the last point, or after a failed point or setup.
     * Must leave no run open.
     */
    void teardown(IDaeHardware hardware)
        throws AcquisitionError, InterruptedException;
}
