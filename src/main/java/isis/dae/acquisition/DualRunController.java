package isis.dae.acquisition;

import isis.dae.hardware.Flipper;
import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.Signal;
import isis.dae.signal.SoftSignalBank;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Wraps a run or period controller and adds a spin flipper which must be
 * driven to the requested state before each sub-acquisition.
 */
public class DualRunController
    implements Controller
{
    private static final Logger logger =
        Logger.getLogger(DualRunController.class);

    private final Controller inner;
    private final Flipper flipper;
    private final double upSetpoint;
    private final double downSetpoint;
    private final double tolerance;
    private final long timeoutMillis;

    private final SoftSignalBank bank = new SoftSignalBank();
    private final SoftSignalBank.SoftSignal spinSignal =
        bank.register("spin_state", null, SpinState.UP.name());

    private SpinState spinState;

    /**
     * @param inner controller opening the run or period for each state
     * @param flipper device selecting the spin state
     * @param upSetpoint flipper setpoint for {@link SpinState#UP}
     * @param downSetpoint flipper setpoint for {@link SpinState#DOWN}
     * @param tolerance maximum difference between readback and setpoint
     * @param timeoutMillis how long to wait for the flipper to settle
     */
    public DualRunController(final Controller inner, final Flipper flipper,
                             final double upSetpoint,
                             final double downSetpoint,
                             final double tolerance,
                             final long timeoutMillis)
    {
        if (inner == null || flipper == null) {
            throw new IllegalArgumentException("Need both a controller and" +
                                               " a flipper");
        }
        if (tolerance < 0.0) {
            throw new IllegalArgumentException("Negative tolerance " +
                                               tolerance);
        }
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("Flipper timeout must be" +
                                               " positive");
        }

        this.inner = inner;
        this.flipper = flipper;
        this.upSetpoint = upSetpoint;
        this.downSetpoint = downSetpoint;
        this.tolerance = tolerance;
        this.timeoutMillis = timeoutMillis;
    }

    public Controller getInner()
    {
        return inner;
    }

    /**
     * @return the last state selected, or <tt>null</tt> before the first
     */
    public SpinState getSpinState()
    {
        return spinState;
    }

    public double getSetpoint(final SpinState state)
    {
        return state == SpinState.UP ? upSetpoint : downSetpoint;
    }

    /**
     * Drive the flipper and wait until its readback is within tolerance.
     *
     * @throws AcquisitionError if the flipper does not settle in time
     */
    public void selectSpinState(final IDaeHardware hardware,
                                final SpinState state)
        throws AcquisitionError, InterruptedException
    {
        final double setpoint = getSetpoint(state);
        logger.info("setting flipper to " + state + " (" + setpoint + ")");

        try {
            flipper.setSetpoint(setpoint);
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot set flipper to " + state, he);
        }

        HardwarePoller.waitFor(hardware, "flipper " + state,
                               new HardwarePoller.Condition() {
                public boolean isSatisfied(final IDaeHardware hw)
                    throws HardwareException
                {
                    return Math.abs(flipper.getReadback() - setpoint) <=
                        tolerance;
                }
            }, timeoutMillis);

        spinState = state;
        bank.update().set(spinSignal, state.name()).commit();
    }

    @Override
    public AcquisitionUnit getAcquisitionUnit()
    {
        return inner.getAcquisitionUnit();
    }

    @Override
    public void setup(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        spinState = null;
        inner.setup(hardware);
    }

    @Override
    public void startCounting(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        inner.startCounting(hardware);
    }

    @Override
    public void stopCounting(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        inner.stopCounting(hardware);
    }

    @Override
    public void teardown(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        inner.teardown(hardware);
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        List<Signal> list = new ArrayList<Signal>(bank.getSignals());
        list.addAll(inner.getPublishedSignals(hardware));
        return list;
    }
}
