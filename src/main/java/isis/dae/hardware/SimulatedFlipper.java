package isis.dae.hardware;

import java.util.ArrayList;
import java.util.List;

/**
 * Flipper whose readback follows the setpoint immediately, or never if
 * it has been told to stick.
 */
public class SimulatedFlipper
    implements Flipper
{
    private double setpoint = Double.NaN;
    private double readback = Double.NaN;
    private boolean stuck;
    private final List<Double> history = new ArrayList<Double>();

    public synchronized void setStuck(final boolean stuck)
    {
        this.stuck = stuck;
    }

    @Override
    public synchronized void setSetpoint(final double value)
    {
        setpoint = value;
        history.add(value);
        if (!stuck) {
            readback = value;
        }
    }

    @Override
    public synchronized double getReadback()
    {
        return readback;
    }

    public synchronized double getSetpoint()
    {
        return setpoint;
    }

    /**
     * @return every setpoint requested so far, oldest first
     */
    public synchronized List<Double> getHistory()
    {
        return new ArrayList<Double>(history);
    }
}
