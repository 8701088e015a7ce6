package isis.dae.hardware;

/**
 * A two-valued spin-state device (neutron flipper, muon spin rotator...)
 * driven between setpoints by polarisation measurements.
 */
public interface Flipper
{
    /**
     * Request a new setpoint.  Returns once the request has been
     * accepted; the readback may lag.
     */
    void setSetpoint(double setpoint) throws HardwareException;

    /**
     * @return the current readback of the device
     */
    double getReadback() throws HardwareException;
}
