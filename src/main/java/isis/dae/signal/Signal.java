package isis.dae.signal;

import isis.dae.hardware.HardwareException;

/**
 * A named value published to the scanning engine after each scan point.
 */
public interface Signal
{
    String getName();

    Provenance getProvenance();

    /**
     * Read the current value.  Hardware-backed signals make a round trip
     * to the electronics; derived signals return the last published value.
     */
    Reading read() throws HardwareException;
}
