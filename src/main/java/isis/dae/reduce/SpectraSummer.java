package isis.dae.reduce;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.stats.Measurement;

/**
 * Reads a set of spectra from the current period and sums them into one
 * count with its variance.
 */
public interface SpectraSummer
{
    /**
     * @param spectra spectrum numbers to read
     *
     * @return the summed counts, each spectrum contributing a variance of
     *         its (possibly fractional) count plus one half
     */
    Measurement sum(IDaeHardware hardware, int[] spectra)
        throws HardwareException;
}
