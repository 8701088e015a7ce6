package isis.dae.reduce;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.ConfigurationError;
import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.hardware.SpectrumDataTable;

/**
 * Checks and reads shared by the reducers.
 */
final class ReducerSupport
{
    private ReducerSupport()
    {
    }

    static int[] copySpectra(final int[] spectra, final String what)
    {
        if (spectra == null || spectra.length == 0) {
            throw new IllegalArgumentException("No " + what + " spectra");
        }
        for (int s : spectra) {
            if (s < 0) {
                throw new IllegalArgumentException("Bad " + what +
                                                   " spectrum " + s);
            }
        }
        return spectra.clone();
    }

    /**
     * @throws ConfigurationError if any spectrum is beyond the hardware's
     */
    static void checkSpectra(final IDaeHardware hardware,
                             final int[] spectra, final String what)
        throws AcquisitionError
    {
        final int numSpectra;
        try {
            numSpectra = hardware.getNumSpectra();
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot read number of spectra", he);
        }

        for (int s : spectra) {
            if (s > numSpectra) {
                throw new ConfigurationError("No " + what + " spectrum " + s +
                                             "; hardware has " + numSpectra +
                                             " spectra");
            }
        }
    }

    /**
     * @throws ConfigurationError if the whole spectrum-data table would be
     *         larger than the hardware allows
     */
    static void checkTableFits(final IDaeHardware hardware)
        throws AcquisitionError
    {
        final int periods;
        final int spectra;
        final int channels;
        try {
            periods = hardware.getNumberOfPeriods();
            spectra = hardware.getNumSpectra();
            channels = hardware.getNumTimeChannels();
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot read DAE dimensions", he);
        }

        if (!SpectrumDataTable.fits(periods, spectra, channels)) {
            throw new ConfigurationError("Spectrum data table of " + periods +
                                         " periods x " + (spectra + 1) +
                                         " spectra x " + (channels + 1) +
                                         " channels exceeds " +
                                         SpectrumDataTable.MAX_ELEMENTS +
                                         " elements; reduce the number of" +
                                         " periods, spectra or channels");
        }
    }

    /**
     * One round trip for the whole current-period table.
     */
    static SpectrumDataTable readTable(final IDaeHardware hardware)
        throws AcquisitionError
    {
        try {
            return new SpectrumDataTable(hardware.readSpectrumData(),
                                         hardware.getNumSpectra(),
                                         hardware.getNumTimeChannels());
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot read spectrum data", he);
        }
    }
}
