package isis.dae.reduce;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.HardwareSignal;

/**
 * Sum detector spectra, then normalise by period good frames.
 */
public class PeriodGoodFramesNormalizer
    extends ScalarNormalizer
{
    public PeriodGoodFramesNormalizer(final int[] detectors)
    {
        super(detectors);
    }

    public PeriodGoodFramesNormalizer(final int[] detectors,
                                      final SpectraSummer detectorSummer)
    {
        super(detectors, detectorSummer);
    }

    @Override
    public HardwareSignal getDenominator(final IDaeHardware hardware)
    {
        return HardwareSignal.periodGoodFrames(hardware);
    }
}
