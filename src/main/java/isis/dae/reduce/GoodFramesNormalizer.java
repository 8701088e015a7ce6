package isis.dae.reduce;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.HardwareSignal;

/**
 * Sum detector spectra, then normalise by total good frames.
 */
public class GoodFramesNormalizer
    extends ScalarNormalizer
{
    public GoodFramesNormalizer(final int[] detectors)
    {
        super(detectors);
    }

    public GoodFramesNormalizer(final int[] detectors,
                                final SpectraSummer detectorSummer)
    {
        super(detectors, detectorSummer);
    }

    @Override
    public HardwareSignal getDenominator(final IDaeHardware hardware)
    {
        return HardwareSignal.goodFrames(hardware);
    }
}
