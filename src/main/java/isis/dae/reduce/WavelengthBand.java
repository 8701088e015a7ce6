package isis.dae.reduce;

import isis.dae.stats.Measurement;

/**
 * Monitor-normalised result for one wavelength band of one acquisition.
 */
public final class WavelengthBand
{
    private final int index;
    private final Measurement detCounts;
    private final Measurement monCounts;
    private final Measurement intensity;

    public WavelengthBand(final int index, final Measurement detCounts,
                          final Measurement monCounts,
                          final Measurement intensity)
    {
        this.index = index;
        this.detCounts = detCounts;
        this.monCounts = monCounts;
        this.intensity = intensity;
    }

    public int getIndex()
    {
        return index;
    }

    public Measurement getDetCounts()
    {
        return detCounts;
    }

    public Measurement getMonCounts()
    {
        return monCounts;
    }

    public Measurement getIntensity()
    {
        return intensity;
    }

    /**
     * Prefix used for this band's signal names.
     */
    public static String signalPrefix(final int index)
    {
        return "band" + index + ".";
    }

    @Override
    public String toString()
    {
        return "Band#" + index + "[det " + detCounts + ", mon " + monCounts +
            ", I " + intensity + "]";
    }
}
