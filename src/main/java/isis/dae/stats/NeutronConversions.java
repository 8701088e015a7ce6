package isis.dae.stats;

/**
 * Time-of-flight conversions for elastic neutron scattering.
 *
 * <pre>
 *   lambda = h * t / (m_n * L)
 *   d      = lambda / (2 sin(theta))      where 2 theta is the scattering angle
 * </pre>
 * Times are in microseconds, lengths in metres, wavelength and d-spacing
 * in angstrom, angles in degrees.
 */
public final class NeutronConversions
{
    /** Planck constant, J s. */
    public static final double PLANCK = 6.62607015e-34;
    /** Neutron mass, kg. */
    public static final double NEUTRON_MASS = 1.67492749804e-27;

    private static final double US_TO_S = 1.0e-6;
    private static final double M_TO_ANGSTROM = 1.0e10;

    private NeutronConversions()
    {
    }

    public static double wavelength(final double tofMicros,
                                    final double lTotal)
    {
        checkFlightPath(lTotal);
        return PLANCK * tofMicros * US_TO_S / (NEUTRON_MASS * lTotal) *
            M_TO_ANGSTROM;
    }

    public static double[] wavelength(final double[] tofMicros,
                                      final double lTotal)
    {
        double[] out = new double[tofMicros.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = wavelength(tofMicros[i], lTotal);
        }
        return out;
    }

    public static double dspacing(final double tofMicros, final double lTotal,
                                  final double twoThetaDegrees)
    {
        final double sinTheta =
            Math.sin(Math.toRadians(twoThetaDegrees) / 2.0);
        if (sinTheta == 0.0) {
            throw new IllegalArgumentException("Scattering angle must not" +
                                               " be zero");
        }
        return wavelength(tofMicros, lTotal) / (2.0 * sinTheta);
    }

    public static double[] dspacing(final double[] tofMicros,
                                    final double lTotal,
                                    final double twoThetaDegrees)
    {
        double[] out = new double[tofMicros.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = dspacing(tofMicros[i], lTotal, twoThetaDegrees);
        }
        return out;
    }

    private static void checkFlightPath(final double lTotal)
    {
        if (!(lTotal > 0.0)) {
            throw new IllegalArgumentException("Flight path length must be" +
                                               " positive, not " + lTotal);
        }
    }
}
