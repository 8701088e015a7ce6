package isis.dae.stats;

/**
 * Polarisation (neutrons) or asymmetry (muons) of two intensities.
 *
 * On SANS and reflectometry instruments <tt>A</tt> and <tt>B</tt> are the
 * intensities before and after switching a flipper; on muon instruments
 * they are the forward and backward detector banks.
 *
 * <tt>P = (A - B) / (A + B)</tt>.  Numerator and denominator are both
 * built from <tt>A</tt> and <tt>B</tt> so they are correlated, and the
 * variance comes from the partial derivatives
 * <pre>
 *   dP/dA =  2B / (A + B)^2
 *   dP/dB = -2A / (A + B)^2
 *   Var(P) = (dP/dA)^2 Var(A) + (dP/dB)^2 Var(B)
 * </pre>
 */
public final class Polarisation
{
    private Polarisation()
    {
    }

    /**
     * @throws ArithmeticException if <tt>A + B</tt> is zero
     */
    public static Measurement calculate(final Measurement a,
                                        final Measurement b)
    {
        final double av = a.getValue();
        final double bv = b.getValue();
        final double sum = av + bv;
        if (sum == 0.0) {
            throw new ArithmeticException("Cannot calculate polarisation;" +
                                          " A + B is zero");
        }

        final double sum2 = sum * sum;
        final double partialA = 2.0 * bv / sum2;
        final double partialB = -2.0 * av / sum2;

        final double variance = partialA * partialA * a.getVariance() +
            partialB * partialB * b.getVariance();
        return new Measurement((av - bv) / sum, variance);
    }

    /**
     * Element-wise polarisation of two equally shaped arrays.
     *
     * @return <tt>{values, variances}</tt>
     */
    public static double[][] calculate(final double[] a, final double[] varA,
                                       final double[] b, final double[] varB)
    {
        if (a.length != b.length || a.length != varA.length ||
            b.length != varB.length)
        {
            throw new IllegalArgumentException("Shapes of A (" + a.length +
                                               ") and B (" + b.length +
                                               ") must match");
        }

        double[] values = new double[a.length];
        double[] variances = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            Measurement p = calculate(new Measurement(a[i], varA[i]),
                                      new Measurement(b[i], varB[i]));
            values[i] = p.getValue();
            variances[i] = p.getVariance();
        }
        return new double[][] { values, variances };
    }

    /**
     * <tt>A / B</tt> treating the two as independent.
     */
    public static Measurement ratio(final Measurement a, final Measurement b)
    {
        return a.divide(b);
    }
}
