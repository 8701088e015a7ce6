package isis.dae.scan;

import isis.dae.signal.Reading;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Accumulates the data handed to a curve fit: x, y and optionally a
 * weight of <tt>1 / stddev(y)</tt> per point.
 */
public class FitInput
{
    private static final Logger logger = Logger.getLogger(FitInput.class);

    private final String xName;
    private final String yName;
    private final String yErrName;

    private final List<Double> xData = new ArrayList<Double>();
    private final List<Double> yData = new ArrayList<Double>();
    private final List<Double> weights = new ArrayList<Double>();

    /**
     * @param yErrName name of the standard deviation of y, or
     *                 <tt>null</tt> for an unweighted fit
     */
    public FitInput(final String xName, final String yName,
                    final String yErrName)
    {
        if (xName == null || yName == null) {
            throw new IllegalArgumentException("Need x and y names");
        }
        this.xName = xName;
        this.yName = yName;
        this.yErrName = yErrName;
    }

    public boolean isWeighted()
    {
        return yErrName != null;
    }

    /**
     * @throws IllegalArgumentException if a configured name is missing
     */
    public void addPoint(final Map<String, Reading> data)
    {
        final double x = CentreOfMassCollector.value(data, xName);
        final double y = CentreOfMassCollector.value(data, yName);

        Double weight = null;
        if (yErrName != null) {
            weight = weightFor(CentreOfMassCollector.value(data, yErrName));
        }

        xData.add(x);
        yData.add(y);
        if (weight != null) {
            weights.add(weight);
        }
    }

    /**
     * <tt>1 / stddev</tt>, or zero (ignoring the point) if the standard
     * deviation is zero.
     */
    static double weightFor(final double stddev)
    {
        if (stddev == 0.0) {
            logger.warn("standard deviation for y is 0, therefore applying" +
                        " weight of 0 on fit");
            return 0.0;
        }
        return 1.0 / stddev;
    }

    public int getNumPoints()
    {
        return xData.size();
    }

    public double[] getX()
    {
        return toArray(xData);
    }

    public double[] getY()
    {
        return toArray(yData);
    }

    /**
     * @return the weights, or <tt>null</tt> for an unweighted fit
     */
    public double[] getWeights()
    {
        if (!isWeighted()) {
            return null;
        }
        return toArray(weights);
    }

    private static double[] toArray(final List<Double> list)
    {
        double[] array = new double[list.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = list.get(i);
        }
        return array;
    }
}
