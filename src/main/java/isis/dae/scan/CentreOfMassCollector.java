package isis.dae.scan;

import isis.dae.signal.Reading;
import isis.dae.stats.CentreOfMass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Collects one (x, y) pair from each scan point and, once the scan is
 * over, computes the centre of mass of the area under the curve.
 */
public class CentreOfMassCollector
{
    private static final Logger logger =
        Logger.getLogger(CentreOfMassCollector.class);

    private final String xName;
    private final String yName;

    private final List<double[]> points = new ArrayList<double[]>();
    private Double result;

    /**
     * @param xName name of the independent variable in each point's data
     * @param yName name of the dependent variable
     */
    public CentreOfMassCollector(final String xName, final String yName)
    {
        if (xName == null || yName == null) {
            throw new IllegalArgumentException("Need x and y names");
        }
        this.xName = xName;
        this.yName = yName;
    }

    /**
     * Record the readings of one scan point.
     *
     * @throws IllegalArgumentException if x or y is missing
     */
    public void addPoint(final Map<String, Reading> data)
    {
        addPoint(value(data, xName), value(data, yName));
    }

    public void addPoint(final double x, final double y)
    {
        points.add(new double[] { x, y });
    }

    static double value(final Map<String, Reading> data, final String name)
    {
        Reading r = data.get(name);
        if (r == null) {
            throw new IllegalArgumentException(name + " is not in the" +
                                               " point data");
        }
        return r.doubleValue();
    }

    public int getNumPoints()
    {
        return points.size();
    }

    /**
     * Compute the centre of mass of everything collected so far.
     *
     * @return the centre along x, or <tt>null</tt> if nothing was collected
     */
    public Double compute()
    {
        if (points.isEmpty()) {
            result = null;
            return null;
        }

        double[] x = new double[points.size()];
        double[] y = new double[points.size()];
        for (int i = 0; i < x.length; i++) {
            x[i] = points.get(i)[0];
            y[i] = points.get(i)[1];
        }

        CentreOfMass.Result com = CentreOfMass.compute(x, y);
        result = com.getCentre();
        logger.info("centre of mass of " + yName + " against " + xName +
                    " is " + result);
        return result;
    }

    /**
     * @return the last computed centre, or <tt>null</tt>
     */
    public Double getResult()
    {
        return result;
    }
}
