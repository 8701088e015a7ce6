package isis.dae.stats;

import java.util.Arrays;
import java.util.Comparator;

/**
 * X-axis centroid of the area under a curve, for positive peaks.
 *
 * The region is bounded below by <tt>min(y)</tt>, left and right by the
 * extreme x values, and above by straight lines joining each point to its
 * neighbours along x.  Between neighbouring points the region is a right
 * trapezoid, split here into a rectangle and a right triangle whose areas
 * and centroids combine as <tt>C = sum(Ci * Ai) / sum(Ai)</tt>.
 *
 * Points may arrive in any order (adaptive or there-and-back scans) and at
 * any spacing; adding a point that lies on an existing segment does not
 * move the result.
 */
public final class CentreOfMass
{
    /**
     * Centre and total area.
     */
    public static final class Result
    {
        private final double centre;
        private final double area;

        Result(final double centre, final double area)
        {
            this.centre = centre;
            this.area = area;
        }

        public double getCentre()
        {
            return centre;
        }

        public double getArea()
        {
            return area;
        }

        @Override
        public String toString()
        {
            return "CentreOfMass[x=" + centre + ", area=" + area + "]";
        }
    }

    private CentreOfMass()
    {
    }

    /**
     * @return the centre of mass, or <tt>null</tt> if there are no points
     */
    public static Result compute(final double[] x, final double[] y)
    {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Got " + x.length +
                                               " x values and " + y.length +
                                               " y values");
        }
        if (x.length == 0) {
            return null;
        }

        Integer[] order = new Integer[x.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        // object sort is stable, so duplicate x values keep scan order
        Arrays.sort(order, new Comparator<Integer>() {
                @Override
                public int compare(final Integer a, final Integer b)
                {
                    return Double.compare(x[a], x[b]);
                }
            });

        double minY = Double.POSITIVE_INFINITY;
        for (double v : y) {
            minY = Math.min(minY, v);
        }

        double[] xs = new double[x.length];
        double[] ys = new double[y.length];
        for (int i = 0; i < order.length; i++) {
            xs[i] = x[order[i]];
            ys[i] = y[order[i]] - minY;
        }

        double totalArea = 0.0;
        double moment = 0.0;
        for (int i = 0; i + 1 < xs.length; i++) {
            final double width = xs[i + 1] - xs[i];

            final double rectArea = width * Math.min(ys[i], ys[i + 1]);
            final double rectCentre = (xs[i] + xs[i + 1]) / 2.0;

            final double triArea = width * Math.abs(ys[i] - ys[i + 1]) / 2.0;
            final double triCentre;
            if (ys[i] > ys[i + 1]) {
                triCentre = xs[i] + width / 3.0;
            } else {
                triCentre = xs[i] + 2.0 * width / 3.0;
            }

            totalArea += rectArea + triArea;
            moment += rectArea * rectCentre + triArea * triCentre;
        }

        if (totalArea == 0.0) {
            // flat data (or a single point): centre of the x range
            return new Result((xs[0] + xs[xs.length - 1]) / 2.0, 0.0);
        }

        return new Result(moment / totalArea, totalArea);
    }
}
