package isis.dae.signal;

import java.util.Arrays;

/**
 * Immutable snapshot of a signal: value, optional variance, optional
 * units.  Values are either boxed scalars or primitive arrays
 * (<tt>double[]</tt>, <tt>long[]</tt>); array values are copied in and out.
 */
public final class Reading
{
    private final Object value;
    private final Object variance;
    private final String units;
    private final Provenance provenance;
    private final long timestamp;

    public Reading(final Object value, final Object variance,
                   final String units, final Provenance provenance)
    {
        this(value, variance, units, provenance, System.currentTimeMillis());
    }

    public Reading(final Object value, final Object variance,
                   final String units, final Provenance provenance,
                   final long timestamp)
    {
        if (value == null) {
            throw new IllegalArgumentException("Reading value is null");
        }
        if (provenance == null) {
            throw new IllegalArgumentException("Reading has no provenance");
        }
        checkVariance(variance);

        this.value = copy(value);
        this.variance = copy(variance);
        this.units = units;
        this.provenance = provenance;
        this.timestamp = timestamp;
    }

    private static void checkVariance(final Object variance)
    {
        if (variance == null) {
            return;
        }
        if (variance instanceof Number) {
            if (((Number) variance).doubleValue() < 0.0) {
                throw new IllegalArgumentException("Negative variance " +
                                                   variance);
            }
        } else if (variance instanceof double[]) {
            for (double v : (double[]) variance) {
                if (v < 0.0) {
                    throw new IllegalArgumentException("Negative variance " +
                                                       v);
                }
            }
        } else {
            throw new IllegalArgumentException("Unsupported variance type " +
                                               variance.getClass().getName());
        }
    }

    private static Object copy(final Object obj)
    {
        if (obj instanceof double[]) {
            return ((double[]) obj).clone();
        } else if (obj instanceof long[]) {
            return ((long[]) obj).clone();
        } else if (obj instanceof int[]) {
            return ((int[]) obj).clone();
        }
        return obj;
    }

    public Object getValue()
    {
        return copy(value);
    }

    /**
     * @return the variance, or <tt>null</tt> if none is known
     */
    public Object getVariance()
    {
        return copy(variance);
    }

    public boolean hasVariance()
    {
        return variance != null;
    }

    public String getUnits()
    {
        return units;
    }

    public Provenance getProvenance()
    {
        return provenance;
    }

    public long getTimestamp()
    {
        return timestamp;
    }

    /**
     * @throws ClassCastException if this is an array reading
     */
    public double doubleValue()
    {
        return ((Number) value).doubleValue();
    }

    public long longValue()
    {
        return ((Number) value).longValue();
    }

    /**
     * Scalar standard deviation, or NaN if there is no variance or the
     * variance is an array.
     */
    public double getStddev()
    {
        if (!(variance instanceof Number)) {
            return Double.NaN;
        }
        return Math.sqrt(((Number) variance).doubleValue());
    }

    public double[] doubleArray()
    {
        if (value instanceof long[]) {
            long[] src = (long[]) value;
            double[] result = new double[src.length];
            for (int i = 0; i < src.length; i++) {
                result[i] = src[i];
            }
            return result;
        }
        return ((double[]) value).clone();
    }

    public long[] longArray()
    {
        return ((long[]) value).clone();
    }

    private static String format(final Object obj)
    {
        if (obj instanceof double[]) {
            return Arrays.toString((double[]) obj);
        } else if (obj instanceof long[]) {
            return Arrays.toString((long[]) obj);
        } else if (obj instanceof int[]) {
            return Arrays.toString((int[]) obj);
        }
        return String.valueOf(obj);
    }

    @Override
    public String toString()
    {
        StringBuilder buf = new StringBuilder(format(value));
        if (variance != null) {
            buf.append(" var ").append(format(variance));
        }
        if (units != null) {
            buf.append(' ').append(units);
        }
        return buf.append(" (").append(provenance).append(')').toString();
    }
}
