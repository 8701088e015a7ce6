package isis.dae.monitoring;

/**
 * Average of the last few durations recorded.
 */
public class MovingAverage
{
    private final long[] window;
    private int next;
    private int filled;
    private long sum;

    public MovingAverage(final int size)
    {
        if (size < 1) {
            throw new IllegalArgumentException("Window size must be" +
                                               " positive, not " + size);
        }
        window = new long[size];
    }

    /**
     * Add a sample, dropping the oldest once the window is full.
     *
     * @return the new average
     */
    public synchronized double add(final long value)
    {
        sum += value - window[next];
        window[next] = value;
        next = (next + 1) % window.length;
        if (filled < window.length) {
            filled++;
        }
        return getAverage();
    }

    /**
     * @return the average, or 0 if nothing has been added
     */
    public synchronized double getAverage()
    {
        if (filled == 0) {
            return 0.0;
        }
        return (double) sum / (double) filled;
    }

    public synchronized int getCount()
    {
        return filled;
    }
}
