package isis.dae.monitoring;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;

import org.apache.log4j.Logger;

/**
 * Times the phases of every scan point acquired by one orchestrator.
 */
public class AcquisitionMonitor
{
    private static final Logger logger =
        Logger.getLogger(AcquisitionMonitor.class);

    /** Log the timing of every point. */
    private static final boolean VERBOSE_POINT_LOGGING =
        Boolean.getBoolean("isis.dae.verbose-point-logging");

    private static final int HISTORY_SIZE = 10;

    /**
     * Parts of a scan point, in the order they normally happen.
     */
    public enum Phase
    {
        FLIPPING,
        STARTING,
        WAITING,
        STOPPING,
        REDUCING;
    }

    /** Identifies the orchestrator. */
    private final String id;

    private long sequence = -1;
    private PointStats current;
    private final Queue<PointStats> history = new LinkedList<PointStats>();
    private final MovingAverage avgPointMillis =
        new MovingAverage(HISTORY_SIZE);

    private long pointsAcquired;
    private long pointsFailed;

    public AcquisitionMonitor(final String id)
    {
        this.id = id;
    }

    long now()
    {
        return System.nanoTime();
    }

    public synchronized void initiatePoint()
    {
        if (current != null) {
            throw new IllegalStateException("Did not complete point " +
                                            current.sequence);
        }
        current = new PointStats(++sequence, now());
    }

    /**
     * Start timing a phase, ending the previous one.
     */
    public synchronized void beginPhase(final Phase phase)
    {
        if (current == null) {
            throw new IllegalStateException("No point in progress");
        }
        current.beginPhase(phase, now());
    }

    public synchronized void completePoint()
    {
        finish(false);
        pointsAcquired++;
    }

    public synchronized void failPoint()
    {
        finish(true);
        pointsFailed++;
    }

    private void finish(final boolean failed)
    {
        if (current == null) {
            throw new IllegalStateException("No point in progress");
        }

        current.stop(now(), failed);
        avgPointMillis.add(current.getDurationMillis());

        history.add(current);
        if (history.size() > HISTORY_SIZE) {
            history.remove();
        }

        if (VERBOSE_POINT_LOGGING) {
            logger.info(id + ": " + current.describe());
        }

        current = null;
    }

    public synchronized long getPointsAcquired()
    {
        return pointsAcquired;
    }

    public synchronized long getPointsFailed()
    {
        return pointsFailed;
    }

    public double getAveragePointMillis()
    {
        return avgPointMillis.getAverage();
    }

    /**
     * @return the most recently finished point, or <tt>null</tt>
     */
    public synchronized PointStats getLastPoint()
    {
        PointStats last = null;
        for (PointStats ps : history) {
            last = ps;
        }
        return last;
    }

    /**
     * Summary lines for the last few points, for logging after a failure.
     */
    public synchronized List<String> logHistory()
    {
        List<String> lines = new ArrayList<String>(history.size() + 1);
        lines.add(id + ": avg-point-duration [" +
                  avgPointMillis.getAverage() + " ms]");
        for (PointStats ps : history) {
            lines.add(ps.describe());
        }
        return lines;
    }

    /**
     * Timing of a single point.
     */
    public static final class PointStats
    {
        private final long sequence;
        private final long startNanos;
        private final long[] phaseNanos = new long[Phase.values().length];

        private Phase phase;
        private long phaseStartNanos;
        private long stopNanos;
        private boolean failed;

        PointStats(final long sequence, final long startNanos)
        {
            this.sequence = sequence;
            this.startNanos = startNanos;
        }

        void beginPhase(final Phase next, final long nanos)
        {
            endPhase(nanos);
            phase = next;
            phaseStartNanos = nanos;
        }

        private void endPhase(final long nanos)
        {
            if (phase != null) {
                phaseNanos[phase.ordinal()] += nanos - phaseStartNanos;
                phase = null;
            }
        }

        void stop(final long nanos, final boolean failed)
        {
            endPhase(nanos);
            stopNanos = nanos;
            this.failed = failed;
        }

        public long getSequence()
        {
            return sequence;
        }

        public boolean isFailed()
        {
            return failed;
        }

        public long getDurationMillis()
        {
            return (stopNanos - startNanos) / 1000000L;
        }

        public long getPhaseMillis(final Phase p)
        {
            return phaseNanos[p.ordinal()] / 1000000L;
        }

        String describe()
        {
            StringBuilder sb = new StringBuilder(128);
            sb.append("point [").append(sequence).append("]");
            if (failed) {
                sb.append(" FAILED");
            }
            sb.append(" duration [").append(getDurationMillis())
                .append(" ms]");
            for (Phase p : Phase.values()) {
                sb.append(' ').append(p.name().toLowerCase()).append(" [")
                    .append(getPhaseMillis(p)).append(" ms]");
            }
            return sb.toString();
        }
    }
}
