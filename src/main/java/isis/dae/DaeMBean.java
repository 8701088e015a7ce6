package isis.dae;

/**
 * Monitor MBean for an acquisition orchestrator.
 */
public interface DaeMBean
{
    /**
     * Get the lifecycle state
     */
    String getState();

    /**
     * Get what the controller opens for each point
     * @return "RUN" or "PERIOD"
     */
    String getAcquisitionUnit();

    /**
     * Get the number of points acquired and reduced successfully.
     */
    long getPointsAcquired();

    /**
     * Get the number of points which failed.
     */
    long getPointsFailed();

    /**
     * Get the average duration of recent points in milliseconds.
     */
    double getAveragePointMillis();

    /**
     * Get the names of the published signals.
     */
    String[] getSignalNames();
}
