package isis.dae.hardware;

/**
 * Run states reported by the DAE.
 */
public enum RunState
{
    PROCESSING,
    SETUP,

    /**
     * Actively counting neutrons/muons into the current period.
     */
    RUNNING,

    /**
     * A run is open but counting is suspended.
     */
    PAUSED,

    /**
     * Counting, but waiting on an external veto or the beam.
     */
    WAITING,
    VETOING,
    ENDING,
    SAVING,
    RESUMING,
    PAUSING,
    BEGINNING,
    ABORTING,
    UPDATING,
    STORING,
    CHANGING;

    /**
     * @return <tt>true</tt> if data is being (or about to be) collected
     *         into the current acquisition unit
     */
    public boolean isCounting()
    {
        return this == RUNNING || this == WAITING || this == VETOING;
    }
}
