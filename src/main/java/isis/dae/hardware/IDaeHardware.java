package isis.dae.hardware;

/**
 * Request/response surface of the ISIS data acquisition electronics.
 *
 * Every call is a blocking round trip to the hardware.  Implementations
 * report transport failures as {@link HardwareException}; nothing in this
 * package retries a failed request.
 */
public interface IDaeHardware
{
    /**
     * Begin a new run.
     *
     * @param paused if <tt>true</tt> the run opens in the PAUSED state
     */
    void beginRun(boolean paused) throws HardwareException;

    /**
     * End the current run, saving its data file.
     */
    void endRun() throws HardwareException;

    /**
     * Abort the current run, discarding its data.
     */
    void abortRun() throws HardwareException;

    void pauseRun() throws HardwareException;

    void resumeRun() throws HardwareException;

    /**
     * Make sure data held in the electronics has been downloaded so that
     * a subsequent {@link #readSpectrumData()} reflects the latest counts.
     */
    void updateRun() throws HardwareException;

    RunState getRunState() throws HardwareException;

    /**
     * Beware: this increments as soon as a run ends, so after an end it
     * reports the <i>next</i> run number.
     */
    int getRunNumber() throws HardwareException;

    int getPeriod() throws HardwareException;

    void setPeriod(int period) throws HardwareException;

    int getNumberOfPeriods() throws HardwareException;

    void setNumberOfPeriods(int periods) throws HardwareException;

    long getGoodFrames() throws HardwareException;

    long getPeriodGoodFrames() throws HardwareException;

    long getRawFrames() throws HardwareException;

    long getPeriodRawFrames() throws HardwareException;

    /** Good proton charge in micro-amp hours for the whole run. */
    double getGoodUah() throws HardwareException;

    double getPeriodGoodUah() throws HardwareException;

    /** Number of events collected, in millions. */
    double getMEvents() throws HardwareException;

    long getRunDurationSeconds() throws HardwareException;

    int getNumSpectra() throws HardwareException;

    int getNumTimeChannels() throws HardwareException;

    /**
     * Read the whole spectrum-data table for the current period in one
     * round trip.  The result is laid out row-major as
     * <tt>(numSpectra + 1) x (numTimeChannels + 1)</tt>; it may be longer
     * than that (the hardware buffer is fixed size) and is truncated by
     * {@link SpectrumDataTable}.
     */
    int[] readSpectrumData() throws HardwareException;

    /**
     * Read one spectrum.
     *
     * @param period period number, or 0 for the current period
     * @param spectrum spectrum number
     */
    Spectrum readSpectrum(int period, int spectrum) throws HardwareException;
}
