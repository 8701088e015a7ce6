package isis.dae.stats;

/**
 * Units accepted for summation bounds.  Time units convert to
 * microseconds, length units to angstrom.
 */
public enum AxisUnit
{
    NANOSECONDS(true, 1.0e-3, "ns"),
    MICROSECONDS(true, 1.0, "us"),
    MILLISECONDS(true, 1.0e3, "ms"),
    ANGSTROM(false, 1.0, "angstrom"),
    NANOMETRE(false, 10.0, "nm");

    private final boolean time;
    private final double toBase;
    private final String symbol;

    AxisUnit(final boolean time, final double toBase, final String symbol)
    {
        this.time = time;
        this.toBase = toBase;
        this.symbol = symbol;
    }

    public boolean isTime()
    {
        return time;
    }

    public boolean isLength()
    {
        return !time;
    }

    /**
     * Convert to microseconds (time) or angstrom (length).
     */
    public double toBase(final double value)
    {
        return value * toBase;
    }

    public String getSymbol()
    {
        return symbol;
    }

    /**
     * Look up a unit by symbol or enum name, ignoring case.
     */
    public static AxisUnit parse(final String text)
    {
        final String trimmed = text.trim();
        for (AxisUnit u : values()) {
            if (u.symbol.equalsIgnoreCase(trimmed) ||
                u.name().equalsIgnoreCase(trimmed))
            {
                return u;
            }
        }
        if (trimmed.equalsIgnoreCase("µs") ||
            trimmed.equalsIgnoreCase("microsecond"))
        {
            return MICROSECONDS;
        }
        throw new IllegalArgumentException("Unknown unit \"" + text + "\"");
    }
}
