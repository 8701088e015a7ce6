package isis.dae.configuration;

import isis.dae.AbstractDae;
import isis.dae.Dae;
import isis.dae.PolarisingDae;
import isis.dae.acquisition.ConfigurationError;
import isis.dae.acquisition.Controller;
import isis.dae.acquisition.DualRunController;
import isis.dae.acquisition.GoodFramesWaiter;
import isis.dae.acquisition.GoodUahWaiter;
import isis.dae.acquisition.MEventsWaiter;
import isis.dae.acquisition.PeriodGoodFramesWaiter;
import isis.dae.acquisition.PeriodGoodUahWaiter;
import isis.dae.acquisition.PeriodPerPointController;
import isis.dae.acquisition.Reducer;
import isis.dae.acquisition.RunPerPointController;
import isis.dae.acquisition.TimeWaiter;
import isis.dae.acquisition.Waiter;
import isis.dae.hardware.Flipper;
import isis.dae.hardware.IDaeHardware;
import isis.dae.reduce.DSpacingMappingReducer;
import isis.dae.reduce.GoodFramesNormalizer;
import isis.dae.reduce.MonitorNormalizer;
import isis.dae.reduce.MultiWavelengthBandNormalizer;
import isis.dae.reduce.PeriodGoodFramesNormalizer;
import isis.dae.reduce.PeriodSpecIntegralsReducer;
import isis.dae.reduce.PolarisationReducer;
import isis.dae.reduce.SpectraSummer;
import isis.dae.reduce.SpectraSummers;
import isis.dae.stats.AxisUnit;
import isis.dae.stats.Bounds;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.dom4j.io.SAXReader;

/**
 * Acquisition strategies for a scan, read from XML:
 * <pre>
 * &lt;daeConfig&gt;
 *   &lt;controller type="period" saveRun="false"/&gt;
 *   &lt;waiter type="periodGoodFrames" value="500"/&gt;
 *   &lt;reducer type="monitorNormalizer"&gt;
 *     &lt;detectors&gt;3-5 9&lt;/detectors&gt;
 *     &lt;monitors&gt;1&lt;/monitors&gt;
 *     &lt;detectorSum type="tof" lower="1000" upper="5000" unit="us"/&gt;
 *   &lt;/reducer&gt;
 * &lt;/daeConfig&gt;
 * </pre>
 * The whole document is validated when it is parsed.
 */
public class ScanConfig
{
    private static final Logger logger = Logger.getLogger(ScanConfig.class);

    public static final String RUN_CONTROLLER = "run";
    public static final String PERIOD_CONTROLLER = "period";

    private String controllerType;
    private boolean saveRun;

    private String waiterType;
    private double waiterValue;

    private String reducerType;
    private int[] detectors;
    private int[] monitors;
    private SumSpec detectorSum;
    private SumSpec monitorSum;
    private List<Bounds> bands;
    private double[] lTotal;
    private double[] twoTheta;
    private double[] dspacingBinEdges;

    private boolean hasFlipper;
    private double flipperUp;
    private double flipperDown;
    private double flipperTolerance;
    private long flipperTimeoutMillis;

    private ScanConfig()
    {
    }

    /**
     * How to sum a group of spectra.
     */
    private static final class SumSpec
    {
        private final String type;
        private final Bounds bounds;
        private final double lTotal;

        SumSpec(final String type, final Bounds bounds, final double lTotal)
        {
            this.type = type;
            this.bounds = bounds;
            this.lTotal = lTotal;
        }

        SpectraSummer toSummer()
        {
            if (type.equals("tof")) {
                return SpectraSummers.tofBounded(bounds);
            } else if (type.equals("wavelength")) {
                return SpectraSummers.wavelengthBounded(bounds, lTotal);
            }
            return SpectraSummers.full();
        }
    }

    public static ScanConfig parseXML(final InputStream inputStream)
        throws ConfigurationError
    {
        final Document doc;
        try {
            SAXReader saxRead = new SAXReader();
            doc = saxRead.read(inputStream);
        } catch (DocumentException de) {
            throw new ConfigurationError("Cannot parse DAE configuration",
                                         de);
        }

        final Element root = doc.getRootElement();
        if (!root.getName().equals("daeConfig")) {
            throw new ConfigurationError("Expected <daeConfig>, not <" +
                                         root.getName() + ">");
        }

        ScanConfig cfg = new ScanConfig();
        cfg.parseController(required(root, "controller"));
        cfg.parseWaiter(required(root, "waiter"));
        cfg.parseReducer(required(root, "reducer"));

        Element flipper = root.element("flipper");
        if (flipper != null) {
            cfg.parseFlipper(flipper);
        } else if (cfg.isPolarising()) {
            throw new ConfigurationError("Polarisation needs a <flipper>");
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Loaded DAE configuration: controller " +
                         cfg.controllerType + ", waiter " + cfg.waiterType +
                         " " + cfg.waiterValue + ", reducer " +
                         cfg.reducerType);
        }
        return cfg;
    }

    private static Element required(final Element parent, final String name)
        throws ConfigurationError
    {
        Element elem = parent.element(name);
        if (elem == null) {
            throw new ConfigurationError("<" + parent.getName() +
                                         "> has no <" + name + ">");
        }
        return elem;
    }

    private static String requiredAttr(final Element elem, final String name)
        throws ConfigurationError
    {
        String val = elem.attributeValue(name);
        if (val == null || val.trim().length() == 0) {
            throw new ConfigurationError("<" + elem.getName() +
                                         "> has no \"" + name +
                                         "\" attribute");
        }
        return val.trim();
    }

    private static double parseDouble(final Element elem, final String text)
        throws ConfigurationError
    {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException nfe) {
            throw new ConfigurationError("Bad number \"" + text + "\" in <" +
                                         elem.getName() + ">", nfe);
        }
    }

    private static double doubleAttr(final Element elem, final String name)
        throws ConfigurationError
    {
        return parseDouble(elem, requiredAttr(elem, name));
    }

    private static double[] doubleList(final Element elem)
        throws ConfigurationError
    {
        final String text = elem.getTextTrim();
        if (text.length() == 0) {
            throw new ConfigurationError("<" + elem.getName() +
                                         "> is empty");
        }

        String[] words = text.split("[\\s,]+");
        double[] vals = new double[words.length];
        for (int i = 0; i < words.length; i++) {
            vals[i] = parseDouble(elem, words[i]);
        }
        return vals;
    }

    /**
     * Parse spectrum numbers, allowing inclusive ranges such as "3-5".
     */
    static int[] spectrumList(final Element elem)
        throws ConfigurationError
    {
        final String text = elem.getTextTrim();
        if (text.length() == 0) {
            throw new ConfigurationError("<" + elem.getName() +
                                         "> is empty");
        }

        List<Integer> list = new ArrayList<Integer>();
        try {
            for (String word : text.split("[\\s,]+")) {
                final int dash = word.indexOf('-', 1);
                if (dash < 0) {
                    list.add(Integer.parseInt(word));
                    continue;
                }

                final int lo = Integer.parseInt(word.substring(0, dash));
                final int hi = Integer.parseInt(word.substring(dash + 1));
                if (hi < lo) {
                    throw new ConfigurationError("Bad spectrum range \"" +
                                                 word + "\" in <" +
                                                 elem.getName() + ">");
                }
                for (int s = lo; s <= hi; s++) {
                    list.add(s);
                }
            }
        } catch (NumberFormatException nfe) {
            throw new ConfigurationError("Bad spectrum list \"" + text +
                                         "\" in <" + elem.getName() + ">",
                                         nfe);
        }

        int[] spectra = new int[list.size()];
        for (int i = 0; i < spectra.length; i++) {
            spectra[i] = list.get(i);
        }
        return spectra;
    }

    private static Bounds bounds(final Element elem)
        throws ConfigurationError
    {
        try {
            return new Bounds(doubleAttr(elem, "lower"),
                              doubleAttr(elem, "upper"),
                              AxisUnit.parse(requiredAttr(elem, "unit")));
        } catch (IllegalArgumentException iae) {
            throw new ConfigurationError("Bad bounds in <" + elem.getName() +
                                         ">", iae);
        }
    }

    private static SumSpec sumSpec(final Element elem)
        throws ConfigurationError
    {
        if (elem == null) {
            return new SumSpec("full", null, 0.0);
        }

        final String type = requiredAttr(elem, "type");
        if (type.equals("full")) {
            return new SumSpec(type, null, 0.0);
        } else if (type.equals("tof")) {
            return new SumSpec(type, bounds(elem), 0.0);
        } else if (type.equals("wavelength")) {
            return new SumSpec(type, bounds(elem), doubleAttr(elem, "lTotal"));
        }
        throw new ConfigurationError("Unknown sum type \"" + type + "\"");
    }

    private void parseController(final Element elem)
        throws ConfigurationError
    {
        controllerType = requiredAttr(elem, "type");
        if (!controllerType.equals(RUN_CONTROLLER) &&
            !controllerType.equals(PERIOD_CONTROLLER))
        {
            throw new ConfigurationError("Unknown controller type \"" +
                                         controllerType + "\"");
        }
        saveRun = Boolean.parseBoolean(elem.attributeValue("saveRun",
                                                           "false"));
    }

    private void parseWaiter(final Element elem)
        throws ConfigurationError
    {
        waiterType = requiredAttr(elem, "type");
        waiterValue = doubleAttr(elem, "value");
        if (!waiterType.equals("goodFrames") &&
            !waiterType.equals("periodGoodFrames") &&
            !waiterType.equals("goodUah") &&
            !waiterType.equals("periodGoodUah") &&
            !waiterType.equals("mEvents") &&
            !waiterType.equals("time"))
        {
            throw new ConfigurationError("Unknown waiter type \"" +
                                         waiterType + "\"");
        }
    }

    private void parseReducer(final Element elem)
        throws ConfigurationError
    {
        reducerType = requiredAttr(elem, "type");

        if (reducerType.equals("goodFramesNormalizer") ||
            reducerType.equals("periodGoodFramesNormalizer"))
        {
            detectors = spectrumList(required(elem, "detectors"));
            detectorSum = sumSpec(elem.element("detectorSum"));
        } else if (reducerType.equals("monitorNormalizer")) {
            detectors = spectrumList(required(elem, "detectors"));
            monitors = spectrumList(required(elem, "monitors"));
            detectorSum = sumSpec(elem.element("detectorSum"));
            monitorSum = sumSpec(elem.element("monitorSum"));
        } else if (reducerType.equals("periodSpecIntegrals")) {
            detectors = spectrumList(required(elem, "detectors"));
            monitors = spectrumList(required(elem, "monitors"));
        } else if (reducerType.equals("dspacing")) {
            detectors = spectrumList(required(elem, "detectors"));
            lTotal = doubleList(required(elem, "lTotal"));
            twoTheta = doubleList(required(elem, "twoTheta"));
            dspacingBinEdges = doubleList(required(elem,
                                                   "dspacingBinEdges"));
        } else if (reducerType.equals("polarisation")) {
            detectors = spectrumList(required(elem, "detectors"));
            monitors = spectrumList(required(elem, "monitors"));
            lTotal = doubleList(required(elem, "lTotal"));
            if (lTotal.length != 1) {
                throw new ConfigurationError("Polarisation needs a single" +
                                             " <lTotal>");
            }

            bands = new ArrayList<Bounds>();
            for (Object obj : elem.elements("band")) {
                bands.add(bounds((Element) obj));
            }
            if (bands.isEmpty()) {
                throw new ConfigurationError("Polarisation needs at least" +
                                             " one <band>");
            }
        } else {
            throw new ConfigurationError("Unknown reducer type \"" +
                                         reducerType + "\"");
        }
    }

    private void parseFlipper(final Element elem)
        throws ConfigurationError
    {
        hasFlipper = true;
        flipperUp = doubleAttr(elem, "up");
        flipperDown = doubleAttr(elem, "down");

        final String tol = elem.attributeValue("tolerance");
        flipperTolerance = tol == null ? 0.01 : parseDouble(elem, tol);

        final String timeout = elem.attributeValue("timeoutMillis");
        flipperTimeoutMillis = timeout == null ? 30000L :
            (long) parseDouble(elem, timeout);
    }

    public String getControllerType()
    {
        return controllerType;
    }

    public boolean isSaveRun()
    {
        return saveRun;
    }

    public String getWaiterType()
    {
        return waiterType;
    }

    public double getWaiterValue()
    {
        return waiterValue;
    }

    public String getReducerType()
    {
        return reducerType;
    }

    public int[] getDetectors()
    {
        return detectors == null ? null : detectors.clone();
    }

    public int[] getMonitors()
    {
        return monitors == null ? null : monitors.clone();
    }

    public boolean isPolarising()
    {
        return "polarisation".equals(reducerType);
    }

    public boolean hasFlipper()
    {
        return hasFlipper;
    }

    private Controller buildController()
    {
        if (controllerType.equals(PERIOD_CONTROLLER)) {
            return new PeriodPerPointController(saveRun);
        }
        return new RunPerPointController(saveRun);
    }

    private Waiter buildWaiter()
    {
        if (waiterType.equals("goodFrames")) {
            return new GoodFramesWaiter(waiterValue);
        } else if (waiterType.equals("periodGoodFrames")) {
            return new PeriodGoodFramesWaiter(waiterValue);
        } else if (waiterType.equals("goodUah")) {
            return new GoodUahWaiter(waiterValue);
        } else if (waiterType.equals("periodGoodUah")) {
            return new PeriodGoodUahWaiter(waiterValue);
        } else if (waiterType.equals("mEvents")) {
            return new MEventsWaiter(waiterValue);
        }
        return new TimeWaiter(waiterValue);
    }

    private Reducer buildReducer()
    {
        if (reducerType.equals("goodFramesNormalizer")) {
            return new GoodFramesNormalizer(detectors,
                                            detectorSum.toSummer());
        } else if (reducerType.equals("periodGoodFramesNormalizer")) {
            return new PeriodGoodFramesNormalizer(detectors,
                                                  detectorSum.toSummer());
        } else if (reducerType.equals("monitorNormalizer")) {
            return new MonitorNormalizer(detectors, monitors,
                                         detectorSum.toSummer(),
                                         monitorSum.toSummer());
        } else if (reducerType.equals("periodSpecIntegrals")) {
            return new PeriodSpecIntegralsReducer(monitors, detectors);
        }
        return new DSpacingMappingReducer(detectors, lTotal, twoTheta,
                                          dspacingBinEdges);
    }

    private PolarisationReducer buildPolarisationReducer()
    {
        List<SpectraSummer> summers = new ArrayList<SpectraSummer>();
        for (Bounds b : bands) {
            summers.add(SpectraSummers.wavelengthBounded(b, lTotal[0]));
        }
        return new PolarisationReducer(bands,
                                       new MultiWavelengthBandNormalizer(
                                           "up.", detectors, monitors,
                                           summers),
                                       new MultiWavelengthBandNormalizer(
                                           "down.", detectors, monitors,
                                           summers));
    }

    /**
     * Build a fresh orchestrator with new strategies.
     *
     * @param flipper only used for polarised measurements; may be
     *                <tt>null</tt> otherwise
     *
     * @throws ConfigurationError if the strategies reject the configured
     *         values
     */
    public AbstractDae build(final IDaeHardware hardware,
                             final Flipper flipper)
        throws ConfigurationError
    {
        try {
            if (isPolarising()) {
                if (flipper == null) {
                    throw new ConfigurationError("Polarisation needs a" +
                                                 " flipper");
                }
                DualRunController dual =
                    new DualRunController(buildController(), flipper,
                                          flipperUp, flipperDown,
                                          flipperTolerance,
                                          flipperTimeoutMillis);
                return new PolarisingDae(hardware, dual, buildWaiter(),
                                         buildPolarisationReducer());
            }

            return new Dae(hardware, buildController(), buildWaiter(),
                           buildReducer());
        } catch (IllegalArgumentException iae) {
            throw new ConfigurationError("Invalid DAE configuration: " +
                                         iae.getMessage(), iae);
        }
    }
}
