package edu.cwru.neymanpearsontesting.analysis;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tunable parameters of an analysis. Defaults can be overridden by a
 * {@code neymanpearson.properties} file on the classpath and then by JVM system
 * properties prefixed with {@code neymanpearson.}.
 */
public class AnalysisParams {
	private static final Logger logger = LogManager.getLogger(AnalysisParams.class);

	public static final String DEFAULT_RESOURCE = "neymanpearson.properties";
	public static final String SYSTEM_PROPERTY_PREFIX = "neymanpearson.";

	/** Absolute slack allowed when checking that a distribution sums to 1. */
	public double sumTolerance = 0.01;
	/** Relative slack under which two likelihood ratios fall in one tie group. */
	public double ratioTolerance = 1e-9;
	/** Largest outcome space accepted. Regions are int bitmasks. */
	public int maxOutcomes = 24;
	/** Outcome count above which enumeration logs a warning. */
	public int warnOutcomes = 16;
	/** Evaluate the region table on parallel streams. */
	public boolean parallel = false;

	public static AnalysisParams defaults() {
		return new AnalysisParams();
	}

	public static AnalysisParams load() {
		return load(DEFAULT_RESOURCE);
	}

	/**
	 * Loads parameters from a classpath resource, then applies system property
	 * overrides. A missing resource leaves the defaults in place.
	 * 
	 * @param resource
	 * @return validated parameters
	 */
	public static AnalysisParams load(String resource) {
		Properties properties = new Properties();
		try (InputStream in = AnalysisParams.class.getClassLoader().getResourceAsStream(resource)) {
			if (in != null)
				properties.load(in);
			else
				logger.debug("No {} on the classpath, using defaults", resource);
		} catch (IOException e) {
			throw new UncheckedIOException("Could not read " + resource, e);
		}
		for (String key : System.getProperties().stringPropertyNames()) {
			if (key.startsWith(SYSTEM_PROPERTY_PREFIX))
				properties.setProperty(key.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(key));
		}
		return fromProperties(properties);
	}

	public static AnalysisParams fromProperties(Properties properties) {
		AnalysisParams params = new AnalysisParams();
		params.sumTolerance = Double.parseDouble(properties.getProperty("sum.tolerance",
				Double.toString(params.sumTolerance)));
		params.ratioTolerance = Double.parseDouble(properties.getProperty("ratio.tolerance",
				Double.toString(params.ratioTolerance)));
		params.maxOutcomes = Integer.parseInt(properties.getProperty("max.outcomes",
				Integer.toString(params.maxOutcomes)).trim());
		params.warnOutcomes = Integer.parseInt(properties.getProperty("warn.outcomes",
				Integer.toString(params.warnOutcomes)).trim());
		params.parallel = Boolean.parseBoolean(properties.getProperty("parallel",
				Boolean.toString(params.parallel)).trim());
		params.validate();
		return params;
	}

	/**
	 * Validate the analysis parameters.
	 * 
	 * @throws IllegalArgumentException if any parameter is invalid
	 */
	public void validate() {
		if (!(sumTolerance >= 0) || sumTolerance >= 1)
			throw new IllegalArgumentException("Invalid sumTolerance: " + sumTolerance);
		if (!(ratioTolerance >= 0) || ratioTolerance >= 1)
			throw new IllegalArgumentException("Invalid ratioTolerance: " + ratioTolerance);
		if (maxOutcomes < 0)
			throw new IllegalArgumentException("Invalid maxOutcomes: " + maxOutcomes);
		if (maxOutcomes > 30)
			throw new IllegalArgumentException("maxOutcomes too large: " + maxOutcomes);
		if (warnOutcomes < 0)
			throw new IllegalArgumentException("Invalid warnOutcomes: " + warnOutcomes);
	}

	@Override
	public String toString() {
		return "AnalysisParams {\n"
				+ "  sumTolerance = " + sumTolerance + ",\n"
				+ "  ratioTolerance = " + ratioTolerance + ",\n"
				+ "  maxOutcomes = " + maxOutcomes + ",\n"
				+ "  warnOutcomes = " + warnOutcomes + ",\n"
				+ "  parallel = " + parallel + "\n"
				+ "}";
	}
}
