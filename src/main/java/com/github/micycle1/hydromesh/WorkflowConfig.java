package com.github.micycle1.hydromesh;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.hydromesh.source.Crs;

/**
 * Settings for a {@link WatershedWorkflow} run.
 * <p>
 * {@link #load()} starts from the defaults, takes the data directory from
 * {@code WATERSHED_WORKFLOW_DATA_DIR} (else {@code ./data}) and then applies
 * the rc files {@code ~/.watershed_workflowrc}, {@code ./.watershed_workflowrc},
 * {@code ./watershed_workflowrc} and {@code ./.docker_watershed_workflowrc} in
 * that order; later files win. The rc files are {@link Properties} files with
 * the keys named by the {@code KEY_} constants.
 */
public final class WorkflowConfig {

	private static final Logger LOGGER = LoggerFactory.getLogger(WorkflowConfig.class);

	public static final String DATA_DIR_ENV = "WATERSHED_WORKFLOW_DATA_DIR";

	public static final String KEY_DATA_DIRECTORY = "data_directory";
	public static final String KEY_SSL_CERT = "ssl_cert";
	public static final String KEY_PROJ_NETWORK = "proj_network";
	public static final String KEY_DEFAULT_CRS = "default_crs";
	public static final String KEY_DIGITS = "digits";
	public static final String KEY_SNAP_RADIUS_FACTOR = "snap_radius_factor";
	public static final String KEY_MAX_REFINEMENT_PASSES = "max_refinement_passes";

	private static final List<String> RC_FILES = Arrays.asList(".watershed_workflowrc", "watershed_workflowrc",
			".docker_watershed_workflowrc");

	private final Crs defaultCrs;
	private final int digits;
	private final Path dataDirectory;
	private final double snapRadiusFactor;
	private final int maxRefinementPasses;
	private final String sslCert;
	private final boolean projNetwork;

	private WorkflowConfig(Builder b) {
		this.defaultCrs = b.defaultCrs;
		this.digits = b.digits;
		this.dataDirectory = b.dataDirectory;
		this.snapRadiusFactor = b.snapRadiusFactor;
		this.maxRefinementPasses = b.maxRefinementPasses;
		this.sslCert = b.sslCert;
		this.projNetwork = b.projNetwork;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static WorkflowConfig defaults() {
		return builder().build();
	}

	/**
	 * Loads the configuration from the environment and rc files of the current
	 * user and working directory.
	 */
	public static WorkflowConfig load() {
		return load(System.getenv(), Paths.get(System.getProperty("user.home")), Paths.get("").toAbsolutePath());
	}

	static WorkflowConfig load(Map<String, String> env, Path home, Path cwd) {
		Properties props = new Properties();
		String dataDir = env.get(DATA_DIR_ENV);
		props.setProperty(KEY_DATA_DIRECTORY, dataDir != null ? dataDir : cwd.resolve("data").toString());

		readIfPresent(home.resolve(RC_FILES.get(0)), props);
		for (String name : RC_FILES) {
			readIfPresent(cwd.resolve(name), props);
		}
		return fromProperties(props);
	}

	private static void readIfPresent(Path file, Properties props) {
		if (!Files.isRegularFile(file)) {
			return;
		}
		LOGGER.debug("Reading configuration from {}", file);
		try (InputStream in = Files.newInputStream(file)) {
			props.load(in);
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot read configuration file " + file, e);
		}
	}

	public static WorkflowConfig fromProperties(Properties props) {
		Builder b = builder();
		String value = props.getProperty(KEY_DATA_DIRECTORY);
		if (StringUtils.isNotBlank(value)) {
			b.dataDirectory(Paths.get(value.trim()));
		}
		value = props.getProperty(KEY_DEFAULT_CRS);
		if (StringUtils.isNotBlank(value)) {
			b.defaultCrs(Crs.of(value));
		}
		value = props.getProperty(KEY_DIGITS);
		if (StringUtils.isNotBlank(value)) {
			b.digits(parseInt(KEY_DIGITS, value));
		}
		value = props.getProperty(KEY_SNAP_RADIUS_FACTOR);
		if (StringUtils.isNotBlank(value)) {
			b.snapRadiusFactor(parseDouble(KEY_SNAP_RADIUS_FACTOR, value));
		}
		value = props.getProperty(KEY_MAX_REFINEMENT_PASSES);
		if (StringUtils.isNotBlank(value)) {
			b.maxRefinementPasses(parseInt(KEY_MAX_REFINEMENT_PASSES, value));
		}
		value = props.getProperty(KEY_SSL_CERT);
		if (StringUtils.isNotBlank(value)) {
			b.sslCert(value.trim());
		}
		value = props.getProperty(KEY_PROJ_NETWORK);
		if (StringUtils.isNotBlank(value)) {
			b.projNetwork(Boolean.parseBoolean(value.trim()));
		}
		return b.build();
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Configuration key '" + key + "' is not an integer: " + value, e);
		}
	}

	private static double parseDouble(String key, String value) {
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Configuration key '" + key + "' is not a number: " + value, e);
		}
	}

	public Crs getDefaultCrs() {
		return defaultCrs;
	}

	/**
	 * Decimal digits coordinates are rounded to after loading.
	 */
	public int getDigits() {
		return digits;
	}

	public Path getDataDirectory() {
		return dataDirectory;
	}

	public double getSnapRadiusFactor() {
		return snapRadiusFactor;
	}

	public int getMaxRefinementPasses() {
		return maxRefinementPasses;
	}

	/**
	 * "True", "False" or a path to certificates; passed through to sources.
	 */
	public String getSslCert() {
		return sslCert;
	}

	public boolean isProjNetwork() {
		return projNetwork;
	}

	@Override
	public String toString() {
		return "WorkflowConfig{defaultCrs=" + defaultCrs + ", digits=" + digits + ", dataDirectory=" + dataDirectory
				+ ", snapRadiusFactor=" + snapRadiusFactor + ", maxRefinementPasses=" + maxRefinementPasses + ", sslCert=" + sslCert
				+ ", projNetwork=" + projNetwork + "}";
	}

	public static final class Builder {

		private Crs defaultCrs = Crs.epsg(5070);
		private int digits = HydroConstants.DEFAULT_DIGITS;
		private Path dataDirectory = Paths.get("data");
		private double snapRadiusFactor = HydroConstants.DEFAULT_SNAP_RADIUS_FACTOR;
		private int maxRefinementPasses = HydroConstants.DEFAULT_MAX_REFINEMENT_PASSES;
		private String sslCert = "True";
		private boolean projNetwork = false;

		private Builder() {
		}

		public Builder defaultCrs(Crs defaultCrs) {
			this.defaultCrs = Validate.notNull(defaultCrs);
			return this;
		}

		public Builder digits(int digits) {
			Validate.isTrue(digits >= 0, "Digits must be non-negative: %d", digits);
			this.digits = digits;
			return this;
		}

		public Builder dataDirectory(Path dataDirectory) {
			this.dataDirectory = Validate.notNull(dataDirectory);
			return this;
		}

		public Builder snapRadiusFactor(double snapRadiusFactor) {
			Validate.isTrue(snapRadiusFactor >= 0, "Snap radius factor must be non-negative: %f", snapRadiusFactor);
			this.snapRadiusFactor = snapRadiusFactor;
			return this;
		}

		public Builder maxRefinementPasses(int maxRefinementPasses) {
			Validate.isTrue(maxRefinementPasses >= 0, "Pass limit must be non-negative: %d", maxRefinementPasses);
			this.maxRefinementPasses = maxRefinementPasses;
			return this;
		}

		public Builder sslCert(String sslCert) {
			this.sslCert = Validate.notNull(sslCert);
			return this;
		}

		public Builder projNetwork(boolean projNetwork) {
			this.projNetwork = projNetwork;
			return this;
		}

		public WorkflowConfig build() {
			return new WorkflowConfig(this);
		}
	}
}
