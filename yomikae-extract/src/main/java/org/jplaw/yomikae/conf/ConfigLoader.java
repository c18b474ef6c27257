package org.jplaw.yomikae.conf;

/*
 * This file is part of Yomikae.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * Yomikae is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Yomikae is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Yomikae.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.jplaw.yomikae.util.Logger;

/**
 * Loads configuration for the read-as extractor from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/yomikae.properties</code> from the
 * classpath. You can override this by setting the system property
 * <code>yomikae.config</code> to a path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Directory values are normalized to end with a trailing slash.</li>
 * <li>Output file names default to <code>yomikae_rules.csv</code> and
 * <code>yomikae_errors.csv</code> under {@link #getOutputPath()}.</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/yomikae.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "yomikae.config";

	// ---- Property keys -------------------------------------------------------
	private static final String K_LAW_XML_PATH = "LAW_XML_PATH";
	private static final String K_LAW_INDEX_FILE = "LAW_INDEX_FILE";
	private static final String K_OUTPUT_PATH = "OUTPUT_PATH";
	private static final String K_RULE_OUTPUT_FILE = "RULE_OUTPUT_FILE";
	private static final String K_ERROR_OUTPUT_FILE = "ERROR_OUTPUT_FILE";
	private static final String K_PARALLEL_LAW_LIMIT = "PARALLEL_LAW_LIMIT";
	private static final String K_MAX_LAW_FILE_MB = "MAX_LAW_FILE_MB";
	private static final String K_BEFORE_WORDS_SEPARATOR = "BEFORE_WORDS_SEPARATOR";

	private static final String DEFAULT_RULE_OUTPUT_FILE = "yomikae_rules.csv";
	private static final String DEFAULT_ERROR_OUTPUT_FILE = "yomikae_errors.csv";
	private static final int DEFAULT_MAX_LAW_FILE_MB = 15;
	private static final String DEFAULT_BEFORE_WORDS_SEPARATOR = "|";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/** Create a loader over already-materialized properties. */
	public ConfigLoader(Properties props) {
		if (props != null) {
			properties.putAll(props);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Validates presence of the keys a batch run needs. This does not fail; it
	 * returns human-readable issues so the caller can decide how to proceed.
	 *
	 * @return list of error strings; empty if all required keys look OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();
		requireNonBlank(K_LAW_XML_PATH, issues);
		requireNonBlank(K_OUTPUT_PATH, issues);

		if (getRuleOutputFile().equals(getErrorOutputFile())) {
			issues.add(K_RULE_OUTPUT_FILE + " must differ from " + K_ERROR_OUTPUT_FILE + ".");
		}

		String limit = getOptional(K_PARALLEL_LAW_LIMIT, null);
		if (limit != null && !limit.matches("\\d+")) {
			issues.add("Invalid integer for " + K_PARALLEL_LAW_LIMIT + ": '" + limit + "'");
		}
		return issues;
	}

	/** Directory containing the law XML files. */
	public String getLawXmlPath() {
		return normalizedDir(getRequired(K_LAW_XML_PATH));
	}

	/**
	 * Optional CSV index listing {@code LawNum,File}. Empty when the XML directory
	 * should be scanned instead.
	 */
	public String getLawIndexFile() {
		return getOptional(K_LAW_INDEX_FILE, "");
	}

	/** Directory for generated CSV files. */
	public String getOutputPath() {
		return normalizedDir(getRequired(K_OUTPUT_PATH));
	}

	public String getRuleOutputFile() {
		return getOptional(K_RULE_OUTPUT_FILE, DEFAULT_RULE_OUTPUT_FILE);
	}

	public String getErrorOutputFile() {
		return getOptional(K_ERROR_OUTPUT_FILE, DEFAULT_ERROR_OUTPUT_FILE);
	}

	/** Separator placed between the before phrases of one rule in the CSV output. */
	public String getBeforeWordsSeparator() {
		String raw = properties.getProperty(K_BEFORE_WORDS_SEPARATOR);
		return (raw == null || raw.isEmpty()) ? DEFAULT_BEFORE_WORDS_SEPARATOR : raw;
	}

	/** Files larger than this are skipped. */
	public long getMaxLawFileBytes() {
		int mb = parsePositive(K_MAX_LAW_FILE_MB, DEFAULT_MAX_LAW_FILE_MB);
		return mb * 1024L * 1024L;
	}

	/**
	 * Number of law files processed in parallel. Defaults to ~25% of available
	 * cores and never exceeds the core count.
	 */
	public int getParallelLawLimit() {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, (int) Math.floor(cores / 4.0));
		int val = parsePositive(K_PARALLEL_LAW_LIMIT, defaultLimit);
		return Math.min(val, cores);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private int parsePositive(String key, int defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			int val = Integer.parseInt(raw);
			return val <= 0 ? defaultVal : val;
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private static String normalizedDir(String path) {
		String p = path.trim();
		if (!p.endsWith("/"))
			p = p + "/";
		return p;
	}

	private void requireNonBlank(String key, List<String> issues) {
		String v = properties.getProperty(key);
		if (v == null || v.trim().isEmpty()) {
			issues.add("Missing required property: " + key);
		}
	}
}
