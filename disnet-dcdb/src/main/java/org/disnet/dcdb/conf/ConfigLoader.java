package org.disnet.dcdb.conf;

/*
 * This file is part of DISNET DCDB.
 *
 * Copyright (C) 2025 DISNET
 *
 * DISNET DCDB is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DISNET DCDB is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DISNET DCDB.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import org.disnet.dcdb.util.Logger;

/**
 * Loads configuration for the DrugCombDB integration from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/dcdb.properties</code> from the
 * classpath. You can override this by setting the system property
 * <code>disnet.config</code> to an absolute path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>If <code>DB_URL</code> is blank the JDBC URL is assembled from
 * <code>DB_HOST</code>, <code>DB_PORT</code> and <code>DB_NAME</code>.</li>
 * <li>Numeric tunables fall back to their defaults on blank or malformed
 * values; a warning is logged for malformed ones.</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys.</li>
 * </ul>
 */
public class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/dcdb.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "disnet.config";

	// ---- Property keys -------------------------------------------------------
	private static final String K_DB_DRIVER = "DB_DRIVER";
	private static final String K_DB_URL = "DB_URL";
	private static final String K_DB_HOST = "DB_HOST";
	private static final String K_DB_PORT = "DB_PORT";
	private static final String K_DB_NAME = "DB_NAME";
	private static final String K_DB_USER = "DB_USER";
	private static final String K_DB_PASS = "DB_PASS";

	// Local working files
	private static final String K_STAGING_DB_PATH = "STAGING_DB_PATH";
	private static final String K_CHECKPOINT_PATH = "CHECKPOINT_PATH";
	private static final String K_AUDIT_PATH = "AUDIT_PATH";
	private static final String K_LOG_FILE = "LOG_FILE";

	// Run tunables
	private static final String K_LOCAL_MODE = "LOCAL_MODE";
	private static final String K_STAGE_BATCH_SIZE = "STAGE_BATCH_SIZE";
	private static final String K_PERSIST_BATCH_SIZE = "PERSIST_BATCH_SIZE";
	private static final String K_CACHE_MAX_ENTRIES = "CACHE_MAX_ENTRIES";
	private static final String K_RESOLVER_THREADS = "RESOLVER_THREADS";
	private static final String K_RETRY_FAILED_ON_RESUME = "RETRY_FAILED_ON_RESUME";

	// Remote services
	private static final String K_HTTP_TIMEOUT_SECONDS = "HTTP_TIMEOUT_SECONDS";
	private static final String K_HTTP_MAX_RETRIES = "HTTP_MAX_RETRIES";
	private static final String K_DCDB_BASE_URL = "DCDB_BASE_URL";
	private static final String K_CELLOSAURUS_BASE_URL = "CELLOSAURUS_BASE_URL";
	private static final String K_UMLS_BASE_URL = "UMLS_BASE_URL";
	private static final String K_UMLS_API_KEY = "UMLS_API_KEY";
	private static final String K_UNICHEM_BASE_URL = "UNICHEM_BASE_URL";
	private static final String K_CHEMBL_BASE_URL = "CHEMBL_BASE_URL";

	// ---- Defaults ------------------------------------------------------------
	static final String DEFAULT_DCDB_BASE_URL = "http://drugcombdb.denglab.org:8888/";
	static final String DEFAULT_CELLOSAURUS_BASE_URL = "https://api.cellosaurus.org/";
	static final String DEFAULT_UMLS_BASE_URL = "https://uts-ws.nlm.nih.gov/rest/";
	static final String DEFAULT_UNICHEM_BASE_URL = "https://www.ebi.ac.uk/unichem/api/v1/";
	static final String DEFAULT_CHEMBL_BASE_URL = "https://www.ebi.ac.uk/chembl/api/data/";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		// 1) explicit file via system property?
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			} else {
				Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
			}
		}
		// 2) fallback to classpath resource
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

	/** Create a loader over an in-memory property set. */
	public ConfigLoader(Properties props) {
		if (props != null) {
			properties.putAll(props);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Validates presence of keys that the pipeline requires to run. This does not
	 * fail; it returns a list of human-readable issues so the caller can decide
	 * how to proceed.
	 *
	 * @return list of error strings; empty if all required keys look OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		// DB essentials
		requireNonBlank(K_DB_DRIVER, issues);
		if (isBlank(K_DB_URL)) {
			requireNonBlank(K_DB_HOST, issues);
			requireNonBlank(K_DB_PORT, issues);
			requireNonBlank(K_DB_NAME, issues);
		}
		requireNonBlank(K_DB_USER, issues);

		// Working files
		requireNonBlank(K_STAGING_DB_PATH, issues);
		requireNonBlank(K_CHECKPOINT_PATH, issues);
		requireNonBlank(K_AUDIT_PATH, issues);

		// Disease lookups run in local mode as well
		requireNonBlank(K_UMLS_API_KEY, issues);

		String port = properties.getProperty(K_DB_PORT);
		if (port != null && !port.isBlank() && !port.trim().chars().allMatch(Character::isDigit)) {
			issues.add("DB_PORT must be numeric: '" + port.trim() + "'");
		}
		if (!isPositiveOrUnset(K_STAGE_BATCH_SIZE) || !isPositiveOrUnset(K_PERSIST_BATCH_SIZE)) {
			issues.add("Batch sizes must be positive.");
		}
		return issues;
	}

	/** JDBC driver class name. */
	public String getDbDriver() {
		return getRequired(K_DB_DRIVER);
	}

	/**
	 * JDBC URL for the DISNET destination store. An explicit {@code DB_URL} wins;
	 * otherwise a MySQL URL is built from host, port and schema name.
	 */
	public String getDbUrl() {
		String explicit = getOptional(K_DB_URL, null);
		if (explicit != null) {
			return explicit;
		}
		return "jdbc:mysql://" + getDbHost() + ":" + getDbPort() + "/" + getDbName();
	}

	/** Hostname for the destination database. */
	public String getDbHost() {
		return getRequired(K_DB_HOST);
	}

	/** Port for the destination database. */
	public String getDbPort() {
		return getRequired(K_DB_PORT);
	}

	/** Database/schema name. */
	public String getDbName() {
		return getRequired(K_DB_NAME);
	}

	/** Database username. */
	public String getDbUser() {
		return getRequired(K_DB_USER);
	}

	/** Database password; blank is allowed. */
	public String getDbPass() {
		return getOptional(K_DB_PASS, "");
	}

	/** SQLite file holding staging tables and the local DrugCombDB mirror. */
	public Path getStagingDbPath() {
		return Path.of(getRequired(K_STAGING_DB_PATH));
	}

	public Path getCheckpointPath() {
		return Path.of(getRequired(K_CHECKPOINT_PATH));
	}

	public Path getAuditPath() {
		return Path.of(getRequired(K_AUDIT_PATH));
	}

	/** Optional log file; {@code null} disables file logging. */
	public Path getLogFile() {
		String v = getOptional(K_LOG_FILE, "logs/dcdb_pipeline.log");
		return "none".equalsIgnoreCase(v) ? null : Path.of(v);
	}

	/** When true, entities missing from the local mirror fail instead of falling back to the DrugCombDB API. */
	public boolean isLocalMode() {
		return getBoolean(K_LOCAL_MODE, false);
	}

	public int getStageBatchSize() {
		return getPositiveInt(K_STAGE_BATCH_SIZE, 1000);
	}

	public int getPersistBatchSize() {
		return getPositiveInt(K_PERSIST_BATCH_SIZE, 500);
	}

	/** Capacity of each in-memory lookup cache. */
	public int getCacheMaxEntries() {
		return getPositiveInt(K_CACHE_MAX_ENTRIES, 1000);
	}

	/**
	 * Worker threads used to resolve drugs and the cell line of one record
	 * concurrently. Capped at the core count, minimum 2.
	 */
	public int getResolverThreads() {
		int cores = Math.max(2, Runtime.getRuntime().availableProcessors());
		return Math.min(getPositiveInt(K_RESOLVER_THREADS, 2), cores);
	}

	/**
	 * When true, the streaming checkpoint only advances over contiguous
	 * successes so failed indices are retried on the next run.
	 */
	public boolean isRetryFailedOnResume() {
		return getBoolean(K_RETRY_FAILED_ON_RESUME, false);
	}

	public int getHttpTimeoutSeconds() {
		return getPositiveInt(K_HTTP_TIMEOUT_SECONDS, 30);
	}

	/** Retries after the first attempt for transient HTTP failures; 0 disables. */
	public int getHttpMaxRetries() {
		String raw = getOptional(K_HTTP_MAX_RETRIES, null);
		if (raw == null) return 2;
		try {
			return Math.max(0, Integer.parseInt(raw));
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default 2", K_HTTP_MAX_RETRIES, raw);
			return 2;
		}
	}

	public String getDcdbBaseUrl() {
		return baseUrl(getOptional(K_DCDB_BASE_URL, DEFAULT_DCDB_BASE_URL));
	}

	public String getCellosaurusBaseUrl() {
		return baseUrl(getOptional(K_CELLOSAURUS_BASE_URL, DEFAULT_CELLOSAURUS_BASE_URL));
	}

	public String getUmlsBaseUrl() {
		return baseUrl(getOptional(K_UMLS_BASE_URL, DEFAULT_UMLS_BASE_URL));
	}

	/** UTS API key; required for disease lookups. */
	public String getUmlsApiKey() {
		return getRequired(K_UMLS_API_KEY);
	}

	public String getUnichemBaseUrl() {
		return baseUrl(getOptional(K_UNICHEM_BASE_URL, DEFAULT_UNICHEM_BASE_URL));
	}

	public String getChemblBaseUrl() {
		return baseUrl(getOptional(K_CHEMBL_BASE_URL, DEFAULT_CHEMBL_BASE_URL));
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null || v.isBlank()) {
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

	private int getPositiveInt(String key, int defaultVal) {
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

	private boolean getBoolean(String key, boolean defaultVal) {
		String raw = getOptional(key, null);
		return raw == null ? defaultVal : Boolean.parseBoolean(raw);
	}

	private static String baseUrl(String url) {
		return url.endsWith("/") ? url : url + "/";
	}

	private boolean isBlank(String key) {
		String v = properties.getProperty(key);
		return v == null || v.trim().isEmpty();
	}

	private boolean isPositiveOrUnset(String key) {
		String raw = getOptional(key, null);
		if (raw == null) return true;
		try {
			return Integer.parseInt(raw) > 0;
		} catch (NumberFormatException nfe) {
			return false;
		}
	}

	private void requireNonBlank(String key, List<String> issues) {
		if (isBlank(key)) {
			issues.add("Missing required property: " + key);
		}
	}
}
