package org.scriptonbasestar.sync.spring.boot;

import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for SB Sync.
 * <p>
 * Bind to {@code sb-sync.*} properties in application.yml/properties.
 * Frequency classes are referred to by their lower-case key ({@code daily}, {@code monthly}, ...).
 * </p>
 *
 * <h3>Example Configuration:</h3>
 * <pre>{@code
 * # application.yml
 * sb-sync:
 *   store-dir: data/cache
 *   lookback-days: 7300
 *   refresh-timeout-seconds: 1800
 *   publication-window-days: 5
 *   calendar-zone: UTC
 *   sla-overrides:
 *     daily: PT6H
 *   rate-limit:
 *     max-calls: 120
 *     window-seconds: 60
 *     min-delay-millis: 500
 *     max-attempts: 3
 *     retry-backoff-millis: 500
 *   jobs:
 *     daily: PT3H
 *     monthly: PT24H
 *   datasets:
 *     DGS10:
 *       frequency: daily
 *       display-name: 10Y Treasury
 *       params:
 *         source: fred
 *   response-cache:
 *     enabled: true
 *     backend: memory
 *     ttl-seconds: 3600
 *   function-cache:
 *     ttl-seconds: 3600
 *     ttls:
 *       fred-series: PT5M
 *   snapshot:
 *     enabled: true
 *     dir: data/backups
 *     retention-days: 30
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@ConfigurationProperties(prefix = "sb-sync")
public class SyncProperties {

	/**
	 * Directory of the frequency-partitioned store.
	 */
	private String storeDir = "data/cache";

	/**
	 * Default fetch lookback in days for datasets without their own.
	 */
	private int lookbackDays = 7300;

	/**
	 * Wall-clock limit of one refresh job.
	 */
	private long refreshTimeoutSeconds = 1800;

	/**
	 * Days at the start of a month (quarter) during which monthly (quarterly) data may be fetched.
	 */
	private int publicationWindowDays = 5;

	/**
	 * Zone used to evaluate the publication calendar.
	 */
	private String calendarZone = "UTC";

	/**
	 * Staleness thresholds per frequency class (overrides the defaults).
	 */
	private Map<String, Duration> slaOverrides = new LinkedHashMap<>();

	/**
	 * Default fetch pacing.
	 */
	private RateLimit rateLimit = new RateLimit();

	/**
	 * Refresh cadence per frequency class. Classes without an entry are only refreshed manually.
	 */
	private Map<String, Duration> jobs = new LinkedHashMap<>();

	/**
	 * Start the scheduler when the application context is ready.
	 */
	private boolean autoStart = true;

	/**
	 * Dataset registry, keyed by dataset id.
	 */
	private Map<String, DatasetConfig> datasets = new LinkedHashMap<>();

	private ResponseCache responseCache = new ResponseCache();

	private Snapshot snapshot = new Snapshot();

	/**
	 * Spring {@code @Cacheable} memoization over the response cache backend.
	 */
	private FunctionCache functionCache = new FunctionCache();

	// Getters and Setters

	public String getStoreDir() {
		return storeDir;
	}

	public void setStoreDir(String storeDir) {
		this.storeDir = storeDir;
	}

	public int getLookbackDays() {
		return lookbackDays;
	}

	public void setLookbackDays(int lookbackDays) {
		this.lookbackDays = lookbackDays;
	}

	public long getRefreshTimeoutSeconds() {
		return refreshTimeoutSeconds;
	}

	public void setRefreshTimeoutSeconds(long refreshTimeoutSeconds) {
		this.refreshTimeoutSeconds = refreshTimeoutSeconds;
	}

	public int getPublicationWindowDays() {
		return publicationWindowDays;
	}

	public void setPublicationWindowDays(int publicationWindowDays) {
		this.publicationWindowDays = publicationWindowDays;
	}

	public String getCalendarZone() {
		return calendarZone;
	}

	public void setCalendarZone(String calendarZone) {
		this.calendarZone = calendarZone;
	}

	public Map<String, Duration> getSlaOverrides() {
		return slaOverrides;
	}

	public void setSlaOverrides(Map<String, Duration> slaOverrides) {
		this.slaOverrides = slaOverrides;
	}

	public RateLimit getRateLimit() {
		return rateLimit;
	}

	public void setRateLimit(RateLimit rateLimit) {
		this.rateLimit = rateLimit;
	}

	public Map<String, Duration> getJobs() {
		return jobs;
	}

	public void setJobs(Map<String, Duration> jobs) {
		this.jobs = jobs;
	}

	public boolean isAutoStart() {
		return autoStart;
	}

	public void setAutoStart(boolean autoStart) {
		this.autoStart = autoStart;
	}

	public Map<String, DatasetConfig> getDatasets() {
		return datasets;
	}

	public void setDatasets(Map<String, DatasetConfig> datasets) {
		this.datasets = datasets;
	}

	public ResponseCache getResponseCache() {
		return responseCache;
	}

	public void setResponseCache(ResponseCache responseCache) {
		this.responseCache = responseCache;
	}

	public Snapshot getSnapshot() {
		return snapshot;
	}

	public void setSnapshot(Snapshot snapshot) {
		this.snapshot = snapshot;
	}

	public FunctionCache getFunctionCache() {
		return functionCache;
	}

	public void setFunctionCache(FunctionCache functionCache) {
		this.functionCache = functionCache;
	}

	/**
	 * {@link #getSlaOverrides()} keyed by frequency class.
	 *
	 * @throws IllegalArgumentException on an unknown frequency key
	 */
	public Map<FrequencyClass, Duration> slaOverridesByClass() {
		return byClass(slaOverrides);
	}

	/**
	 * {@link #getJobs()} keyed by frequency class.
	 *
	 * @throws IllegalArgumentException on an unknown frequency key
	 */
	public Map<FrequencyClass, Duration> jobsByClass() {
		return byClass(jobs);
	}

	private static Map<FrequencyClass, Duration> byClass(Map<String, Duration> source) {
		Map<FrequencyClass, Duration> result = new EnumMap<>(FrequencyClass.class);
		if (source != null) {
			source.forEach((key, value) -> result.put(FrequencyClass.fromKey(key), value));
		}
		return result;
	}

	/**
	 * Default fetch pacing.
	 */
	public static class RateLimit {
		/**
		 * Calls allowed per window, 0 = no window limit.
		 */
		private int maxCalls = 0;

		private long windowSeconds = 60;

		/**
		 * Minimum spacing between consecutive fetches.
		 */
		private long minDelayMillis = 500;

		/**
		 * Fetch attempts per dataset, 1 = no retry.
		 */
		private int maxAttempts = 3;

		/**
		 * Wait before the first retry, doubled on every further retry.
		 */
		private long retryBackoffMillis = 500;

		public int getMaxCalls() {
			return maxCalls;
		}

		public void setMaxCalls(int maxCalls) {
			this.maxCalls = maxCalls;
		}

		public long getWindowSeconds() {
			return windowSeconds;
		}

		public void setWindowSeconds(long windowSeconds) {
			this.windowSeconds = windowSeconds;
		}

		public long getMinDelayMillis() {
			return minDelayMillis;
		}

		public void setMinDelayMillis(long minDelayMillis) {
			this.minDelayMillis = minDelayMillis;
		}

		public int getMaxAttempts() {
			return maxAttempts;
		}

		public void setMaxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
		}

		public long getRetryBackoffMillis() {
			return retryBackoffMillis;
		}

		public void setRetryBackoffMillis(long retryBackoffMillis) {
			this.retryBackoffMillis = retryBackoffMillis;
		}
	}

	/**
	 * One dataset of the registry.
	 */
	public static class DatasetConfig {
		private String frequency;
		private String displayName;
		private Map<String, String> params = new LinkedHashMap<>();
		private boolean enabled = true;
		private boolean requiresCredential = false;

		/**
		 * Dataset-specific lookback in days (overrides lookback-days).
		 */
		private Integer lookbackDays;

		/**
		 * Dataset-specific calls per minute, gives the dataset its own limiter.
		 */
		private Integer callsPerMinute;

		private List<String> tags = new ArrayList<>();

		public String getFrequency() {
			return frequency;
		}

		public void setFrequency(String frequency) {
			this.frequency = frequency;
		}

		public String getDisplayName() {
			return displayName;
		}

		public void setDisplayName(String displayName) {
			this.displayName = displayName;
		}

		public Map<String, String> getParams() {
			return params;
		}

		public void setParams(Map<String, String> params) {
			this.params = params;
		}

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public boolean isRequiresCredential() {
			return requiresCredential;
		}

		public void setRequiresCredential(boolean requiresCredential) {
			this.requiresCredential = requiresCredential;
		}

		public Integer getLookbackDays() {
			return lookbackDays;
		}

		public void setLookbackDays(Integer lookbackDays) {
			this.lookbackDays = lookbackDays;
		}

		public Integer getCallsPerMinute() {
			return callsPerMinute;
		}

		public void setCallsPerMinute(Integer callsPerMinute) {
			this.callsPerMinute = callsPerMinute;
		}

		public List<String> getTags() {
			return tags;
		}

		public void setTags(List<String> tags) {
			this.tags = tags;
		}
	}

	/**
	 * Read-through response cache.
	 */
	public static class ResponseCache {
		private boolean enabled = true;

		/**
		 * memory | redis | none. A user-supplied SBCacheBackend bean always wins.
		 */
		private String backend = "memory";

		private long ttlSeconds = 3600;

		/**
		 * Path prefixes whose GET responses are cached.
		 */
		private List<String> cachePaths = new ArrayList<>(
			Arrays.asList("/v1/data", "/v1/features", "/v1/predictions", "/v1/signals"));

		private Redis redis = new Redis();

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public String getBackend() {
			return backend;
		}

		public void setBackend(String backend) {
			this.backend = backend;
		}

		public long getTtlSeconds() {
			return ttlSeconds;
		}

		public void setTtlSeconds(long ttlSeconds) {
			this.ttlSeconds = ttlSeconds;
		}

		public List<String> getCachePaths() {
			return cachePaths;
		}

		public void setCachePaths(List<String> cachePaths) {
			this.cachePaths = cachePaths;
		}

		public Redis getRedis() {
			return redis;
		}

		public void setRedis(Redis redis) {
			this.redis = redis;
		}
	}

	/**
	 * Redis connection for {@code response-cache.backend=redis}.
	 */
	public static class Redis {
		private String host = "localhost";
		private int port = 6379;

		public String getHost() {
			return host;
		}

		public void setHost(String host) {
			this.host = host;
		}

		public int getPort() {
			return port;
		}

		public void setPort(int port) {
			this.port = port;
		}
	}

	/**
	 * Combined view snapshots and their retention.
	 */
	public static class Snapshot {
		private boolean enabled = true;
		private String dir = "data/backups";

		/**
		 * Snapshots older than this are pruned daily. Negative keeps everything.
		 */
		private int retentionDays = 30;

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public String getDir() {
			return dir;
		}

		public void setDir(String dir) {
			this.dir = dir;
		}

		public int getRetentionDays() {
			return retentionDays;
		}

		public void setRetentionDays(int retentionDays) {
			this.retentionDays = retentionDays;
		}
	}

	/**
	 * CacheManager for {@code @Cacheable} methods, created when the application enables caching.
	 */
	public static class FunctionCache {
		private boolean enabled = true;

		private String keyPrefix = "api";

		private long ttlSeconds = 3600;

		/**
		 * Per cache name TTL overrides.
		 */
		private Map<String, Duration> ttls = new LinkedHashMap<>();

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public String getKeyPrefix() {
			return keyPrefix;
		}

		public void setKeyPrefix(String keyPrefix) {
			this.keyPrefix = keyPrefix;
		}

		public long getTtlSeconds() {
			return ttlSeconds;
		}

		public void setTtlSeconds(long ttlSeconds) {
			this.ttlSeconds = ttlSeconds;
		}

		public Map<String, Duration> getTtls() {
			return ttls;
		}

		public void setTtls(Map<String, Duration> ttls) {
			this.ttls = ttls;
		}
	}
}
