package org.scriptonbasestar.sync.spring.actuator;

import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.JobState;
import org.scriptonbasestar.sync.core.model.RefreshStatus;
import org.scriptonbasestar.sync.engine.TieredSyncService;
import org.scriptonbasestar.sync.engine.response.ResponseCacheStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring Boot Actuator HealthIndicator for the refresh jobs.
 * <p>
 * DOWN when the last run of any frequency class ended with every fetch failing.
 * A response cache whose backend is unreachable is reported in the details but does not
 * turn the status DOWN, requests are still served without it.
 * </p>
 *
 * <h3>Response Format:</h3>
 * <pre>{@code
 * {
 *   "status": "UP",
 *   "details": {
 *     "daily": {
 *       "lastRefresh": "2024-03-01T06:00:00Z",
 *       "nextDue": "2024-03-01T12:00:00Z",
 *       "lastState": "SUCCESS"
 *     },
 *     "responseCache": { "enabled": true, "backendAvailable": true, "hitRate": "85.00%" }
 *   }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class RefreshStatusHealthIndicator implements HealthIndicator {

	private final TieredSyncService service;

	public RefreshStatusHealthIndicator(TieredSyncService service) {
		if (service == null) {
			throw new IllegalArgumentException("service must not be null");
		}
		this.service = service;
	}

	@Override
	public Health health() {
		boolean healthy = true;
		Map<String, Object> details = new LinkedHashMap<>();

		for (Map.Entry<FrequencyClass, RefreshStatus> e : service.statuses().entrySet()) {
			RefreshStatus status = e.getValue();
			if (status.getLastRefresh() == null && status.getLastRunAt() == null) {
				continue;
			}
			Map<String, Object> one = new LinkedHashMap<>();
			one.put("lastRefresh", status.getLastRefresh());
			one.put("nextDue", status.getNextDue());
			one.put("lastRunAt", status.getLastRunAt());
			one.put("lastState", status.getLastState());
			if (status.getLastError() != null) {
				one.put("lastError", status.getLastError());
			}
			if (status.getLastState() == JobState.ALL_FAILED) {
				healthy = false;
			}
			details.put(e.getKey().key(), one);
		}

		ResponseCacheStats stats = service.cacheStats();
		Map<String, Object> cache = new LinkedHashMap<>();
		cache.put("enabled", stats.isEnabled());
		cache.put("backendAvailable", stats.isBackendAvailable());
		cache.put("hitRate", String.format("%.2f%%", stats.getHitRate() * 100));
		details.put("responseCache", cache);

		return (healthy ? Health.up() : Health.down()).withDetails(details).build();
	}
}
