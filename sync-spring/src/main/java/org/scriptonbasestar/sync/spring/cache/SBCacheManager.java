package org.scriptonbasestar.sync.spring.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.sync.core.store.SBCacheBackend;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spring CacheManager 구현체.
 * 모든 캐시가 하나의 {@link SBCacheBackend} 를 공유하고, 처음 요청된 이름의 캐시는 기본 TTL 로 만들어진다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * @Configuration
 * @EnableCaching
 * public class CacheConfig {
 *     @Bean
 *     public CacheManager cacheManager(SBCacheBackend backend) {
 *         return new SBCacheManager(backend, Duration.ofHours(1))
 *             .ttl("fred-series", Duration.ofMinutes(5));
 *     }
 * }
 *
 * @Cacheable(cacheNames = "fred-series", key = "#seriesId")
 * public SeriesSummary summary(String seriesId) { ... }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBCacheManager implements CacheManager {

	public static final String DEFAULT_KEY_PREFIX = "api";

	private final SBCacheBackend backend;
	private final Duration defaultTtl;
	private final Map<String, Cache> caches = new ConcurrentHashMap<>();
	private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
	private ObjectMapper objectMapper = new ObjectMapper();
	private String keyPrefix = DEFAULT_KEY_PREFIX;
	private boolean allowNullValues = true;

	public SBCacheManager(SBCacheBackend backend, Duration defaultTtl) {
		if (backend == null) {
			throw new IllegalArgumentException("SBCacheBackend must not be null");
		}
		if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
			throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
		}
		this.backend = backend;
		this.defaultTtl = defaultTtl;
	}

	/**
	 * 특정 캐시의 TTL 을 지정합니다. 이미 만들어진 캐시에는 적용되지 않는다.
	 *
	 * @return this (fluent API)
	 */
	public SBCacheManager ttl(String name, Duration ttl) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}
		if (ttl == null || ttl.isZero() || ttl.isNegative()) {
			throw new IllegalArgumentException("ttl must be positive: " + ttl);
		}
		ttls.put(name, ttl);
		return this;
	}

	public SBCacheManager keyPrefix(String keyPrefix) {
		if (keyPrefix == null || keyPrefix.isEmpty()) {
			throw new IllegalArgumentException("keyPrefix must not be empty");
		}
		this.keyPrefix = keyPrefix;
		return this;
	}

	public SBCacheManager objectMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
		return this;
	}

	public SBCacheManager allowNullValues(boolean allowNullValues) {
		this.allowNullValues = allowNullValues;
		return this;
	}

	@Override
	public Cache getCache(String name) {
		return caches.computeIfAbsent(name, n ->
			new SBCache(n, keyPrefix, backend, objectMapper, ttls.getOrDefault(n, defaultTtl), allowNullValues));
	}

	@Override
	public Collection<String> getCacheNames() {
		return Collections.unmodifiableSet(caches.keySet());
	}

	public boolean isAllowNullValues() {
		return allowNullValues;
	}
}
