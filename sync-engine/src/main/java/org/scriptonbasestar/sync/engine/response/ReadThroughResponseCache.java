package org.scriptonbasestar.sync.engine.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.sync.core.store.SBCacheBackend;
import org.scriptonbasestar.sync.engine.metrics.CacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 계산된 응답을 요청 형태(method + path + 정규화된 파라미터) 기준으로 TTL 동안 메모이즈한다.
 *
 * <pre>{@code
 * ReadThroughResponseCache cache = ReadThroughResponseCache.builder()
 *     .backend(new RedisCacheBackend(jedis))
 *     .ttl(Duration.ofHours(1))
 *     .build();
 *
 * CachedResponse<String> response = cache.getOrCompute(
 *     ResponseRequest.get("/v1/data/DGS10"), String.class, () -> service.render("DGS10"));
 * }</pre>
 *
 * 특징:
 * - GET/HEAD 이면서 허용된 path prefix 아래 요청만 캐시
 * - 백엔드가 없거나 장애면 캐시 없이 계산만 한다 (fail open)
 * - 동시에 같은 키를 놓치면 양쪽 모두 계산하고 저장할 수 있다 (마지막 저장이 남음)
 *
 * @author archmagece
 * @since 2025-02
 */
public class ReadThroughResponseCache {

	private static final Logger log = LoggerFactory.getLogger(ReadThroughResponseCache.class);

	public static final Duration DEFAULT_TTL = Duration.ofHours(1);
	public static final List<String> DEFAULT_CACHE_PATHS = Collections.unmodifiableList(
		Arrays.asList("/v1/data", "/v1/features", "/v1/predictions", "/v1/signals"));

	private final SBCacheBackend backend;  // null 이면 캐시 비활성 (항상 계산)
	private final ObjectMapper objectMapper;
	private final Duration ttl;
	private final List<String> cachePaths;
	private final Clock clock;
	private final CacheMetrics metrics;

	private ReadThroughResponseCache(Builder builder) {
		this.backend = builder.backend;
		this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
		this.ttl = builder.ttl;
		this.cachePaths = Collections.unmodifiableList(new ArrayList<>(builder.cachePaths));
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
		this.metrics = builder.metrics != null ? builder.metrics : new CacheMetrics();
		if (backend == null) {
			log.info("Response cache has no backend, responses will always be computed");
		} else {
			log.debug("ReadThroughResponseCache initialized - backend: {}, ttl: {}, paths: {}",
				backend.getClass().getSimpleName(), ttl, cachePaths);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isEnabled() {
		return backend != null;
	}

	/**
	 * GET/HEAD 이면서 허용 prefix 아래 path 인 경우만 캐시 대상
	 */
	public boolean isEligible(ResponseRequest request) {
		if (!"GET".equals(request.getMethod()) && !"HEAD".equals(request.getMethod())) {
			return false;
		}
		String path = request.getPath();
		for (String prefix : cachePaths) {
			if (path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/")) {
				return true;
			}
		}
		return false;
	}

	public <T> CachedResponse<T> getOrCompute(ResponseRequest request, Class<T> type, Supplier<T> producer) {
		return getOrCompute(request, type, producer, value -> true);
	}

	/**
	 * 캐시에 유효한 값이 있으면 돌려주고, 없으면 producer 를 한 번 실행해서 저장 후 돌려준다.
	 *
	 * @param request 요청 형태
	 * @param type 값 타입 (Jackson 으로 직렬화 가능해야 함)
	 * @param producer 값 계산기. 예외는 그대로 호출자에게 전파된다
	 * @param cacheable false 를 돌려주는 값은 저장하지 않는다 (예: 200 이 아닌 응답)
	 */
	public <T> CachedResponse<T> getOrCompute(ResponseRequest request, Class<T> type,
											  Supplier<T> producer, Predicate<T> cacheable) {
		if (!isEnabled() || !isEligible(request)) {
			return new CachedResponse<>(compute(producer), CachedResponse.Source.BYPASS);
		}

		String key = ResponseCacheKey.of(request);
		Lookup<T> cached = lookup(key, type);
		if (cached.found) {
			metrics.recordHit();
			log.trace("Response cache hit: {}", key);
			return new CachedResponse<>(cached.value, CachedResponse.Source.HIT);
		}
		if (cached.backendFailed) {
			return new CachedResponse<>(compute(producer), CachedResponse.Source.BYPASS);
		}

		metrics.recordMiss();
		log.trace("Response cache miss: {}", key);
		T value = compute(producer);
		if (value != null && cacheable.test(value)) {
			if (!store(key, value, ttl)) {
				return new CachedResponse<>(value, CachedResponse.Source.BYPASS);
			}
		}
		return new CachedResponse<>(value, CachedResponse.Source.MISS);
	}

	/**
	 * 유효한 캐시 값 조회. 만료, 손상, 백엔드 장애는 모두 null.
	 */
	public <T> T lookup(ResponseRequest request, Class<T> type) {
		if (!isEnabled()) {
			return null;
		}
		return lookup(ResponseCacheKey.of(request), type).value;
	}

	/**
	 * @return 저장 성공 여부. 백엔드가 없거나 장애면 false
	 */
	public <T> boolean store(ResponseRequest request, T value) {
		return isEnabled() && store(ResponseCacheKey.of(request), value, ttl);
	}

	/**
	 * glob 패턴에 맞는 응답 키를 삭제합니다.
	 *
	 * @return 삭제된 키 수, 백엔드가 없거나 장애면 0
	 */
	public long deleteByPattern(String pattern) {
		if (!isEnabled()) {
			return 0;
		}
		try {
			long deleted = backend.deleteByPattern(pattern);
			metrics.recordInvalidation(deleted);
			log.debug("Invalidated {} responses matching {}", deleted, pattern);
			return deleted;
		} catch (RuntimeException e) {
			metrics.recordBypass();
			log.warn("Response cache backend unavailable, could not invalidate {}: {}", pattern, e.getMessage());
			return 0;
		}
	}

	/**
	 * path prefix 아래 모든 응답을 무효화합니다.
	 */
	public long invalidatePath(String pathPrefix) {
		long deleted = 0;
		for (String pattern : ResponseCacheKey.patternsFor(pathPrefix)) {
			deleted += deleteByPattern(pattern);
		}
		return deleted;
	}

	public boolean invalidate(ResponseRequest request) {
		if (!isEnabled()) {
			return false;
		}
		try {
			boolean deleted = backend.delete(ResponseCacheKey.of(request));
			if (deleted) {
				metrics.recordInvalidation(1);
			}
			return deleted;
		} catch (RuntimeException e) {
			metrics.recordBypass();
			log.warn("Response cache backend unavailable, could not invalidate {}: {}", request, e.getMessage());
			return false;
		}
	}

	public ResponseCacheStats stats() {
		boolean available = isEnabled() && pingQuietly();
		return new ResponseCacheStats(isEnabled(), available, metrics.hitCount(), metrics.missCount(),
			metrics.bypassCount(), metrics.invalidationCount(), metrics.hitRate());
	}

	public CacheMetrics metrics() {
		return metrics;
	}

	public List<String> getCachePaths() {
		return cachePaths;
	}

	public Duration getTtl() {
		return ttl;
	}

	private <T> T compute(Supplier<T> producer) {
		long start = System.nanoTime();
		try {
			T value = producer.get();
			metrics.recordLoadSuccess(System.nanoTime() - start);
			return value;
		} catch (RuntimeException e) {
			metrics.recordLoadFailure();
			throw e;
		}
	}

	private <T> Lookup<T> lookup(String key, Class<T> type) {
		String raw;
		try {
			raw = backend.get(key);
		} catch (RuntimeException e) {
			metrics.recordBypass();
			log.warn("Response cache backend unavailable, computing without cache: {}", e.getMessage());
			return Lookup.failed();
		}
		if (raw == null) {
			return Lookup.absent();
		}
		try {
			ResponseCacheEnvelope envelope = objectMapper.readValue(raw, ResponseCacheEnvelope.class);
			if (envelope.isExpired(clock.millis())) {
				log.trace("Response cache entry expired: {}", key);
				return Lookup.absent();
			}
			return Lookup.of(objectMapper.treeToValue(envelope.getValue(), type));
		} catch (JsonProcessingException | IllegalArgumentException e) {
			log.warn("Unreadable response cache entry {}, recomputing: {}", key, e.getMessage());
			return Lookup.absent();
		}
	}

	private boolean store(String key, Object value, Duration entryTtl) {
		try {
			JsonNode node = objectMapper.valueToTree(value);
			String json = objectMapper.writeValueAsString(
				new ResponseCacheEnvelope(key, clock.millis(), entryTtl.toMillis(), node));
			backend.setWithTtl(key, json, entryTtl);
			log.trace("Response cached: {} (ttl {})", key, entryTtl);
			return true;
		} catch (JsonProcessingException e) {
			log.warn("Response for {} is not serializable, not cached: {}", key, e.getMessage());
			return false;
		} catch (RuntimeException e) {
			metrics.recordBypass();
			log.warn("Response cache backend unavailable, {} not cached: {}", key, e.getMessage());
			return false;
		}
	}

	private boolean pingQuietly() {
		try {
			return backend.ping();
		} catch (RuntimeException e) {
			log.debug("Response cache backend ping failed: {}", e.getMessage());
			return false;
		}
	}

	private static final class Lookup<T> {
		private final boolean found;
		private final boolean backendFailed;
		private final T value;

		private Lookup(boolean found, boolean backendFailed, T value) {
			this.found = found;
			this.backendFailed = backendFailed;
			this.value = value;
		}

		static <T> Lookup<T> of(T value) {
			return new Lookup<>(true, false, value);
		}

		static <T> Lookup<T> absent() {
			return new Lookup<>(false, false, null);
		}

		static <T> Lookup<T> failed() {
			return new Lookup<>(false, true, null);
		}
	}

	public static class Builder {
		private SBCacheBackend backend;
		private ObjectMapper objectMapper;
		private Duration ttl = DEFAULT_TTL;
		private List<String> cachePaths = DEFAULT_CACHE_PATHS;
		private Clock clock;
		private CacheMetrics metrics;

		public Builder backend(SBCacheBackend backend) {
			this.backend = backend;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder ttl(Duration ttl) {
			if (ttl == null || ttl.isZero() || ttl.isNegative()) {
				throw new IllegalArgumentException("ttl must be positive: " + ttl);
			}
			this.ttl = ttl;
			return this;
		}

		public Builder cachePaths(List<String> cachePaths) {
			if (cachePaths == null) {
				throw new IllegalArgumentException("cachePaths must not be null");
			}
			List<String> normalized = new ArrayList<>();
			for (String path : cachePaths) {
				normalized.add(ResponseRequest.normalizePath(path));
			}
			this.cachePaths = normalized;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder metrics(CacheMetrics metrics) {
			this.metrics = metrics;
			return this;
		}

		public ReadThroughResponseCache build() {
			return new ReadThroughResponseCache(this);
		}
	}
}
