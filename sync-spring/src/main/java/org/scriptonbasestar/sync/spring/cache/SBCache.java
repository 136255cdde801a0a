package org.scriptonbasestar.sync.spring.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.sync.core.store.SBCacheBackend;
import org.scriptonbasestar.sync.engine.metrics.CacheMetrics;
import org.scriptonbasestar.sync.engine.response.GlobPattern;
import org.springframework.cache.support.AbstractValueAdaptingCache;
import org.springframework.cache.support.NullValue;
import org.springframework.util.ClassUtils;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Spring Cache 인터페이스 구현체.
 * {@link SBCacheBackend}(Redis, in-memory) 위에서 {@code @Cacheable} 메서드 결과를 TTL 동안 memoize 합니다.
 * <p>
 * 키는 {@code <keyPrefix>:<cacheName>:<key>}, 값은 타입 이름과 함께 JSON 으로 저장된다.
 * 백엔드 장애는 캐시 미스로 취급한다 (fail open). 제네릭 컬렉션의 원소 타입은 보존되지 않으므로
 * 컬렉션을 돌려주는 메서드는 배열이나 전용 타입을 쓰는 편이 낫다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
public class SBCache extends AbstractValueAdaptingCache {

	private final String name;
	private final String keyPrefix;
	private final SBCacheBackend backend;
	private final ObjectMapper objectMapper;
	private final Duration ttl;
	private final CacheMetrics metrics = new CacheMetrics();

	public SBCache(String name, String keyPrefix, SBCacheBackend backend, ObjectMapper objectMapper,
				   Duration ttl, boolean allowNullValues) {
		super(allowNullValues);
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}
		if (backend == null) {
			throw new IllegalArgumentException("SBCacheBackend must not be null");
		}
		if (ttl == null || ttl.isZero() || ttl.isNegative()) {
			throw new IllegalArgumentException("ttl must be positive: " + ttl);
		}
		this.name = name;
		this.keyPrefix = keyPrefix;
		this.backend = backend;
		this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
		this.ttl = ttl;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public Object getNativeCache() {
		return backend;
	}

	@Override
	protected Object lookup(Object key) {
		String cacheKey = cacheKey(key);
		String raw;
		try {
			raw = backend.get(cacheKey);
		} catch (RuntimeException e) {
			metrics.recordBypass();
			log.warn("Cache backend unavailable, {} treated as miss: {}", cacheKey, e.getMessage());
			return null;
		}
		if (raw == null) {
			metrics.recordMiss();
			return null;
		}
		try {
			StoredValue stored = objectMapper.readValue(raw, StoredValue.class);
			Object value = stored.getType() == null
				? NullValue.INSTANCE
				: objectMapper.treeToValue(stored.getValue(), ClassUtils.forName(stored.getType(), null));
			metrics.recordHit();
			log.trace("Cache hit: {}", cacheKey);
			return value;
		} catch (JsonProcessingException | IllegalArgumentException | ClassNotFoundException | LinkageError e) {
			metrics.recordMiss();
			log.warn("Unreadable cache entry {}, treated as miss: {}", cacheKey, e.getMessage());
			return null;
		}
	}

	@Override
	@SuppressWarnings("unchecked")
	public synchronized <T> T get(Object key, Callable<T> valueLoader) {
		ValueWrapper cached = get(key);
		if (cached != null) {
			return (T) cached.get();
		}
		long start = System.nanoTime();
		T loaded;
		try {
			loaded = valueLoader.call();
		} catch (Exception e) {
			metrics.recordLoadFailure();
			throw new ValueRetrievalException(key, valueLoader, e);
		}
		metrics.recordLoadSuccess(System.nanoTime() - start);
		put(key, loaded);
		return loaded;
	}

	@Override
	public void put(Object key, Object value) {
		Object storeValue = toStoreValue(value);
		String cacheKey = cacheKey(key);
		try {
			StoredValue stored = storeValue == NullValue.INSTANCE
				? new StoredValue(null, null)
				: new StoredValue(storeValue.getClass().getName(), objectMapper.valueToTree(storeValue));
			backend.setWithTtl(cacheKey, objectMapper.writeValueAsString(stored), ttl);
		} catch (JsonProcessingException | IllegalArgumentException e) {
			log.warn("Value for {} is not serializable, not cached: {}", cacheKey, e.getMessage());
		} catch (RuntimeException e) {
			metrics.recordBypass();
			log.warn("Cache backend unavailable, {} not cached: {}", cacheKey, e.getMessage());
		}
	}

	@Override
	public void evict(Object key) {
		evictIfPresent(key);
	}

	@Override
	public boolean evictIfPresent(Object key) {
		try {
			boolean deleted = backend.delete(cacheKey(key));
			if (deleted) {
				metrics.recordInvalidation(1);
			}
			return deleted;
		} catch (RuntimeException e) {
			metrics.recordBypass();
			log.warn("Cache backend unavailable, could not evict {}: {}", cacheKey(key), e.getMessage());
			return false;
		}
	}

	@Override
	public void clear() {
		invalidate();
	}

	@Override
	public boolean invalidate() {
		String pattern = GlobPattern.escape(keyPrefix + ":" + name + ":") + "*";
		try {
			long deleted = backend.deleteByPattern(pattern);
			metrics.recordInvalidation(deleted);
			log.debug("Cleared {} entries of cache {}", deleted, name);
			return deleted > 0;
		} catch (RuntimeException e) {
			metrics.recordBypass();
			log.warn("Cache backend unavailable, could not clear {}: {}", name, e.getMessage());
			return false;
		}
	}

	String cacheKey(Object key) {
		return keyPrefix + ":" + name + ":" + key;
	}

	public Duration getTtl() {
		return ttl;
	}

	public CacheMetrics metrics() {
		return metrics;
	}

	/**
	 * 백엔드에 저장되는 형태. type 이 null 이면 null 값
	 */
	static class StoredValue {
		private String type;
		private JsonNode value;

		StoredValue() {
		}

		StoredValue(String type, JsonNode value) {
			this.type = type;
			this.value = value;
		}

		public String getType() {
			return type;
		}

		public void setType(String type) {
			this.type = type;
		}

		public JsonNode getValue() {
			return value;
		}

		public void setValue(JsonNode value) {
			this.value = value;
		}
	}
}
