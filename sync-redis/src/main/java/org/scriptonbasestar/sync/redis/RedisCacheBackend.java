package org.scriptonbasestar.sync.redis;

import org.scriptonbasestar.sync.core.exception.SBCacheBackendUnavailableException;
import org.scriptonbasestar.sync.core.store.SBCacheBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Duration;
import java.util.List;

/**
 * Redis 를 응답 캐시 백엔드로 사용합니다.
 *
 * 사용 예시:
 * <pre>
 * JedisPooled jedis = new JedisPooled("localhost", 6379);
 * ReadThroughResponseCache cache = ReadThroughResponseCache.builder()
 *     .backend(new RedisCacheBackend(jedis))
 *     .build();
 * </pre>
 *
 * 패턴 삭제는 KEYS 대신 SCAN 으로 나눠서 지운다.
 * Redis 오류는 모두 {@link SBCacheBackendUnavailableException}으로 바뀌어 던져진다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class RedisCacheBackend implements SBCacheBackend, AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(RedisCacheBackend.class);

	private static final int SCAN_COUNT = 500;

	private final JedisPooled jedis;
	private final boolean autoClose;

	/**
	 * Redis 백엔드 생성 (자동 close 비활성화)
	 *
	 * @param jedis Jedis 연결 인스턴스
	 */
	public RedisCacheBackend(JedisPooled jedis) {
		this(jedis, false);
	}

	/**
	 * @param jedis Jedis 연결 인스턴스
	 * @param autoClose close() 호출 시 Jedis 인스턴스도 함께 종료할지 여부
	 */
	public RedisCacheBackend(JedisPooled jedis, boolean autoClose) {
		if (jedis == null) {
			throw new IllegalArgumentException("JedisPooled must not be null");
		}
		this.jedis = jedis;
		this.autoClose = autoClose;
		log.debug("RedisCacheBackend initialized (autoClose: {})", autoClose);
	}

	@Override
	public String get(String key) {
		try {
			return jedis.get(key);
		} catch (JedisException e) {
			throw new SBCacheBackendUnavailableException("Redis GET failed: " + key, e);
		}
	}

	@Override
	public void setWithTtl(String key, String value, Duration ttl) {
		try {
			if (ttl == null || ttl.isZero() || ttl.isNegative()) {
				jedis.set(key, value);
			} else {
				// 초 단위 미만은 올림
				long seconds = Math.max(1, (ttl.toMillis() + 999) / 1000);
				jedis.setex(key, seconds, value);
			}
			log.trace("Stored in Redis: {} (ttl {})", key, ttl);
		} catch (JedisException e) {
			throw new SBCacheBackendUnavailableException("Redis SETEX failed: " + key, e);
		}
	}

	@Override
	public boolean delete(String key) {
		try {
			return jedis.del(key) > 0;
		} catch (JedisException e) {
			throw new SBCacheBackendUnavailableException("Redis DEL failed: " + key, e);
		}
	}

	@Override
	public long deleteByPattern(String pattern) {
		ScanParams params = new ScanParams().match(pattern).count(SCAN_COUNT);
		String cursor = ScanParams.SCAN_POINTER_START;
		long deleted = 0;
		try {
			do {
				ScanResult<String> page = jedis.scan(cursor, params);
				List<String> keys = page.getResult();
				if (!keys.isEmpty()) {
					deleted += jedis.del(keys.toArray(new String[0]));
				}
				cursor = page.getCursor();
			} while (!ScanParams.SCAN_POINTER_START.equals(cursor));
		} catch (JedisException e) {
			throw new SBCacheBackendUnavailableException("Redis SCAN/DEL failed for pattern " + pattern, e);
		}
		log.debug("Deleted {} Redis keys matching {}", deleted, pattern);
		return deleted;
	}

	@Override
	public boolean ping() {
		try {
			return "PONG".equalsIgnoreCase(jedis.ping());
		} catch (JedisException e) {
			log.debug("Redis ping failed: {}", e.getMessage());
			return false;
		}
	}

	@Override
	public void close() {
		if (autoClose && jedis != null) {
			log.debug("Closing Jedis connection");
			jedis.close();
		}
	}
}
