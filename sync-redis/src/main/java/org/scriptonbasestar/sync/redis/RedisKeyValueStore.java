package org.scriptonbasestar.sync.redis;

import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;
import org.scriptonbasestar.sync.core.store.SBKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.nio.charset.StandardCharsets;

/**
 * frequency 엔트리를 Redis 에 바이너리로 저장하는 key-value 저장소.
 * 여러 프로세스가 같은 엔트리를 공유해야 할 때 파일 저장소 대신 쓴다.
 *
 * <pre>
 * FrequencyPartitionedStore store = new FrequencyPartitionedStore(
 *     new RedisKeyValueStore(jedis, "sb-sync:"));
 * </pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class RedisKeyValueStore implements SBKeyValueStore, AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

	private final JedisPooled jedis;
	private final String keyPrefix;
	private final boolean autoClose;

	public RedisKeyValueStore(JedisPooled jedis, String keyPrefix) {
		this(jedis, keyPrefix, false);
	}

	/**
	 * @param jedis Jedis 연결 인스턴스
	 * @param keyPrefix Redis 키 접두사 (예: "sb-sync:")
	 * @param autoClose close() 호출 시 Jedis 인스턴스도 함께 종료할지 여부
	 */
	public RedisKeyValueStore(JedisPooled jedis, String keyPrefix, boolean autoClose) {
		if (jedis == null) {
			throw new IllegalArgumentException("JedisPooled must not be null");
		}
		this.jedis = jedis;
		this.keyPrefix = keyPrefix != null ? keyPrefix : "";
		this.autoClose = autoClose;
		log.debug("RedisKeyValueStore initialized with prefix: {}", this.keyPrefix);
	}

	@Override
	public byte[] get(String key) {
		try {
			return jedis.get(redisKey(key));
		} catch (JedisException e) {
			throw new SBStoreUnavailableException("Redis GET failed: " + key, e);
		}
	}

	@Override
	public void put(String key, byte[] value) {
		try {
			jedis.set(redisKey(key), value);
			log.trace("Saved to Redis: {}{} ({} bytes)", keyPrefix, key, value.length);
		} catch (JedisException e) {
			throw new SBStoreUnavailableException("Redis SET failed: " + key, e);
		}
	}

	@Override
	public boolean delete(String key) {
		try {
			return jedis.del(redisKey(key)) > 0;
		} catch (JedisException e) {
			throw new SBStoreUnavailableException("Redis DEL failed: " + key, e);
		}
	}

	public String getKeyPrefix() {
		return keyPrefix;
	}

	private byte[] redisKey(String key) {
		return (keyPrefix + key).getBytes(StandardCharsets.UTF_8);
	}

	@Override
	public void close() {
		if (autoClose && jedis != null) {
			log.debug("Closing Jedis connection");
			jedis.close();
		}
	}
}
