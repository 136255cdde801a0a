package org.scriptonbasestar.sync.redis;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.sync.core.exception.FailureMode;
import org.scriptonbasestar.sync.core.exception.SBCacheBackendUnavailableException;
import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.engine.response.CachedResponse;
import org.scriptonbasestar.sync.engine.response.ReadThroughResponseCache;
import org.scriptonbasestar.sync.engine.response.ResponseRequest;
import org.scriptonbasestar.sync.store.file.FrequencyPartitionedStore;
import redis.clients.jedis.JedisPooled;

import static org.junit.Assert.*;

/**
 * 아무것도 listen 하지 않는 포트로 접속해서 장애 처리를 확인한다. Redis 서버 불필요.
 *
 * @author archmagece
 * @since 2025-02
 */
public class RedisUnavailableTest {

	private JedisPooled jedis;

	@Before
	public void setUp() {
		jedis = new JedisPooled("localhost", 1);
	}

	@After
	public void tearDown() {
		jedis.close();
	}

	@Test
	public void backendErrorsAreTranslated() {
		RedisCacheBackend backend = new RedisCacheBackend(jedis);
		try {
			backend.get("k");
			fail("expected exception");
		} catch (SBCacheBackendUnavailableException e) {
			assertEquals(FailureMode.CACHE_BACKEND_UNAVAILABLE, e.getFailureMode());
		}
		assertFalse(backend.ping());
	}

	@Test
	public void responseCacheFailsOpen() {
		ReadThroughResponseCache cache = ReadThroughResponseCache.builder()
			.backend(new RedisCacheBackend(jedis))
			.build();

		CachedResponse<String> response = cache.getOrCompute(ResponseRequest.get("/v1/data"), String.class, () -> "computed");

		assertEquals("computed", response.getValue());
		assertEquals(CachedResponse.Source.BYPASS, response.getSource());
		assertFalse(cache.stats().isBackendAvailable());
	}

	@Test
	public void keyValueStoreErrorsAreTranslated() {
		RedisKeyValueStore kv = new RedisKeyValueStore(jedis, "sb-sync:");
		try {
			kv.get("frequency-cache:daily");
			fail("expected exception");
		} catch (SBStoreUnavailableException e) {
			assertEquals(FailureMode.STORE_UNAVAILABLE, e.getFailureMode());
		}

		// 파티션 저장소는 읽기 장애를 "엔트리 없음"으로 본다
		assertNull(new FrequencyPartitionedStore(kv).get(FrequencyClass.DAILY));
	}
}
