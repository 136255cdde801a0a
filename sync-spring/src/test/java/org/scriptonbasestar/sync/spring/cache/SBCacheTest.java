package org.scriptonbasestar.sync.spring.cache;

import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.sync.core.exception.SBCacheBackendUnavailableException;
import org.scriptonbasestar.sync.core.store.SBCacheBackend;
import org.scriptonbasestar.sync.core.support.ManualClock;
import org.scriptonbasestar.sync.engine.response.InMemoryCacheBackend;
import org.springframework.cache.Cache;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * SBCache 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBCacheTest {

	private ManualClock clock;
	private InMemoryCacheBackend backend;
	private SBCache cache;

	@Before
	public void setUp() {
		clock = ManualClock.at("2024-03-01T00:00:00Z");
		backend = new InMemoryCacheBackend(clock);
		cache = new SBCache("fred-series", "api", backend, null, Duration.ofMinutes(5), true);
	}

	@Test
	public void testPutThenGetKeepsType() {
		cache.put("DGS10", new SeriesSummary("DGS10", 4.2));

		SeriesSummary summary = cache.get("DGS10", SeriesSummary.class);

		assertEquals("DGS10", summary.getId());
		assertEquals(4.2, summary.getLast(), 0.0);
		assertNotNull(backend.get("api:fred-series:DGS10"));
		assertEquals(1, cache.metrics().hitCount());
	}

	@Test
	public void testEntryExpiresAfterTtl() {
		cache.put("DGS10", new SeriesSummary("DGS10", 4.2));

		clock.advance(Duration.ofMinutes(5).plusSeconds(1));

		assertNull(cache.get("DGS10"));
	}

	@Test
	public void testValueLoaderCalledOncePerKey() {
		AtomicInteger loads = new AtomicInteger();

		Integer first = cache.get("k", () -> loads.incrementAndGet() * 10);
		Integer second = cache.get("k", () -> loads.incrementAndGet() * 10);

		assertEquals(Integer.valueOf(10), first);
		assertEquals(Integer.valueOf(10), second);
		assertEquals(1, loads.get());
		assertEquals(1, cache.metrics().loadSuccessCount());
	}

	@Test
	public void testNullValueIsCached() {
		cache.put("missing", null);

		Cache.ValueWrapper wrapper = cache.get("missing");

		assertNotNull(wrapper);
		assertNull(wrapper.get());
	}

	@Test(expected = Cache.ValueRetrievalException.class)
	public void testLoaderFailureWrapped() {
		cache.get("k", () -> {
			throw new IllegalStateException("boom");
		});
	}

	@Test
	public void testEvictAndClearOnlyTouchOwnKeys() {
		SBCache other = new SBCache("fred-series-2", "api", backend, null, Duration.ofMinutes(5), true);
		cache.put("a", "1");
		cache.put("b", "2");
		other.put("a", "3");

		assertTrue(cache.evictIfPresent("a"));
		assertNull(cache.get("a"));

		cache.clear();
		assertNull(cache.get("b"));
		assertEquals("3", other.get("a", String.class));
	}

	@Test
	public void testBackendFailureFailsOpen() {
		SBCache broken = new SBCache("fred-series", "api", new BrokenBackend(), null, Duration.ofMinutes(5), true);
		AtomicInteger loads = new AtomicInteger();

		assertEquals("v", broken.get("k", () -> {
			loads.incrementAndGet();
			return "v";
		}));
		assertEquals("v", broken.get("k", () -> {
			loads.incrementAndGet();
			return "v";
		}));

		assertEquals(2, loads.get());
		assertFalse(broken.evictIfPresent("k"));
		assertFalse(broken.invalidate());
		assertTrue(broken.metrics().bypassCount() > 0);
	}

	@Test
	public void testUnreadableEntryTreatedAsMiss() {
		backend.setWithTtl("api:fred-series:k", "not json", Duration.ofMinutes(1));

		assertNull(cache.get("k"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveTtlRejected() {
		new SBCache("c", "api", backend, null, Duration.ZERO, true);
	}

	public static class SeriesSummary {
		private String id;
		private double last;

		public SeriesSummary() {
		}

		public SeriesSummary(String id, double last) {
			this.id = id;
			this.last = last;
		}

		public String getId() {
			return id;
		}

		public void setId(String id) {
			this.id = id;
		}

		public double getLast() {
			return last;
		}

		public void setLast(double last) {
			this.last = last;
		}
	}

	private static class BrokenBackend implements SBCacheBackend {
		@Override
		public String get(String key) {
			throw new SBCacheBackendUnavailableException("down");
		}

		@Override
		public void setWithTtl(String key, String value, Duration ttl) {
			throw new SBCacheBackendUnavailableException("down");
		}

		@Override
		public boolean delete(String key) {
			throw new SBCacheBackendUnavailableException("down");
		}

		@Override
		public long deleteByPattern(String pattern) {
			throw new SBCacheBackendUnavailableException("down");
		}

		@Override
		public boolean ping() {
			return false;
		}
	}
}
