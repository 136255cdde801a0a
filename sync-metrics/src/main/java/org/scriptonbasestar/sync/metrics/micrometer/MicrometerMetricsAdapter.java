package org.scriptonbasestar.sync.metrics.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.FunctionTimer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.scriptonbasestar.sync.engine.metrics.CacheMetrics;

import java.util.concurrent.TimeUnit;

/**
 * 응답 캐시의 CacheMetrics 를 Micrometer 메터로 노출하는 어댑터
 *
 * CacheMetrics 는 캐시가 직접 갱신하고, 여기서 등록한 메터는 스크랩 시점에 값을 읽어간다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * ReadThroughResponseCache cache = ReadThroughResponseCache.builder().backend(backend).build();
 *
 * new MicrometerMetricsAdapter(cache.metrics(), registry, "http");
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class MicrometerMetricsAdapter {

	private final CacheMetrics cacheMetrics;
	private final String cacheName;

	/**
	 * Micrometer 어댑터 생성
	 *
	 * @param cacheMetrics 캐시 메트릭
	 * @param meterRegistry Micrometer 레지스트리
	 * @param cacheName 캐시 이름 (태그로 사용)
	 */
	public MicrometerMetricsAdapter(
		CacheMetrics cacheMetrics,
		MeterRegistry meterRegistry,
		String cacheName
	) {
		if (cacheMetrics == null) {
			throw new IllegalArgumentException("CacheMetrics must not be null");
		}
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}

		this.cacheMetrics = cacheMetrics;
		this.cacheName = cacheName;

		FunctionCounter.builder("cache.hits", cacheMetrics, CacheMetrics::hitCount)
			.tag("cache", cacheName)
			.description("Response cache hit count")
			.register(meterRegistry);

		FunctionCounter.builder("cache.misses", cacheMetrics, CacheMetrics::missCount)
			.tag("cache", cacheName)
			.description("Response cache miss count")
			.register(meterRegistry);

		FunctionCounter.builder("cache.loads", cacheMetrics, CacheMetrics::loadSuccessCount)
			.tag("cache", cacheName)
			.tag("result", "success")
			.description("Response computation success count")
			.register(meterRegistry);

		FunctionCounter.builder("cache.loads", cacheMetrics, CacheMetrics::loadFailureCount)
			.tag("cache", cacheName)
			.tag("result", "failure")
			.description("Response computation failure count")
			.register(meterRegistry);

		// 백엔드 장애로 캐시 없이 처리한 횟수
		FunctionCounter.builder("cache.bypasses", cacheMetrics, CacheMetrics::bypassCount)
			.tag("cache", cacheName)
			.description("Requests served without the cache because the backend failed")
			.register(meterRegistry);

		FunctionCounter.builder("cache.invalidations", cacheMetrics, CacheMetrics::invalidationCount)
			.tag("cache", cacheName)
			.description("Cached responses removed by invalidation")
			.register(meterRegistry);

		FunctionTimer.builder("cache.load.duration", cacheMetrics,
				CacheMetrics::loadSuccessCount, CacheMetrics::totalLoadTimeNanos, TimeUnit.NANOSECONDS)
			.tag("cache", cacheName)
			.description("Response computation time")
			.register(meterRegistry);

		// Gauge 등록 (실시간 값)
		Gauge.builder("cache.hit.rate", cacheMetrics, CacheMetrics::hitRate)
			.tag("cache", cacheName)
			.register(meterRegistry);
	}

	/**
	 * 캐시 이름을 반환합니다.
	 *
	 * @return 캐시 이름
	 */
	public String getCacheName() {
		return cacheName;
	}

	public CacheMetrics getCacheMetrics() {
		return cacheMetrics;
	}
}
