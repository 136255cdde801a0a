package org.scriptonbasestar.sync.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.scriptonbasestar.sync.engine.TieredSyncService;
import org.scriptonbasestar.sync.engine.metrics.CacheMetrics;

/**
 * Prometheus 메트릭 간편 설정 헬퍼
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();
 * PrometheusMetricsHelper.bindService(service, registry);
 *
 * // Prometheus 포맷으로 메트릭 출력
 * String prometheusFormat = registry.scrape();
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class PrometheusMetricsHelper {

	public static final String RESPONSE_CACHE_NAME = "http";

	/**
	 * 기본 설정으로 Prometheus 레지스트리를 생성합니다.
	 *
	 * @return PrometheusMeterRegistry
	 */
	public static PrometheusMeterRegistry createPrometheusRegistry() {
		return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
	}

	public static PrometheusMeterRegistry createPrometheusRegistry(PrometheusConfig config) {
		return new PrometheusMeterRegistry(config);
	}

	/**
	 * 응답 캐시 메트릭을 MeterRegistry 에 바인딩합니다.
	 */
	public static MicrometerMetricsAdapter bindMetrics(
		CacheMetrics cacheMetrics,
		MeterRegistry meterRegistry,
		String cacheName
	) {
		return new MicrometerMetricsAdapter(cacheMetrics, meterRegistry, cacheName);
	}

	/**
	 * 서비스 하나의 갱신 메트릭과 응답 캐시 메트릭을 한번에 바인딩합니다.
	 *
	 * @return 갱신 메트릭 바인더 (이미 실행기에 리스너로 등록됨)
	 */
	public static SyncMetricsBinder bindService(TieredSyncService service, MeterRegistry meterRegistry) {
		bindMetrics(service.getResponseCache().metrics(), meterRegistry, RESPONSE_CACHE_NAME);
		return SyncMetricsBinder.bindTo(service.getExecutor(), meterRegistry);
	}

	/**
	 * Prometheus 스크래핑 포맷으로 메트릭을 출력합니다.
	 */
	public static String scrapeMetrics(PrometheusMeterRegistry registry) {
		return registry.scrape();
	}

	private PrometheusMetricsHelper() {
		// 유틸리티 클래스
	}
}
