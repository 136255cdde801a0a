/**
 * Micrometer 기반 동기화 메트릭 통합
 *
 * <h3>주요 클래스</h3>
 * <ul>
 *   <li>{@link org.scriptonbasestar.sync.metrics.micrometer.SyncMetricsBinder} - 갱신 결과, 엔트리 나이</li>
 *   <li>{@link org.scriptonbasestar.sync.metrics.micrometer.MicrometerMetricsAdapter} - 응답 캐시 히트/미스</li>
 *   <li>{@link org.scriptonbasestar.sync.metrics.micrometer.PrometheusMetricsHelper} - Prometheus 편의 클래스</li>
 * </ul>
 *
 * <h3>Prometheus 메트릭 예시</h3>
 * <pre>
 * sync_refresh_outcomes_total{frequency="daily",status="SUCCESS",} 12.0
 * sync_entry_age_seconds{frequency="monthly",} 86400.0
 * cache_hits_total{cache="http",} 15234.0
 * </pre>
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.sync.metrics.micrometer;
