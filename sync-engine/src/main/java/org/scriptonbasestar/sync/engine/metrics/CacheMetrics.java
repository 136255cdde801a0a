package org.scriptonbasestar.sync.engine.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 응답 캐시 통계. AtomicLong 기반이라 스레드 안전하고 오버헤드가 작다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class CacheMetrics {

	private final AtomicLong hitCount = new AtomicLong(0);
	private final AtomicLong missCount = new AtomicLong(0);
	private final AtomicLong loadSuccessCount = new AtomicLong(0);
	private final AtomicLong loadFailureCount = new AtomicLong(0);
	private final AtomicLong bypassCount = new AtomicLong(0);        // 백엔드 장애로 캐시를 우회한 횟수
	private final AtomicLong invalidationCount = new AtomicLong(0);  // 무효화로 삭제된 키 수
	private final AtomicLong totalLoadTime = new AtomicLong(0);  // 나노초

	public void recordHit() {
		hitCount.incrementAndGet();
	}

	public void recordMiss() {
		missCount.incrementAndGet();
	}

	/**
	 * producer 실행 성공을 기록합니다.
	 *
	 * @param loadTimeNanos 계산에 걸린 시간 (나노초)
	 */
	public void recordLoadSuccess(long loadTimeNanos) {
		loadSuccessCount.incrementAndGet();
		totalLoadTime.addAndGet(loadTimeNanos);
	}

	public void recordLoadFailure() {
		loadFailureCount.incrementAndGet();
	}

	public void recordBypass() {
		bypassCount.incrementAndGet();
	}

	public void recordInvalidation(long count) {
		invalidationCount.addAndGet(count);
	}

	public long hitCount() {
		return hitCount.get();
	}

	public long missCount() {
		return missCount.get();
	}

	public long requestCount() {
		return hitCount.get() + missCount.get();
	}

	/**
	 * @return 히트율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double hitRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) hitCount.get() / requests;
	}

	public long loadSuccessCount() {
		return loadSuccessCount.get();
	}

	public long loadFailureCount() {
		return loadFailureCount.get();
	}

	public long bypassCount() {
		return bypassCount.get();
	}

	public long totalLoadTimeNanos() {
		return totalLoadTime.get();
	}

	public long invalidationCount() {
		return invalidationCount.get();
	}

	/**
	 * @return 평균 계산 시간 (나노초), 계산이 없었으면 0.0
	 */
	public double averageLoadPenalty() {
		long loads = loadSuccessCount.get();
		return loads == 0 ? 0.0 : (double) totalLoadTime.get() / loads;
	}

	public void reset() {
		hitCount.set(0);
		missCount.set(0);
		loadSuccessCount.set(0);
		loadFailureCount.set(0);
		bypassCount.set(0);
		invalidationCount.set(0);
		totalLoadTime.set(0);
	}

	@Override
	public String toString() {
		return String.format(
			"CacheMetrics{requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, " +
			"loadSuccess=%d, loadFailure=%d, bypass=%d, invalidated=%d, avgLoadTime=%.2fμs}",
			requestCount(),
			hitCount(),
			missCount(),
			hitRate() * 100,
			loadSuccessCount(),
			loadFailureCount(),
			bypassCount(),
			invalidationCount(),
			averageLoadPenalty() / 1000
		);
	}
}
