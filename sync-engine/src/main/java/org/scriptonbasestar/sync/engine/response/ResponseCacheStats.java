package org.scriptonbasestar.sync.engine.response;

/**
 * 응답 캐시 통계 스냅샷
 *
 * @author archmagece
 * @since 2025-02
 */
public final class ResponseCacheStats {

	private final boolean enabled;
	private final boolean backendAvailable;
	private final long hitCount;
	private final long missCount;
	private final long bypassCount;
	private final long invalidationCount;
	private final double hitRate;

	public ResponseCacheStats(boolean enabled, boolean backendAvailable, long hitCount, long missCount,
							  long bypassCount, long invalidationCount, double hitRate) {
		this.enabled = enabled;
		this.backendAvailable = backendAvailable;
		this.hitCount = hitCount;
		this.missCount = missCount;
		this.bypassCount = bypassCount;
		this.invalidationCount = invalidationCount;
		this.hitRate = hitRate;
	}

	public boolean isEnabled() {
		return enabled;
	}

	public boolean isBackendAvailable() {
		return backendAvailable;
	}

	public long getHitCount() {
		return hitCount;
	}

	public long getMissCount() {
		return missCount;
	}

	public long getBypassCount() {
		return bypassCount;
	}

	public long getInvalidationCount() {
		return invalidationCount;
	}

	public double getHitRate() {
		return hitRate;
	}

	@Override
	public String toString() {
		return "ResponseCacheStats{enabled=" + enabled + ", backendAvailable=" + backendAvailable
			+ ", hits=" + hitCount + ", misses=" + missCount + ", bypass=" + bypassCount + "}";
	}
}
