package org.scriptonbasestar.sync.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 윈도우 당 최대 호출 수
 *
 * @author archmagece
 * @since 2025-02
 */
public final class RateLimit {

	private final int maxCalls;
	private final Duration window;

	public RateLimit(int maxCalls, Duration window) {
		if (maxCalls <= 0) {
			throw new IllegalArgumentException("maxCalls must be positive: " + maxCalls);
		}
		if (window == null || window.isZero() || window.isNegative()) {
			throw new IllegalArgumentException("window must be positive: " + window);
		}
		this.maxCalls = maxCalls;
		this.window = window;
	}

	public static RateLimit perMinute(int maxCalls) {
		return new RateLimit(maxCalls, Duration.ofMinutes(1));
	}

	public int getMaxCalls() {
		return maxCalls;
	}

	public Duration getWindow() {
		return window;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof RateLimit)) return false;
		RateLimit that = (RateLimit) o;
		return maxCalls == that.maxCalls && window.equals(that.window);
	}

	@Override
	public int hashCode() {
		return Objects.hash(maxCalls, window);
	}

	@Override
	public String toString() {
		return maxCalls + "/" + window;
	}
}
