package org.scriptonbasestar.sync.engine.fetch;

import org.scriptonbasestar.sync.core.model.RateLimit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 슬라이딩 윈도우 + 최소 호출 간격 페이서.
 * 호출 전에 {@link #acquire()}를 부르면 허용될 때까지 대기한다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class RateLimiter {

	private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

	private final String name;
	private final RateLimit limit;      // null이면 윈도우 제한 없음
	private final Duration minDelay;    // 연속 호출 사이 최소 간격
	private final Clock clock;
	private final Sleeper sleeper;
	private final Deque<Instant> calls = new ArrayDeque<>();
	private Instant lastCall;

	public RateLimiter(String name, RateLimit limit, Duration minDelay, Clock clock, Sleeper sleeper) {
		if (clock == null) {
			throw new IllegalArgumentException("Clock must not be null");
		}
		if (sleeper == null) {
			throw new IllegalArgumentException("Sleeper must not be null");
		}
		this.name = name;
		this.limit = limit;
		this.minDelay = minDelay != null ? minDelay : Duration.ZERO;
		this.clock = clock;
		this.sleeper = sleeper;
	}

	/**
	 * 호출 허가를 받을 때까지 대기합니다.
	 *
	 * @return 총 대기 시간
	 * @throws InterruptedException 대기 중 인터럽트
	 */
	public synchronized Duration acquire() throws InterruptedException {
		Duration waited = Duration.ZERO;
		while (true) {
			Instant now = clock.instant();
			Duration wait = requiredWait(now);
			if (wait.isZero() || wait.isNegative()) {
				calls.addLast(now);
				lastCall = now;
				if (!waited.isZero()) {
					log.debug("[{}] paced for {} ms", name, waited.toMillis());
				}
				return waited;
			}
			log.trace("[{}] waiting {} ms", name, wait.toMillis());
			sleeper.sleep(wait);
			waited = waited.plus(wait);
		}
	}

	private Duration requiredWait(Instant now) {
		Duration wait = Duration.ZERO;
		if (lastCall != null && !minDelay.isZero()) {
			Duration sinceLast = Duration.between(lastCall, now);
			if (sinceLast.compareTo(minDelay) < 0) {
				wait = minDelay.minus(sinceLast);
			}
		}
		if (limit != null) {
			Instant windowStart = now.minus(limit.getWindow());
			while (!calls.isEmpty() && !calls.peekFirst().isAfter(windowStart)) {
				calls.pollFirst();
			}
			if (calls.size() >= limit.getMaxCalls()) {
				Duration untilSlot = Duration.between(now, calls.peekFirst().plus(limit.getWindow()));
				if (untilSlot.compareTo(wait) > 0) {
					wait = untilSlot;
				}
			}
		} else {
			calls.clear();
		}
		return wait;
	}

	public String getName() {
		return name;
	}

	public RateLimit getLimit() {
		return limit;
	}
}
