package org.scriptonbasestar.sync.engine.fetch;

import java.time.Duration;

/**
 * 페이싱용 대기. 테스트에서는 가짜 시계를 전진시키는 구현으로 바꿔 끼운다.
 *
 * @author archmagece
 * @since 2025-02
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper THREAD = duration -> Thread.sleep(duration.toMillis(), (int) (duration.toNanos() % 1_000_000));

	void sleep(Duration duration) throws InterruptedException;
}
