package org.scriptonbasestar.sync.core.model;

import java.time.Duration;
import java.util.Locale;

/**
 * 데이터셋의 자연 발행 주기 버킷. 선언 순서는 빠른 주기에서 느린 주기 순이다.
 *
 * @author archmagece
 * @since 2025-02
 */
public enum FrequencyClass {
	REALTIME(Duration.ofMinutes(1)),
	INTRADAY(Duration.ofHours(1)),
	DAILY(Duration.ofHours(6)),
	WEEKLY(Duration.ofDays(1)),
	MONTHLY(Duration.ofDays(7)),
	QUARTERLY(Duration.ofDays(30)),
	ANNUAL(Duration.ofDays(90));

	private final Duration defaultSla;

	FrequencyClass(Duration defaultSla) {
		this.defaultSla = defaultSla;
	}

	/**
	 * 갱신 후 이 시간이 지나면 stale로 판단한다.
	 */
	public Duration defaultSla() {
		return defaultSla;
	}

	/**
	 * 저장소 키, 설정값 등에 쓰이는 소문자 이름
	 */
	public String key() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * "daily", "DAILY" 등 대소문자 무관 파싱
	 *
	 * @throws IllegalArgumentException 알 수 없는 이름
	 */
	public static FrequencyClass fromKey(String key) {
		if (key == null || key.isBlank()) {
			throw new IllegalArgumentException("Frequency class must not be empty");
		}
		return FrequencyClass.valueOf(key.trim().toUpperCase(Locale.ROOT));
	}
}
