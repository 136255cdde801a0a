package org.scriptonbasestar.sync.core.freshness;

import org.scriptonbasestar.sync.core.model.FrequencyClass;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * 월간/분기 데이터의 발행 윈도우.
 * <ul>
 *   <li>MONTHLY: 매월 1일 ~ N일</li>
 *   <li>QUARTERLY: 분기 첫 달(1, 4, 7, 10월) 전체</li>
 *   <li>그 외: 항상 fetch 가능</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-02
 */
public final class PublicationCalendar {

	public static final int DEFAULT_WINDOW_DAYS = 5;

	private final int windowDays;
	private final ZoneId zone;

	public PublicationCalendar() {
		this(DEFAULT_WINDOW_DAYS, ZoneOffset.UTC);
	}

	public PublicationCalendar(int windowDays, ZoneId zone) {
		if (windowDays < 1 || windowDays > 31) {
			throw new IllegalArgumentException("windowDays must be between 1 and 31: " + windowDays);
		}
		if (zone == null) {
			throw new IllegalArgumentException("zone must not be null");
		}
		this.windowDays = windowDays;
		this.zone = zone;
	}

	public boolean isPublishable(FrequencyClass frequencyClass, Instant now) {
		ZonedDateTime local = now.atZone(zone);
		switch (frequencyClass) {
			case MONTHLY:
				return local.getDayOfMonth() <= windowDays;
			case QUARTERLY:
				return local.getMonthValue() % 3 == 1;
			default:
				return true;
		}
	}

	public int getWindowDays() {
		return windowDays;
	}

	public ZoneId getZone() {
		return zone;
	}
}
