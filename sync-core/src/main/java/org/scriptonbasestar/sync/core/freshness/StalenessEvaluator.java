package org.scriptonbasestar.sync.core.freshness;

import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.sync.core.model.FrequencyClass;

import java.time.Duration;
import java.time.Instant;

/**
 * 갱신 필요 여부 판단기. 현재 시각은 항상 호출자가 넘긴다 (내부에서 시계를 읽지 않는다).
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
public class StalenessEvaluator {

	private final SlaPolicy slaPolicy;
	private final PublicationCalendar calendar;

	public StalenessEvaluator() {
		this(SlaPolicy.defaults(), new PublicationCalendar());
	}

	public StalenessEvaluator(SlaPolicy slaPolicy, PublicationCalendar calendar) {
		if (slaPolicy == null) {
			throw new IllegalArgumentException("SlaPolicy must not be null");
		}
		if (calendar == null) {
			throw new IllegalArgumentException("PublicationCalendar must not be null");
		}
		this.slaPolicy = slaPolicy;
		this.calendar = calendar;
	}

	/**
	 * 마지막 갱신 후 SLA 이상 지났으면 stale.
	 *
	 * @param frequencyClass 주기
	 * @param lastRefresh 마지막 갱신 시각, 한 번도 갱신하지 않았으면 null
	 * @param now 현재 시각
	 * @return null 이거나 {@code now - lastRefresh >= sla} 이면 true.
	 *         lastRefresh가 미래(시계 오차)면 fresh로 본다.
	 */
	public boolean isStale(FrequencyClass frequencyClass, Instant lastRefresh, Instant now) {
		if (lastRefresh == null) {
			log.trace("isStale {} - never refreshed", frequencyClass);
			return true;
		}
		Duration sla = slaPolicy.slaOf(frequencyClass);
		Duration age = Duration.between(lastRefresh, now);

		if (log.isTraceEnabled()) {
			log.trace("isStale param - frequency : {}, lastRefresh : {}, now : {}", frequencyClass, lastRefresh, now);
			log.trace("isStale 비교 - age : {}, sla : {}", age, sla);
		}

		if (age.isNegative()) {
			log.debug("lastRefresh {} is after now {} for {}, treating as fresh", lastRefresh, now, frequencyClass);
			return false;
		}
		return age.compareTo(sla) >= 0;
	}

	/**
	 * 발행 윈도우 안인지 확인합니다.
	 */
	public boolean canFetchNow(FrequencyClass frequencyClass, Instant now) {
		boolean publishable = calendar.isPublishable(frequencyClass, now);
		log.trace("canFetchNow {} at {} : {}", frequencyClass, now, publishable);
		return publishable;
	}

	/**
	 * @return lastRefresh + sla, 갱신 이력이 없으면 null
	 */
	public Instant nextDue(FrequencyClass frequencyClass, Instant lastRefresh) {
		return lastRefresh == null ? null : lastRefresh.plus(slaPolicy.slaOf(frequencyClass));
	}

	public Duration slaOf(FrequencyClass frequencyClass) {
		return slaPolicy.slaOf(frequencyClass);
	}

	public SlaPolicy getSlaPolicy() {
		return slaPolicy;
	}

	public PublicationCalendar getCalendar() {
		return calendar;
	}
}
