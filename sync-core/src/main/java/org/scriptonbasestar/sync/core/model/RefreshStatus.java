package org.scriptonbasestar.sync.core.model;

import java.time.Instant;

/**
 * 작업 트리거 표면에서 조회하는 frequency class 상태
 *
 * @author archmagece
 * @since 2025-02
 */
public final class RefreshStatus {

	private final FrequencyClass frequencyClass;
	private final Instant lastRefresh;   // 저장된 엔트리의 refreshedAt
	private final Instant nextDue;       // lastRefresh + sla
	private final Instant lastRunAt;     // 마지막 작업 실행 시각 (skip 포함)
	private final RefreshReport lastOutcome;
	private final String lastError;      // 작업 자체가 예외로 끝난 경우

	public RefreshStatus(FrequencyClass frequencyClass, Instant lastRefresh, Instant nextDue,
						 Instant lastRunAt, RefreshReport lastOutcome, String lastError) {
		this.frequencyClass = frequencyClass;
		this.lastRefresh = lastRefresh;
		this.nextDue = nextDue;
		this.lastRunAt = lastRunAt;
		this.lastOutcome = lastOutcome;
		this.lastError = lastError;
	}

	public FrequencyClass getFrequencyClass() {
		return frequencyClass;
	}

	public Instant getLastRefresh() {
		return lastRefresh;
	}

	public Instant getNextDue() {
		return nextDue;
	}

	public Instant getLastRunAt() {
		return lastRunAt;
	}

	public RefreshReport getLastOutcome() {
		return lastOutcome;
	}

	public String getLastError() {
		return lastError;
	}

	public JobState getLastState() {
		return lastOutcome != null ? lastOutcome.getState() : null;
	}

	@Override
	public String toString() {
		return "RefreshStatus{" + frequencyClass.key() + ", lastRefresh=" + lastRefresh + ", nextDue=" + nextDue
			+ ", lastState=" + getLastState() + (lastError != null ? ", lastError=" + lastError : "") + "}";
	}
}
