package org.scriptonbasestar.sync.core.model;

/**
 * 데이터셋 단위 갱신 결과
 *
 * @author archmagece
 * @since 2025-02
 */
public enum OutcomeStatus {
	SUCCESS,
	/** SLA 안쪽이라 fetch 하지 않음 */
	SKIPPED_FRESH,
	/** 발행 윈도우 밖이라 fetch 하지 않음 */
	SKIPPED_NOT_PUBLISHABLE,
	FAILED,
	/** 배치 타임아웃으로 시도하지 못함 */
	ABANDONED;

	public boolean isSkipped() {
		return this == SKIPPED_FRESH || this == SKIPPED_NOT_PUBLISHABLE;
	}
}
