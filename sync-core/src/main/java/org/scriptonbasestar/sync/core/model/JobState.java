package org.scriptonbasestar.sync.core.model;

/**
 * frequency class 단위 갱신 작업의 최종 상태
 *
 * @author archmagece
 * @since 2025-02
 */
public enum JobState {
	/** 시도한 모든 데이터셋 성공 (skip 포함) */
	SUCCESS,
	/** 일부 실패 또는 타임아웃. 성공분은 커밋됨 */
	PARTIAL,
	/** 발행 윈도우 밖이거나 전부 fresh 해서 아무것도 fetch 하지 않음 */
	SKIPPED,
	/** 시도한 fetch 전부 실패. 기존 엔트리 유지 */
	ALL_FAILED
}
