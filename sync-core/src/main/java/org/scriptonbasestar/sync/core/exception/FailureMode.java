package org.scriptonbasestar.sync.core.exception;

/**
 * 동기화 과정에서 구분하는 실패 유형
 *
 * @author archmagece
 * @since 2025-02
 */
public enum FailureMode {
	/** 단일 데이터셋 fetch 실패. 배치는 계속 진행된다. */
	FETCH_FAILURE,
	/** 영속 저장소 읽기/쓰기 불가 */
	STORE_UNAVAILABLE,
	/** 응답 캐시 백엔드 불가. 캐시를 우회(fail open)한다. */
	CACHE_BACKEND_UNAVAILABLE,
	/** 배치 내 모든 fetch 실패. 기존 엔트리는 유지된다. */
	ALL_ITEMS_FAILED
}
