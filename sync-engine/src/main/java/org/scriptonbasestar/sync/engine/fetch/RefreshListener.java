package org.scriptonbasestar.sync.engine.fetch;

import org.scriptonbasestar.sync.core.model.FrequencyCacheEntry;
import org.scriptonbasestar.sync.core.model.RefreshReport;

/**
 * 갱신 작업 이벤트 수신자. 리스너 예외는 작업 결과에 영향을 주지 않는다.
 *
 * @author archmagece
 * @since 2025-02
 */
public interface RefreshListener {

	/**
	 * 새 엔트리가 저장소에 기록된 직후
	 */
	default void onCommit(FrequencyCacheEntry entry) {
	}

	/**
	 * 모든 갱신 작업 종료 시 (skip 포함)
	 */
	default void onReport(RefreshReport report) {
	}
}
