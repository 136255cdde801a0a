package org.scriptonbasestar.sync.core.writer;

import org.scriptonbasestar.sync.core.model.CombinedView;

/**
 * 병합된 뷰를 받아가는 하류 소비자 (DB 적재 등)
 *
 * @author archmagece
 * @since 2025-02
 */
@FunctionalInterface
public interface SBCombinedViewSink {
	void accept(CombinedView view);
}
