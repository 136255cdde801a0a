package org.scriptonbasestar.sync.core.fetcher;

import org.scriptonbasestar.sync.core.exception.SBFetchFailException;
import org.scriptonbasestar.sync.core.model.TimeSeries;

import java.time.Instant;
import java.util.Map;

/**
 * 외부 데이터 소스 호출부. 구현체는 네트워크/파싱 오류를 {@link SBFetchFailException}으로 감싸서 던진다.
 *
 * <pre>{@code
 * SBDatasetFetcher fetcher = (id, params, since) -> fredClient.observations(id, since);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@FunctionalInterface
public interface SBDatasetFetcher {
	/**
	 * 데이터셋 하나를 가져옵니다.
	 *
	 * @param datasetId 데이터셋 id
	 * @param params descriptor의 fetch 파라미터 (불투명 값)
	 * @param since 시작 범위. 이 시각 이후의 관측치만 필요하다
	 * @return 시계열
	 * @throws SBFetchFailException 가져오기 실패 시
	 */
	TimeSeries fetch(String datasetId, Map<String, String> params, Instant since) throws SBFetchFailException;
}
