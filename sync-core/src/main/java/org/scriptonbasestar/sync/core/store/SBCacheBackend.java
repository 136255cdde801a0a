package org.scriptonbasestar.sync.core.store;

import org.scriptonbasestar.sync.core.exception.SBCacheBackendUnavailableException;

import java.time.Duration;

/**
 * 응답 캐시용 TTL key-value 백엔드 (Redis, in-memory 등).
 * 모든 메서드는 백엔드 장애 시 {@link SBCacheBackendUnavailableException}을 던진다.
 *
 * @author archmagece
 * @since 2025-02
 */
public interface SBCacheBackend {

	String get(String key);

	void setWithTtl(String key, String value, Duration ttl);

	boolean delete(String key);

	/**
	 * glob 패턴 ({@code *}, {@code ?})에 맞는 키를 모두 삭제합니다.
	 *
	 * @return 삭제된 키 수
	 */
	long deleteByPattern(String pattern);

	/**
	 * @return 백엔드 응답 가능 여부. 예외를 던지지 않는다.
	 */
	boolean ping();
}
