package org.scriptonbasestar.sync.core.exception;

/**
 * 응답 캐시 백엔드 접근 실패
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBCacheBackendUnavailableException extends SBSyncException {

	public SBCacheBackendUnavailableException(String message) {
		super(FailureMode.CACHE_BACKEND_UNAVAILABLE, message);
	}

	public SBCacheBackendUnavailableException(String message, Throwable cause) {
		super(FailureMode.CACHE_BACKEND_UNAVAILABLE, message, cause);
	}

	public SBCacheBackendUnavailableException(Throwable cause) {
		super(FailureMode.CACHE_BACKEND_UNAVAILABLE, cause.getMessage(), cause);
	}
}
