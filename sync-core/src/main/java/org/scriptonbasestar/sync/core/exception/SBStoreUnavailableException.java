package org.scriptonbasestar.sync.core.exception;

/**
 * 영속 저장소 접근 실패. 복구 가능한 예외로 취급한다
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBStoreUnavailableException extends SBSyncException {

	public SBStoreUnavailableException(String message) {
		super(FailureMode.STORE_UNAVAILABLE, message);
	}

	public SBStoreUnavailableException(String message, Throwable cause) {
		super(FailureMode.STORE_UNAVAILABLE, message, cause);
	}

	public SBStoreUnavailableException(Throwable cause) {
		super(FailureMode.STORE_UNAVAILABLE, cause.getMessage(), cause);
	}
}
