package org.scriptonbasestar.sync.core.exception;

/**
 * 데이터셋 fetch 실패
 *
 * retryable 이 false 인 실패(잘못된 series id, 인증 실패 등)는 실행기가 재시도하지 않는다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBFetchFailException extends SBSyncException {

	private final boolean retryable;

	public SBFetchFailException(String message) {
		this(message, true);
	}

	public SBFetchFailException(String message, boolean retryable) {
		super(FailureMode.FETCH_FAILURE, message);
		this.retryable = retryable;
	}

	public SBFetchFailException(String message, Throwable cause) {
		super(FailureMode.FETCH_FAILURE, message, cause);
		this.retryable = true;
	}

	public SBFetchFailException(Throwable cause) {
		super(FailureMode.FETCH_FAILURE, cause.getMessage(), cause);
		this.retryable = true;
	}

	public boolean isRetryable() {
		return retryable;
	}
}
