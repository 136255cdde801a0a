package org.scriptonbasestar.sync.core.exception;

/**
 * 동기화 계층 예외의 공통 부모. 어떤 {@link FailureMode}에 해당하는지 함께 전달한다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBSyncException extends RuntimeException {

	private final FailureMode failureMode;

	public SBSyncException(FailureMode failureMode, String message) {
		super(message);
		this.failureMode = failureMode;
	}

	public SBSyncException(FailureMode failureMode, String message, Throwable cause) {
		super(message, cause);
		this.failureMode = failureMode;
	}

	public FailureMode getFailureMode() {
		return failureMode;
	}
}
