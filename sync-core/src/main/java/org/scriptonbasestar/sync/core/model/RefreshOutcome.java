package org.scriptonbasestar.sync.core.model;

import org.scriptonbasestar.sync.core.exception.FailureMode;

import java.util.Objects;

/**
 * @author archmagece
 * @since 2025-02
 */
public final class RefreshOutcome {

	private final String datasetId;
	private final OutcomeStatus status;
	private final int items;
	private final String error;
	private final FailureMode failureMode;

	private RefreshOutcome(String datasetId, OutcomeStatus status, int items, String error, FailureMode failureMode) {
		this.datasetId = Objects.requireNonNull(datasetId, "datasetId");
		this.status = Objects.requireNonNull(status, "status");
		this.items = items;
		this.error = error;
		this.failureMode = failureMode;
	}

	public static RefreshOutcome success(String datasetId, int items) {
		return new RefreshOutcome(datasetId, OutcomeStatus.SUCCESS, items, null, null);
	}

	public static RefreshOutcome skipped(String datasetId, OutcomeStatus status) {
		if (!status.isSkipped()) {
			throw new IllegalArgumentException("Not a skip status: " + status);
		}
		return new RefreshOutcome(datasetId, status, 0, null, null);
	}

	public static RefreshOutcome failed(String datasetId, String error) {
		return new RefreshOutcome(datasetId, OutcomeStatus.FAILED, 0, error, FailureMode.FETCH_FAILURE);
	}

	public static RefreshOutcome abandoned(String datasetId) {
		return new RefreshOutcome(datasetId, OutcomeStatus.ABANDONED, 0, "refresh timeout exceeded", null);
	}

	public String getDatasetId() {
		return datasetId;
	}

	public OutcomeStatus getStatus() {
		return status;
	}

	/**
	 * fetch 된 포인트 수
	 */
	public int getItems() {
		return items;
	}

	public String getError() {
		return error;
	}

	public FailureMode getFailureMode() {
		return failureMode;
	}

	/**
	 * SUCCESS 또는 skip이면 true
	 */
	public boolean isSuccess() {
		return status == OutcomeStatus.SUCCESS || status.isSkipped();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof RefreshOutcome)) return false;
		RefreshOutcome that = (RefreshOutcome) o;
		return items == that.items && datasetId.equals(that.datasetId) && status == that.status
			&& Objects.equals(error, that.error) && failureMode == that.failureMode;
	}

	@Override
	public int hashCode() {
		return Objects.hash(datasetId, status, items, error, failureMode);
	}

	@Override
	public String toString() {
		return "RefreshOutcome{" + datasetId + ": " + status + (error != null ? ", error=" + error : "") + "}";
	}
}
