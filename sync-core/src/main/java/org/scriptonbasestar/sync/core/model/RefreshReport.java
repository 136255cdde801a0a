package org.scriptonbasestar.sync.core.model;

import org.scriptonbasestar.sync.core.exception.FailureMode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * frequency class 한 번의 갱신 결과 모음
 *
 * @author archmagece
 * @since 2025-02
 */
public final class RefreshReport {

	private final FrequencyClass frequencyClass;
	private final Instant startedAt;
	private final Instant finishedAt;
	private final List<RefreshOutcome> outcomes;
	private final boolean committed;
	private final Set<FailureMode> failures;

	public RefreshReport(FrequencyClass frequencyClass, Instant startedAt, Instant finishedAt,
						 List<RefreshOutcome> outcomes, boolean committed, Set<FailureMode> failures) {
		this.frequencyClass = Objects.requireNonNull(frequencyClass, "frequencyClass");
		this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
		this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt");
		this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
		this.committed = committed;
		EnumSet<FailureMode> modes = EnumSet.noneOf(FailureMode.class);
		if (failures != null) {
			modes.addAll(failures);
		}
		this.failures = Collections.unmodifiableSet(modes);
	}

	public FrequencyClass getFrequencyClass() {
		return frequencyClass;
	}

	public Instant getStartedAt() {
		return startedAt;
	}

	public Instant getFinishedAt() {
		return finishedAt;
	}

	public Duration elapsed() {
		return Duration.between(startedAt, finishedAt);
	}

	public List<RefreshOutcome> getOutcomes() {
		return outcomes;
	}

	/**
	 * 새 엔트리를 저장소에 기록하려 했는지 여부 (성공 fetch가 하나 이상)
	 */
	public boolean isCommitted() {
		return committed;
	}

	public Set<FailureMode> getFailures() {
		return failures;
	}

	public long count(OutcomeStatus status) {
		return outcomes.stream().filter(o -> o.getStatus() == status).count();
	}

	public RefreshOutcome outcomeOf(String datasetId) {
		for (RefreshOutcome outcome : outcomes) {
			if (outcome.getDatasetId().equals(datasetId)) {
				return outcome;
			}
		}
		return null;
	}

	public JobState getState() {
		long succeeded = count(OutcomeStatus.SUCCESS);
		long failed = count(OutcomeStatus.FAILED);
		long abandoned = count(OutcomeStatus.ABANDONED);

		if (succeeded == 0 && failed == 0 && abandoned == 0) {
			return JobState.SKIPPED;
		}
		if (succeeded == 0) {
			return JobState.ALL_FAILED;
		}
		if (failed > 0 || abandoned > 0) {
			return JobState.PARTIAL;
		}
		return JobState.SUCCESS;
	}

	@Override
	public String toString() {
		return "RefreshReport{" + frequencyClass.key()
			+ ", state=" + getState()
			+ ", success=" + count(OutcomeStatus.SUCCESS)
			+ ", fresh=" + count(OutcomeStatus.SKIPPED_FRESH)
			+ ", failed=" + count(OutcomeStatus.FAILED)
			+ ", abandoned=" + count(OutcomeStatus.ABANDONED)
			+ ", committed=" + committed
			+ ", elapsed=" + elapsed().toMillis() + "ms}";
	}
}
