package org.scriptonbasestar.sync.engine.metrics;

import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.JobState;
import org.scriptonbasestar.sync.core.model.OutcomeStatus;
import org.scriptonbasestar.sync.core.model.RefreshOutcome;
import org.scriptonbasestar.sync.core.model.RefreshReport;
import org.scriptonbasestar.sync.engine.fetch.RefreshListener;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * frequency class 별 갱신 결과 카운터. 실행기에 리스너로 등록해서 쓴다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class RefreshMetrics implements RefreshListener {

	private final Map<FrequencyClass, Map<OutcomeStatus, AtomicLong>> outcomes = new EnumMap<>(FrequencyClass.class);
	private final Map<FrequencyClass, Map<JobState, AtomicLong>> jobs = new EnumMap<>(FrequencyClass.class);

	public RefreshMetrics() {
		for (FrequencyClass fc : FrequencyClass.values()) {
			Map<OutcomeStatus, AtomicLong> perStatus = new EnumMap<>(OutcomeStatus.class);
			for (OutcomeStatus status : OutcomeStatus.values()) {
				perStatus.put(status, new AtomicLong());
			}
			outcomes.put(fc, perStatus);

			Map<JobState, AtomicLong> perState = new EnumMap<>(JobState.class);
			for (JobState state : JobState.values()) {
				perState.put(state, new AtomicLong());
			}
			jobs.put(fc, perState);
		}
	}

	@Override
	public void onReport(RefreshReport report) {
		Map<OutcomeStatus, AtomicLong> perStatus = outcomes.get(report.getFrequencyClass());
		for (RefreshOutcome outcome : report.getOutcomes()) {
			perStatus.get(outcome.getStatus()).incrementAndGet();
		}
		jobs.get(report.getFrequencyClass()).get(report.getState()).incrementAndGet();
	}

	public long outcomeCount(FrequencyClass frequencyClass, OutcomeStatus status) {
		return outcomes.get(frequencyClass).get(status).get();
	}

	public long jobCount(FrequencyClass frequencyClass, JobState state) {
		return jobs.get(frequencyClass).get(state).get();
	}

	@Override
	public String toString() {
		return "RefreshMetrics" + jobs;
	}
}
