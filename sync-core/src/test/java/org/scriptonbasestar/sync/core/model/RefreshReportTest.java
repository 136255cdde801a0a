package org.scriptonbasestar.sync.core.model;

import org.junit.Test;
import org.scriptonbasestar.sync.core.exception.FailureMode;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-02
 */
public class RefreshReportTest {

	private static final Instant START = Instant.parse("2024-03-01T06:00:00Z");

	private RefreshReport report(List<RefreshOutcome> outcomes) {
		return new RefreshReport(FrequencyClass.DAILY, START, START.plusSeconds(3), outcomes, false, Collections.emptySet());
	}

	@Test
	public void stateFromOutcomes() {
		assertEquals(JobState.SUCCESS, report(Arrays.asList(
			RefreshOutcome.success("A", 10),
			RefreshOutcome.skipped("B", OutcomeStatus.SKIPPED_FRESH))).getState());

		assertEquals(JobState.PARTIAL, report(Arrays.asList(
			RefreshOutcome.success("A", 10),
			RefreshOutcome.failed("B", "boom"))).getState());

		assertEquals(JobState.PARTIAL, report(Arrays.asList(
			RefreshOutcome.success("A", 10),
			RefreshOutcome.abandoned("B"))).getState());

		assertEquals(JobState.ALL_FAILED, report(Arrays.asList(
			RefreshOutcome.failed("A", "x"),
			RefreshOutcome.skipped("B", OutcomeStatus.SKIPPED_FRESH))).getState());

		assertEquals(JobState.SKIPPED, report(Arrays.asList(
			RefreshOutcome.skipped("A", OutcomeStatus.SKIPPED_NOT_PUBLISHABLE))).getState());

		assertEquals(JobState.SKIPPED, report(Collections.emptyList()).getState());
	}

	@Test
	public void failedOutcomeCarriesFetchFailure() {
		RefreshOutcome outcome = RefreshOutcome.failed("A", "timeout");
		assertFalse(outcome.isSuccess());
		assertEquals(FailureMode.FETCH_FAILURE, outcome.getFailureMode());
		assertTrue(RefreshOutcome.skipped("A", OutcomeStatus.SKIPPED_FRESH).isSuccess());
	}

	@Test(expected = IllegalArgumentException.class)
	public void skippedRequiresSkipStatus() {
		RefreshOutcome.skipped("A", OutcomeStatus.SUCCESS);
	}

	@Test
	public void outcomeLookup() {
		RefreshReport report = report(Arrays.asList(RefreshOutcome.success("A", 3), RefreshOutcome.failed("B", "x")));
		assertEquals(OutcomeStatus.FAILED, report.outcomeOf("B").getStatus());
		assertNull(report.outcomeOf("C"));
		assertEquals(3000, report.elapsed().toMillis());
	}
}
