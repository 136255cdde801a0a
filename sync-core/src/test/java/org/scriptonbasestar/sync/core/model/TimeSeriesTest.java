package org.scriptonbasestar.sync.core.model;

import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-02
 */
public class TimeSeriesTest {

	private static final Instant T1 = Instant.parse("2024-01-01T00:00:00Z");
	private static final Instant T2 = Instant.parse("2024-01-02T00:00:00Z");
	private static final Instant T3 = Instant.parse("2024-01-03T00:00:00Z");

	@Test
	public void unorderedInputIsSorted() {
		TimeSeries ts = TimeSeries.of(Arrays.asList(
			new TimeSeries.Point(T3, 3.0),
			new TimeSeries.Point(T1, 1.0),
			new TimeSeries.Point(T2, 2.0)));

		assertEquals(Arrays.asList(T1, T2, T3), ts.points().keySet().stream().toList());
		assertEquals(T1, ts.firstTimestamp());
		assertEquals(T3, ts.lastTimestamp());
		assertEquals(Double.valueOf(2.0), ts.valueAt(T2));
	}

	@Test(expected = IllegalArgumentException.class)
	public void duplicateTimestampRejected() {
		TimeSeries.builder().point(T1, 1.0).point(T1, 1.5).build();
	}

	@Test(expected = UnsupportedOperationException.class)
	public void pointsAreImmutable() {
		TimeSeries ts = TimeSeries.builder().point(T1, 1.0).build();
		ts.points().put(T2, 2.0);
	}

	@Test
	public void emptySeries() {
		assertTrue(TimeSeries.empty().isEmpty());
		assertNull(TimeSeries.empty().firstTimestamp());
		assertEquals(TimeSeries.empty(), TimeSeries.builder().build());
	}
}
