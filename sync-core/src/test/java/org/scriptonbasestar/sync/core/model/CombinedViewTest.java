package org.scriptonbasestar.sync.core.model;

import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-02
 */
public class CombinedViewTest {

	private static final Instant T1 = Instant.parse("2024-01-01T00:00:00Z");
	private static final Instant T2 = Instant.parse("2024-02-01T00:00:00Z");
	private static final Instant REFRESHED = Instant.parse("2024-02-03T06:00:00Z");

	private CombinedView sample(Map<String, TimeSeries> series) {
		Map<String, CombinedView.Provenance> provenance = new HashMap<>();
		series.keySet().forEach(name -> provenance.put(name,
			new CombinedView.Provenance(name.startsWith("M") ? FrequencyClass.MONTHLY : FrequencyClass.DAILY, REFRESHED)));
		return new CombinedView(series, provenance);
	}

	@Test
	public void alignedJoinsOnTimestamp() {
		Map<String, TimeSeries> series = new HashMap<>();
		series.put("DGS10", TimeSeries.builder().point(T1, 4.0).point(T2, 4.2).build());
		series.put("M_CPI", TimeSeries.builder().point(T2, 310.0).build());

		SortedMap<Instant, SortedMap<String, Double>> rows = sample(series).aligned();

		assertEquals(2, rows.size());
		assertEquals(1, rows.get(T1).size());
		assertEquals(Double.valueOf(4.2), rows.get(T2).get("DGS10"));
		assertEquals(Double.valueOf(310.0), rows.get(T2).get("M_CPI"));
	}

	@Test
	public void renderIsIndependentOfInsertionOrder() {
		Map<String, TimeSeries> a = new LinkedHashMap<>();
		a.put("B", TimeSeries.builder().point(T1, 1.0).build());
		a.put("A", TimeSeries.builder().point(T2, 2.0).build());
		Map<String, TimeSeries> b = new LinkedHashMap<>();
		b.put("A", TimeSeries.builder().point(T2, 2.0).build());
		b.put("B", TimeSeries.builder().point(T1, 1.0).build());

		assertEquals(sample(a), sample(b));
		assertEquals(sample(a).render(), sample(b).render());
		assertTrue(sample(a).render().startsWith("A[daily@"));
	}

	@Test
	public void renderKeepsSubMillisecondTimestampsApart() {
		Map<String, TimeSeries> series = new HashMap<>();
		series.put("VIX", TimeSeries.builder()
			.point(Instant.parse("2024-03-01T14:30:00.000100Z"), 14.1)
			.point(Instant.parse("2024-03-01T14:30:00.000300Z"), 14.2)
			.build());

		String rendered = sample(series).render();

		assertTrue(rendered.contains("2024-03-01T14:30:00.000100Z=14.1"));
		assertTrue(rendered.contains("2024-03-01T14:30:00.000300Z=14.2"));
	}

	@Test
	public void selectIgnoresUnknownNames() {
		Map<String, TimeSeries> series = new HashMap<>();
		series.put("DGS10", TimeSeries.builder().point(T1, 4.0).build());
		series.put("M_CPI", TimeSeries.builder().point(T2, 310.0).build());

		CombinedView selected = sample(series).select(Arrays.asList("M_CPI", "NOPE"));
		assertEquals(1, selected.size());
		assertNotNull(selected.series("M_CPI"));
		assertEquals(FrequencyClass.MONTHLY, selected.getProvenance().get("M_CPI").getFrequencyClass());
	}

	@Test(expected = IllegalArgumentException.class)
	public void provenanceRequiredForEverySeries() {
		Map<String, TimeSeries> series = new HashMap<>();
		series.put("DGS10", TimeSeries.empty());
		new CombinedView(series, new HashMap<>());
	}
}
