package org.scriptonbasestar.sync.jdbc;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;
import org.scriptonbasestar.sync.core.model.CombinedView;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.TimeSeries;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Tests for JdbcCombinedViewSink with H2 embedded database.
 */
public class JdbcCombinedViewSinkTest {

	private static final Instant D1 = Instant.parse("2024-01-01T00:00:00Z");
	private static final Instant D2 = Instant.parse("2024-01-02T00:00:00Z");
	private static final Instant REFRESHED = Instant.parse("2024-03-01T06:00:00Z");

	private EmbeddedDatabase db;
	private JdbcTemplate jdbcTemplate;
	private JdbcCombinedViewSink sink;

	@Before
	public void setUp() {
		db = new EmbeddedDatabaseBuilder()
			.setType(EmbeddedDatabaseType.H2)
			.generateUniqueName(true)
			.addScript("classpath:schema.sql")
			.build();
		jdbcTemplate = new JdbcTemplate(db);
		sink = new JdbcCombinedViewSink(jdbcTemplate);
	}

	@After
	public void tearDown() {
		if (db != null) {
			db.shutdown();
		}
	}

	private static CombinedView view(String name, FrequencyClass fc, TimeSeries series) {
		Map<String, TimeSeries> s = new HashMap<>();
		Map<String, CombinedView.Provenance> p = new HashMap<>();
		s.put(name, series);
		p.put(name, new CombinedView.Provenance(fc, REFRESHED));
		return new CombinedView(s, p);
	}

	// ========== Constructor Validation Tests ==========

	@Test(expected = IllegalArgumentException.class)
	public void testConstructor_NullJdbcTemplate() {
		new JdbcCombinedViewSink(null);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testConstructor_SuspiciousTableName() {
		new JdbcCombinedViewSink(jdbcTemplate, "series; DROP TABLE x");
	}

	// ========== Write Tests ==========

	@Test
	public void testAccept_WritesAllPoints() {
		TimeSeries series = TimeSeries.builder().point(D1, 4.1).point(D2, 4.2).build();

		sink.accept(view("DGS10", FrequencyClass.DAILY, series));

		Assert.assertEquals(2, sink.countRows("DGS10"));
		Assert.assertEquals(series, sink.readSeries("DGS10"));
		Assert.assertEquals("daily", jdbcTemplate.queryForObject(
			"SELECT DISTINCT source_class FROM combined_series WHERE series_name = ?", String.class, "DGS10"));
	}

	@Test
	public void testAccept_ReplacesExistingRows() {
		sink.accept(view("DGS10", FrequencyClass.DAILY, TimeSeries.builder().point(D1, 4.1).point(D2, 4.2).build()));
		sink.accept(view("DGS10", FrequencyClass.DAILY, TimeSeries.builder().point(D2, 4.25).build()));

		Assert.assertEquals(1, sink.countRows("DGS10"));
		Assert.assertEquals(Double.valueOf(4.25), sink.readSeries("DGS10").valueAt(D2));
	}

	@Test
	public void testAccept_LeavesOtherSeriesAlone() {
		sink.accept(view("CPIAUCSL", FrequencyClass.MONTHLY, TimeSeries.builder().point(D1, 310.3).build()));
		sink.accept(view("DGS10", FrequencyClass.DAILY, TimeSeries.builder().point(D1, 4.1).build()));

		Assert.assertEquals(1, sink.countRows("CPIAUCSL"));
		Assert.assertEquals(1, sink.countRows("DGS10"));
	}

	@Test
	public void testAccept_EmptyViewIsNoop() {
		sink.accept(CombinedView.empty());
		Assert.assertEquals(Integer.valueOf(0),
			jdbcTemplate.queryForObject("SELECT COUNT(*) FROM combined_series", Integer.class));
	}

	@Test(expected = SBStoreUnavailableException.class)
	public void testAccept_MissingTable() {
		new JdbcCombinedViewSink(jdbcTemplate, "no_such_table")
			.accept(view("DGS10", FrequencyClass.DAILY, TimeSeries.builder().point(D1, 4.1).build()));
	}

	@Test
	public void testAccept_FailureRollsBack() {
		sink.accept(view("DGS10", FrequencyClass.DAILY, TimeSeries.builder().point(D1, 4.1).build()));
		jdbcTemplate.execute("ALTER TABLE combined_series ADD CONSTRAINT positive CHECK (obs_value > 0)");

		try {
			sink.accept(view("DGS10", FrequencyClass.DAILY, TimeSeries.builder().point(D1, -1.0).build()));
			Assert.fail("expected exception");
		} catch (SBStoreUnavailableException e) {
			Assert.assertEquals(1, sink.countRows("DGS10"));
		}
	}
}
