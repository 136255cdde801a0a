package org.scriptonbasestar.sync.jdbc;

import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;
import org.scriptonbasestar.sync.core.model.CombinedView;
import org.scriptonbasestar.sync.core.model.TimeSeries;
import org.scriptonbasestar.sync.core.writer.SBCombinedViewSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes the combined view into a relational table using Spring JdbcTemplate.
 * <p>
 * Each call replaces the rows of every series present in the view inside one transaction.
 * Series that are not part of the view are left untouched.
 * </p>
 *
 * <h3>Table layout:</h3>
 * <pre>{@code
 * CREATE TABLE combined_series (
 *     series_name  VARCHAR(128) NOT NULL,
 *     observed_at  TIMESTAMP    NOT NULL,
 *     obs_value    DOUBLE       NOT NULL,
 *     source_class VARCHAR(16)  NOT NULL,
 *     refreshed_at TIMESTAMP    NOT NULL,
 *     PRIMARY KEY (series_name, observed_at)
 * );
 * }</pre>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
 * TieredSyncService service = TieredSyncService.builder()
 *     .executor(executor)
 *     .sink(new JdbcCombinedViewSink(jdbcTemplate))
 *     .build();
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class JdbcCombinedViewSink implements SBCombinedViewSink {

	private static final Logger log = LoggerFactory.getLogger(JdbcCombinedViewSink.class);

	public static final String DEFAULT_TABLE = "combined_series";
	private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

	private final JdbcTemplate jdbcTemplate;
	private final TransactionTemplate transactionTemplate;
	private final String tableName;
	private final String deleteSql;
	private final String insertSql;

	public JdbcCombinedViewSink(JdbcTemplate jdbcTemplate) {
		this(jdbcTemplate, DEFAULT_TABLE);
	}

	/**
	 * @param jdbcTemplate Spring JdbcTemplate instance (must have a DataSource)
	 * @param tableName    target table, letters, digits, underscore and dot only
	 */
	public JdbcCombinedViewSink(JdbcTemplate jdbcTemplate, String tableName) {
		if (jdbcTemplate == null || jdbcTemplate.getDataSource() == null) {
			throw new IllegalArgumentException("jdbcTemplate with a DataSource is required");
		}
		if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
			throw new IllegalArgumentException("Invalid table name: " + tableName);
		}
		this.jdbcTemplate = jdbcTemplate;
		this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(jdbcTemplate.getDataSource()));
		this.tableName = tableName;
		this.deleteSql = "DELETE FROM " + tableName + " WHERE series_name = ?";
		this.insertSql = "INSERT INTO " + tableName
			+ " (series_name, observed_at, obs_value, source_class, refreshed_at) VALUES (?, ?, ?, ?, ?)";
	}

	/**
	 * @throws SBStoreUnavailableException if the database rejects the write
	 */
	@Override
	public void accept(CombinedView view) {
		if (view == null || view.isEmpty()) {
			log.debug("Empty combined view, nothing written to {}", tableName);
			return;
		}

		List<Object[]> deletes = new ArrayList<>();
		List<Object[]> inserts = new ArrayList<>();
		for (Map.Entry<String, TimeSeries> e : view.getSeries().entrySet()) {
			String name = e.getKey();
			CombinedView.Provenance provenance = view.getProvenance().get(name);
			Timestamp refreshedAt = Timestamp.from(provenance.getRefreshedAt());
			String sourceClass = provenance.getFrequencyClass().key();
			deletes.add(new Object[]{name});
			for (TimeSeries.Point point : e.getValue().asList()) {
				inserts.add(new Object[]{name, Timestamp.from(point.getTimestamp()), point.getValue(), sourceClass, refreshedAt});
			}
		}

		try {
			transactionTemplate.executeWithoutResult(status -> {
				jdbcTemplate.batchUpdate(deleteSql, deletes);
				jdbcTemplate.batchUpdate(insertSql, inserts);
			});
		} catch (DataAccessException e) {
			throw new SBStoreUnavailableException("Failed to write combined view to " + tableName, e);
		}
		log.info("Wrote {} series ({} rows) to {}", deletes.size(), inserts.size(), tableName);
	}

	/**
	 * Read one series back from the table.
	 *
	 * @param seriesName series to read
	 * @return the stored series, empty if there are no rows
	 */
	public TimeSeries readSeries(String seriesName) {
		TimeSeries.Builder builder = TimeSeries.builder();
		jdbcTemplate.query(
			"SELECT observed_at, obs_value FROM " + tableName + " WHERE series_name = ? ORDER BY observed_at",
			rs -> {
				builder.point(rs.getTimestamp("observed_at").toInstant(), rs.getDouble("obs_value"));
			},
			seriesName);
		return builder.build();
	}

	public int countRows(String seriesName) {
		Integer count = jdbcTemplate.queryForObject(
			"SELECT COUNT(*) FROM " + tableName + " WHERE series_name = ?", Integer.class, seriesName);
		return count != null ? count : 0;
	}

	public String getTableName() {
		return tableName;
	}
}
