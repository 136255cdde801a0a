package org.scriptonbasestar.sync.store.file;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scriptonbasestar.sync.core.exception.FailureMode;
import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;
import org.scriptonbasestar.sync.core.model.EntryMetadata;
import org.scriptonbasestar.sync.core.model.FrequencyCacheEntry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.TimeSeries;
import org.scriptonbasestar.sync.core.store.SBKeyValueStore;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-02
 */
public class FrequencyPartitionedStoreTest {

	private static final Instant REFRESHED = Instant.parse("2024-03-01T06:00:00Z");

	@Rule
	public TemporaryFolder temp = new TemporaryFolder();

	private FileKeyValueStore keyValueStore;
	private FrequencyPartitionedStore store;

	@Before
	public void setUp() {
		keyValueStore = new FileKeyValueStore(temp.getRoot().toPath());
		store = new FrequencyPartitionedStore(keyValueStore);
	}

	private FrequencyCacheEntry dailyEntry() {
		Map<String, TimeSeries> payload = new HashMap<>();
		payload.put("DGS10", TimeSeries.builder()
			.point(Instant.parse("2024-02-28T00:00:00Z"), 4.27)
			.point(Instant.parse("2024-02-29T00:00:00Z"), 4.25)
			.build());
		payload.put("DFF", TimeSeries.builder()
			.point(Instant.parse("2024-02-29T00:00:00Z"), 5.33)
			.build());
		Map<String, Instant> perSeries = new HashMap<>();
		perSeries.put("DFF", REFRESHED.minusSeconds(3600));
		return new FrequencyCacheEntry(FrequencyClass.DAILY, payload, REFRESHED, perSeries);
	}

	@Test
	public void emptyStoreReturnsNull() {
		assertNull(store.get(FrequencyClass.DAILY));
		assertNull(store.metadata(FrequencyClass.DAILY));
	}

	@Test
	public void putAndGet() {
		FrequencyCacheEntry entry = dailyEntry();
		store.put(entry);

		FrequencyCacheEntry loaded = store.get(FrequencyClass.DAILY);
		assertEquals(entry, loaded);
		assertEquals(REFRESHED.minusSeconds(3600), loaded.seriesRefreshedAt("DFF"));
		assertEquals(REFRESHED, loaded.seriesRefreshedAt("DGS10"));
		assertNull(store.get(FrequencyClass.WEEKLY));
	}

	@Test
	public void metadataWithoutPayload() {
		store.put(dailyEntry());
		assertEquals(new EntryMetadata(FrequencyClass.DAILY, REFRESHED, 2), store.metadata(FrequencyClass.DAILY));
	}

	@Test
	public void metadataStopsBeforeBrokenPayload() {
		String truncated = "{\"frequencyClass\":\"monthly\",\"refreshedAt\":\"2024-03-01T06:00:00Z\",\"itemCount\":1,"
			+ "\"seriesRefreshedAt\":{\"CPI\":\"2024-03-01T06:00:00Z\"},\"payload\":{\"CPI\":[[\"2024-02-01T00:00:00Z\",3";
		keyValueStore.put(FrequencyPartitionedStore.keyOf(FrequencyClass.MONTHLY), truncated.getBytes(StandardCharsets.UTF_8));

		EntryMetadata metadata = store.metadata(FrequencyClass.MONTHLY);
		assertNotNull(metadata);
		assertEquals(1, metadata.getItemCount());
		assertNull(store.get(FrequencyClass.MONTHLY));
	}

	@Test
	public void corruptBlobTreatedAsAbsent() {
		keyValueStore.put(FrequencyPartitionedStore.keyOf(FrequencyClass.DAILY), "not json".getBytes(StandardCharsets.UTF_8));
		assertNull(store.get(FrequencyClass.DAILY));
		assertNull(store.metadata(FrequencyClass.DAILY));
	}

	@Test
	public void itemCountMismatchTreatedAsCorrupt() {
		String json = "{\"frequencyClass\":\"daily\",\"refreshedAt\":\"2024-03-01T06:00:00Z\",\"itemCount\":3,\"payload\":{}}";
		keyValueStore.put(FrequencyPartitionedStore.keyOf(FrequencyClass.DAILY), json.getBytes(StandardCharsets.UTF_8));
		assertNull(store.get(FrequencyClass.DAILY));
	}

	@Test
	public void unavailableStoreReadsAsAbsentButPutThrows() {
		FrequencyPartitionedStore broken = new FrequencyPartitionedStore(new UnavailableStore());
		assertNull(broken.get(FrequencyClass.DAILY));
		assertNull(broken.metadata(FrequencyClass.DAILY));
		try {
			broken.put(dailyEntry());
			fail("put should propagate store failure");
		} catch (SBStoreUnavailableException e) {
			assertEquals(FailureMode.STORE_UNAVAILABLE, e.getFailureMode());
		}
	}

	@Test
	public void subMillisecondTimestampsSurviveRoundTrip() {
		Instant refreshed = Instant.parse("2024-03-01T14:30:01.123456Z");
		Map<String, TimeSeries> payload = new HashMap<>();
		payload.put("VIX", TimeSeries.builder()
			.point(Instant.parse("2024-03-01T14:30:00.000100Z"), 14.1)
			.point(Instant.parse("2024-03-01T14:30:00.000300Z"), 14.2)
			.build());
		FrequencyCacheEntry entry = new FrequencyCacheEntry(FrequencyClass.REALTIME, payload, refreshed, new HashMap<>());

		store.put(entry);
		FrequencyCacheEntry loaded = store.get(FrequencyClass.REALTIME);

		assertNotNull(loaded);
		assertEquals(entry, loaded);
		assertEquals(2, loaded.getPayload().get("VIX").size());
		assertEquals(refreshed, loaded.getRefreshedAt());
		assertEquals(refreshed, store.metadata(FrequencyClass.REALTIME).getRefreshedAt());
	}

	@Test
	public void malformedTimestampTreatedAsCorrupt() {
		String json = "{\"frequencyClass\":\"daily\",\"refreshedAt\":\"yesterday\",\"itemCount\":0,\"payload\":{}}";
		keyValueStore.put(FrequencyPartitionedStore.keyOf(FrequencyClass.DAILY), json.getBytes(StandardCharsets.UTF_8));

		assertNull(store.get(FrequencyClass.DAILY));
		assertNull(store.metadata(FrequencyClass.DAILY));
	}

	@Test
	public void delete() {
		store.put(dailyEntry());
		assertTrue(store.delete(FrequencyClass.DAILY));
		assertNull(store.get(FrequencyClass.DAILY));
	}

	static class UnavailableStore implements SBKeyValueStore {
		@Override
		public byte[] get(String key) {
			throw new SBStoreUnavailableException("disk gone");
		}

		@Override
		public void put(String key, byte[] value) {
			throw new SBStoreUnavailableException("disk gone");
		}

		@Override
		public boolean delete(String key) {
			throw new SBStoreUnavailableException("disk gone");
		}
	}
}
