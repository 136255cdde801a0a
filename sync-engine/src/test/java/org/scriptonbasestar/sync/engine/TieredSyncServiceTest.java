package org.scriptonbasestar.sync.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scriptonbasestar.sync.core.model.CombinedView;
import org.scriptonbasestar.sync.core.model.DatasetDescriptor;
import org.scriptonbasestar.sync.core.model.DatasetRegistry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.JobState;
import org.scriptonbasestar.sync.core.model.RefreshReport;
import org.scriptonbasestar.sync.core.support.ManualClock;
import org.scriptonbasestar.sync.engine.fetch.RateLimitedFetchExecutor;
import org.scriptonbasestar.sync.engine.response.CachedResponse;
import org.scriptonbasestar.sync.engine.response.InMemoryCacheBackend;
import org.scriptonbasestar.sync.engine.response.ReadThroughResponseCache;
import org.scriptonbasestar.sync.engine.response.ResponseRequest;
import org.scriptonbasestar.sync.engine.support.InMemoryKeyValueStore;
import org.scriptonbasestar.sync.engine.support.ScriptedFetcher;
import org.scriptonbasestar.sync.store.file.FrequencyPartitionedStore;
import org.scriptonbasestar.sync.store.file.SnapshotManager;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;
import static org.scriptonbasestar.sync.engine.support.ScriptedFetcher.series;

/**
 * 커밋 이후 뷰, 응답 캐시, 스냅샷, sink 가 연동되는지 확인
 *
 * @author archmagece
 * @since 2025-02
 */
public class TieredSyncServiceTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private ManualClock clock;
	private ScriptedFetcher fetcher;
	private InMemoryCacheBackend backend;
	private SnapshotManager snapshots;
	private List<CombinedView> sunk;
	private TieredSyncService service;

	@Before
	public void setUp() throws Exception {
		clock = ManualClock.at("2024-03-01T06:00:00Z");
		fetcher = new ScriptedFetcher()
			.returns("DGS10", series(4.1, 4.2))
			.returns("CPIAUCSL", series(310.3))
			.returns("GDP", series(27000.0));

		DatasetRegistry registry = new DatasetRegistry();
		registry.register(DatasetDescriptor.builder("DGS10", FrequencyClass.DAILY).build());
		registry.register(DatasetDescriptor.builder("CPIAUCSL", FrequencyClass.MONTHLY).build());
		registry.register(DatasetDescriptor.builder("GDP", FrequencyClass.QUARTERLY).build());

		RateLimitedFetchExecutor executor = RateLimitedFetchExecutor.builder()
			.fetcher(fetcher)
			.registry(registry)
			.store(new FrequencyPartitionedStore(new InMemoryKeyValueStore()))
			.clock(clock)
			.sleeper(clock::advance)
			.minDelay(Duration.ZERO)
			.build();

		backend = new InMemoryCacheBackend(clock);
		snapshots = new SnapshotManager(folder.newFolder("snapshots").toPath(), new ObjectMapper(), clock);
		sunk = new ArrayList<>();

		service = TieredSyncService.builder()
			.executor(executor)
			.responseCache(ReadThroughResponseCache.builder().backend(backend).clock(clock).build())
			.snapshotWriter(snapshots)
			.sink(sunk::add)
			.build();
	}

	@After
	public void tearDown() {
		service.close();
	}

	@Test
	public void commitRebuildsCombinedView() {
		assertTrue(service.combinedView().isEmpty());

		service.runNow(FrequencyClass.DAILY, false);
		service.runNow(FrequencyClass.MONTHLY, false);

		CombinedView view = service.combinedView();
		assertEquals(2, view.size());
		assertEquals(series(310.3), view.series("CPIAUCSL"));
		assertEquals(1, service.combinedView(Arrays.asList("DGS10")).size());
	}

	@Test
	public void commitInvalidatesCachedDataResponses() {
		ReadThroughResponseCache cache = service.getResponseCache();
		ResponseRequest request = ResponseRequest.get("/v1/data/DGS10");
		cache.getOrCompute(request, String.class, () -> "stale");
		assertEquals(1, backend.size());

		service.runNow(FrequencyClass.DAILY, false);

		assertEquals(0, backend.size());
		CachedResponse<String> response = cache.getOrCompute(request, String.class, () -> "fresh");
		assertEquals("fresh", response.getValue());
		assertEquals(1, service.cacheStats().getInvalidationCount());
	}

	@Test
	public void commitWritesSnapshotAndFeedsSink() throws Exception {
		service.runNow(FrequencyClass.DAILY, false);

		assertEquals(1, sunk.size());
		assertEquals(1, sunk.get(0).size());

		List<Path> files = snapshots.list();
		assertEquals(1, files.size());
		assertTrue(files.get(0).getFileName().toString().endsWith("_combined.json"));
		JsonNode doc = new ObjectMapper().readTree(Files.readAllBytes(files.get(0)));
		assertEquals(1, doc.get("seriesCount").asInt());
		assertTrue(doc.get("series").has("DGS10"));
	}

	@Test
	public void skippedRunDoesNotTouchDownstream() {
		service.runNow(FrequencyClass.DAILY, false);
		clock.advance(Duration.ofSeconds(1));
		service.runNow(FrequencyClass.DAILY, false);

		assertEquals(1, sunk.size());
		assertEquals(1, snapshots.list().size());
	}

	@Test
	public void sinkFailureDoesNotBreakRefresh() {
		TieredSyncService failing = TieredSyncService.builder()
			.executor(service.getExecutor())
			.responseCache(service.getResponseCache())
			.sink(view -> {
				throw new IllegalStateException("db down");
			})
			.build();

		RefreshReport report = failing.runNow(FrequencyClass.MONTHLY, false);
		assertEquals(JobState.SUCCESS, report.getState());
		assertTrue(report.isCommitted());
	}

	@Test
	public void runAllVisitsEveryClass() {
		List<RefreshReport> reports = service.runAll(false);

		assertEquals(FrequencyClass.values().length, reports.size());
		// 2024-03-01 은 분기 첫 달이 아니라 GDP 는 발행 윈도우 밖
		assertEquals(JobState.SKIPPED, reports.get(FrequencyClass.QUARTERLY.ordinal()).getState());
		assertEquals(2, service.combinedView().size());
	}

	@Test
	public void statusReflectsLastRun() {
		service.runNow(FrequencyClass.DAILY, false);

		assertEquals(JobState.SUCCESS, service.status(FrequencyClass.DAILY).getLastState());
		assertEquals(clock.instant(), service.statuses().get(FrequencyClass.DAILY).getLastRefresh());
	}
}
