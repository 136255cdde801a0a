package org.scriptonbasestar.sync.engine.schedule;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scriptonbasestar.sync.core.model.DatasetDescriptor;
import org.scriptonbasestar.sync.core.model.DatasetRegistry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.JobState;
import org.scriptonbasestar.sync.core.model.RefreshStatus;
import org.scriptonbasestar.sync.core.support.ManualClock;
import org.scriptonbasestar.sync.engine.fetch.RateLimitedFetchExecutor;
import org.scriptonbasestar.sync.engine.support.InMemoryKeyValueStore;
import org.scriptonbasestar.sync.engine.support.ScriptedFetcher;
import org.scriptonbasestar.sync.store.file.FrequencyPartitionedStore;
import org.scriptonbasestar.sync.store.file.SnapshotManager;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.*;
import static org.scriptonbasestar.sync.engine.support.ScriptedFetcher.series;

/**
 * @author archmagece
 * @since 2025-02
 */
public class RefreshSchedulerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private ManualClock clock;
	private ScriptedFetcher fetcher;
	private RateLimitedFetchExecutor executor;
	private RefreshScheduler scheduler;

	@Before
	public void setUp() {
		clock = ManualClock.at("2024-03-01T06:00:00Z");
		fetcher = new ScriptedFetcher().returns("DGS10", series(4.1)).returns("CPIAUCSL", series(310.3));
		DatasetRegistry registry = new DatasetRegistry();
		registry.register(DatasetDescriptor.builder("DGS10", FrequencyClass.DAILY).build());
		registry.register(DatasetDescriptor.builder("CPIAUCSL", FrequencyClass.MONTHLY).build());
		executor = RateLimitedFetchExecutor.builder()
			.fetcher(fetcher)
			.registry(registry)
			.store(new FrequencyPartitionedStore(new InMemoryKeyValueStore()))
			.clock(clock)
			.sleeper(clock::advance)
			.minDelay(Duration.ZERO)
			.build();
		scheduler = RefreshScheduler.builder(executor).build();
	}

	@After
	public void tearDown() {
		scheduler.close();
		executor.close();
	}

	@Test
	public void statusBeforeAnyRunHasNothing() {
		RefreshStatus status = scheduler.status(FrequencyClass.DAILY);

		assertNull(status.getLastRefresh());
		assertNull(status.getNextDue());
		assertNull(status.getLastRunAt());
		assertNull(status.getLastState());
	}

	@Test
	public void runNowRecordsHistoryAndNextDue() {
		scheduler.runNow(FrequencyClass.DAILY, false);

		RefreshStatus status = scheduler.status(FrequencyClass.DAILY);
		assertEquals(clock.instant(), status.getLastRefresh());
		assertEquals(clock.instant().plus(Duration.ofHours(6)), status.getNextDue());
		assertEquals(clock.instant(), status.getLastRunAt());
		assertEquals(JobState.SUCCESS, status.getLastState());
		assertNull(status.getLastError());
	}

	@Test
	public void statusesCoverEveryClass() {
		Map<FrequencyClass, RefreshStatus> statuses = scheduler.statuses();
		assertEquals(FrequencyClass.values().length, statuses.size());
	}

	@Test
	public void runNowPropagatesAndRecordsErrors() {
		scheduler.runNow(FrequencyClass.DAILY, false);
		executor.close();

		try {
			scheduler.runNow(FrequencyClass.DAILY, true);
			fail("expected exception");
		} catch (IllegalStateException e) {
			assertTrue(e.getMessage().contains("closed"));
		}

		RefreshStatus status = scheduler.status(FrequencyClass.DAILY);
		assertTrue(status.getLastError().startsWith("IllegalStateException"));
		assertEquals(JobState.SUCCESS, status.getLastState());
	}

	@Test
	public void scheduledRunNeverThrows() {
		executor.close();

		scheduler.runScheduled(FrequencyClass.MONTHLY);

		assertNotNull(scheduler.status(FrequencyClass.MONTHLY).getLastError());
	}

	@Test
	public void scheduledRunUsesFreshnessRules() {
		scheduler.runScheduled(FrequencyClass.DAILY);
		fetcher.clearCalls();

		scheduler.runScheduled(FrequencyClass.DAILY);

		assertTrue(fetcher.calls().isEmpty());
		assertEquals(JobState.SKIPPED, scheduler.status(FrequencyClass.DAILY).getLastState());
	}

	@Test
	public void startedSchedulerRunsConfiguredClasses() throws Exception {
		RefreshScheduler running = RefreshScheduler.builder(executor)
			.cadence(FrequencyClass.DAILY, Duration.ofMillis(50))
			.build();
		try {
			running.start();
			running.start();
			assertTrue(running.isStarted());

			long deadline = System.currentTimeMillis() + 5000;
			while (running.status(FrequencyClass.DAILY).getLastRunAt() == null && System.currentTimeMillis() < deadline) {
				Thread.sleep(20);
			}
			assertNotNull(running.status(FrequencyClass.DAILY).getLastRunAt());
			assertNull(running.status(FrequencyClass.MONTHLY).getLastRunAt());
		} finally {
			running.close();
		}
	}

	@Test
	public void pruneRemovesExpiredSnapshots() throws Exception {
		SnapshotManager snapshots = new SnapshotManager(folder.newFolder("snapshots").toPath(), new ObjectMapper(), clock);
		snapshots.snapshot(Collections.singletonMap("a", 1), "old");
		clock.advance(Duration.ofDays(31));
		snapshots.snapshot(Collections.singletonMap("a", 2), "new");

		RefreshScheduler pruning = RefreshScheduler.builder(executor).retention(snapshots, 30).build();

		assertEquals(1, pruning.runPrune());
		assertEquals(1, snapshots.list().size());
	}

	@Test(expected = IllegalArgumentException.class)
	public void cadenceMustBePositive() {
		RefreshScheduler.builder(executor).cadence(FrequencyClass.DAILY, Duration.ZERO);
	}

	@Test(expected = IllegalStateException.class)
	public void closedSchedulerCannotStart() {
		scheduler.close();
		scheduler.start();
	}
}
