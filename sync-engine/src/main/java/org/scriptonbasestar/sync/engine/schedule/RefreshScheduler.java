package org.scriptonbasestar.sync.engine.schedule;

import org.scriptonbasestar.sync.core.freshness.StalenessEvaluator;
import org.scriptonbasestar.sync.core.model.EntryMetadata;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.RefreshReport;
import org.scriptonbasestar.sync.core.model.RefreshStatus;
import org.scriptonbasestar.sync.engine.fetch.RateLimitedFetchExecutor;
import org.scriptonbasestar.sync.store.file.FrequencyPartitionedStore;
import org.scriptonbasestar.sync.store.file.SnapshotManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * frequency class 별 주기 작업과 보존 정리 작업을 돌린다. 수동 실행({@link #runNow})과 상태 조회도 여기서 한다.
 * <p>
 * 같은 class 의 작업이 이미 돌고 있으면 예약 실행은 건너뛴다.
 * 작업 중 예외는 상태에 기록하고 스케줄러 스레드로 던지지 않는다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public class RefreshScheduler implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

	private final RateLimitedFetchExecutor executor;
	private final FrequencyPartitionedStore store;
	private final StalenessEvaluator evaluator;
	private final Clock clock;
	private final Map<FrequencyClass, Duration> cadences;
	private final Duration initialDelay;
	private final SnapshotManager snapshotManager;  // null 이면 정리 작업 없음
	private final int retentionDays;
	private final Duration pruneInterval;
	private final Map<FrequencyClass, JobRecord> history = new ConcurrentHashMap<>();
	private final AtomicBoolean started = new AtomicBoolean(false);
	private final AtomicBoolean closed = new AtomicBoolean(false);
	private ScheduledExecutorService scheduler;

	private RefreshScheduler(Builder builder) {
		this.executor = builder.executor;
		this.store = builder.executor.getStore();
		this.evaluator = builder.executor.getEvaluator();
		this.clock = builder.executor.getClock();
		this.cadences = Collections.unmodifiableMap(new EnumMap<>(builder.cadences));
		this.initialDelay = builder.initialDelay;
		this.snapshotManager = builder.snapshotManager;
		this.retentionDays = builder.retentionDays;
		this.pruneInterval = builder.pruneInterval;
	}

	public static Builder builder(RateLimitedFetchExecutor executor) {
		return new Builder(executor);
	}

	/**
	 * 주기 작업을 시작합니다. 두 번째 호출부터는 무시된다.
	 */
	public void start() {
		if (closed.get()) {
			throw new IllegalStateException("RefreshScheduler is closed");
		}
		if (!started.compareAndSet(false, true)) {
			return;
		}
		AtomicInteger threadCount = new AtomicInteger();
		int poolSize = Math.max(1, cadences.size() + (snapshotManager != null ? 1 : 0));
		scheduler = Executors.newScheduledThreadPool(poolSize, r -> {
			Thread t = new Thread(r, "SBSync-Scheduler-" + threadCount.incrementAndGet());
			t.setDaemon(true);
			return t;
		});

		cadences.forEach((fc, cadence) -> {
			scheduler.scheduleWithFixedDelay(() -> runScheduled(fc),
				initialDelay.toMillis(), cadence.toMillis(), TimeUnit.MILLISECONDS);
			log.info("Scheduled {} refresh every {}", fc.key(), cadence);
		});

		if (snapshotManager != null) {
			scheduler.scheduleAtFixedRate(this::runPrune,
				pruneInterval.toMillis(), pruneInterval.toMillis(), TimeUnit.MILLISECONDS);
			log.info("Scheduled snapshot pruning every {} (retention {} days)", pruneInterval, retentionDays);
		}
	}

	/**
	 * 즉시 실행. 같은 class 작업이 진행 중이면 끝날 때까지 기다린다.
	 *
	 * @param frequencyClass 대상 class
	 * @param force 발행 윈도우와 SLA 무시
	 */
	public RefreshReport runNow(FrequencyClass frequencyClass, boolean force) {
		Instant runAt = clock.instant();
		try {
			RefreshReport report = executor.refresh(frequencyClass, force);
			history.put(frequencyClass, new JobRecord(runAt, report, null));
			return report;
		} catch (RuntimeException e) {
			history.put(frequencyClass, new JobRecord(runAt, lastReport(frequencyClass), describe(e)));
			log.error("Manual refresh of {} failed", frequencyClass.key(), e);
			throw e;
		}
	}

	/**
	 * 예약 실행 본체. 예외를 밖으로 던지지 않는다.
	 */
	void runScheduled(FrequencyClass frequencyClass) {
		Instant runAt = clock.instant();
		try {
			RefreshReport report = executor.tryRefresh(frequencyClass, false);
			if (report == null) {
				log.debug("Scheduled {} refresh skipped, previous run still in progress", frequencyClass.key());
				return;
			}
			history.put(frequencyClass, new JobRecord(runAt, report, null));
		} catch (RuntimeException e) {
			history.put(frequencyClass, new JobRecord(runAt, lastReport(frequencyClass), describe(e)));
			log.error("Scheduled refresh of {} failed", frequencyClass.key(), e);
		}
	}

	/**
	 * @return 정리된 스냅샷 수
	 */
	int runPrune() {
		try {
			return snapshotManager.prune(retentionDays);
		} catch (RuntimeException e) {
			log.error("Snapshot pruning failed", e);
			return 0;
		}
	}

	public RefreshStatus status(FrequencyClass frequencyClass) {
		EntryMetadata metadata = store.metadata(frequencyClass);
		Instant lastRefresh = metadata != null ? metadata.getRefreshedAt() : null;
		JobRecord record = history.get(frequencyClass);
		return new RefreshStatus(frequencyClass, lastRefresh, evaluator.nextDue(frequencyClass, lastRefresh),
			record != null ? record.runAt : null,
			record != null ? record.report : null,
			record != null ? record.error : null);
	}

	public Map<FrequencyClass, RefreshStatus> statuses() {
		Map<FrequencyClass, RefreshStatus> all = new EnumMap<>(FrequencyClass.class);
		for (FrequencyClass fc : FrequencyClass.values()) {
			all.put(fc, status(fc));
		}
		return all;
	}

	public Map<FrequencyClass, Duration> getCadences() {
		return cadences;
	}

	public boolean isStarted() {
		return started.get();
	}

	@Override
	public void close() {
		if (!closed.compareAndSet(false, true)) {
			return;
		}
		if (scheduler != null) {
			scheduler.shutdown();
			try {
				if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
					scheduler.shutdownNow();
				}
			} catch (InterruptedException e) {
				scheduler.shutdownNow();
				Thread.currentThread().interrupt();
			}
		}
		log.debug("RefreshScheduler closed");
	}

	private RefreshReport lastReport(FrequencyClass frequencyClass) {
		JobRecord record = history.get(frequencyClass);
		return record != null ? record.report : null;
	}

	private static String describe(Throwable e) {
		return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
	}

	private static final class JobRecord {
		private final Instant runAt;
		private final RefreshReport report;
		private final String error;

		private JobRecord(Instant runAt, RefreshReport report, String error) {
			this.runAt = runAt;
			this.report = report;
			this.error = error;
		}
	}

	public static class Builder {
		private final RateLimitedFetchExecutor executor;
		private final Map<FrequencyClass, Duration> cadences = new EnumMap<>(FrequencyClass.class);
		private Duration initialDelay = Duration.ZERO;
		private SnapshotManager snapshotManager;
		private int retentionDays = 30;
		private Duration pruneInterval = Duration.ofDays(1);

		private Builder(RateLimitedFetchExecutor executor) {
			if (executor == null) {
				throw new IllegalArgumentException("RateLimitedFetchExecutor must not be null");
			}
			this.executor = executor;
		}

		public Builder cadence(FrequencyClass frequencyClass, Duration cadence) {
			if (cadence == null || cadence.isZero() || cadence.isNegative()) {
				throw new IllegalArgumentException("cadence must be positive: " + frequencyClass + "=" + cadence);
			}
			this.cadences.put(frequencyClass, cadence);
			return this;
		}

		public Builder cadences(Map<FrequencyClass, Duration> cadences) {
			cadences.forEach(this::cadence);
			return this;
		}

		public Builder initialDelay(Duration initialDelay) {
			if (initialDelay == null || initialDelay.isNegative()) {
				throw new IllegalArgumentException("initialDelay must not be negative: " + initialDelay);
			}
			this.initialDelay = initialDelay;
			return this;
		}

		/**
		 * 스냅샷 보존 정리 작업 설정
		 *
		 * @param snapshotManager 대상
		 * @param retentionDays 보존 일수, 음수면 전부 보존
		 */
		public Builder retention(SnapshotManager snapshotManager, int retentionDays) {
			this.snapshotManager = snapshotManager;
			this.retentionDays = retentionDays;
			return this;
		}

		public Builder pruneInterval(Duration pruneInterval) {
			if (pruneInterval == null || pruneInterval.isZero() || pruneInterval.isNegative()) {
				throw new IllegalArgumentException("pruneInterval must be positive: " + pruneInterval);
			}
			this.pruneInterval = pruneInterval;
			return this;
		}

		public RefreshScheduler build() {
			return new RefreshScheduler(this);
		}
	}
}
