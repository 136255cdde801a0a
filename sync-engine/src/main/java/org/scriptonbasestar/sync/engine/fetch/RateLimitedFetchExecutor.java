package org.scriptonbasestar.sync.engine.fetch;

import org.scriptonbasestar.sync.core.exception.FailureMode;
import org.scriptonbasestar.sync.core.exception.SBFetchFailException;
import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;
import org.scriptonbasestar.sync.core.fetcher.SBDatasetFetcher;
import org.scriptonbasestar.sync.core.freshness.StalenessEvaluator;
import org.scriptonbasestar.sync.core.model.DatasetDescriptor;
import org.scriptonbasestar.sync.core.model.DatasetRegistry;
import org.scriptonbasestar.sync.core.model.FrequencyCacheEntry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.OutcomeStatus;
import org.scriptonbasestar.sync.core.model.RateLimit;
import org.scriptonbasestar.sync.core.model.RefreshOutcome;
import org.scriptonbasestar.sync.core.model.RefreshReport;
import org.scriptonbasestar.sync.core.model.TimeSeries;
import org.scriptonbasestar.sync.store.file.FrequencyPartitionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * frequency class 단위 갱신 실행기.
 *
 * <pre>{@code
 * RateLimitedFetchExecutor executor = RateLimitedFetchExecutor.builder()
 *     .fetcher(fredFetcher)
 *     .registry(registry)
 *     .store(new FrequencyPartitionedStore(new FileKeyValueStore(Paths.get("data/cache"))))
 *     .minDelay(Duration.ofMillis(500))
 *     .timeout(Duration.ofMinutes(30))
 *     .build();
 *
 * RefreshReport report = executor.refresh(FrequencyClass.DAILY, false);
 * }</pre>
 *
 * 동작:
 * - 같은 class의 갱신은 직렬화 (class 별 lock). 서로 다른 class는 동시에 갱신 가능
 * - force가 아니면 발행 윈도우 밖에서는 아무것도 하지 않음
 * - 데이터셋별로 stale 한 것만 fetch, 실패는 격리하고 다음 데이터셋으로 진행
 * - 재시도 가능한 실패는 maxAttempts 까지 지수 backoff 후 다시 시도 (rate limiter 도 다시 통과)
 * - 타임아웃이 지나면 남은 데이터셋은 ABANDONED
 * - 성공이 하나라도 있으면 엔트리를 통째로 교체. 모두 실패하면 기존 엔트리 유지
 *
 * @author archmagece
 * @since 2025-02
 */
public class RateLimitedFetchExecutor implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(RateLimitedFetchExecutor.class);

	public static final Duration DEFAULT_LOOKBACK = Duration.ofDays(365L * 20);
	public static final Duration DEFAULT_MIN_DELAY = Duration.ofMillis(500);
	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);
	public static final int DEFAULT_MAX_ATTEMPTS = 3;
	public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(500);

	private final SBDatasetFetcher fetcher;
	private final DatasetRegistry registry;
	private final FrequencyPartitionedStore store;
	private final StalenessEvaluator evaluator;
	private final Clock clock;
	private final Sleeper sleeper;
	private final Duration defaultLookback;
	private final Duration timeout;
	private final Duration minDelay;
	private final int maxAttempts;
	private final Duration retryBackoff;
	private final RateLimiter defaultLimiter;  // 자체 rateLimit 이 없는 데이터셋이 공유
	private final Map<String, RateLimiter> datasetLimiters = new ConcurrentHashMap<>();
	private final Map<FrequencyClass, ReentrantLock> locks = new EnumMap<>(FrequencyClass.class);
	private final List<RefreshListener> listeners = new CopyOnWriteArrayList<>();
	private final ExecutorService fetchExecutor;  // 타임아웃을 걸기 위해 fetch 는 별도 스레드에서 실행
	private final AtomicBoolean closed = new AtomicBoolean(false);

	private RateLimitedFetchExecutor(Builder builder) {
		this.fetcher = builder.fetcher;
		this.registry = builder.registry;
		this.store = builder.store;
		this.evaluator = builder.evaluator != null ? builder.evaluator : new StalenessEvaluator();
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
		this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
		this.defaultLookback = builder.defaultLookback;
		this.timeout = builder.timeout;
		this.minDelay = builder.minDelay;
		this.maxAttempts = builder.maxAttempts;
		this.retryBackoff = builder.retryBackoff;
		this.defaultLimiter = new RateLimiter("default", builder.defaultRateLimit, minDelay, clock, sleeper);
		this.listeners.addAll(builder.listeners);
		for (FrequencyClass fc : FrequencyClass.values()) {
			locks.put(fc, new ReentrantLock());
		}

		AtomicInteger threadCount = new AtomicInteger();
		this.fetchExecutor = Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r, "SBSync-Fetch-" + threadCount.incrementAndGet());
			t.setDaemon(true);
			return t;
		});

		log.debug("RateLimitedFetchExecutor initialized - timeout: {}, minDelay: {}, defaultRateLimit: {}, maxAttempts: {}",
			timeout, minDelay, builder.defaultRateLimit, maxAttempts);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * frequency class 하나를 갱신합니다. 같은 class 의 갱신이 진행 중이면 끝날 때까지 기다린다.
	 *
	 * @param frequencyClass 대상 class
	 * @param force true 면 발행 윈도우와 SLA 를 무시하고 전부 fetch
	 * @return 갱신 결과
	 */
	public RefreshReport refresh(FrequencyClass frequencyClass, boolean force) {
		ensureOpen();
		ReentrantLock lock = locks.get(frequencyClass);
		lock.lock();
		try {
			return doRefresh(frequencyClass, force);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * 같은 class 의 갱신이 진행 중이면 기다리지 않고 null 을 반환합니다. (스케줄러용)
	 */
	public RefreshReport tryRefresh(FrequencyClass frequencyClass, boolean force) {
		ensureOpen();
		ReentrantLock lock = locks.get(frequencyClass);
		if (!lock.tryLock()) {
			log.debug("Refresh of {} already in flight, skipping", frequencyClass.key());
			return null;
		}
		try {
			return doRefresh(frequencyClass, force);
		} finally {
			lock.unlock();
		}
	}

	public boolean isRefreshing(FrequencyClass frequencyClass) {
		return locks.get(frequencyClass).isLocked();
	}

	public void addListener(RefreshListener listener) {
		listeners.add(listener);
	}

	public void removeListener(RefreshListener listener) {
		listeners.remove(listener);
	}

	private RefreshReport doRefresh(FrequencyClass frequencyClass, boolean force) {
		Instant startedAt = clock.instant();
		Instant deadline = startedAt.plus(timeout);
		List<DatasetDescriptor> descriptors = new ArrayList<>();
		for (DatasetDescriptor descriptor : registry.listByFrequency(frequencyClass)) {
			if (descriptor.isEnabled()) {
				descriptors.add(descriptor);
			}
		}

		if (!force && !evaluator.canFetchNow(frequencyClass, startedAt)) {
			List<RefreshOutcome> skipped = new ArrayList<>();
			for (DatasetDescriptor descriptor : descriptors) {
				skipped.add(RefreshOutcome.skipped(descriptor.getId(), OutcomeStatus.SKIPPED_NOT_PUBLISHABLE));
			}
			log.info("{} is outside its publication window, {} datasets skipped", frequencyClass.key(), skipped.size());
			return finish(new RefreshReport(frequencyClass, startedAt, clock.instant(), skipped, false, null), null);
		}

		FrequencyCacheEntry previous = store.get(frequencyClass);
		List<RefreshOutcome> outcomes = new ArrayList<>();
		Map<String, TimeSeries> payload = new TreeMap<>();
		Map<String, Instant> seriesRefreshedAt = new TreeMap<>();
		Set<FailureMode> failures = EnumSet.noneOf(FailureMode.class);
		boolean abandonRest = false;
		int succeeded = 0;
		int attempted = 0;

		for (DatasetDescriptor descriptor : descriptors) {
			String name = descriptor.getDisplayName();
			Instant lastFetched = previous != null ? previous.seriesRefreshedAt(name) : null;

			if (!abandonRest && !clock.instant().isBefore(deadline)) {
				log.warn("Refresh of {} exceeded timeout {}, abandoning remaining datasets", frequencyClass.key(), timeout);
				abandonRest = true;
			}
			if (abandonRest) {
				outcomes.add(RefreshOutcome.abandoned(descriptor.getId()));
				carryOver(previous, name, payload, seriesRefreshedAt);
				continue;
			}

			if (!force && lastFetched != null && !evaluator.isStale(frequencyClass, lastFetched, clock.instant())) {
				log.debug("{} is fresh (last fetched {}), skipping", descriptor.getId(), lastFetched);
				outcomes.add(RefreshOutcome.skipped(descriptor.getId(), OutcomeStatus.SKIPPED_FRESH));
				carryOver(previous, name, payload, seriesRefreshedAt);
				continue;
			}

			attempted++;
			FetchResult result = fetchOne(descriptor, deadline);
			outcomes.add(result.outcome);
			switch (result.outcome.getStatus()) {
				case SUCCESS:
					succeeded++;
					payload.put(name, result.series);
					seriesRefreshedAt.put(name, clock.instant());
					break;
				case ABANDONED:
					abandonRest = true;
					carryOver(previous, name, payload, seriesRefreshedAt);
					break;
				default:
					failures.add(FailureMode.FETCH_FAILURE);
			}
		}

		boolean committed = false;
		FrequencyCacheEntry entry = null;
		if (succeeded > 0) {
			entry = new FrequencyCacheEntry(frequencyClass, payload, clock.instant(), seriesRefreshedAt);
			try {
				store.put(entry);
				committed = true;
			} catch (SBStoreUnavailableException e) {
				failures.add(FailureMode.STORE_UNAVAILABLE);
				log.warn("Could not persist {} entry, keeping previous one: {}", frequencyClass.key(), e.getMessage());
			}
		} else if (attempted > 0) {
			failures.add(FailureMode.ALL_ITEMS_FAILED);
			log.error("All {} fetches for {} failed, existing entry kept", attempted, frequencyClass.key());
		}

		RefreshReport report = new RefreshReport(frequencyClass, startedAt, clock.instant(), outcomes, committed, failures);
		log.info("Refresh finished: {}", report);
		return finish(report, committed ? entry : null);
	}

	private FetchResult fetchOne(DatasetDescriptor descriptor, Instant deadline) {
		String id = descriptor.getId();
		for (int attempt = 1; ; attempt++) {
			try {
				limiterFor(descriptor).acquire();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				log.warn("Interrupted while pacing {}", id);
				return FetchResult.of(RefreshOutcome.abandoned(id));
			}

			Duration lookback = descriptor.getLookback() != null ? descriptor.getLookback() : defaultLookback;
			Instant since = clock.instant().minus(lookback);
			Duration remaining = Duration.between(clock.instant(), deadline);
			if (remaining.isZero() || remaining.isNegative()) {
				return FetchResult.of(RefreshOutcome.abandoned(id));
			}

			log.debug("Fetching {} since {} (attempt {}/{})", id, since, attempt, maxAttempts);
			Future<TimeSeries> future = fetchExecutor.submit(() -> fetcher.fetch(id, descriptor.getFetchParams(), since));
			Throwable failure;
			try {
				TimeSeries series = future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
				if (series == null) {
					log.warn("Fetcher returned nothing for {}", id);
					return FetchResult.of(RefreshOutcome.failed(id, "fetcher returned null"));
				}
				log.debug("Fetched {} points for {}", series.size(), id);
				return FetchResult.success(RefreshOutcome.success(id, series.size()), series);
			} catch (ExecutionException e) {
				failure = e.getCause() != null ? e.getCause() : e;
			} catch (TimeoutException e) {
				future.cancel(true);
				log.warn("Fetch of {} did not finish before the refresh deadline", id);
				return FetchResult.of(RefreshOutcome.abandoned(id));
			} catch (InterruptedException e) {
				future.cancel(true);
				Thread.currentThread().interrupt();
				log.warn("Interrupted while fetching {}", id);
				return FetchResult.of(RefreshOutcome.abandoned(id));
			}

			Duration backoff = backoffFor(attempt);
			boolean retry = attempt < maxAttempts && isRetryable(failure)
				&& clock.instant().plus(backoff).isBefore(deadline);
			if (!retry) {
				log.warn("Fetch of {} failed after {} attempt(s): {}", id, attempt, failure.getMessage());
				log.debug("Fetch failure detail for {}", id, failure);
				return FetchResult.of(RefreshOutcome.failed(id, String.valueOf(failure.getMessage())));
			}
			log.info("Fetch of {} failed ({}), retrying in {}", id, failure.getMessage(), backoff);
			try {
				sleeper.sleep(backoff);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				log.warn("Interrupted while backing off {}", id);
				return FetchResult.of(RefreshOutcome.abandoned(id));
			}
		}
	}

	/**
	 * retryBackoff * 2^(attempt-1)
	 */
	Duration backoffFor(int attempt) {
		return retryBackoff.multipliedBy(1L << Math.min(attempt - 1, 20));
	}

	private static boolean isRetryable(Throwable failure) {
		return failure instanceof SBFetchFailException && ((SBFetchFailException) failure).isRetryable();
	}

	private RateLimiter limiterFor(DatasetDescriptor descriptor) {
		RateLimit own = descriptor.getRateLimit();
		if (own == null) {
			return defaultLimiter;
		}
		return datasetLimiters.compute(descriptor.getId(), (id, existing) ->
			existing != null && own.equals(existing.getLimit()) ? existing : new RateLimiter(id, own, minDelay, clock, sleeper));
	}

	/**
	 * 이번에 fetch 하지 않은 시계열은 이전 값과 이전 fetch 시각을 그대로 유지한다.
	 */
	private static void carryOver(FrequencyCacheEntry previous, String name,
								  Map<String, TimeSeries> payload, Map<String, Instant> seriesRefreshedAt) {
		if (previous == null) {
			return;
		}
		TimeSeries series = previous.getPayload().get(name);
		if (series != null) {
			payload.put(name, series);
			seriesRefreshedAt.put(name, previous.seriesRefreshedAt(name));
		}
	}

	private RefreshReport finish(RefreshReport report, FrequencyCacheEntry committed) {
		for (RefreshListener listener : listeners) {
			if (committed != null) {
				try {
					listener.onCommit(committed);
				} catch (RuntimeException e) {
					log.warn("Refresh listener {} failed on commit", listener, e);
				}
			}
			try {
				listener.onReport(report);
			} catch (RuntimeException e) {
				log.warn("Refresh listener {} failed on report", listener, e);
			}
		}
		return report;
	}

	private void ensureOpen() {
		if (closed.get()) {
			throw new IllegalStateException("RateLimitedFetchExecutor is closed");
		}
	}

	public StalenessEvaluator getEvaluator() {
		return evaluator;
	}

	public DatasetRegistry getRegistry() {
		return registry;
	}

	public FrequencyPartitionedStore getStore() {
		return store;
	}

	public Clock getClock() {
		return clock;
	}

	@Override
	public void close() {
		if (closed.compareAndSet(false, true)) {
			log.debug("Closing RateLimitedFetchExecutor");
			fetchExecutor.shutdownNow();
		}
	}

	private static final class FetchResult {
		private final RefreshOutcome outcome;
		private final TimeSeries series;

		private FetchResult(RefreshOutcome outcome, TimeSeries series) {
			this.outcome = outcome;
			this.series = series;
		}

		static FetchResult of(RefreshOutcome outcome) {
			return new FetchResult(outcome, null);
		}

		static FetchResult success(RefreshOutcome outcome, TimeSeries series) {
			return new FetchResult(outcome, series);
		}
	}

	public static class Builder {
		private SBDatasetFetcher fetcher;
		private DatasetRegistry registry;
		private FrequencyPartitionedStore store;
		private StalenessEvaluator evaluator;
		private Clock clock;
		private Sleeper sleeper;
		private RateLimit defaultRateLimit;
		private Duration minDelay = DEFAULT_MIN_DELAY;
		private Duration defaultLookback = DEFAULT_LOOKBACK;
		private Duration timeout = DEFAULT_TIMEOUT;
		private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
		private Duration retryBackoff = DEFAULT_RETRY_BACKOFF;
		private final List<RefreshListener> listeners = new ArrayList<>();

		public Builder fetcher(SBDatasetFetcher fetcher) {
			this.fetcher = fetcher;
			return this;
		}

		public Builder registry(DatasetRegistry registry) {
			this.registry = registry;
			return this;
		}

		public Builder store(FrequencyPartitionedStore store) {
			this.store = store;
			return this;
		}

		public Builder evaluator(StalenessEvaluator evaluator) {
			this.evaluator = evaluator;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * 자체 rateLimit 이 없는 데이터셋에 적용할 윈도우 제한 (null 이면 최소 간격만 적용)
		 */
		public Builder defaultRateLimit(RateLimit rateLimit) {
			this.defaultRateLimit = rateLimit;
			return this;
		}

		/**
		 * 연속 fetch 사이 최소 간격 (기본 500ms)
		 */
		public Builder minDelay(Duration minDelay) {
			if (minDelay == null || minDelay.isNegative()) {
				throw new IllegalArgumentException("minDelay must not be negative: " + minDelay);
			}
			this.minDelay = minDelay;
			return this;
		}

		public Builder defaultLookback(Duration lookback) {
			if (lookback == null || lookback.isNegative()) {
				throw new IllegalArgumentException("lookback must not be negative: " + lookback);
			}
			this.defaultLookback = lookback;
			return this;
		}

		/**
		 * 갱신 작업 전체의 wall-clock 제한 (기본 30분)
		 */
		public Builder timeout(Duration timeout) {
			if (timeout == null || timeout.isZero() || timeout.isNegative()) {
				throw new IllegalArgumentException("timeout must be positive: " + timeout);
			}
			this.timeout = timeout;
			return this;
		}

		/**
		 * 데이터셋 하나당 fetch 시도 횟수 (기본 3, 1 이면 재시도 없음)
		 */
		public Builder maxAttempts(int maxAttempts) {
			if (maxAttempts < 1) {
				throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
			}
			this.maxAttempts = maxAttempts;
			return this;
		}

		/**
		 * 첫 재시도 전 대기 시간. 이후 시도마다 두 배 (기본 500ms)
		 */
		public Builder retryBackoff(Duration retryBackoff) {
			if (retryBackoff == null || retryBackoff.isNegative()) {
				throw new IllegalArgumentException("retryBackoff must not be negative: " + retryBackoff);
			}
			this.retryBackoff = retryBackoff;
			return this;
		}

		public Builder listener(RefreshListener listener) {
			this.listeners.add(listener);
			return this;
		}

		public RateLimitedFetchExecutor build() {
			if (fetcher == null) {
				throw new IllegalArgumentException("SBDatasetFetcher must not be null");
			}
			if (registry == null) {
				throw new IllegalArgumentException("DatasetRegistry must not be null");
			}
			if (store == null) {
				throw new IllegalArgumentException("FrequencyPartitionedStore must not be null");
			}
			return new RateLimitedFetchExecutor(this);
		}
	}
}
