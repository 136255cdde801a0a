package org.scriptonbasestar.sync.engine;

import org.scriptonbasestar.sync.core.model.CombinedView;
import org.scriptonbasestar.sync.core.model.FrequencyCacheEntry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.RefreshReport;
import org.scriptonbasestar.sync.core.model.RefreshStatus;
import org.scriptonbasestar.sync.core.writer.SBCombinedViewSink;
import org.scriptonbasestar.sync.core.writer.SBSnapshotWriter;
import org.scriptonbasestar.sync.engine.fetch.RateLimitedFetchExecutor;
import org.scriptonbasestar.sync.engine.fetch.RefreshListener;
import org.scriptonbasestar.sync.engine.response.ReadThroughResponseCache;
import org.scriptonbasestar.sync.engine.response.ResponseCacheStats;
import org.scriptonbasestar.sync.engine.schedule.RefreshScheduler;
import org.scriptonbasestar.sync.engine.view.CacheReconstitutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 두 계층을 묶는 진입점.
 * <p>
 * 엔트리가 커밋되면 순서대로:
 * 뷰 무효화, 데이터 응답 무효화, 병합 뷰 스냅샷, sink 전달.
 * 각 단계는 best-effort 이며 실패해도 다음 단계는 진행한다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public class TieredSyncService implements RefreshListener, AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(TieredSyncService.class);

	public static final String SNAPSHOT_LABEL = "combined";

	private final RateLimitedFetchExecutor executor;
	private final CacheReconstitutionEngine viewEngine;
	private final ReadThroughResponseCache responseCache;
	private final RefreshScheduler scheduler;
	private final SBSnapshotWriter snapshotWriter;  // null 이면 스냅샷 없음
	private final SBCombinedViewSink sink;          // null 이면 sink 없음
	private final List<String> invalidatePaths;

	private TieredSyncService(Builder builder) {
		this.executor = builder.executor;
		this.viewEngine = builder.viewEngine;
		this.responseCache = builder.responseCache;
		this.scheduler = builder.scheduler != null ? builder.scheduler : RefreshScheduler.builder(executor).build();
		this.snapshotWriter = builder.snapshotWriter;
		this.sink = builder.sink;
		this.invalidatePaths = builder.invalidatePaths != null
			? new ArrayList<>(builder.invalidatePaths)
			: new ArrayList<>(responseCache.getCachePaths());
		executor.addListener(this);
	}

	public static Builder builder() {
		return new Builder();
	}

	public RefreshReport runNow(FrequencyClass frequencyClass, boolean force) {
		return scheduler.runNow(frequencyClass, force);
	}

	/**
	 * 모든 class 를 빠른 주기부터 차례로 갱신합니다.
	 */
	public List<RefreshReport> runAll(boolean force) {
		List<RefreshReport> reports = new ArrayList<>();
		for (FrequencyClass fc : FrequencyClass.values()) {
			reports.add(runNow(fc, force));
		}
		return reports;
	}

	public RefreshStatus status(FrequencyClass frequencyClass) {
		return scheduler.status(frequencyClass);
	}

	public Map<FrequencyClass, RefreshStatus> statuses() {
		return scheduler.statuses();
	}

	public CombinedView combinedView() {
		return viewEngine.combined();
	}

	public CombinedView combinedView(Collection<String> seriesNames) {
		return viewEngine.combined(seriesNames);
	}

	public ResponseCacheStats cacheStats() {
		return responseCache.stats();
	}

	public long invalidateResponses(String pattern) {
		return responseCache.deleteByPattern(pattern);
	}

	public void start() {
		scheduler.start();
	}

	@Override
	public void onCommit(FrequencyCacheEntry entry) {
		viewEngine.invalidate();

		long invalidated = 0;
		for (String path : invalidatePaths) {
			invalidated += responseCache.invalidatePath(path);
		}
		log.debug("{} committed, {} cached responses invalidated", entry.getFrequencyClass().key(), invalidated);

		if (snapshotWriter == null && sink == null) {
			return;
		}
		CombinedView view = viewEngine.combined();
		if (snapshotWriter != null) {
			snapshotWriter.snapshot(view, SNAPSHOT_LABEL);
		}
		if (sink != null) {
			try {
				sink.accept(view);
			} catch (RuntimeException e) {
				log.warn("Combined view sink failed: {}", e.getMessage(), e);
			}
		}
	}

	public RateLimitedFetchExecutor getExecutor() {
		return executor;
	}

	public CacheReconstitutionEngine getViewEngine() {
		return viewEngine;
	}

	public ReadThroughResponseCache getResponseCache() {
		return responseCache;
	}

	public RefreshScheduler getScheduler() {
		return scheduler;
	}

	@Override
	public void close() {
		executor.removeListener(this);
		scheduler.close();
		executor.close();
	}

	public static class Builder {
		private RateLimitedFetchExecutor executor;
		private CacheReconstitutionEngine viewEngine;
		private ReadThroughResponseCache responseCache;
		private RefreshScheduler scheduler;
		private SBSnapshotWriter snapshotWriter;
		private SBCombinedViewSink sink;
		private List<String> invalidatePaths;

		public Builder executor(RateLimitedFetchExecutor executor) {
			this.executor = executor;
			return this;
		}

		public Builder viewEngine(CacheReconstitutionEngine viewEngine) {
			this.viewEngine = viewEngine;
			return this;
		}

		public Builder responseCache(ReadThroughResponseCache responseCache) {
			this.responseCache = responseCache;
			return this;
		}

		public Builder scheduler(RefreshScheduler scheduler) {
			this.scheduler = scheduler;
			return this;
		}

		public Builder snapshotWriter(SBSnapshotWriter snapshotWriter) {
			this.snapshotWriter = snapshotWriter;
			return this;
		}

		public Builder sink(SBCombinedViewSink sink) {
			this.sink = sink;
			return this;
		}

		/**
		 * 커밋 시 무효화할 응답 path prefix. 지정하지 않으면 응답 캐시의 허용 path 전부
		 */
		public Builder invalidatePaths(List<String> invalidatePaths) {
			this.invalidatePaths = invalidatePaths;
			return this;
		}

		public TieredSyncService build() {
			if (executor == null) {
				throw new IllegalArgumentException("RateLimitedFetchExecutor must not be null");
			}
			if (viewEngine == null) {
				viewEngine = new CacheReconstitutionEngine(executor.getStore());
			}
			if (responseCache == null) {
				responseCache = ReadThroughResponseCache.builder().build();
			}
			return new TieredSyncService(this);
		}
	}
}
