package org.scriptonbasestar.sync.metrics.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.scriptonbasestar.sync.core.model.EntryMetadata;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.RefreshOutcome;
import org.scriptonbasestar.sync.core.model.RefreshReport;
import org.scriptonbasestar.sync.engine.fetch.RateLimitedFetchExecutor;
import org.scriptonbasestar.sync.engine.fetch.RefreshListener;
import org.scriptonbasestar.sync.store.file.FrequencyPartitionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * 갱신 결과와 엔트리 나이를 Micrometer 로 기록합니다.
 *
 * <ul>
 *   <li>sync.refresh.outcomes{frequency, status} - 데이터셋 결과 수 (Counter)</li>
 *   <li>sync.refresh.jobs{frequency, state} - 작업 결과 수 (Counter)</li>
 *   <li>sync.refresh.duration{frequency} - 작업 소요 시간 (Timer)</li>
 *   <li>sync.entry.age.seconds{frequency} - 엔트리 나이, 없으면 NaN (Gauge)</li>
 * </ul>
 *
 * <pre>{@code
 * SyncMetricsBinder.bindTo(executor, registry);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class SyncMetricsBinder implements RefreshListener {

	private static final Logger log = LoggerFactory.getLogger(SyncMetricsBinder.class);

	private final MeterRegistry meterRegistry;
	private final FrequencyPartitionedStore store;
	private final Clock clock;

	public SyncMetricsBinder(MeterRegistry meterRegistry, FrequencyPartitionedStore store, Clock clock) {
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}
		if (store == null) {
			throw new IllegalArgumentException("FrequencyPartitionedStore must not be null");
		}
		this.meterRegistry = meterRegistry;
		this.store = store;
		this.clock = clock != null ? clock : Clock.systemUTC();

		for (FrequencyClass fc : FrequencyClass.values()) {
			Gauge.builder("sync.entry.age.seconds", this, binder -> binder.entryAgeSeconds(fc))
				.tag("frequency", fc.key())
				.description("Seconds since the frequency entry was last committed")
				.register(meterRegistry);
		}
	}

	/**
	 * 실행기의 저장소와 시계로 바인더를 만들고 리스너로 등록합니다.
	 */
	public static SyncMetricsBinder bindTo(RateLimitedFetchExecutor executor, MeterRegistry meterRegistry) {
		SyncMetricsBinder binder = new SyncMetricsBinder(meterRegistry, executor.getStore(), executor.getClock());
		executor.addListener(binder);
		log.debug("Refresh metrics bound to {}", meterRegistry.getClass().getSimpleName());
		return binder;
	}

	@Override
	public void onReport(RefreshReport report) {
		String frequency = report.getFrequencyClass().key();
		for (RefreshOutcome outcome : report.getOutcomes()) {
			Counter.builder("sync.refresh.outcomes")
				.tag("frequency", frequency)
				.tag("status", outcome.getStatus().name())
				.description("Per-dataset refresh outcomes")
				.register(meterRegistry)
				.increment();
		}
		Counter.builder("sync.refresh.jobs")
			.tag("frequency", frequency)
			.tag("state", report.getState().name())
			.description("Refresh job results")
			.register(meterRegistry)
			.increment();
		Timer.builder("sync.refresh.duration")
			.tag("frequency", frequency)
			.description("Refresh job duration")
			.register(meterRegistry)
			.record(report.elapsed());
	}

	double entryAgeSeconds(FrequencyClass frequencyClass) {
		EntryMetadata metadata = store.metadata(frequencyClass);
		if (metadata == null) {
			return Double.NaN;
		}
		return Duration.between(metadata.getRefreshedAt(), clock.instant()).toMillis() / 1000.0;
	}
}
