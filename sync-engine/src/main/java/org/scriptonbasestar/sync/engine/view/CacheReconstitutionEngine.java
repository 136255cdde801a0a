package org.scriptonbasestar.sync.engine.view;

import org.scriptonbasestar.sync.core.model.CombinedView;
import org.scriptonbasestar.sync.core.model.FrequencyCacheEntry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.TimeSeries;
import org.scriptonbasestar.sync.engine.fetch.RefreshListener;
import org.scriptonbasestar.sync.store.file.FrequencyPartitionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * frequency 엔트리들을 합쳐 하나의 {@link CombinedView}를 만든다. 저장소에는 쓰지 않는다.
 * <p>
 * 같은 이름의 시계열이 여러 엔트리에 있으면 refreshedAt 이 가장 최근인 엔트리가 이긴다.
 * 동률이면 더 느린 주기(enum 뒤쪽)가 이긴다.
 * </p>
 * <p>
 * 결과는 메모이즈되고 {@link #invalidate()} 시 버려진다. 세대(generation) 번호로 보호하므로
 * 커밋 이전 데이터로 만든 뷰가 무효화 이후에 캐시되는 일은 없다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public class CacheReconstitutionEngine implements RefreshListener {

	private static final Logger log = LoggerFactory.getLogger(CacheReconstitutionEngine.class);

	private final FrequencyPartitionedStore store;
	private final AtomicLong generation = new AtomicLong();
	private volatile Memo memo;

	public CacheReconstitutionEngine(FrequencyPartitionedStore store) {
		if (store == null) {
			throw new IllegalArgumentException("FrequencyPartitionedStore must not be null");
		}
		this.store = store;
	}

	public CombinedView combined() {
		long gen = generation.get();
		Memo current = memo;
		if (current != null && current.generation == gen) {
			return current.view;
		}

		CombinedView built = build();
		synchronized (this) {
			if (generation.get() == gen) {
				memo = new Memo(gen, built);
			}
		}
		return built;
	}

	/**
	 * 요청한 시계열만 담은 뷰. 없는 이름은 무시한다.
	 */
	public CombinedView combined(Collection<String> seriesNames) {
		return combined().select(seriesNames);
	}

	public void invalidate() {
		synchronized (this) {
			generation.incrementAndGet();
			memo = null;
		}
		log.debug("Combined view invalidated");
	}

	@Override
	public void onCommit(FrequencyCacheEntry entry) {
		invalidate();
	}

	CombinedView build() {
		Map<String, TimeSeries> series = new TreeMap<>();
		Map<String, CombinedView.Provenance> provenance = new TreeMap<>();
		int entries = 0;

		for (FrequencyClass fc : FrequencyClass.values()) {
			FrequencyCacheEntry entry = store.get(fc);
			if (entry == null) {
				continue;
			}
			entries++;
			for (Map.Entry<String, TimeSeries> e : entry.getPayload().entrySet()) {
				CombinedView.Provenance existing = provenance.get(e.getKey());
				if (existing != null) {
					if (entry.getRefreshedAt().isBefore(existing.getRefreshedAt())) {
						continue;
					}
					log.debug("Series {} present in {} and {}, using {}", e.getKey(),
						existing.getFrequencyClass().key(), fc.key(), fc.key());
				}
				series.put(e.getKey(), e.getValue());
				provenance.put(e.getKey(), new CombinedView.Provenance(fc, entry.getRefreshedAt()));
			}
		}

		log.debug("Combined view rebuilt from {} entries, {} series", entries, series.size());
		return new CombinedView(series, provenance);
	}

	private static final class Memo {
		private final long generation;
		private final CombinedView view;

		private Memo(long generation, CombinedView view) {
			this.generation = generation;
			this.view = view;
		}
	}
}
