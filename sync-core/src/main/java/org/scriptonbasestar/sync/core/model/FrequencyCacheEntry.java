package org.scriptonbasestar.sync.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * frequency class 하나에 대한 영속 캐시 엔트리.
 * 항상 통째로 생성/교체되며 부분 갱신되지 않는다.
 *
 * @author archmagece
 * @since 2025-02
 */
public final class FrequencyCacheEntry {

	private final FrequencyClass frequencyClass;
	private final SortedMap<String, TimeSeries> payload;
	private final Instant refreshedAt;
	private final SortedMap<String, Instant> seriesRefreshedAt;  // 시계열별 마지막 fetch 시각

	public FrequencyCacheEntry(FrequencyClass frequencyClass, Map<String, TimeSeries> payload,
							   Instant refreshedAt, Map<String, Instant> seriesRefreshedAt) {
		this.frequencyClass = Objects.requireNonNull(frequencyClass, "frequencyClass");
		this.refreshedAt = Objects.requireNonNull(refreshedAt, "refreshedAt");
		this.payload = Collections.unmodifiableSortedMap(new TreeMap<>(payload));

		TreeMap<String, Instant> perSeries = new TreeMap<>();
		for (String name : this.payload.keySet()) {
			Instant at = seriesRefreshedAt != null ? seriesRefreshedAt.get(name) : null;
			perSeries.put(name, at != null ? at : refreshedAt);
		}
		this.seriesRefreshedAt = Collections.unmodifiableSortedMap(perSeries);
	}

	/**
	 * 모든 시계열이 같은 시각에 갱신된 엔트리
	 */
	public FrequencyCacheEntry(FrequencyClass frequencyClass, Map<String, TimeSeries> payload, Instant refreshedAt) {
		this(frequencyClass, payload, refreshedAt, null);
	}

	public FrequencyClass getFrequencyClass() {
		return frequencyClass;
	}

	public SortedMap<String, TimeSeries> getPayload() {
		return payload;
	}

	public Instant getRefreshedAt() {
		return refreshedAt;
	}

	public int getItemCount() {
		return payload.size();
	}

	public SortedMap<String, Instant> getSeriesRefreshedAt() {
		return seriesRefreshedAt;
	}

	/**
	 * @return 해당 시계열의 마지막 fetch 시각. 엔트리에 없으면 null
	 */
	public Instant seriesRefreshedAt(String seriesName) {
		return seriesRefreshedAt.get(seriesName);
	}

	public EntryMetadata metadata() {
		return new EntryMetadata(frequencyClass, refreshedAt, payload.size());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof FrequencyCacheEntry)) return false;
		FrequencyCacheEntry that = (FrequencyCacheEntry) o;
		return frequencyClass == that.frequencyClass
			&& refreshedAt.equals(that.refreshedAt)
			&& payload.equals(that.payload)
			&& seriesRefreshedAt.equals(that.seriesRefreshedAt);
	}

	@Override
	public int hashCode() {
		return Objects.hash(frequencyClass, refreshedAt, payload);
	}

	@Override
	public String toString() {
		return "FrequencyCacheEntry{" + frequencyClass.key() + ", refreshedAt=" + refreshedAt + ", items=" + payload.size() + "}";
	}
}
