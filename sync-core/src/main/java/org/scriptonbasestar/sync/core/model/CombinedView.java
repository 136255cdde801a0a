package org.scriptonbasestar.sync.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 모든 frequency 엔트리를 합친 파생 뷰. 진실의 원천(source of truth)이 아니다.
 * <p>
 * 시계열 이름 순으로 정렬되어 있어서 같은 엔트리 집합이면 항상 같은 뷰, 같은 {@link #render()} 결과가 나온다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public final class CombinedView {

	private static final CombinedView EMPTY = new CombinedView(Collections.emptyMap(), Collections.emptyMap());

	private final SortedMap<String, TimeSeries> series;
	private final SortedMap<String, Provenance> provenance;

	public CombinedView(Map<String, TimeSeries> series, Map<String, Provenance> provenance) {
		this.series = Collections.unmodifiableSortedMap(new TreeMap<>(series));
		this.provenance = Collections.unmodifiableSortedMap(new TreeMap<>(provenance));
		if (!this.series.keySet().equals(this.provenance.keySet())) {
			throw new IllegalArgumentException("Every series needs provenance: " + this.series.keySet() + " vs " + this.provenance.keySet());
		}
	}

	public static CombinedView empty() {
		return EMPTY;
	}

	public SortedMap<String, TimeSeries> getSeries() {
		return series;
	}

	public SortedMap<String, Provenance> getProvenance() {
		return provenance;
	}

	public TimeSeries series(String name) {
		return series.get(name);
	}

	public boolean isEmpty() {
		return series.isEmpty();
	}

	public int size() {
		return series.size();
	}

	/**
	 * 요청한 이름 중 존재하는 시계열만 남긴 뷰. 없는 이름은 무시한다.
	 */
	public CombinedView select(Collection<String> names) {
		TreeMap<String, TimeSeries> selected = new TreeMap<>();
		TreeMap<String, Provenance> selectedProvenance = new TreeMap<>();
		for (String name : names) {
			TimeSeries ts = series.get(name);
			if (ts != null) {
				selected.put(name, ts);
				selectedProvenance.put(name, provenance.get(name));
			}
		}
		return new CombinedView(selected, selectedProvenance);
	}

	/**
	 * timestamp 기준 정렬 (timestamp -> 시계열 이름 -> 값).
	 * 해당 시점에 값이 없는 시계열은 행에서 빠진다.
	 */
	public SortedMap<Instant, SortedMap<String, Double>> aligned() {
		TreeMap<Instant, SortedMap<String, Double>> rows = new TreeMap<>();
		series.forEach((name, ts) -> ts.points().forEach((at, value) ->
			rows.computeIfAbsent(at, k -> new TreeMap<>()).put(name, value)));
		return rows;
	}

	/**
	 * 결정적(canonical) 텍스트 표현. 스냅샷 비교나 디버깅용.
	 */
	public String render() {
		StringBuilder sb = new StringBuilder();
		series.forEach((name, ts) -> {
			Provenance p = provenance.get(name);
			sb.append(name).append('[').append(p.getFrequencyClass().key()).append('@').append(p.getRefreshedAt()).append(']');
			ts.points().forEach((at, value) -> sb.append(' ').append(at).append('=').append(value));
			sb.append('\n');
		});
		return sb.toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof CombinedView)) return false;
		CombinedView that = (CombinedView) o;
		return series.equals(that.series) && provenance.equals(that.provenance);
	}

	@Override
	public int hashCode() {
		return Objects.hash(series, provenance);
	}

	@Override
	public String toString() {
		return "CombinedView{series=" + series.keySet() + "}";
	}

	/**
	 * 시계열을 기여한 frequency class와 그 엔트리의 갱신 시각
	 */
	public static final class Provenance {
		private final FrequencyClass frequencyClass;
		private final Instant refreshedAt;

		public Provenance(FrequencyClass frequencyClass, Instant refreshedAt) {
			this.frequencyClass = Objects.requireNonNull(frequencyClass, "frequencyClass");
			this.refreshedAt = Objects.requireNonNull(refreshedAt, "refreshedAt");
		}

		public FrequencyClass getFrequencyClass() {
			return frequencyClass;
		}

		public Instant getRefreshedAt() {
			return refreshedAt;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (!(o instanceof Provenance)) return false;
			Provenance that = (Provenance) o;
			return frequencyClass == that.frequencyClass && refreshedAt.equals(that.refreshedAt);
		}

		@Override
		public int hashCode() {
			return Objects.hash(frequencyClass, refreshedAt);
		}

		@Override
		public String toString() {
			return frequencyClass.key() + "@" + refreshedAt;
		}
	}
}
