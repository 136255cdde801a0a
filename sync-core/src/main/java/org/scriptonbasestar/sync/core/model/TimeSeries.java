package org.scriptonbasestar.sync.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * (timestamp, value) 쌍의 정렬된 시퀀스. timestamp는 유일하고 단조 증가한다.
 * <p>
 * 정렬되지 않은 입력은 생성 시 정렬하고, 중복 timestamp는 거부한다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public final class TimeSeries {

	private static final TimeSeries EMPTY = new TimeSeries(new TreeMap<>());

	private final NavigableMap<Instant, Double> points;

	private TimeSeries(TreeMap<Instant, Double> points) {
		this.points = Collections.unmodifiableNavigableMap(points);
	}

	public static TimeSeries empty() {
		return EMPTY;
	}

	/**
	 * @throws IllegalArgumentException timestamp 중복 또는 null
	 */
	public static TimeSeries of(List<Point> points) {
		TreeMap<Instant, Double> sorted = new TreeMap<>();
		for (Point point : points) {
			if (sorted.put(point.getTimestamp(), point.getValue()) != null) {
				throw new IllegalArgumentException("Duplicate timestamp in series: " + point.getTimestamp());
			}
		}
		return new TimeSeries(sorted);
	}

	/**
	 * 이미 timestamp로 키가 잡힌 맵에서 생성 (중복이 있을 수 없다)
	 */
	public static TimeSeries of(Map<Instant, Double> points) {
		return new TimeSeries(new TreeMap<>(points));
	}

	public static Builder builder() {
		return new Builder();
	}

	public NavigableMap<Instant, Double> points() {
		return points;
	}

	public List<Point> asList() {
		List<Point> list = new ArrayList<>(points.size());
		points.forEach((ts, value) -> list.add(new Point(ts, value)));
		return list;
	}

	public Double valueAt(Instant timestamp) {
		return points.get(timestamp);
	}

	public int size() {
		return points.size();
	}

	public boolean isEmpty() {
		return points.isEmpty();
	}

	public Instant firstTimestamp() {
		return points.isEmpty() ? null : points.firstKey();
	}

	public Instant lastTimestamp() {
		return points.isEmpty() ? null : points.lastKey();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TimeSeries)) return false;
		return points.equals(((TimeSeries) o).points);
	}

	@Override
	public int hashCode() {
		return points.hashCode();
	}

	@Override
	public String toString() {
		return "TimeSeries{size=" + points.size() + ", first=" + firstTimestamp() + ", last=" + lastTimestamp() + "}";
	}

	public static final class Point {
		private final Instant timestamp;
		private final double value;

		public Point(Instant timestamp, double value) {
			this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
			this.value = value;
		}

		public Instant getTimestamp() {
			return timestamp;
		}

		public double getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (!(o instanceof Point)) return false;
			Point point = (Point) o;
			return Double.compare(point.value, value) == 0 && timestamp.equals(point.timestamp);
		}

		@Override
		public int hashCode() {
			return Objects.hash(timestamp, value);
		}

		@Override
		public String toString() {
			return timestamp + "=" + value;
		}
	}

	public static class Builder {
		private final List<Point> points = new ArrayList<>();

		public Builder point(Instant timestamp, double value) {
			points.add(new Point(timestamp, value));
			return this;
		}

		public TimeSeries build() {
			return TimeSeries.of(points);
		}
	}
}
