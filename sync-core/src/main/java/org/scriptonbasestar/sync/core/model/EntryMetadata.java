package org.scriptonbasestar.sync.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * payload를 디코딩하지 않고 읽을 수 있는 엔트리 헤더
 *
 * @author archmagece
 * @since 2025-02
 */
public final class EntryMetadata {

	private final FrequencyClass frequencyClass;
	private final Instant refreshedAt;
	private final int itemCount;

	public EntryMetadata(FrequencyClass frequencyClass, Instant refreshedAt, int itemCount) {
		this.frequencyClass = Objects.requireNonNull(frequencyClass, "frequencyClass");
		this.refreshedAt = Objects.requireNonNull(refreshedAt, "refreshedAt");
		this.itemCount = itemCount;
	}

	public FrequencyClass getFrequencyClass() {
		return frequencyClass;
	}

	public Instant getRefreshedAt() {
		return refreshedAt;
	}

	public int getItemCount() {
		return itemCount;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof EntryMetadata)) return false;
		EntryMetadata that = (EntryMetadata) o;
		return itemCount == that.itemCount && frequencyClass == that.frequencyClass && refreshedAt.equals(that.refreshedAt);
	}

	@Override
	public int hashCode() {
		return Objects.hash(frequencyClass, refreshedAt, itemCount);
	}

	@Override
	public String toString() {
		return "EntryMetadata{" + frequencyClass.key() + ", refreshedAt=" + refreshedAt + ", items=" + itemCount + "}";
	}
}
