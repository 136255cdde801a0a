package org.scriptonbasestar.sync.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 외부 데이터셋 하나의 정의. 불변 객체이며 {@link #builder(String, FrequencyClass)}로 생성한다.
 * <p>
 * SLA는 descriptor가 아니라 frequency class에서 파생된다.
 * (SlaPolicy 참고)
 * </p>
 *
 * <pre>{@code
 * DatasetDescriptor dgs10 = DatasetDescriptor.builder("DGS10", FrequencyClass.DAILY)
 *     .displayName("10Y Treasury")
 *     .fetchParam("source", "fred")
 *     .requiresCredential(true)
 *     .rateLimit(RateLimit.perMinute(120))
 *     .build();
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public final class DatasetDescriptor {

	private final String id;
	private final String displayName;
	private final FrequencyClass frequencyClass;
	private final Map<String, String> fetchParams;
	private final boolean requiresCredential;
	private final RateLimit rateLimit;  // null이면 executor 기본값
	private final Duration lookback;    // null이면 executor 기본값
	private final boolean enabled;
	private final Set<String> tags;

	private DatasetDescriptor(Builder builder) {
		this.id = builder.id;
		this.displayName = builder.displayName != null ? builder.displayName : builder.id;
		this.frequencyClass = builder.frequencyClass;
		this.fetchParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fetchParams));
		this.requiresCredential = builder.requiresCredential;
		this.rateLimit = builder.rateLimit;
		this.lookback = builder.lookback;
		this.enabled = builder.enabled;
		this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
	}

	public static Builder builder(String id, FrequencyClass frequencyClass) {
		return new Builder(id, frequencyClass);
	}

	public String getId() {
		return id;
	}

	/**
	 * payload 안에서 쓰이는 시계열 이름. 지정하지 않으면 id와 같다.
	 */
	public String getDisplayName() {
		return displayName;
	}

	public FrequencyClass getFrequencyClass() {
		return frequencyClass;
	}

	public Map<String, String> getFetchParams() {
		return fetchParams;
	}

	public boolean isRequiresCredential() {
		return requiresCredential;
	}

	public RateLimit getRateLimit() {
		return rateLimit;
	}

	public Duration getLookback() {
		return lookback;
	}

	public boolean isEnabled() {
		return enabled;
	}

	public Set<String> getTags() {
		return tags;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof DatasetDescriptor)) return false;
		return id.equals(((DatasetDescriptor) o).id);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public String toString() {
		return "DatasetDescriptor{id=" + id + ", frequency=" + frequencyClass.key() + ", enabled=" + enabled + "}";
	}

	public static class Builder {
		private final String id;
		private final FrequencyClass frequencyClass;
		private String displayName;
		private final Map<String, String> fetchParams = new LinkedHashMap<>();
		private boolean requiresCredential = false;
		private RateLimit rateLimit;
		private Duration lookback;
		private boolean enabled = true;
		private final Set<String> tags = new LinkedHashSet<>();

		private Builder(String id, FrequencyClass frequencyClass) {
			if (id == null || id.trim().isEmpty()) {
				throw new IllegalArgumentException("Dataset id must not be empty");
			}
			this.id = id;
			this.frequencyClass = Objects.requireNonNull(frequencyClass, "frequencyClass");
		}

		public Builder displayName(String displayName) {
			this.displayName = displayName;
			return this;
		}

		public Builder fetchParam(String name, String value) {
			this.fetchParams.put(name, value);
			return this;
		}

		public Builder fetchParams(Map<String, String> params) {
			if (params != null) {
				this.fetchParams.putAll(params);
			}
			return this;
		}

		public Builder requiresCredential(boolean requiresCredential) {
			this.requiresCredential = requiresCredential;
			return this;
		}

		public Builder rateLimit(RateLimit rateLimit) {
			this.rateLimit = rateLimit;
			return this;
		}

		/**
		 * fetch 시작 범위 (now - lookback)
		 */
		public Builder lookback(Duration lookback) {
			if (lookback != null && lookback.isNegative()) {
				throw new IllegalArgumentException("lookback must not be negative: " + lookback);
			}
			this.lookback = lookback;
			return this;
		}

		public Builder enabled(boolean enabled) {
			this.enabled = enabled;
			return this;
		}

		public Builder tag(String tag) {
			this.tags.add(tag);
			return this;
		}

		public DatasetDescriptor build() {
			return new DatasetDescriptor(this);
		}
	}
}
