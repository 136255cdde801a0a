package org.scriptonbasestar.sync.core.freshness;

import org.scriptonbasestar.sync.core.model.FrequencyClass;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * frequency class별 SLA.
 * 빠른 주기에서 느린 주기로 갈수록 SLA가 줄어들면 안 된다 (monotonic non-decreasing).
 *
 * @author archmagece
 * @since 2025-02
 */
public final class SlaPolicy {

	private static final SlaPolicy DEFAULTS = new SlaPolicy(Collections.emptyMap());

	private final EnumMap<FrequencyClass, Duration> slas = new EnumMap<>(FrequencyClass.class);

	private SlaPolicy(Map<FrequencyClass, Duration> overrides) {
		for (FrequencyClass fc : FrequencyClass.values()) {
			Duration sla = overrides.get(fc);
			if (sla == null) {
				sla = fc.defaultSla();
			} else if (sla.isZero() || sla.isNegative()) {
				throw new IllegalArgumentException("SLA must be positive: " + fc.key() + "=" + sla);
			}
			slas.put(fc, sla);
		}

		Duration previous = Duration.ZERO;
		FrequencyClass previousClass = null;
		for (FrequencyClass fc : FrequencyClass.values()) {
			Duration sla = slas.get(fc);
			if (sla.compareTo(previous) < 0) {
				throw new IllegalArgumentException("SLA must not decrease from " + previousClass.key()
					+ " (" + previous + ") to " + fc.key() + " (" + sla + ")");
			}
			previous = sla;
			previousClass = fc;
		}
	}

	public static SlaPolicy defaults() {
		return DEFAULTS;
	}

	/**
	 * @param overrides 지정하지 않은 class는 기본 SLA
	 * @throws IllegalArgumentException 0 이하 SLA, 또는 단조성 위반
	 */
	public static SlaPolicy withOverrides(Map<FrequencyClass, Duration> overrides) {
		return new SlaPolicy(overrides != null ? overrides : Collections.emptyMap());
	}

	public Duration slaOf(FrequencyClass frequencyClass) {
		return slas.get(frequencyClass);
	}

	public Map<FrequencyClass, Duration> asMap() {
		return Collections.unmodifiableMap(slas);
	}

	@Override
	public String toString() {
		return "SlaPolicy" + slas;
	}
}
