package org.scriptonbasestar.sync.engine.response;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 백엔드에 저장되는 응답 캐시 항목 {key, value, storedAt, ttl}
 *
 * @author archmagece
 * @since 2025-02
 */
@JsonPropertyOrder({"key", "storedAt", "ttlMillis", "value"})
public class ResponseCacheEnvelope {

	private String key;
	private long storedAt;    // epoch millis
	private long ttlMillis;
	private JsonNode value;

	public ResponseCacheEnvelope() {
	}

	public ResponseCacheEnvelope(String key, long storedAt, long ttlMillis, JsonNode value) {
		this.key = key;
		this.storedAt = storedAt;
		this.ttlMillis = ttlMillis;
		this.value = value;
	}

	public String getKey() {
		return key;
	}

	public void setKey(String key) {
		this.key = key;
	}

	public long getStoredAt() {
		return storedAt;
	}

	public void setStoredAt(long storedAt) {
		this.storedAt = storedAt;
	}

	public long getTtlMillis() {
		return ttlMillis;
	}

	public void setTtlMillis(long ttlMillis) {
		this.ttlMillis = ttlMillis;
	}

	public JsonNode getValue() {
		return value;
	}

	public void setValue(JsonNode value) {
		this.value = value;
	}

	boolean isExpired(long nowMillis) {
		return nowMillis - storedAt >= ttlMillis;
	}
}
