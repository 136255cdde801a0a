package org.scriptonbasestar.sync.store.file;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * {@link org.scriptonbasestar.sync.core.model.FrequencyCacheEntry}의 JSON 형태.
 * 헤더 필드가 payload보다 먼저 나와야 메타데이터만 읽을 때 payload를 건너뛸 수 있다.
 * 시각은 ISO-8601 문자열(나노초 정밀도 유지), 포인트는 [시각, value] 배열로 기록한다.
 *
 * @author archmagece
 * @since 2025-02
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"frequencyClass", "refreshedAt", "itemCount", "seriesRefreshedAt", "payload"})
public class FrequencyEntryDocument {

	public static final String FIELD_PAYLOAD = "payload";

	private String frequencyClass;
	private String refreshedAt;
	private int itemCount;
	private Map<String, String> seriesRefreshedAt;
	private Map<String, List<PointDocument>> payload;

	public String getFrequencyClass() {
		return frequencyClass;
	}

	public void setFrequencyClass(String frequencyClass) {
		this.frequencyClass = frequencyClass;
	}

	public String getRefreshedAt() {
		return refreshedAt;
	}

	public void setRefreshedAt(String refreshedAt) {
		this.refreshedAt = refreshedAt;
	}

	public int getItemCount() {
		return itemCount;
	}

	public void setItemCount(int itemCount) {
		this.itemCount = itemCount;
	}

	public Map<String, String> getSeriesRefreshedAt() {
		return seriesRefreshedAt;
	}

	public void setSeriesRefreshedAt(Map<String, String> seriesRefreshedAt) {
		this.seriesRefreshedAt = seriesRefreshedAt;
	}

	public Map<String, List<PointDocument>> getPayload() {
		return payload;
	}

	public void setPayload(Map<String, List<PointDocument>> payload) {
		this.payload = payload;
	}
}
