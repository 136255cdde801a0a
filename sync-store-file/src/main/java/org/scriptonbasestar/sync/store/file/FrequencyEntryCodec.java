package org.scriptonbasestar.sync.store.file;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.sync.core.model.EntryMetadata;
import org.scriptonbasestar.sync.core.model.FrequencyCacheEntry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * FrequencyCacheEntry JSON 인코더/디코더 (Jackson)
 *
 * @author archmagece
 * @since 2025-02
 */
public class FrequencyEntryCodec {

	private static final Logger log = LoggerFactory.getLogger(FrequencyEntryCodec.class);

	private final ObjectMapper objectMapper;

	public FrequencyEntryCodec() {
		this(new ObjectMapper());
	}

	public FrequencyEntryCodec(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	public byte[] encode(FrequencyCacheEntry entry) throws IOException {
		return objectMapper.writeValueAsBytes(toDocument(entry));
	}

	/**
	 * @throws IOException JSON 구문 오류
	 * @throws IllegalArgumentException 구문은 맞지만 내용이 엔트리 불변식을 어기는 경우
	 */
	public FrequencyCacheEntry decode(byte[] bytes) throws IOException {
		FrequencyEntryDocument doc = objectMapper.readValue(bytes, FrequencyEntryDocument.class);
		return fromDocument(doc);
	}

	/**
	 * 헤더 필드만 읽고 payload 직전에서 멈춘다.
	 *
	 * @return 메타데이터, 헤더 필드가 빠져 있으면 IllegalArgumentException
	 */
	public EntryMetadata readMetadata(byte[] bytes) throws IOException {
		String frequency = null;
		String refreshedAt = null;
		Integer itemCount = null;

		try (JsonParser parser = objectMapper.getFactory().createParser(bytes)) {
			if (parser.nextToken() != JsonToken.START_OBJECT) {
				throw new IOException("Entry is not a JSON object");
			}
			while (parser.nextToken() == JsonToken.FIELD_NAME) {
				String field = parser.currentName();
				if (FrequencyEntryDocument.FIELD_PAYLOAD.equals(field)) {
					break;
				}
				JsonToken value = parser.nextToken();
				switch (field) {
					case "frequencyClass":
						frequency = parser.getValueAsString();
						break;
					case "refreshedAt":
						refreshedAt = parser.getValueAsString();
						break;
					case "itemCount":
						itemCount = parser.getIntValue();
						break;
					default:
						if (value == JsonToken.START_OBJECT || value == JsonToken.START_ARRAY) {
							parser.skipChildren();
						}
				}
				if (frequency != null && refreshedAt != null && itemCount != null) {
					break;
				}
			}
		}

		if (frequency == null || refreshedAt == null || itemCount == null) {
			throw new IllegalArgumentException("Entry header incomplete: frequencyClass=" + frequency
				+ ", refreshedAt=" + refreshedAt + ", itemCount=" + itemCount);
		}
		return new EntryMetadata(FrequencyClass.fromKey(frequency), parseInstant(refreshedAt), itemCount);
	}

	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	FrequencyEntryDocument toDocument(FrequencyCacheEntry entry) {
		FrequencyEntryDocument doc = new FrequencyEntryDocument();
		doc.setFrequencyClass(entry.getFrequencyClass().key());
		doc.setRefreshedAt(entry.getRefreshedAt().toString());
		doc.setItemCount(entry.getItemCount());

		Map<String, String> perSeries = new TreeMap<>();
		entry.getSeriesRefreshedAt().forEach((name, at) -> perSeries.put(name, at.toString()));
		doc.setSeriesRefreshedAt(perSeries);

		Map<String, List<PointDocument>> payload = new TreeMap<>();
		entry.getPayload().forEach((name, series) -> {
			List<PointDocument> points = new ArrayList<>(series.size());
			series.points().forEach((at, value) -> points.add(new PointDocument(at.toString(), value)));
			payload.put(name, points);
		});
		doc.setPayload(payload);
		return doc;
	}

	FrequencyCacheEntry fromDocument(FrequencyEntryDocument doc) {
		if (doc.getFrequencyClass() == null) {
			throw new IllegalArgumentException("frequencyClass missing");
		}
		FrequencyClass frequencyClass = FrequencyClass.fromKey(doc.getFrequencyClass());
		Map<String, List<PointDocument>> rawPayload = doc.getPayload() != null ? doc.getPayload() : new TreeMap<>();

		if (rawPayload.size() != doc.getItemCount()) {
			throw new IllegalArgumentException("itemCount " + doc.getItemCount() + " does not match payload size " + rawPayload.size());
		}

		Map<String, TimeSeries> payload = new TreeMap<>();
		for (Map.Entry<String, List<PointDocument>> e : rawPayload.entrySet()) {
			List<TimeSeries.Point> points = new ArrayList<>(e.getValue().size());
			for (PointDocument point : e.getValue()) {
				if (point == null || point.getAt() == null) {
					throw new IllegalArgumentException("Malformed point in series " + e.getKey());
				}
				points.add(new TimeSeries.Point(parseInstant(point.getAt()), point.getValue()));
			}
			payload.put(e.getKey(), TimeSeries.of(points));
		}

		Map<String, Instant> perSeries = new TreeMap<>();
		if (doc.getSeriesRefreshedAt() != null) {
			doc.getSeriesRefreshedAt().forEach((name, at) -> perSeries.put(name, parseInstant(at)));
		}

		FrequencyCacheEntry entry = new FrequencyCacheEntry(frequencyClass, payload, parseInstant(doc.getRefreshedAt()), perSeries);
		log.trace("Decoded {}", entry);
		return entry;
	}

	/**
	 * @throws IllegalArgumentException ISO-8601 instant 가 아닌 경우
	 */
	static Instant parseInstant(String text) {
		if (text == null) {
			throw new IllegalArgumentException("Timestamp missing");
		}
		try {
			return Instant.parse(text);
		} catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Malformed timestamp: " + text, e);
		}
	}
}
