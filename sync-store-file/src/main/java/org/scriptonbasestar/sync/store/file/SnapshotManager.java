package org.scriptonbasestar.sync.store.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.scriptonbasestar.sync.core.model.CombinedView;
import org.scriptonbasestar.sync.core.model.FrequencyCacheEntry;
import org.scriptonbasestar.sync.core.writer.SBSnapshotWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 백업/보존 관리자.
 * <p>
 * {@code <yyyyMMdd'T'HHmmss'Z'>_<label>.json} 형식의 불변 사본을 남기고, 오래된 사본을 정리한다.
 * snapshot 실패는 로그만 남기고 호출자에게 전파하지 않는다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public class SnapshotManager implements SBSnapshotWriter {

	private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

	static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
	private static final String SUFFIX = ".json";
	private static final int STAMP_LENGTH = 16;
	private static final int MAX_NAME_ATTEMPTS = 100;

	private final Path directory;
	private final ObjectMapper objectMapper;
	private final FrequencyEntryCodec codec;
	private final Clock clock;

	public SnapshotManager(Path directory) {
		this(directory, new ObjectMapper(), Clock.systemUTC());
	}

	public SnapshotManager(Path directory, ObjectMapper objectMapper, Clock clock) {
		if (directory == null) {
			throw new IllegalArgumentException("Directory must not be null");
		}
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		if (clock == null) {
			throw new IllegalArgumentException("Clock must not be null");
		}
		this.directory = directory;
		this.objectMapper = objectMapper.copy().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
		this.codec = new FrequencyEntryCodec(this.objectMapper);
		this.clock = clock;
	}

	@Override
	public boolean snapshot(Object payload, String label) {
		String safeLabel = sanitize(label);
		Instant now = clock.instant();
		try {
			Files.createDirectories(directory);
			Object document = toDocument(payload);
			for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
				Path file = directory.resolve(fileName(now, safeLabel, attempt));
				try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
					objectMapper.writeValue(out, document);
					log.info("Snapshot written: {}", file);
					return true;
				} catch (FileAlreadyExistsException e) {
					log.trace("Snapshot name taken: {}", file);
				}
			}
			log.warn("Could not find a free snapshot name for {} at {}", safeLabel, now);
			return false;
		} catch (IOException | RuntimeException e) {
			log.warn("Snapshot {} failed: {}", safeLabel, e.getMessage(), e);
			return false;
		}
	}

	/**
	 * 보존 기간을 넘긴 스냅샷을 삭제합니다.
	 *
	 * @param maxAgeDays 보존 일수. 음수면 모두 보존
	 * @return 삭제한 파일 수
	 */
	public int prune(int maxAgeDays) {
		if (maxAgeDays < 0) {
			log.debug("Retention disabled (maxAgeDays={}), nothing pruned", maxAgeDays);
			return 0;
		}
		Instant threshold = clock.instant().minus(Duration.ofDays(maxAgeDays));
		int deleted = 0;
		for (Path file : list()) {
			Instant createdAt = createdAt(file);
			if (createdAt != null && createdAt.isBefore(threshold)) {
				try {
					if (Files.deleteIfExists(file)) {
						deleted++;
						log.debug("Pruned snapshot {}", file.getFileName());
					}
				} catch (IOException e) {
					log.warn("Failed to prune snapshot {}: {}", file, e.getMessage());
				}
			}
		}
		if (deleted > 0) {
			log.info("Pruned {} snapshots older than {} days", deleted, maxAgeDays);
		}
		return deleted;
	}

	/**
	 * @return 스냅샷 파일 목록, 최신 순
	 */
	public List<Path> list() {
		if (!Files.isDirectory(directory)) {
			return new ArrayList<>();
		}
		try (Stream<Path> files = Files.list(directory)) {
			return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
				.sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
				.collect(Collectors.toList());
		} catch (IOException e) {
			log.warn("Failed to list snapshots in {}: {}", directory, e.getMessage());
			return new ArrayList<>();
		}
	}

	public Path getDirectory() {
		return directory;
	}

	/**
	 * 파일명의 타임스탬프, 파싱할 수 없으면 파일 수정 시각
	 */
	Instant createdAt(Path file) {
		String name = file.getFileName().toString();
		if (name.length() > STAMP_LENGTH) {
			try {
				return LocalDateTime.parse(name.substring(0, STAMP_LENGTH), STAMP).toInstant(ZoneOffset.UTC);
			} catch (DateTimeParseException e) {
				log.trace("No timestamp prefix in {}", name);
			}
		}
		try {
			return Files.getLastModifiedTime(file).toInstant();
		} catch (IOException e) {
			log.warn("Cannot determine age of {}: {}", file, e.getMessage());
			return null;
		}
	}

	static String fileName(Instant at, String label, int attempt) {
		return STAMP.format(at) + "_" + label + (attempt > 0 ? "-" + attempt : "") + SUFFIX;
	}

	private Object toDocument(Object payload) {
		if (payload instanceof FrequencyCacheEntry) {
			return codec.toDocument((FrequencyCacheEntry) payload);
		}
		if (payload instanceof CombinedView) {
			return combinedDocument((CombinedView) payload);
		}
		return payload;
	}

	private Map<String, Object> combinedDocument(CombinedView view) {
		Map<String, Object> doc = new LinkedHashMap<>();
		Map<String, Object> series = new LinkedHashMap<>();
		view.getSeries().forEach((name, ts) -> {
			CombinedView.Provenance provenance = view.getProvenance().get(name);
			Map<String, Object> one = new LinkedHashMap<>();
			one.put("frequencyClass", provenance.getFrequencyClass().key());
			one.put("refreshedAt", provenance.getRefreshedAt().toString());
			List<PointDocument> points = new ArrayList<>(ts.size());
			ts.points().forEach((at, value) -> points.add(new PointDocument(at.toString(), value)));
			one.put("points", points);
			series.put(name, one);
		});
		doc.put("seriesCount", view.size());
		doc.put("series", series);
		return doc;
	}

	private static String sanitize(String label) {
		if (label == null || label.isBlank()) {
			return "snapshot";
		}
		return label.replaceAll("[^A-Za-z0-9._-]", "_");
	}
}
