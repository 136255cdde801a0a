package org.scriptonbasestar.sync.store.file;

import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;
import org.scriptonbasestar.sync.core.store.SBKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 디렉터리 하나를 key-value 저장소로 쓴다. 키 하나가 파일 하나.
 * <p>
 * 쓰기는 같은 디렉터리에 임시 파일을 만든 뒤 rename 으로 교체하므로,
 * 읽는 쪽은 이전 값 또는 새 값 중 하나만 본다.
 * </p>
 *
 * <pre>{@code
 * SBKeyValueStore store = new FileKeyValueStore(Paths.get("data/cache"));
 * store.put("frequency-cache:daily", bytes);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
public class FileKeyValueStore implements SBKeyValueStore {

	private static final Logger log = LoggerFactory.getLogger(FileKeyValueStore.class);

	static final String SUFFIX = ".cache";
	private static final String TMP_SUFFIX = ".tmp";

	private final Path directory;

	public FileKeyValueStore(Path directory) {
		if (directory == null) {
			throw new IllegalArgumentException("Directory must not be null");
		}
		this.directory = directory;
		log.debug("FileKeyValueStore initialized at {}", directory.toAbsolutePath());
	}

	@Override
	public byte[] get(String key) throws SBStoreUnavailableException {
		Path file = fileOf(key);
		try {
			byte[] bytes = Files.readAllBytes(file);
			log.trace("Read {} bytes from {}", bytes.length, file);
			return bytes;
		} catch (NoSuchFileException e) {
			log.trace("No file for key {}", key);
			return null;
		} catch (IOException e) {
			throw new SBStoreUnavailableException("Failed to read key " + key + " from " + file, e);
		}
	}

	@Override
	public void put(String key, byte[] value) throws SBStoreUnavailableException {
		if (value == null) {
			throw new IllegalArgumentException("Value must not be null");
		}
		Path target = fileOf(key);
		Path tmp = null;
		try {
			Files.createDirectories(directory);
			tmp = Files.createTempFile(directory, target.getFileName().toString(), TMP_SUFFIX);
			Files.write(tmp, value);
			try {
				Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException e) {
				log.debug("Atomic move not supported in {}, falling back to replace", directory);
				Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
			}
			log.trace("Wrote {} bytes to {}", value.length, target);
		} catch (IOException e) {
			deleteQuietly(tmp);
			throw new SBStoreUnavailableException("Failed to write key " + key + " to " + target, e);
		}
	}

	@Override
	public boolean delete(String key) throws SBStoreUnavailableException {
		Path file = fileOf(key);
		try {
			return Files.deleteIfExists(file);
		} catch (IOException e) {
			throw new SBStoreUnavailableException("Failed to delete key " + key, e);
		}
	}

	/**
	 * 저장된 키 목록 (임시 파일 제외)
	 */
	public List<String> keys() throws SBStoreUnavailableException {
		List<String> keys = new ArrayList<>();
		if (!Files.isDirectory(directory)) {
			return keys;
		}
		try (Stream<Path> files = Files.list(directory)) {
			files.map(p -> p.getFileName().toString())
				.filter(name -> name.endsWith(SUFFIX))
				.map(name -> URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8))
				.sorted()
				.forEach(keys::add);
			return keys;
		} catch (IOException e) {
			throw new SBStoreUnavailableException("Failed to list " + directory, e);
		}
	}

	public Path getDirectory() {
		return directory;
	}

	Path fileOf(String key) {
		if (key == null || key.isEmpty()) {
			throw new IllegalArgumentException("Key must not be empty");
		}
		return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
	}

	private void deleteQuietly(Path tmp) {
		if (tmp == null) {
			return;
		}
		try {
			Files.deleteIfExists(tmp);
		} catch (IOException e) {
			log.warn("Failed to remove temp file {}", tmp, e);
		}
	}
}
