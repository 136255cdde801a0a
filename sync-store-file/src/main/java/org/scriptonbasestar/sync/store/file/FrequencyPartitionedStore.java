package org.scriptonbasestar.sync.store.file;

import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;
import org.scriptonbasestar.sync.core.model.EntryMetadata;
import org.scriptonbasestar.sync.core.model.FrequencyCacheEntry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.store.SBKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * frequency class 하나당 키 하나({@code frequency-cache:<class>})로 엔트리를 보관한다.
 * <p>
 * 읽기는 저장소 장애나 손상된 데이터를 만나면 null 을 돌려준다 (엔트리 없음과 같게 취급).
 * 쓰기 실패는 {@link SBStoreUnavailableException}으로 호출자에게 알린다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
public class FrequencyPartitionedStore {

	private static final Logger log = LoggerFactory.getLogger(FrequencyPartitionedStore.class);

	public static final String KEY_PREFIX = "frequency-cache:";

	private final SBKeyValueStore keyValueStore;
	private final FrequencyEntryCodec codec;

	public FrequencyPartitionedStore(SBKeyValueStore keyValueStore) {
		this(keyValueStore, new FrequencyEntryCodec());
	}

	public FrequencyPartitionedStore(SBKeyValueStore keyValueStore, FrequencyEntryCodec codec) {
		if (keyValueStore == null) {
			throw new IllegalArgumentException("SBKeyValueStore must not be null");
		}
		if (codec == null) {
			throw new IllegalArgumentException("FrequencyEntryCodec must not be null");
		}
		this.keyValueStore = keyValueStore;
		this.codec = codec;
	}

	/**
	 * @return 엔트리, 없거나 읽을 수 없으면 null
	 */
	public FrequencyCacheEntry get(FrequencyClass frequencyClass) {
		byte[] bytes = read(frequencyClass);
		if (bytes == null) {
			return null;
		}
		try {
			return codec.decode(bytes);
		} catch (IOException | IllegalArgumentException e) {
			log.warn("Corrupt cache entry for {}, treating as absent: {}", frequencyClass.key(), e.getMessage());
			return null;
		}
	}

	/**
	 * 기존 엔트리를 통째로 교체합니다.
	 *
	 * @throws SBStoreUnavailableException 저장 실패
	 */
	public void put(FrequencyCacheEntry entry) throws SBStoreUnavailableException {
		byte[] bytes;
		try {
			bytes = codec.encode(entry);
		} catch (IOException e) {
			throw new SBStoreUnavailableException("Failed to encode entry for " + entry.getFrequencyClass().key(), e);
		}
		keyValueStore.put(keyOf(entry.getFrequencyClass()), bytes);
		log.debug("Stored {} ({} bytes)", entry, bytes.length);
	}

	/**
	 * payload 를 디코딩하지 않고 헤더만 읽는다.
	 *
	 * @return 메타데이터, 없거나 읽을 수 없으면 null
	 */
	public EntryMetadata metadata(FrequencyClass frequencyClass) {
		byte[] bytes = read(frequencyClass);
		if (bytes == null) {
			return null;
		}
		try {
			return codec.readMetadata(bytes);
		} catch (IOException | IllegalArgumentException e) {
			log.warn("Corrupt cache header for {}, treating as absent: {}", frequencyClass.key(), e.getMessage());
			return null;
		}
	}

	/**
	 * @throws SBStoreUnavailableException 삭제 실패
	 */
	public boolean delete(FrequencyClass frequencyClass) throws SBStoreUnavailableException {
		return keyValueStore.delete(keyOf(frequencyClass));
	}

	public static String keyOf(FrequencyClass frequencyClass) {
		return KEY_PREFIX + frequencyClass.key();
	}

	public FrequencyEntryCodec getCodec() {
		return codec;
	}

	private byte[] read(FrequencyClass frequencyClass) {
		try {
			return keyValueStore.get(keyOf(frequencyClass));
		} catch (SBStoreUnavailableException e) {
			log.warn("Store unavailable while reading {}: {}", frequencyClass.key(), e.getMessage());
			return null;
		}
	}
}
