package org.scriptonbasestar.sync.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 데이터셋 정의 레지스트리. id 기준 유일하다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class DatasetRegistry {

	private static final Logger log = LoggerFactory.getLogger(DatasetRegistry.class);

	private final Map<String, DatasetDescriptor> descriptors = new ConcurrentHashMap<>();

	public DatasetRegistry() {
	}

	public DatasetRegistry(Collection<DatasetDescriptor> initial) {
		initial.forEach(this::register);
	}

	/**
	 * 같은 id가 이미 있으면 교체한다.
	 * 같은 frequency class 안에서 시계열 이름(displayName)은 유일해야 한다. 한 엔트리의 payload 키이기 때문.
	 *
	 * @throws IllegalArgumentException 같은 class 의 다른 데이터셋이 같은 displayName 을 쓰는 경우
	 */
	public synchronized void register(DatasetDescriptor descriptor) {
		for (DatasetDescriptor existing : descriptors.values()) {
			if (!existing.getId().equals(descriptor.getId())
				&& existing.getFrequencyClass() == descriptor.getFrequencyClass()
				&& existing.getDisplayName().equals(descriptor.getDisplayName())) {
				throw new IllegalArgumentException("Series name '" + descriptor.getDisplayName() + "' of dataset "
					+ descriptor.getId() + " is already used by " + existing.getId()
					+ " in " + descriptor.getFrequencyClass().key());
			}
		}
		DatasetDescriptor previous = descriptors.put(descriptor.getId(), descriptor);
		if (previous != null) {
			log.warn("Dataset {} already registered, replacing ({} -> {})",
				descriptor.getId(), previous.getFrequencyClass().key(), descriptor.getFrequencyClass().key());
		} else {
			log.debug("Registered dataset {} ({})", descriptor.getId(), descriptor.getFrequencyClass().key());
		}
	}

	public synchronized boolean unregister(String id) {
		return descriptors.remove(id) != null;
	}

	/**
	 * @throws IllegalArgumentException 등록되지 않은 id
	 */
	public DatasetDescriptor get(String id) {
		DatasetDescriptor descriptor = descriptors.get(id);
		if (descriptor == null) {
			throw new IllegalArgumentException("Unknown dataset: " + id);
		}
		return descriptor;
	}

	public boolean contains(String id) {
		return descriptors.containsKey(id);
	}

	/**
	 * id 순으로 정렬된 전체 목록
	 */
	public List<DatasetDescriptor> listAll() {
		return sorted(descriptors.values());
	}

	public List<DatasetDescriptor> listByFrequency(FrequencyClass frequencyClass) {
		return sorted(descriptors.values().stream()
			.filter(d -> d.getFrequencyClass() == frequencyClass)
			.collect(Collectors.toList()));
	}

	public List<DatasetDescriptor> listEnabled() {
		return sorted(descriptors.values().stream()
			.filter(DatasetDescriptor::isEnabled)
			.collect(Collectors.toList()));
	}

	public List<DatasetDescriptor> listByTag(String tag) {
		return sorted(descriptors.values().stream()
			.filter(d -> d.getTags().contains(tag))
			.collect(Collectors.toList()));
	}

	public int size() {
		return descriptors.size();
	}

	private static List<DatasetDescriptor> sorted(Collection<DatasetDescriptor> values) {
		List<DatasetDescriptor> list = new ArrayList<>(values);
		list.sort((a, b) -> a.getId().compareTo(b.getId()));
		return list;
	}
}
