package org.scriptonbasestar.sync.core.store;

import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;

/**
 * 영속 key-value 저장소. put은 원자적 교체여야 한다 (읽는 쪽이 절반만 쓰인 값을 보면 안 된다).
 *
 * @author archmagece
 * @since 2025-02
 */
public interface SBKeyValueStore {
	/**
	 * @return 저장된 값, 없으면 null
	 * @throws SBStoreUnavailableException 저장소 접근 실패
	 */
	byte[] get(String key) throws SBStoreUnavailableException;

	/**
	 * @throws SBStoreUnavailableException 저장소 접근 실패
	 */
	void put(String key, byte[] value) throws SBStoreUnavailableException;

	/**
	 * @return 삭제했으면 true
	 * @throws SBStoreUnavailableException 저장소 접근 실패
	 */
	boolean delete(String key) throws SBStoreUnavailableException;
}
