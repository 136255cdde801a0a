package org.scriptonbasestar.sync.engine.response;

/**
 * 응답 값과 그 출처
 *
 * @author archmagece
 * @since 2025-02
 */
public final class CachedResponse<T> {

	public enum Source {
		/** 캐시에서 읽음 */
		HIT,
		/** 새로 계산해서 저장함 */
		MISS,
		/** 캐시 대상이 아니거나 백엔드 장애로 계산만 함 */
		BYPASS
	}

	private final T value;
	private final Source source;

	public CachedResponse(T value, Source source) {
		this.value = value;
		this.source = source;
	}

	public T getValue() {
		return value;
	}

	public Source getSource() {
		return source;
	}

	public boolean isServedFromCache() {
		return source == Source.HIT;
	}

	@Override
	public String toString() {
		return "CachedResponse{" + source + "}";
	}
}
