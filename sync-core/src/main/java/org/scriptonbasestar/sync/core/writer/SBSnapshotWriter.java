package org.scriptonbasestar.sync.core.writer;

/**
 * 타임스탬프가 붙은 불변 백업 사본 기록기. 실패해도 예외를 던지지 않는다 (best-effort).
 *
 * @author archmagece
 * @since 2025-02
 */
public interface SBSnapshotWriter {
	/**
	 * @param payload 직렬화 가능한 객체
	 * @param label 파일명 등에 쓰이는 이름 (예: "combined", "daily")
	 * @return 기록 성공 여부
	 */
	boolean snapshot(Object payload, String label);
}
