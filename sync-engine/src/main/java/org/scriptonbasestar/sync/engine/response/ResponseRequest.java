package org.scriptonbasestar.sync.engine.response;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 응답 캐시 키를 만드는 데 쓰는 요청 형태 (method + path + query parameter)
 *
 * @author archmagece
 * @since 2025-02
 */
public final class ResponseRequest {

	private final String method;
	private final String path;
	private final Map<String, List<String>> params;

	public ResponseRequest(String method, String path, Map<String, List<String>> params) {
		this.method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
		this.path = normalizePath(path);
		Map<String, List<String>> copy = new LinkedHashMap<>();
		if (params != null) {
			params.forEach((name, values) -> copy.put(name,
				values == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values))));
		}
		this.params = Collections.unmodifiableMap(copy);
	}

	public static ResponseRequest get(String path) {
		return new ResponseRequest("GET", path, null);
	}

	/**
	 * servlet 의 {@code getParameterMap()} 형태에서 생성
	 */
	public static ResponseRequest of(String method, String path, Map<String, String[]> parameterMap) {
		Map<String, List<String>> params = new LinkedHashMap<>();
		if (parameterMap != null) {
			parameterMap.forEach((name, values) -> params.put(name, values == null ? null : List.of(values)));
		}
		return new ResponseRequest(method, path, params);
	}

	public ResponseRequest withParam(String name, String... values) {
		Map<String, List<String>> copy = new LinkedHashMap<>(params);
		copy.put(name, List.of(values));
		return new ResponseRequest(method, path, copy);
	}

	public String getMethod() {
		return method;
	}

	public String getPath() {
		return path;
	}

	public Map<String, List<String>> getParams() {
		return params;
	}

	static String normalizePath(String path) {
		if (path == null || path.isEmpty()) {
			return "/";
		}
		String normalized = path.startsWith("/") ? path : "/" + path;
		while (normalized.length() > 1 && normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ResponseRequest)) return false;
		ResponseRequest that = (ResponseRequest) o;
		return method.equals(that.method) && path.equals(that.path) && params.equals(that.params);
	}

	@Override
	public int hashCode() {
		return Objects.hash(method, path, params);
	}

	@Override
	public String toString() {
		return method + " " + path + (params.isEmpty() ? "" : " " + params);
	}
}
