package org.scriptonbasestar.sync.engine.response;

import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 응답 캐시 키 생성.
 * <p>
 * {@code http_cache:<path>:<sha-256(canonical request)>}.
 * canonical request 는 대문자 method, 정규화된 path, 소문자 이름으로 정렬된 파라미터(값도 정렬)로 이뤄진다.
 * 파라미터 순서나 이름의 대소문자가 달라도 키는 같다.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 */
@UtilityClass
public class ResponseCacheKey {

	public static final String PREFIX = "http_cache:";

	public static String of(ResponseRequest request) {
		return PREFIX + request.getPath() + ":" + sha256(canonical(request));
	}

	/**
	 * path 자신과 그 하위 path 의 응답 키에 맞는 glob 패턴들.
	 * {@code /v1/data} 는 {@code /v1/data:*}, {@code /v1/data/*} 만 매칭하고 {@code /v1/database} 는 건드리지 않는다.
	 */
	public static List<String> patternsFor(String pathPrefix) {
		String path = ResponseRequest.normalizePath(pathPrefix);
		if ("/".equals(path)) {
			return Collections.singletonList(PREFIX + "*");
		}
		String escaped = PREFIX + GlobPattern.escape(path);
		return Arrays.asList(escaped + ":*", escaped + "/*");
	}

	public static String canonical(ResponseRequest request) {
		TreeMap<String, List<String>> sorted = new TreeMap<>();
		for (Map.Entry<String, List<String>> e : request.getParams().entrySet()) {
			List<String> values = sorted.computeIfAbsent(e.getKey().toLowerCase(Locale.ROOT), k -> new ArrayList<>());
			for (String value : e.getValue()) {
				values.add(value == null ? "" : value);
			}
		}

		StringBuilder sb = new StringBuilder();
		sb.append(request.getMethod()).append(' ').append(request.getPath()).append('?');
		boolean first = true;
		for (Map.Entry<String, List<String>> e : sorted.entrySet()) {
			List<String> values = e.getValue();
			values.sort(null);
			if (values.isEmpty()) {
				values.add("");
			}
			for (String value : values) {
				if (!first) {
					sb.append('&');
				}
				sb.append(escape(e.getKey())).append('=').append(escape(value));
				first = false;
			}
		}
		return sb.toString();
	}

	private static String escape(String s) {
		return s.replace("%", "%25").replace("&", "%26").replace("=", "%3D");
	}

	private static String sha256(String text) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}
}
