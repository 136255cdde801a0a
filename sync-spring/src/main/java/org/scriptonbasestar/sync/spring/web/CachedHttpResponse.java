package org.scriptonbasestar.sync.spring.web;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 응답 캐시에 저장되는 HTTP 응답 (Jackson 으로 직렬화, body 는 base64)
 *
 * headers 에는 애플리케이션이 설정한 헤더만 담는다. Content-Type, Content-Length 는 별도 필드로 관리.
 *
 * @author archmagece
 * @since 2025-02
 */
public class CachedHttpResponse {

	private int status;
	private String contentType;
	private String characterEncoding;
	private byte[] body;
	private Map<String, List<String>> headers = new LinkedHashMap<>();

	public CachedHttpResponse() {
	}

	public CachedHttpResponse(int status, String contentType, String characterEncoding, byte[] body) {
		this.status = status;
		this.contentType = contentType;
		this.characterEncoding = characterEncoding;
		this.body = body;
	}

	public int getStatus() {
		return status;
	}

	public void setStatus(int status) {
		this.status = status;
	}

	public String getContentType() {
		return contentType;
	}

	public void setContentType(String contentType) {
		this.contentType = contentType;
	}

	public String getCharacterEncoding() {
		return characterEncoding;
	}

	public void setCharacterEncoding(String characterEncoding) {
		this.characterEncoding = characterEncoding;
	}

	public byte[] getBody() {
		return body;
	}

	public void setBody(byte[] body) {
		this.body = body;
	}

	public Map<String, List<String>> getHeaders() {
		return headers;
	}

	public void setHeaders(Map<String, List<String>> headers) {
		this.headers = headers != null ? headers : new LinkedHashMap<>();
	}

	public CachedHttpResponse header(String name, String value) {
		headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
		return this;
	}
}
