package org.scriptonbasestar.sync.spring.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.sync.engine.response.CachedResponse;
import org.scriptonbasestar.sync.engine.response.ReadThroughResponseCache;
import org.scriptonbasestar.sync.engine.response.ResponseRequest;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Servlet filter that serves eligible GET/HEAD requests through the {@link ReadThroughResponseCache}.
 * <p>
 * Only {@code 200} responses are stored, together with the headers the application set
 * (except the ones listed in {@link #NOT_REPLAYED}). Every response carries an {@code X-Cache} header
 * ({@code HIT}, {@code MISS} or {@code BYPASS}).
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * @Bean
 * public FilterRegistrationBean<ResponseCacheFilter> responseCacheFilter(ReadThroughResponseCache cache) {
 *     return new FilterRegistrationBean<>(new ResponseCacheFilter(cache));
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
public class ResponseCacheFilter extends OncePerRequestFilter {

	public static final String HEADER = "X-Cache";

	/**
	 * 캐시에 담지 않는 헤더 (소문자). 본문/전송 관련이거나 요청마다 달라야 하는 것들
	 */
	static final Set<String> NOT_REPLAYED = new HashSet<>(Arrays.asList(
		"x-cache", "content-type", "content-length", "transfer-encoding", "connection", "date", "set-cookie"));

	private final ReadThroughResponseCache cache;

	public ResponseCacheFilter(ReadThroughResponseCache cache) {
		if (cache == null) {
			throw new IllegalArgumentException("ReadThroughResponseCache must not be null");
		}
		this.cache = cache;
	}

	@Override
	protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
		throws ServletException, IOException {
		ResponseRequest shape = toResponseRequest(request);
		if (!cache.isEnabled() || !cache.isEligible(shape)) {
			response.setHeader(HEADER, CachedResponse.Source.BYPASS.name());
			chain.doFilter(request, response);
			return;
		}

		ContentCachingResponseWrapper[] produced = new ContentCachingResponseWrapper[1];
		CachedResponse<CachedHttpResponse> result;
		try {
			result = cache.getOrCompute(shape, CachedHttpResponse.class,
				() -> render(request, response, chain, produced),
				rendered -> rendered.getStatus() == HttpServletResponse.SC_OK);
		} catch (ChainFailure e) {
			if (produced[0] != null) {
				produced[0].copyBodyToResponse();
			}
			if (e.getCause() instanceof ServletException) {
				throw (ServletException) e.getCause();
			}
			throw (IOException) e.getCause();
		}

		response.setHeader(HEADER, result.getSource().name());
		if (produced[0] != null) {
			produced[0].copyBodyToResponse();
			return;
		}

		CachedHttpResponse cached = result.getValue();
		log.trace("Serving {} from response cache", shape);
		response.setStatus(cached.getStatus());
		if (cached.getContentType() != null) {
			response.setContentType(cached.getContentType());
		}
		if (cached.getCharacterEncoding() != null) {
			response.setCharacterEncoding(cached.getCharacterEncoding());
		}
		for (Map.Entry<String, List<String>> header : cached.getHeaders().entrySet()) {
			String name = header.getKey();
			if (NOT_REPLAYED.contains(name.toLowerCase(Locale.ROOT)) || response.containsHeader(name)) {
				continue;
			}
			for (String value : header.getValue()) {
				response.addHeader(name, value);
			}
		}
		byte[] body = cached.getBody() != null ? cached.getBody() : new byte[0];
		response.setContentLength(body.length);
		if (!"HEAD".equals(shape.getMethod())) {
			response.getOutputStream().write(body);
		}
	}

	private static CachedHttpResponse render(HttpServletRequest request, HttpServletResponse response,
											 FilterChain chain, ContentCachingResponseWrapper[] produced) {
		ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
		produced[0] = wrapper;
		try {
			chain.doFilter(request, wrapper);
		} catch (IOException | ServletException e) {
			throw new ChainFailure(e);
		}
		CachedHttpResponse rendered = new CachedHttpResponse(wrapper.getStatus(), wrapper.getContentType(),
			wrapper.getCharacterEncoding(), wrapper.getContentAsByteArray());
		for (String name : wrapper.getHeaderNames()) {
			if (NOT_REPLAYED.contains(name.toLowerCase(Locale.ROOT))) {
				continue;
			}
			for (String value : wrapper.getHeaders(name)) {
				rendered.header(name, value);
			}
		}
		return rendered;
	}

	static ResponseRequest toResponseRequest(HttpServletRequest request) {
		String path = request.getRequestURI();
		String contextPath = request.getContextPath();
		if (path == null) {
			path = "/";
		} else if (contextPath != null && !contextPath.isEmpty() && path.startsWith(contextPath)) {
			path = path.substring(contextPath.length());
		}
		return ResponseRequest.of(request.getMethod(), path, request.getParameterMap());
	}

	/**
	 * 필터 체인의 checked 예외를 producer 밖으로 전달한다.
	 */
	private static final class ChainFailure extends RuntimeException {
		private ChainFailure(Exception cause) {
			super(cause);
		}
	}
}
