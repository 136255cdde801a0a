package org.scriptonbasestar.sync.engine.response;

import org.scriptonbasestar.sync.core.store.SBCacheBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 프로세스 내 TTL 맵 백엔드. Redis 가 없는 단일 노드 배포나 테스트용.
 *
 * @author archmagece
 * @since 2025-02
 */
public class InMemoryCacheBackend implements SBCacheBackend {

	private static final Logger log = LoggerFactory.getLogger(InMemoryCacheBackend.class);

	private final ConcurrentHashMap<String, Item> data = new ConcurrentHashMap<>();
	private final Clock clock;

	public InMemoryCacheBackend() {
		this(Clock.systemUTC());
	}

	public InMemoryCacheBackend(Clock clock) {
		if (clock == null) {
			throw new IllegalArgumentException("Clock must not be null");
		}
		this.clock = clock;
	}

	@Override
	public String get(String key) {
		Item item = data.get(key);
		if (item == null) {
			return null;
		}
		if (item.isExpired(clock.instant())) {
			data.remove(key, item);
			log.trace("Expired: {}", key);
			return null;
		}
		return item.value;
	}

	@Override
	public void setWithTtl(String key, String value, Duration ttl) {
		Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
		data.put(key, new Item(value, expiresAt));
		log.trace("Stored {} (ttl {})", key, ttl);
	}

	@Override
	public boolean delete(String key) {
		return data.remove(key) != null;
	}

	@Override
	public long deleteByPattern(String pattern) {
		Pattern regex = GlobPattern.compile(pattern);
		long deleted = 0;
		for (Iterator<Map.Entry<String, Item>> it = data.entrySet().iterator(); it.hasNext(); ) {
			if (regex.matcher(it.next().getKey()).matches()) {
				it.remove();
				deleted++;
			}
		}
		log.debug("Deleted {} keys matching {}", deleted, pattern);
		return deleted;
	}

	@Override
	public boolean ping() {
		return true;
	}

	public int size() {
		return data.size();
	}

	private static final class Item {
		private final String value;
		private final Instant expiresAt;  // null 이면 만료 없음

		private Item(String value, Instant expiresAt) {
			this.value = value;
			this.expiresAt = expiresAt;
		}

		boolean isExpired(Instant now) {
			return expiresAt != null && !now.isBefore(expiresAt);
		}
	}
}
