package org.scriptonbasestar.sync.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.sync.core.fetcher.SBDatasetFetcher;
import org.scriptonbasestar.sync.core.freshness.PublicationCalendar;
import org.scriptonbasestar.sync.core.freshness.SlaPolicy;
import org.scriptonbasestar.sync.core.freshness.StalenessEvaluator;
import org.scriptonbasestar.sync.core.model.DatasetDescriptor;
import org.scriptonbasestar.sync.core.model.DatasetRegistry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.RateLimit;
import org.scriptonbasestar.sync.core.store.SBCacheBackend;
import org.scriptonbasestar.sync.core.writer.SBCombinedViewSink;
import org.scriptonbasestar.sync.engine.TieredSyncService;
import org.scriptonbasestar.sync.engine.fetch.RateLimitedFetchExecutor;
import org.scriptonbasestar.sync.engine.response.InMemoryCacheBackend;
import org.scriptonbasestar.sync.engine.response.ReadThroughResponseCache;
import org.scriptonbasestar.sync.engine.schedule.RefreshScheduler;
import org.scriptonbasestar.sync.engine.view.CacheReconstitutionEngine;
import org.scriptonbasestar.sync.metrics.micrometer.PrometheusMetricsHelper;
import org.scriptonbasestar.sync.metrics.micrometer.SyncMetricsBinder;
import org.scriptonbasestar.sync.redis.RedisCacheBackend;
import org.scriptonbasestar.sync.spring.actuator.RefreshStatusHealthIndicator;
import org.scriptonbasestar.sync.spring.cache.SBCacheManager;
import org.scriptonbasestar.sync.spring.web.ResponseCacheFilter;
import org.scriptonbasestar.sync.store.file.FileKeyValueStore;
import org.scriptonbasestar.sync.store.file.FrequencyPartitionedStore;
import org.scriptonbasestar.sync.store.file.SnapshotManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.cache.CacheAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.cache.CacheManager;
import org.springframework.cache.interceptor.CacheAspectSupport;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import redis.clients.jedis.JedisPooled;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

/**
 * Spring Boot Auto-Configuration for SB Sync.
 * <p>
 * The refresh side (executor, scheduler, service, health) is only created when the application
 * provides an {@link SBDatasetFetcher} bean. The store, registry and response cache are always available.
 * Every bean backs off when the application defines its own.
 * </p>
 *
 * <h3>Minimal Usage:</h3>
 * <pre>{@code
 * @Bean
 * public SBDatasetFetcher fredFetcher(FredClient client) {
 *     return (id, params, since) -> client.observations(id, since);
 * }
 *
 * # application.yml
 * sb-sync:
 *   jobs:
 *     daily: PT3H
 *   datasets:
 *     DGS10:
 *       frequency: daily
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@Slf4j
@AutoConfiguration(before = CacheAutoConfiguration.class)
@ConditionalOnClass(TieredSyncService.class)
@EnableConfigurationProperties(SyncProperties.class)
public class SyncAutoConfiguration {

	private final SyncProperties properties;

	public SyncAutoConfiguration(SyncProperties properties) {
		this.properties = properties;
	}

	/**
	 * Registry built from {@code sb-sync.datasets}.
	 */
	@Bean
	@ConditionalOnMissingBean
	public DatasetRegistry sbSyncDatasetRegistry() {
		DatasetRegistry registry = new DatasetRegistry();
		for (Map.Entry<String, SyncProperties.DatasetConfig> entry : properties.getDatasets().entrySet()) {
			registry.register(toDescriptor(entry.getKey(), entry.getValue()));
		}
		log.info("SB Sync registry: {} datasets configured", registry.size());
		return registry;
	}

	@Bean
	@ConditionalOnMissingBean
	public StalenessEvaluator sbSyncStalenessEvaluator() {
		SlaPolicy policy = SlaPolicy.withOverrides(properties.slaOverridesByClass());
		PublicationCalendar calendar = new PublicationCalendar(
			properties.getPublicationWindowDays(), ZoneId.of(properties.getCalendarZone()));
		return new StalenessEvaluator(policy, calendar);
	}

	@Bean
	@ConditionalOnMissingBean
	public FrequencyPartitionedStore sbSyncFrequencyStore() {
		return new FrequencyPartitionedStore(new FileKeyValueStore(Paths.get(properties.getStoreDir())));
	}

	@Bean
	@ConditionalOnMissingBean
	public CacheReconstitutionEngine sbSyncViewEngine(FrequencyPartitionedStore store) {
		return new CacheReconstitutionEngine(store);
	}

	@Bean
	@ConditionalOnMissingBean(SBCacheBackend.class)
	@ConditionalOnProperty(prefix = "sb-sync.response-cache", name = "backend", havingValue = "memory", matchIfMissing = true)
	public SBCacheBackend sbSyncInMemoryCacheBackend() {
		return new InMemoryCacheBackend();
	}

	/**
	 * Response cache. Disabled (always computes) when {@code sb-sync.response-cache.enabled=false}
	 * or when there is no backend.
	 */
	@Bean
	@ConditionalOnMissingBean
	public ReadThroughResponseCache sbSyncResponseCache(ObjectProvider<SBCacheBackend> backend) {
		SyncProperties.ResponseCache config = properties.getResponseCache();
		SBCacheBackend selected = config.isEnabled() ? backend.getIfAvailable() : null;
		return ReadThroughResponseCache.builder()
			.backend(selected)
			.ttl(Duration.ofSeconds(config.getTtlSeconds()))
			.cachePaths(config.getCachePaths())
			.build();
	}

	@Bean
	@ConditionalOnMissingBean
	@ConditionalOnProperty(prefix = "sb-sync.snapshot", name = "enabled", havingValue = "true", matchIfMissing = true)
	public SnapshotManager sbSyncSnapshotManager() {
		return new SnapshotManager(Paths.get(properties.getSnapshot().getDir()));
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnBean(SBDatasetFetcher.class)
	@ConditionalOnMissingBean
	public RateLimitedFetchExecutor sbSyncFetchExecutor(SBDatasetFetcher fetcher, DatasetRegistry registry,
														FrequencyPartitionedStore store, StalenessEvaluator evaluator) {
		SyncProperties.RateLimit rateLimit = properties.getRateLimit();
		return RateLimitedFetchExecutor.builder()
			.fetcher(fetcher)
			.registry(registry)
			.store(store)
			.evaluator(evaluator)
			.defaultRateLimit(rateLimit.getMaxCalls() > 0
				? new RateLimit(rateLimit.getMaxCalls(), Duration.ofSeconds(rateLimit.getWindowSeconds()))
				: null)
			.minDelay(Duration.ofMillis(rateLimit.getMinDelayMillis()))
			.maxAttempts(rateLimit.getMaxAttempts())
			.retryBackoff(Duration.ofMillis(rateLimit.getRetryBackoffMillis()))
			.defaultLookback(Duration.ofDays(properties.getLookbackDays()))
			.timeout(Duration.ofSeconds(properties.getRefreshTimeoutSeconds()))
			.build();
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnBean(SBDatasetFetcher.class)
	@ConditionalOnMissingBean
	public RefreshScheduler sbSyncRefreshScheduler(RateLimitedFetchExecutor executor,
												   ObjectProvider<SnapshotManager> snapshotManager) {
		RefreshScheduler.Builder builder = RefreshScheduler.builder(executor)
			.cadences(properties.jobsByClass());
		SnapshotManager snapshots = snapshotManager.getIfAvailable();
		if (snapshots != null) {
			builder.retention(snapshots, properties.getSnapshot().getRetentionDays());
		}
		return builder.build();
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnBean(SBDatasetFetcher.class)
	@ConditionalOnMissingBean
	public TieredSyncService sbSyncService(RateLimitedFetchExecutor executor, CacheReconstitutionEngine viewEngine,
										   ReadThroughResponseCache responseCache, RefreshScheduler scheduler,
										   ObjectProvider<SnapshotManager> snapshotManager,
										   ObjectProvider<SBCombinedViewSink> sink) {
		return TieredSyncService.builder()
			.executor(executor)
			.viewEngine(viewEngine)
			.responseCache(responseCache)
			.scheduler(scheduler)
			.snapshotWriter(snapshotManager.getIfAvailable())
			.sink(sink.getIfAvailable())
			.build();
	}

	/**
	 * Starts the refresh jobs once the application is ready.
	 */
	@Bean
	@ConditionalOnBean(SBDatasetFetcher.class)
	@ConditionalOnProperty(prefix = "sb-sync", name = "auto-start", havingValue = "true", matchIfMissing = true)
	public ApplicationListener<ApplicationReadyEvent> sbSyncStarter(TieredSyncService service) {
		return event -> {
			service.start();
			log.info("SB Sync scheduler started: {}", service.getScheduler().getCadences());
		};
	}

	static DatasetDescriptor toDescriptor(String id, SyncProperties.DatasetConfig config) {
		if (config.getFrequency() == null) {
			throw new IllegalArgumentException("sb-sync.datasets." + id + ".frequency is required");
		}
		DatasetDescriptor.Builder builder = DatasetDescriptor.builder(id, FrequencyClass.fromKey(config.getFrequency()))
			.displayName(config.getDisplayName())
			.fetchParams(config.getParams())
			.requiresCredential(config.isRequiresCredential())
			.enabled(config.isEnabled());
		if (config.getLookbackDays() != null) {
			builder.lookback(Duration.ofDays(config.getLookbackDays()));
		}
		if (config.getCallsPerMinute() != null) {
			builder.rateLimit(RateLimit.perMinute(config.getCallsPerMinute()));
		}
		if (config.getTags() != null) {
			config.getTags().forEach(builder::tag);
		}
		return builder.build();
	}

	/**
	 * Servlet filter serving eligible GET/HEAD requests through the response cache.
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
	@ConditionalOnClass(name = "jakarta.servlet.Filter")
	static class WebConfiguration {

		@Bean
		@ConditionalOnMissingBean(name = "sbSyncResponseCacheFilter")
		public FilterRegistrationBean<ResponseCacheFilter> sbSyncResponseCacheFilter(ReadThroughResponseCache cache) {
			FilterRegistrationBean<ResponseCacheFilter> registration = new FilterRegistrationBean<>(new ResponseCacheFilter(cache));
			registration.setName("sbSyncResponseCacheFilter");
			registration.setOrder(Ordered.LOWEST_PRECEDENCE - 10);
			return registration;
		}
	}

	/**
	 * {@code @Cacheable} memoization over the response cache backend, when the application uses
	 * {@code @EnableCaching} and defines no CacheManager of its own.
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(CacheManager.class)
	@ConditionalOnBean(CacheAspectSupport.class)
	@ConditionalOnProperty(prefix = "sb-sync.function-cache", name = "enabled", havingValue = "true", matchIfMissing = true)
	static class FunctionCacheConfiguration {

		@Bean
		@ConditionalOnMissingBean(CacheManager.class)
		public SBCacheManager sbSyncCacheManager(SyncProperties properties, ObjectProvider<SBCacheBackend> backend) {
			SyncProperties.FunctionCache config = properties.getFunctionCache();
			SBCacheBackend selected = backend.getIfAvailable();
			if (selected == null) {
				log.info("No SBCacheBackend configured, @Cacheable results are kept in memory");
				selected = new InMemoryCacheBackend();
			}
			SBCacheManager manager = new SBCacheManager(selected, Duration.ofSeconds(config.getTtlSeconds()))
				.keyPrefix(config.getKeyPrefix());
			config.getTtls().forEach(manager::ttl);
			return manager;
		}
	}

	/**
	 * Redis response cache backend ({@code sb-sync.response-cache.backend=redis}).
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass({JedisPooled.class, RedisCacheBackend.class})
	@ConditionalOnProperty(prefix = "sb-sync.response-cache", name = "backend", havingValue = "redis")
	static class RedisBackendConfiguration {

		@Bean(destroyMethod = "close")
		@ConditionalOnMissingBean(SBCacheBackend.class)
		public RedisCacheBackend sbSyncRedisCacheBackend(SyncProperties properties) {
			SyncProperties.Redis redis = properties.getResponseCache().getRedis();
			log.info("SB Sync response cache uses Redis at {}:{}", redis.getHost(), redis.getPort());
			return new RedisCacheBackend(new JedisPooled(redis.getHost(), redis.getPort()), true);
		}
	}

	/**
	 * Actuator health for the refresh jobs.
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(HealthIndicator.class)
	@ConditionalOnBean(SBDatasetFetcher.class)
	static class HealthConfiguration {

		@Bean
		@ConditionalOnMissingBean(name = "sbSyncHealthIndicator")
		public HealthIndicator sbSyncHealthIndicator(TieredSyncService service) {
			return new RefreshStatusHealthIndicator(service);
		}
	}

	/**
	 * Micrometer binding when a MeterRegistry is present.
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass({MeterRegistry.class, SyncMetricsBinder.class})
	@ConditionalOnBean({MeterRegistry.class, SBDatasetFetcher.class})
	static class MetricsConfiguration {

		@Bean
		@ConditionalOnMissingBean
		public SyncMetricsBinder sbSyncMetricsBinder(TieredSyncService service, MeterRegistry meterRegistry) {
			return PrometheusMetricsHelper.bindService(service, meterRegistry);
		}
	}
}
