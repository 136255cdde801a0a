package org.scriptonbasestar.sync.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scriptonbasestar.sync.core.fetcher.SBDatasetFetcher;
import org.scriptonbasestar.sync.core.freshness.StalenessEvaluator;
import org.scriptonbasestar.sync.core.model.DatasetRegistry;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.TimeSeries;
import org.scriptonbasestar.sync.core.store.SBCacheBackend;
import org.scriptonbasestar.sync.engine.TieredSyncService;
import org.scriptonbasestar.sync.engine.fetch.RateLimitedFetchExecutor;
import org.scriptonbasestar.sync.engine.response.InMemoryCacheBackend;
import org.scriptonbasestar.sync.engine.response.ReadThroughResponseCache;
import org.scriptonbasestar.sync.engine.schedule.RefreshScheduler;
import org.scriptonbasestar.sync.metrics.micrometer.SyncMetricsBinder;
import org.scriptonbasestar.sync.spring.actuator.RefreshStatusHealthIndicator;
import org.scriptonbasestar.sync.spring.cache.SBCache;
import org.scriptonbasestar.sync.spring.cache.SBCacheManager;
import org.scriptonbasestar.sync.store.file.FrequencyPartitionedStore;
import org.scriptonbasestar.sync.store.file.SnapshotManager;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.Instant;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-02
 */
public class SyncAutoConfigurationTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private AnnotationConfigApplicationContext context;

	@After
	public void tearDown() {
		if (context != null) {
			context.close();
		}
	}

	@Test
	public void testCacheSideWithoutFetcher() throws Exception {
		load(null);

		assertNotNull(context.getBean(DatasetRegistry.class));
		assertNotNull(context.getBean(StalenessEvaluator.class));
		assertNotNull(context.getBean(FrequencyPartitionedStore.class));
		assertTrue(context.getBean(SBCacheBackend.class) instanceof InMemoryCacheBackend);
		assertTrue(context.getBean(ReadThroughResponseCache.class).isEnabled());
		assertTrue(context.getBeansOfType(TieredSyncService.class).isEmpty());
		assertTrue(context.getBeansOfType(RateLimitedFetchExecutor.class).isEmpty());
		assertTrue(context.getBeansOfType(RefreshStatusHealthIndicator.class).isEmpty());
	}

	@Test
	public void testFullWiringWithFetcher() throws Exception {
		load(FetcherConfig.class,
			"sb-sync.jobs.daily=PT3H",
			"sb-sync.datasets[DGS10].frequency=daily",
			"sb-sync.datasets[CPIAUCSL].frequency=monthly",
			"sb-sync.sla-overrides.daily=PT2H");

		TieredSyncService service = context.getBean(TieredSyncService.class);
		assertEquals(2, context.getBean(DatasetRegistry.class).size());
		assertEquals(Duration.ofHours(2), context.getBean(StalenessEvaluator.class).slaOf(FrequencyClass.DAILY));

		RefreshScheduler scheduler = context.getBean(RefreshScheduler.class);
		assertEquals(Duration.ofHours(3), scheduler.getCadences().get(FrequencyClass.DAILY));
		assertFalse(scheduler.isStarted());
		assertSame(scheduler, service.getScheduler());
		assertSame(context.getBean(ReadThroughResponseCache.class), service.getResponseCache());

		assertTrue(context.getBean("sbSyncHealthIndicator", HealthIndicator.class) instanceof RefreshStatusHealthIndicator);
		assertNotNull(context.getBean(SyncMetricsBinder.class));
		assertNotNull(context.getBean(SnapshotManager.class));

		service.runNow(FrequencyClass.DAILY, true);
		assertEquals(1, service.combinedView().size());
		MeterRegistry meterRegistry = context.getBean(MeterRegistry.class);
		assertNotNull(meterRegistry.find("cache.hits").tag("cache", "http").functionCounter());
	}

	@Test
	public void testResponseCacheDisabled() throws Exception {
		load(null, "sb-sync.response-cache.backend=none");

		assertTrue(context.getBeansOfType(SBCacheBackend.class).isEmpty());
		assertFalse(context.getBean(ReadThroughResponseCache.class).isEnabled());
	}

	@Test
	public void testResponseCacheSwitchedOff() throws Exception {
		load(null, "sb-sync.response-cache.enabled=false");

		assertFalse(context.getBean(ReadThroughResponseCache.class).isEnabled());
	}

	@Test
	public void testSnapshotDisabled() throws Exception {
		load(FetcherConfig.class, "sb-sync.snapshot.enabled=false");

		assertTrue(context.getBeansOfType(SnapshotManager.class).isEmpty());
		assertNotNull(context.getBean(TieredSyncService.class));
	}

	@Test
	public void testFunctionCacheManagerWhenCachingEnabled() throws Exception {
		load(CachingConfig.class, "sb-sync.function-cache.ttls.fred-series=PT5M");

		CacheManager manager = context.getBean(CacheManager.class);
		assertTrue(manager instanceof SBCacheManager);
		assertEquals(Duration.ofMinutes(5), ((SBCache) manager.getCache("fred-series")).getTtl());
		assertEquals(Duration.ofHours(1), ((SBCache) manager.getCache("other")).getTtl());
		assertSame(context.getBean(SBCacheBackend.class), manager.getCache("other").getNativeCache());
	}

	@Test
	public void testNoFunctionCacheWithoutEnableCaching() throws Exception {
		load(null);

		assertTrue(context.getBeansOfType(CacheManager.class).isEmpty());
	}

	@Test
	public void testFunctionCacheCanBeDisabled() throws Exception {
		load(CachingConfig.class, "sb-sync.function-cache.enabled=false");

		assertTrue(context.getBeansOfType(SBCacheManager.class).isEmpty());
	}

	@Test
	public void testUserBackendWins() throws Exception {
		load(UserBackendConfig.class);

		assertSame(UserBackendConfig.BACKEND, context.getBean(SBCacheBackend.class));
	}

	private void load(Class<?> userConfig, String... properties) throws Exception {
		context = new AnnotationConfigApplicationContext();
		TestPropertyValues.of(
				"sb-sync.store-dir=" + folder.newFolder("cache").getAbsolutePath(),
				"sb-sync.snapshot.dir=" + folder.newFolder("backups").getAbsolutePath(),
				"sb-sync.rate-limit.min-delay-millis=0",
				"sb-sync.auto-start=false")
			.and(properties)
			.applyTo(context);
		if (userConfig != null) {
			context.register(userConfig);
		}
		context.register(SyncAutoConfiguration.class);
		context.refresh();
	}

	@Configuration(proxyBeanMethods = false)
	static class FetcherConfig {

		@Bean
		public SBDatasetFetcher fetcher() {
			return (id, params, since) -> TimeSeries.builder()
				.point(Instant.parse("2024-01-02T00:00:00Z"), 4.1)
				.build();
		}

		@Bean
		public MeterRegistry meterRegistry() {
			return new SimpleMeterRegistry();
		}
	}

	@Configuration(proxyBeanMethods = false)
	@EnableCaching
	static class CachingConfig {
	}

	@Configuration(proxyBeanMethods = false)
	static class UserBackendConfig {
		static final SBCacheBackend BACKEND = new InMemoryCacheBackend();

		@Bean
		public SBCacheBackend userBackend() {
			return BACKEND;
		}
	}
}
