package org.scriptonbasestar.sync.spring.boot;

import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables SB Sync in applications that do not use auto-configuration.
 *
 * <h3>Basic Usage:</h3>
 * <pre>{@code
 * @Configuration
 * @EnableSBSync
 * public class SyncConfig {
 *     @Bean
 *     public SBDatasetFetcher fetcher() {
 *         return new FredFetcher(apiKey);
 *     }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 * @see SyncAutoConfiguration
 * @see SyncProperties
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(SyncAutoConfiguration.class)
public @interface EnableSBSync {
}
