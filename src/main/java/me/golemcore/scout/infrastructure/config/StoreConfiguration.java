package me.golemcore.scout.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.adapter.outbound.store.InMemoryCacheStore;
import me.golemcore.scout.adapter.outbound.store.InMemoryCounterStore;
import me.golemcore.scout.adapter.outbound.store.RedisCacheStore;
import me.golemcore.scout.adapter.outbound.store.RedisCounterStore;
import me.golemcore.scout.port.outbound.CacheStorePort;
import me.golemcore.scout.port.outbound.CounterStorePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Builds the counter and cache store beans from {@link ScoutProperties}.
 *
 * <p>
 * {@code scout.store.redis-url} decides the backend once at startup:
 * <ul>
 * <li>empty or {@code memory} - in-process stores with a background
 * sweeper</li>
 * <li>anything else - a Redis URL ({@code redis://[:password@]host:port[/db]}
 * or {@code rediss://} for TLS) used by both stores over one Lettuce
 * connection</li>
 * </ul>
 *
 * <p>
 * Callers only ever see {@link CounterStorePort} and {@link CacheStorePort}.
 * The Redis connection is lazy, so an unreachable server surfaces on first
 * use as a backend failure rather than at startup.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class StoreConfiguration {

    private final ScoutProperties properties;

    @Bean(destroyMethod = "destroy")
    public StoreConnection storeConnection() {
        ScoutProperties.StoreProperties store = properties.getStore();
        if (!store.isDistributed()) {
            log.info("[Store] Using in-process counter and cache stores");
            return StoreConnection.memory();
        }
        LettuceConnectionFactory factory = redisConnectionFactory(store);
        factory.afterPropertiesSet();
        StringRedisTemplate template = new StringRedisTemplate(factory);
        log.info("[Store] Using Redis stores at {}", redactedUrl(store.getRedisUrl()));
        return StoreConnection.redis(factory, template);
    }

    @Bean
    public CounterStorePort counterStorePort(StoreConnection connection, ObjectProvider<Clock> clockProvider) {
        if (connection.isRedis()) {
            return new RedisCounterStore(connection.getTemplate());
        }
        InMemoryCounterStore store = new InMemoryCounterStore(clockProvider.getIfAvailable(Clock::systemUTC));
        store.startSweeper(properties.getStore().getSweepInterval());
        return store;
    }

    @Bean
    public CacheStorePort cacheStorePort(StoreConnection connection, ObjectProvider<Clock> clockProvider) {
        if (connection.isRedis()) {
            return new RedisCacheStore(connection.getTemplate());
        }
        InMemoryCacheStore store = new InMemoryCacheStore(clockProvider.getIfAvailable(Clock::systemUTC));
        store.startSweeper(properties.getStore().getSweepInterval());
        return store;
    }

    static LettuceConnectionFactory redisConnectionFactory(ScoutProperties.StoreProperties store) {
        RedisURI uri = RedisURI.create(store.getRedisUrl().trim());

        RedisStandaloneConfiguration serverConfig = new RedisStandaloneConfiguration();
        serverConfig.setHostName(uri.getHost());
        serverConfig.setPort(uri.getPort());
        serverConfig.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            serverConfig.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null && uri.getPassword().length > 0) {
            serverConfig.setPassword(RedisPassword.of(uri.getPassword()));
        }

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(store.getConnectTimeout())
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder clientConfig = LettuceClientConfiguration
                .builder()
                .clientOptions(clientOptions)
                .commandTimeout(store.getCommandTimeout());
        if (uri.isSsl()) {
            clientConfig.useSsl();
        }

        return new LettuceConnectionFactory(serverConfig, clientConfig.build());
    }

    static String redactedUrl(String url) {
        int at = url.lastIndexOf('@');
        int scheme = url.indexOf("://");
        if (at < 0 || scheme < 0) {
            return url;
        }
        return url.substring(0, scheme + 3) + "***" + url.substring(at);
    }

    /**
     * Holder for the optional Redis connection, so that both stores share it
     * and it is closed once on shutdown.
     */
    public static final class StoreConnection {

        private final LettuceConnectionFactory factory;
        private final StringRedisTemplate template;

        private StoreConnection(LettuceConnectionFactory factory, StringRedisTemplate template) {
            this.factory = factory;
            this.template = template;
        }

        static StoreConnection memory() {
            return new StoreConnection(null, null);
        }

        static StoreConnection redis(LettuceConnectionFactory factory, StringRedisTemplate template) {
            return new StoreConnection(factory, template);
        }

        public boolean isRedis() {
            return template != null;
        }

        public StringRedisTemplate getTemplate() {
            return template;
        }

        public void destroy() {
            if (factory != null) {
                factory.destroy();
            }
        }
    }
}
