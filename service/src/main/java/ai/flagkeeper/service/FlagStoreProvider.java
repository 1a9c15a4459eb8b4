package ai.flagkeeper.service;

import ai.flagkeeper.online.FlagStore;
import ai.flagkeeper.online.FlagStoreException;
import ai.flagkeeper.online.InMemoryFlagStore;
import ai.flagkeeper.online.JdbcFlagStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for building the FlagStore the web service reads and writes. Configured with:
 * store.type - 'memory' (default) or 'jdbc'
 * store.jdbc.url / store.jdbc.user / store.jdbc.password - connection params for 'jdbc'
 * store.jdbc.pool.size - max connections in the pool
 * store.jdbc.init.schema - create the tables on startup if missing (default true)
 */
public class FlagStoreProvider {
    private static final Logger logger = LoggerFactory.getLogger(FlagStoreProvider.class);

    public static FlagStore buildFlagStore(ConfigStore configStore) {
        String storeType = configStore.getStoreType();
        switch (storeType) {
            case ConfigStore.STORE_TYPE_MEMORY:
                logger.info("Using in-memory flag store, flags won't survive a restart");
                return new InMemoryFlagStore();
            case ConfigStore.STORE_TYPE_JDBC:
                return buildJdbcFlagStore(configStore);
            default:
                throw new IllegalArgumentException(
                        "Unsupported store.type '" + storeType + "', expected 'memory' or 'jdbc'");
        }
    }

    private static FlagStore buildJdbcFlagStore(ConfigStore configStore) {
        String jdbcUrl = configStore.getJdbcUrl().orElseThrow(() ->
                new IllegalArgumentException("'store.jdbc.url' must be set when store.type is 'jdbc'"));

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName("flagkeeper-store");
        hikariConfig.setJdbcUrl(jdbcUrl);
        configStore.getJdbcUser().ifPresent(hikariConfig::setUsername);
        configStore.getJdbcPassword().ifPresent(hikariConfig::setPassword);
        hikariConfig.setMaximumPoolSize(configStore.getJdbcPoolSize());

        logger.info("Connecting flag store to {}", jdbcUrl);
        JdbcFlagStore flagStore = new JdbcFlagStore(new HikariDataSource(hikariConfig));
        if (configStore.shouldInitSchema()) {
            try {
                flagStore.createSchema();
            } catch (FlagStoreException e) {
                flagStore.close();
                throw e;
            }
        }
        return flagStore;
    }
}
