package ai.flagkeeper.service;

import io.vertx.config.ConfigRetriever;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.Optional;

/**
 * Helps keep track of the flag service configs.
 * Configs are read once at startup from the default Vert.x config stores (conf/config.json, system
 * properties and environment variables, later ones winning).
 */
public class ConfigStore {

    private static final int DEFAULT_PORT = 8080;
    private static final int DEFAULT_POOL_SIZE = 10;

    public static final String STORE_TYPE_MEMORY = "memory";
    public static final String STORE_TYPE_JDBC = "jdbc";

    private static final String SERVER_PORT = "server.port";
    private static final String STORE_TYPE = "store.type";
    private static final String JDBC_URL = "store.jdbc.url";
    private static final String JDBC_USER = "store.jdbc.user";
    private static final String JDBC_PASSWORD = "store.jdbc.password";
    private static final String JDBC_POOL_SIZE = "store.jdbc.pool.size";
    private static final String JDBC_INIT_SCHEMA = "store.jdbc.init.schema";

    private final JsonObject jsonConfig;

    public ConfigStore(JsonObject jsonConfig) {
        this.jsonConfig = jsonConfig.copy();
    }

    /**
     * Reads the service config through the default Vert.x config stores. A config that can't be read
     * (e.g. a malformed conf/config.json) fails the returned future with the underlying cause.
     */
    public static Future<ConfigStore> load(Vertx vertx) {
        ConfigRetriever configRetriever = ConfigRetriever.create(vertx);
        return configRetriever.getConfig()
                .onComplete(ar -> configRetriever.close())
                .map(ConfigStore::new);
    }

    public int getServerPort() {
        return intValue(SERVER_PORT, DEFAULT_PORT);
    }

    public String getStoreType() {
        return jsonConfig.getString(STORE_TYPE, STORE_TYPE_MEMORY);
    }

    public Optional<String> getJdbcUrl() {
        return Optional.ofNullable(jsonConfig.getString(JDBC_URL));
    }

    public Optional<String> getJdbcUser() {
        return Optional.ofNullable(jsonConfig.getString(JDBC_USER));
    }

    public Optional<String> getJdbcPassword() {
        return Optional.ofNullable(jsonConfig.getString(JDBC_PASSWORD));
    }

    public int getJdbcPoolSize() {
        return intValue(JDBC_POOL_SIZE, DEFAULT_POOL_SIZE);
    }

    public boolean shouldInitSchema() {
        Object value = jsonConfig.getValue(JDBC_INIT_SCHEMA);
        return value == null || Boolean.parseBoolean(String.valueOf(value));
    }

    /**
     * Pretty printed config for the /config route. The database password is masked.
     */
    public String encodeConfig() {
        JsonObject visible = jsonConfig.copy();
        if (visible.containsKey(JDBC_PASSWORD)) {
            visible.put(JDBC_PASSWORD, "******");
        }
        return visible.encodePrettily();
    }

    // system properties and env vars come through as strings
    private int intValue(String key, int defaultValue) {
        Object value = jsonConfig.getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' must be an integer, got: " + value, e);
        }
    }
}
