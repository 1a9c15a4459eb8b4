/*
 *    Copyright (C) 2026 The Flagkeeper Authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package ai.flagkeeper.online;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link FlagStore} on top of a relational database, using plain JDBC.
 *
 * Uniqueness and the feature/override ownership are declared in the schema (see {@link #createSchema()})
 * so the database stays the authority when writers race: a losing insert fails on the unique index and
 * is reported as a {@link ConflictException}. Overrides go away with their feature through
 * {@code ON DELETE CASCADE}.
 */
public class JdbcFlagStore implements FlagStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcFlagStore.class);

    static final String UNIQUE_VIOLATION = "23505";
    static final String FOREIGN_KEY_VIOLATION = "23503";
    // H2 reports a missing parent row with its own code
    static final String FOREIGN_KEY_PARENT_MISSING = "23506";

    private static final String[] SCHEMA = {
            "CREATE TABLE IF NOT EXISTS features ("
                    + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                    + " feature_key VARCHAR(255) NOT NULL,"
                    + " default_enabled BOOLEAN DEFAULT FALSE NOT NULL,"
                    + " description VARCHAR(4096),"
                    + " created_at TIMESTAMP WITH TIME ZONE NOT NULL,"
                    + " updated_at TIMESTAMP WITH TIME ZONE NOT NULL,"
                    + " CONSTRAINT uq_features_key UNIQUE (feature_key))",
            "CREATE TABLE IF NOT EXISTS feature_overrides ("
                    + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                    + " feature_id BIGINT NOT NULL,"
                    + " target_type VARCHAR(16) NOT NULL,"
                    + " target_identifier VARCHAR(255) NOT NULL,"
                    + " enabled BOOLEAN NOT NULL,"
                    + " created_at TIMESTAMP WITH TIME ZONE NOT NULL,"
                    + " CONSTRAINT uq_feature_overrides_target UNIQUE (feature_id, target_type, target_identifier),"
                    + " CONSTRAINT fk_feature_overrides_feature FOREIGN KEY (feature_id)"
                    + " REFERENCES features (id) ON DELETE CASCADE)",
            "CREATE INDEX IF NOT EXISTS idx_feature_overrides_feature_id ON feature_overrides (feature_id)"
    };

    private static final String FEATURE_COLUMNS = "id, feature_key, default_enabled, description, created_at, updated_at";
    private static final String OVERRIDE_COLUMNS = "id, feature_id, target_type, target_identifier, enabled, created_at";

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcFlagStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcFlagStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    /**
     * Creates the tables and indexes if they don't exist yet.
     */
    public void createSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
            logger.info("Flag store schema is in place");
        } catch (SQLException e) {
            logger.error("Failed to create flag store schema", e);
            throw new FlagStoreException("Failed to create flag store schema", e);
        }
    }

    @Override
    public Optional<Feature> findFeature(String key) {
        if (key == null) {
            return Optional.empty();
        }
        try (Connection conn = dataSource.getConnection()) {
            return selectFeature(conn, key);
        } catch (SQLException e) {
            throw storeFailure("Failed to look up feature " + key, e);
        }
    }

    @Override
    public Optional<FeatureOverride> findOverride(Feature feature, TargetType targetType, String targetIdentifier) {
        String sql = "SELECT " + OVERRIDE_COLUMNS + " FROM feature_overrides"
                + " WHERE feature_id = ? AND target_type = ? AND target_identifier = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, feature.getId());
            stmt.setString(2, targetType.name());
            stmt.setString(3, targetIdentifier);
            return firstOverride(stmt);
        } catch (SQLException e) {
            throw storeFailure("Failed to look up " + targetType + " override for " + feature.getKey(), e);
        }
    }

    @Override
    public Optional<FeatureOverride> findLatestOverride(Feature feature, TargetType targetType, Collection<String> targetIdentifiers) {
        if (targetIdentifiers == null || targetIdentifiers.isEmpty()) {
            return Optional.empty();
        }
        List<String> identifiers = new ArrayList<>(new LinkedHashSet<>(targetIdentifiers));
        String placeholders = identifiers.stream().map(id -> "?").collect(Collectors.joining(","));
        String sql = "SELECT " + OVERRIDE_COLUMNS + " FROM feature_overrides"
                + " WHERE feature_id = ? AND target_type = ? AND target_identifier IN (" + placeholders + ")"
                + " ORDER BY created_at DESC, id DESC"
                + " LIMIT 1";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, feature.getId());
            stmt.setString(2, targetType.name());
            for (int i = 0; i < identifiers.size(); i++) {
                stmt.setString(i + 3, identifiers.get(i));
            }
            return firstOverride(stmt);
        } catch (SQLException e) {
            throw storeFailure("Failed to look up latest " + targetType + " override for " + feature.getKey(), e);
        }
    }

    @Override
    public Optional<FeatureOverride> findOverrideById(Feature feature, long overrideId) {
        String sql = "SELECT " + OVERRIDE_COLUMNS + " FROM feature_overrides WHERE id = ? AND feature_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, overrideId);
            stmt.setLong(2, feature.getId());
            return firstOverride(stmt);
        } catch (SQLException e) {
            throw storeFailure("Failed to look up override " + overrideId, e);
        }
    }

    @Override
    public List<Feature> listFeatures() {
        String sql = "SELECT " + FEATURE_COLUMNS + " FROM features ORDER BY feature_key";
        List<Feature> features = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                features.add(mapFeature(rs));
            }
        } catch (SQLException e) {
            throw storeFailure("Failed to list features", e);
        }
        return features;
    }

    @Override
    public List<FeatureOverride> listOverrides(Feature feature) {
        String sql = "SELECT " + OVERRIDE_COLUMNS + " FROM feature_overrides WHERE feature_id = ? ORDER BY created_at, id";
        List<FeatureOverride> overrides = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, feature.getId());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    overrides.add(mapOverride(rs));
                }
            }
        } catch (SQLException e) {
            throw storeFailure("Failed to list overrides for " + feature.getKey(), e);
        }
        return overrides;
    }

    @Override
    public Feature createFeature(String key, boolean defaultEnabled, String description) {
        FlagValidations.validateFeatureKey(key).getValue();
        String sql = "INSERT INTO features (feature_key, default_enabled, description, created_at, updated_at)"
                + " VALUES (?, ?, ?, ?, ?)";
        Instant now = now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, key);
            stmt.setBoolean(2, defaultEnabled);
            stmt.setString(3, description);
            stmt.setObject(4, toDbTime(now));
            stmt.setObject(5, toDbTime(now));
            stmt.executeUpdate();

            Feature feature = Feature.builder()
                    .id(generatedId(stmt))
                    .key(key)
                    .defaultEnabled(defaultEnabled)
                    .description(description)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            logger.info("Created {}", feature);
            return feature;
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new ConflictException("Feature key has already been taken: " + key, e);
            }
            throw storeFailure("Failed to create feature " + key, e);
        }
    }

    @Override
    public Feature updateFeature(String key, Boolean defaultEnabled, String description) {
        FlagValidations.validateFeatureKey(key).getValue();
        // omitted fields keep their stored value within the same statement
        String sql = "UPDATE features SET default_enabled = COALESCE(CAST(? AS BOOLEAN), default_enabled),"
                + " description = COALESCE(CAST(? AS VARCHAR(4096)), description), updated_at = ? WHERE feature_key = ?";
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                if (defaultEnabled == null) {
                    stmt.setNull(1, Types.BOOLEAN);
                } else {
                    stmt.setBoolean(1, defaultEnabled);
                }
                if (description == null) {
                    stmt.setNull(2, Types.VARCHAR);
                } else {
                    stmt.setString(2, description);
                }
                stmt.setObject(3, toDbTime(now()));
                stmt.setString(4, key);
                if (stmt.executeUpdate() == 0) {
                    throw new FeatureNotFoundException(key);
                }
            }
            Feature updated = selectFeature(conn, key).orElseThrow(() -> new FeatureNotFoundException(key));
            logger.info("Updated {}", updated);
            return updated;
        } catch (SQLException e) {
            throw storeFailure("Failed to update feature " + key, e);
        }
    }

    @Override
    public boolean deleteFeature(String key) {
        if (key == null) {
            return false;
        }
        String sql = "DELETE FROM features WHERE feature_key = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            boolean deleted = stmt.executeUpdate() > 0;
            if (deleted) {
                logger.info("Deleted feature {}", key);
            }
            return deleted;
        } catch (SQLException e) {
            throw storeFailure("Failed to delete feature " + key, e);
        }
    }

    @Override
    public FeatureOverride createOverride(Feature feature, TargetType targetType, String targetIdentifier, boolean enabled) {
        FlagValidations.validateOverride(targetType, targetIdentifier).getValue();
        String sql = "INSERT INTO feature_overrides (feature_id, target_type, target_identifier, enabled, created_at)"
                + " VALUES (?, ?, ?, ?, ?)";
        Instant now = now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setLong(1, feature.getId());
            stmt.setString(2, targetType.name());
            stmt.setString(3, targetIdentifier);
            stmt.setBoolean(4, enabled);
            stmt.setObject(5, toDbTime(now));
            stmt.executeUpdate();

            FeatureOverride override = FeatureOverride.builder()
                    .id(generatedId(stmt))
                    .featureId(feature.getId())
                    .targetType(targetType)
                    .targetIdentifier(targetIdentifier)
                    .enabled(enabled)
                    .createdAt(now)
                    .build();
            logger.info("Created {}", override);
            return override;
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new ConflictException("Target identifier has already been taken for "
                        + feature.getKey() + " " + targetType + ": " + targetIdentifier, e);
            }
            if (FOREIGN_KEY_VIOLATION.equals(e.getSQLState()) || FOREIGN_KEY_PARENT_MISSING.equals(e.getSQLState())) {
                throw new FeatureNotFoundException(feature.getKey(), e);
            }
            throw storeFailure("Failed to create override for " + feature.getKey(), e);
        }
    }

    @Override
    public void deleteOverride(long overrideId) {
        String sql = "DELETE FROM feature_overrides WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, overrideId);
            if (stmt.executeUpdate() > 0) {
                logger.info("Deleted override {}", overrideId);
            }
        } catch (SQLException e) {
            throw storeFailure("Failed to delete override " + overrideId, e);
        }
    }

    /**
     * Closes the data source when it owns resources, e.g. a connection pool.
     */
    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) dataSource).close();
            } catch (Exception e) {
                throw new FlagStoreException("Failed to close data source", e);
            }
        }
    }

    private Optional<Feature> selectFeature(Connection conn, String key) throws SQLException {
        String sql = "SELECT " + FEATURE_COLUMNS + " FROM features WHERE feature_key = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapFeature(rs)) : Optional.empty();
            }
        }
    }

    private Optional<FeatureOverride> firstOverride(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? Optional.of(mapOverride(rs)) : Optional.empty();
        }
    }

    private static long generatedId(PreparedStatement stmt) throws SQLException {
        try (ResultSet keys = stmt.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated id returned");
            }
            return keys.getLong(1);
        }
    }

    private static Feature mapFeature(ResultSet rs) throws SQLException {
        return Feature.builder()
                .id(rs.getLong("id"))
                .key(rs.getString("feature_key"))
                .defaultEnabled(rs.getBoolean("default_enabled"))
                .description(rs.getString("description"))
                .createdAt(fromDbTime(rs, "created_at"))
                .updatedAt(fromDbTime(rs, "updated_at"))
                .build();
    }

    private static FeatureOverride mapOverride(ResultSet rs) throws SQLException {
        String targetType = rs.getString("target_type");
        return FeatureOverride.builder()
                .id(rs.getLong("id"))
                .featureId(rs.getLong("feature_id"))
                .targetType(TargetType.valueOf(targetType))
                .targetIdentifier(rs.getString("target_identifier"))
                .enabled(rs.getBoolean("enabled"))
                .createdAt(fromDbTime(rs, "created_at"))
                .build();
    }

    // timestamps are stored with an explicit UTC offset so ordering never depends on the JVM time zone
    private static OffsetDateTime toDbTime(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant fromDbTime(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, OffsetDateTime.class).toInstant();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static FlagStoreException storeFailure(String message, SQLException e) {
        logger.error(message, e);
        return new FlagStoreException(message, e);
    }
}
