package ai.flagkeeper.service.model;

import ai.flagkeeper.online.Feature;
import ai.flagkeeper.online.FeatureOverride;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * JSON views of the stored records returned by the admin routes.
 */
public final class FlagJson {

    private FlagJson() {
    }

    public static JsonObject toJson(Feature feature) {
        return new JsonObject()
                .put("id", feature.getId())
                .put("key", feature.getKey())
                .put("defaultEnabled", feature.isDefaultEnabled())
                .put("description", feature.getDescription())
                .put("createdAt", String.valueOf(feature.getCreatedAt()))
                .put("updatedAt", String.valueOf(feature.getUpdatedAt()));
    }

    public static JsonObject toJson(FeatureOverride override) {
        return new JsonObject()
                .put("id", override.getId())
                .put("featureId", override.getFeatureId())
                .put("targetType", override.getTargetType().name())
                .put("targetIdentifier", override.getTargetIdentifier())
                .put("enabled", override.isEnabled())
                .put("createdAt", String.valueOf(override.getCreatedAt()));
    }

    public static JsonArray featuresToJson(List<Feature> features) {
        JsonArray array = new JsonArray();
        features.forEach(f -> array.add(toJson(f)));
        return array;
    }

    public static JsonArray overridesToJson(List<FeatureOverride> overrides) {
        JsonArray array = new JsonArray();
        overrides.forEach(o -> array.add(toJson(o)));
        return array;
    }
}
