package ai.flagkeeper.service.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of the feature create / update admin routes. Fields left out of an update keep their current
 * value; a created feature defaults to disabled.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureRequest {
    public String key;

    @JsonAlias("default_enabled")
    public Boolean defaultEnabled;

    public String description;
}
