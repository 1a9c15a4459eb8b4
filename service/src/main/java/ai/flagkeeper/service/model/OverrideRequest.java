package ai.flagkeeper.service.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

// Body of the override create admin route
@JsonIgnoreProperties(ignoreUnknown = true)
public class OverrideRequest {
    @JsonAlias("target_type")
    public String targetType;

    @JsonAlias("target_identifier")
    public String targetIdentifier;

    public Boolean enabled;
}
