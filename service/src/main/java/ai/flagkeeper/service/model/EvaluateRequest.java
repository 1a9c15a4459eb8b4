package ai.flagkeeper.service.model;

import ai.flagkeeper.online.EvaluationRequest;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

// One entry of the /v1/flags/evaluate request body
@JsonIgnoreProperties(ignoreUnknown = true)
public class EvaluateRequest {
    @JsonAlias("feature_key")
    public String featureKey;

    @JsonAlias("user_id")
    public String userId;

    public List<String> groups;

    public EvaluationRequest toEvaluationRequest() {
        return new EvaluationRequest(featureKey, userId, groups);
    }
}
