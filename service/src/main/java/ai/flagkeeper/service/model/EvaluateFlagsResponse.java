package ai.flagkeeper.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * PoJo capturing the response we return from /v1/flags/evaluate. Each request in the batch gets a
 * result, in request order; a store failure marks that result as Failure instead of reporting the
 * flag as disabled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluateFlagsResponse {
    private final List<Result> results;

    private EvaluateFlagsResponse(Builder builder) {
        this.results = builder.results;
    }

    public List<Result> getResults() {
        return results;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<Result> results = new ArrayList<>();

        public Builder results(List<Result> results) {
            this.results = results;
            return this;
        }

        public Builder addResult(Result result) {
            this.results.add(result);
            return this;
        }

        public EvaluateFlagsResponse build() {
            return new EvaluateFlagsResponse(this);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Result {
        public enum Status {
            Success,
            Failure
        }

        private final Status status;
        private final String featureKey;
        private final String userId;
        private final Boolean enabled;
        private final String error;

        private Result(Builder builder) {
            this.status = builder.status;
            this.featureKey = builder.featureKey;
            this.userId = builder.userId;
            this.enabled = builder.enabled;
            this.error = builder.error;
        }

        public Status getStatus() {
            return status;
        }

        public String getFeatureKey() {
            return featureKey;
        }

        public String getUserId() {
            return userId;
        }

        public Boolean getEnabled() {
            return enabled;
        }

        public String getError() {
            return error;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private Status status;
            private String featureKey;
            private String userId;
            private Boolean enabled;
            private String error;

            public Builder status(Status status) {
                this.status = status;
                return this;
            }

            public Builder featureKey(String featureKey) {
                this.featureKey = featureKey;
                return this;
            }

            public Builder userId(String userId) {
                this.userId = userId;
                return this;
            }

            public Builder enabled(Boolean enabled) {
                this.enabled = enabled;
                return this;
            }

            public Builder error(String error) {
                this.error = error;
                return this;
            }

            public Result build() {
                return new Result(this);
            }
        }
    }
}
