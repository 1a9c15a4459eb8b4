package ai.flagkeeper.online;

public class EvaluationResponse {
    public EvaluationRequest request;
    public JTry<Boolean> enabled;

    public EvaluationResponse(EvaluationRequest request, JTry<Boolean> enabled) {
        this.request = request;
        this.enabled = enabled;
    }
}
