package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.inference.gateway.domain.model.GatewayError;
import fr.lapetina.inference.gateway.domain.model.TargetFailure;

import java.util.List;

/**
 * OpenAI style error envelope: {@code {"error": {...}}}.
 */
public class ErrorResponse {

    private Body error;

    public Body getError() { return error; }
    public void setError(Body error) { this.error = error; }

    public static ErrorResponse from(GatewayError gatewayError) {
        Body body = new Body();
        body.setMessage(gatewayError.message());
        body.setType(gatewayError.type().wireName());
        body.setCode(gatewayError.code());
        if (!gatewayError.failures().isEmpty()) {
            body.setFailures(gatewayError.failures().stream().map(Failure::from).toList());
        }
        ErrorResponse response = new ErrorResponse();
        response.setError(body);
        return response;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Body {
        private String message;
        private String type;
        private int code;
        private List<Failure> failures;

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getCode() { return code; }
        public void setCode(int code) { this.code = code; }

        public List<Failure> getFailures() { return failures; }
        public void setFailures(List<Failure> failures) { this.failures = failures; }
    }

    public static class Failure {
        private String target;
        private String type;
        private String message;
        private int code;

        static Failure from(TargetFailure failure) {
            Failure f = new Failure();
            f.setTarget(failure.target());
            f.setType(failure.type().wireName());
            f.setMessage(failure.message());
            f.setCode(failure.code());
            return f;
        }

        public String getTarget() { return target; }
        public void setTarget(String target) { this.target = target; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }

        public int getCode() { return code; }
        public void setCode(int code) { this.code = code; }
    }
}
