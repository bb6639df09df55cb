package linkguard.core.model.ratelimit;

import java.util.Objects;

/**
 * The parts of an inbound request the admission controller looks at.
 *
 * @param callerAddress the resolved client address
 * @param method the HTTP method
 * @param path the request path
 */
public record AdmissionRequest(String callerAddress, String method, String path) {

    public AdmissionRequest {
        callerAddress = Objects.requireNonNullElse(callerAddress, "unknown");
        method = Objects.requireNonNullElse(method, "GET");
        path = Objects.requireNonNullElse(path, "/");
    }
}
