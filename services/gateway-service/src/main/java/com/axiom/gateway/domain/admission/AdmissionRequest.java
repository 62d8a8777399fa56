package com.axiom.gateway.domain.admission;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Input to {@link AdmissionController#admit}.
 *
 * <p>The project is resolved lazily, after authentication, so that resource lookups never run
 * for unauthenticated callers.
 *
 * @param authorizationHeader raw {@code Authorization} header, may be null
 * @param clientAddress remote address, used as the rate limit key for anonymous callers
 * @param projectResolver yields the project the operation touches; null for unscoped operations
 * @param estimatedCost expected spend for cost-incurring operations, otherwise zero
 */
public record AdmissionRequest(
        GatedOperation operation,
        String authorizationHeader,
        String clientAddress,
        Supplier<UUID> projectResolver,
        BigDecimal estimatedCost) {

    public AdmissionRequest {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        if (operation.projectScoped() && projectResolver == null) {
            throw new IllegalArgumentException(operation + " requires a project");
        }
        estimatedCost = estimatedCost != null ? estimatedCost : BigDecimal.ZERO;
    }

    public static AdmissionRequest forProject(GatedOperation operation, String authorizationHeader,
                                              String clientAddress, UUID projectId, BigDecimal estimatedCost) {
        return new AdmissionRequest(operation, authorizationHeader, clientAddress, () -> projectId, estimatedCost);
    }

    public static AdmissionRequest forProject(GatedOperation operation, String authorizationHeader,
                                              String clientAddress, UUID projectId) {
        return forProject(operation, authorizationHeader, clientAddress, projectId, BigDecimal.ZERO);
    }

    /** The project is looked up from an owned resource, such as an IVCU or certificate. */
    public static AdmissionRequest forResource(GatedOperation operation, String authorizationHeader,
                                               String clientAddress, Supplier<UUID> projectResolver) {
        return new AdmissionRequest(operation, authorizationHeader, clientAddress, projectResolver, BigDecimal.ZERO);
    }

    public static AdmissionRequest unscoped(GatedOperation operation, String authorizationHeader,
                                            String clientAddress) {
        return new AdmissionRequest(operation, authorizationHeader, clientAddress, null, BigDecimal.ZERO);
    }
}
