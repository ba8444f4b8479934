package com.address.resolution.application.dto;

import com.address.resolution.application.port.out.GeocodingProviderException;
import com.address.resolution.domain.model.ResolvedAddress;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a resolution call. The address is never null; every non-resolved
 * status carries {@link ResolvedAddress#empty()} so callers can render it directly.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ResolutionResult {

    public enum Status {
        RESOLVED,
        NOT_FOUND,
        VALIDATION_ERROR,
        PROVIDER_ERROR
    }

    private final Status status;
    private final ResolvedAddress address;
    private final GeocodingProviderException.Reason failureReason;
    private final String message;

    private ResolutionResult(
            Status status,
            ResolvedAddress address,
            GeocodingProviderException.Reason failureReason,
            String message) {
        this.status = status;
        this.address = address;
        this.failureReason = failureReason;
        this.message = message;
    }

    public static ResolutionResult resolved(ResolvedAddress address) {
        return new ResolutionResult(Status.RESOLVED, address, null, null);
    }

    public static ResolutionResult notFound(String message) {
        return new ResolutionResult(Status.NOT_FOUND, ResolvedAddress.empty(), null, message);
    }

    public static ResolutionResult validationError(String message) {
        return new ResolutionResult(Status.VALIDATION_ERROR, ResolvedAddress.empty(), null, message);
    }

    public static ResolutionResult providerError(GeocodingProviderException error) {
        return new ResolutionResult(
            Status.PROVIDER_ERROR, ResolvedAddress.empty(), error.getReason(), error.getMessage());
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
