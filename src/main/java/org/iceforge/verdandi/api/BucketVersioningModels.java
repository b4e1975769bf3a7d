package org.iceforge.verdandi.api;

import com.fasterxml.jackson.annotation.JsonInclude;

public final class BucketVersioningModels {

    private BucketVersioningModels() {}

    public record VersioningStatusResponse(boolean enabled) {}

    /** {@code deleteVersionId} is left out when the store did not report a marker version. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DeleteMarkerResponse(String deleteVersionId) {}

    public record ApiError(String error, String message) {}
}
