package io.planwright.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;

/// Keeps the derived `isGoto()` flag out of `onError` JSON; only `strategy` and
/// `targetNodeId` are written.
public abstract class ErrorHandlingMixin {

    @JsonIgnore
    abstract boolean isGoto();
}
