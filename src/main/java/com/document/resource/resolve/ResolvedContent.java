package com.document.resource.resolve;

import java.util.Objects;

/**
 * Result of resolving an address: the text slice, or a failure with guidance for the caller.
 *
 * @param content    the resolved text, null on failure
 * @param failure    the failure kind, null on success
 * @param error      what went wrong, may be null for {@link ResolutionFailure#NOT_CACHE_BACKED}
 * @param hint       what to do about it
 * @param suggestion a concrete next step, such as an address or operation to call, may be null
 */
public record ResolvedContent(
        String content,
        ResolutionFailure failure,
        String error,
        String hint,
        String suggestion
) {

    public ResolvedContent {
        if ((content == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of content or failure is required");
        }
    }

    public static ResolvedContent of(String content) {
        return new ResolvedContent(Objects.requireNonNull(content, "content is required"), null, null, null, null);
    }

    public static ResolvedContent failed(ResolutionFailure failure, String error, String hint, String suggestion) {
        return new ResolvedContent(null, Objects.requireNonNull(failure, "failure is required"), error, hint, suggestion);
    }

    public boolean found() {
        return content != null;
    }
}
