package com.document.resource.truncation;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Output of {@link TruncationGuard}.
 *
 * @param text           the bounded text, footer included when truncated
 * @param truncated      whether the input exceeded the limit
 * @param originalLength length of the input, present only when truncated
 */
public record TruncationResult(String text, boolean truncated, OptionalInt originalLength) {

    public TruncationResult {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(originalLength, "originalLength is required");
        if (truncated != originalLength.isPresent()) {
            throw new IllegalArgumentException("originalLength must be present exactly when truncated");
        }
    }

    public static TruncationResult unchanged(String text) {
        return new TruncationResult(text, false, OptionalInt.empty());
    }

    public static TruncationResult truncated(String text, int originalLength) {
        return new TruncationResult(text, true, OptionalInt.of(originalLength));
    }
}
