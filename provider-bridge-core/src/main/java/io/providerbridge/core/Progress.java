package io.providerbridge.core;

import java.util.List;

/**
 * Loading progress pushed through {@code progressCallback}.
 */
public record Progress(List<Range> fullyLoadedFractionRanges) {
    public Progress {
        fullyLoadedFractionRanges = fullyLoadedFractionRanges == null ? List.of() : List.copyOf(fullyLoadedFractionRanges);
    }
}
