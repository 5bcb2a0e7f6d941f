package com.ifblock.block;

import java.util.List;

/**
 * Caller-supplied filter marking regions of a template in which markers
 * are treated as plain text.
 */
@FunctionalInterface
public interface ScanExclusion {

    /**
     * Exclusion that excludes nothing: markers are recognized everywhere.
     */
    ScanExclusion NONE = content -> List.of();

    /**
     * Compute the excluded regions of a template.
     *
     * @param content Template text
     * @return Excluded ranges in document order
     */
    List<TextRange> excludedRanges(String content);
}
