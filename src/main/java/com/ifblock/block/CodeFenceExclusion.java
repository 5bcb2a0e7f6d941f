package com.ifblock.block;

import java.util.ArrayList;
import java.util.List;

/**
 * Excludes Markdown fenced code blocks (``` or ~~~) so that markers shown
 * as examples inside code are left untouched. An unclosed fence runs to the
 * end of the document.
 */
public class CodeFenceExclusion implements ScanExclusion {

    @Override
    public List<TextRange> excludedRanges(String content) {
        List<TextRange> ranges = new ArrayList<>();
        int fenceStart = -1;
        int lineStart = 0;

        while (lineStart <= content.length()) {
            int newline = content.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? content.length() : newline + 1;

            if (isFenceToggle(content.substring(lineStart, lineEnd))) {
                if (fenceStart < 0) {
                    fenceStart = lineStart;
                } else {
                    ranges.add(new TextRange(fenceStart, lineEnd));
                    fenceStart = -1;
                }
            }

            if (newline < 0) {
                break;
            }
            lineStart = lineEnd;
        }

        if (fenceStart >= 0) {
            ranges.add(new TextRange(fenceStart, content.length()));
        }
        return ranges;
    }

    private static boolean isFenceToggle(String line) {
        String trimmed = line.stripLeading();
        return trimmed.startsWith("```") || trimmed.startsWith("~~~");
    }
}
