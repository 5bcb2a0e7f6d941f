package com.ifblock.block;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds block markers in raw template text.
 * <p>
 * Recognized forms, with whitespace allowed after the opening braces, between
 * keyword parts and before the closing braces:
 * <pre>
 * {{#if EXPR}}   {{else if EXPR}}   {{else}}   {{/if}}
 * </pre>
 * Keywords are matched exactly (case-sensitive). Anything else in double braces,
 * such as a {@code {{VAR}}} placeholder, is left as text.
 * <p>
 * A marker that is the only non-blank text on its line is standalone: its span
 * covers the whole line, including indentation and the line break, so removing
 * it leaves no empty line behind. Inline markers span exactly their own text.
 */
public class TagScanner {

    private static final Logger log = LoggerFactory.getLogger(TagScanner.class);

    private static final Pattern TAG = Pattern.compile(
            "\\{\\{\\s*(?:"
                    + "#if(?=\\s|\\}\\})\\s*(?<if>.*?)"
                    + "|else\\s+if(?=\\s|\\}\\})\\s*(?<elseif>.*?)"
                    + "|(?<else>else)"
                    + "|(?<end>/if)"
                    + ")\\s*\\}\\}",
            Pattern.DOTALL);

    private final ScanExclusion exclusion;

    public TagScanner() {
        this(ScanExclusion.NONE);
    }

    public TagScanner(ScanExclusion exclusion) {
        this.exclusion = exclusion;
    }

    /**
     * Scan the template for markers.
     *
     * @param content  Template text
     * @param lines    Line index over the same text
     * @return Markers in document order, each stamped with its line
     */
    public List<TagEvent> scan(String content, LineIndex lines) {
        List<TextRange> excluded = exclusion.excludedRanges(content);
        List<TagEvent> events = new ArrayList<>();
        Matcher m = TAG.matcher(content);

        while (m.find()) {
            if (isExcluded(excluded, m.start())) {
                continue;
            }
            int line = lines.lineAt(m.start());
            int start = m.start();
            int end = m.end();
            int lineStart = blankBefore(content, start);
            int lineEnd = blankAfter(content, end);
            if (lineStart >= 0 && lineEnd >= 0) {
                start = lineStart;
                end = lineEnd;
            }

            TagEvent event;
            if (m.group("if") != null) {
                event = new TagEvent(TagKind.IF, m.group("if"), line, start, end, m.start("if"));
            } else if (m.group("elseif") != null) {
                event = new TagEvent(TagKind.ELSE_IF, m.group("elseif"), line, start, end, m.start("elseif"));
            } else if (m.group("else") != null) {
                event = new TagEvent(TagKind.ELSE, null, line, start, end, -1);
            } else {
                event = new TagEvent(TagKind.END_IF, null, line, start, end, -1);
            }
            events.add(event);
        }

        log.debug("Scanned {} markers ({} excluded regions)", events.size(), excluded.size());
        return events;
    }

    /**
     * Start of the line holding {@code offset} if only blanks precede it on that line, else -1.
     */
    private static int blankBefore(String content, int offset) {
        int i = offset;
        while (i > 0 && isBlank(content.charAt(i - 1))) {
            i--;
        }
        return i == 0 || content.charAt(i - 1) == '\n' ? i : -1;
    }

    /**
     * Offset just past the line break ending the line at {@code offset} if only
     * blanks follow on that line, else -1. At end of input the line has no break.
     */
    private static int blankAfter(String content, int offset) {
        int i = offset;
        while (i < content.length() && isBlank(content.charAt(i))) {
            i++;
        }
        if (i == content.length()) {
            return i;
        }
        return content.charAt(i) == '\n' ? i + 1 : -1;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r';
    }

    private static boolean isExcluded(List<TextRange> ranges, int offset) {
        for (TextRange range : ranges) {
            if (range.contains(offset)) {
                return true;
            }
        }
        return false;
    }
}
