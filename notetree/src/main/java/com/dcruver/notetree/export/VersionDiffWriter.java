package com.dcruver.notetree.export;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Unified diffs between two revisions of a note's content.
 */
@Component
public class VersionDiffWriter {

    private static final int CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between two versions of content
     */
    public String generateDiff(String original, String revised, String originalLabel, String revisedLabel) {
        List<String> originalLines = toLines(original);
        List<String> revisedLines = toLines(revised);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            originalLabel,
            revisedLabel,
            originalLines,
            patch,
            CONTEXT_LINES
        );

        return String.join("\n", unifiedDiff);
    }

    // A trailing newline yields a final empty line, so adding or dropping it is a change
    private static List<String> toLines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }
}
