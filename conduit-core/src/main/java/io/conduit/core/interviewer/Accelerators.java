package io.conduit.core.interviewer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parses accelerator keys from option labels.
///
/// Recognized forms, each with a single alphanumeric key:
/// - `[Y] Yes`
/// - `Y) Yes`
/// - `Y - Yes`
public final class Accelerators {

    private static final List<Pattern> PATTERNS =
            List.of(
                    Pattern.compile("^\\[([a-zA-Z0-9])\\]\\s*(.*)$"),
                    Pattern.compile("^([a-zA-Z0-9])\\)\\s*(.*)$"),
                    Pattern.compile("^([a-zA-Z0-9])\\s*-\\s+(.*)$"));

    /// A parsed label: accelerator key (empty when none) and the remaining text.
    public record Parsed(String key, String label) {
        public boolean hasKey() {
            return !key.isEmpty();
        }
    }

    private Accelerators() {}

    /// Splits a label into its accelerator key and the label text.
    ///
    /// @param label raw label, not null
    /// @return parsed result; key is empty and label is the trimmed input when no accelerator matches
    public static Parsed parse(String label) {
        String trimmed = label.trim();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(trimmed);
            if (matcher.matches()) {
                return new Parsed(matcher.group(1), matcher.group(2).trim());
            }
        }
        return new Parsed("", trimmed);
    }
}
