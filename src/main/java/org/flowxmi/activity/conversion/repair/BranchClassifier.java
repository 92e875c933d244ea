package org.flowxmi.activity.conversion.repair;

import org.flowxmi.activity.conversion.graph.GuardLabels;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Best-effort guess whether a label reads like the positive or the negative outcome of a decision.
 * A keyword matches when some word of the label starts with it ("approved" matches "approve",
 * "invalid" does not match "valid"). A keyword ending in {@code $} must match a whole word
 * ("valid$" matches "Valid" but not "Validate"). Negative keywords win when both sides match.
 */
public class BranchClassifier {
    private static final String WHOLE_WORD_MARKER = "$";

    private final List<String> successKeywords;
    private final List<String> failureKeywords;

    public BranchClassifier(List<String> successKeywords, List<String> failureKeywords) {
        this.successKeywords = normalizeAll(successKeywords);
        this.failureKeywords = normalizeAll(failureKeywords);
    }

    /**
     * @param label the label of a branch target
     * @return {@link GuardLabels#YES}, {@link GuardLabels#NO}, or null when the label gives no hint
     */
    public String classify(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String[] words = normalize(label).split("[^\\p{L}\\p{N}]+");
        if (matchesAny(words, failureKeywords)) {
            return GuardLabels.NO;
        }
        if (matchesAny(words, successKeywords)) {
            return GuardLabels.YES;
        }
        return null;
    }

    private static boolean matchesAny(String[] words, List<String> keywords) {
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            for (String keyword : keywords) {
                boolean matches = keyword.endsWith(WHOLE_WORD_MARKER)
                        ? word.equals(keyword.substring(0, keyword.length() - 1))
                        : word.startsWith(keyword);
                if (matches) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<String> normalizeAll(List<String> keywords) {
        List<String> result = new ArrayList<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank() && !keyword.trim().equals(WHOLE_WORD_MARKER)) {
                    result.add(normalize(keyword.trim()));
                }
            }
        }
        return result;
    }

    // lower case without diacritics, so "błąd" and "blad" compare equal
    private static String normalize(String value) {
        String lower = value.toLowerCase(Locale.ROOT).replace('ł', 'l');
        return Normalizer.normalize(lower, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    }
}
