package org.flowxmi.activity.conversion.repair;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BranchClassifierTest {
    private final BranchClassifier classifier = new BranchClassifier(
            List.of("approve", "confirm", "valid", "zatwierdz"),
            List.of("reject", "invalid", "błąd"));

    @Test
    void shouldMatchWordPrefixes() {
        assertEquals("yes", classifier.classify("Order approved"));
        assertEquals("yes", classifier.classify("Payment confirmed"));
        assertEquals("no", classifier.classify("Reject request"));
    }

    @Test
    void shouldNotMatchInsideWords() {
        assertEquals("no", classifier.classify("Invalid data"));
        assertNull(classifier.classify("Prevalidate form"));
    }

    @Test
    void shouldMatchWholeWordKeywordsExactly() {
        BranchClassifier wholeWord = new BranchClassifier(List.of("valid$", "ok$"), List.of("invalid"));

        assertEquals("yes", wholeWord.classify("Data valid"));
        assertEquals("yes", wholeWord.classify("OK"));
        assertNull(wholeWord.classify("Validate"));
        assertNull(wholeWord.classify("Validation report"));
        assertNull(wholeWord.classify("Okay then"));
        assertEquals("no", wholeWord.classify("Invalid data"));
    }

    @Test
    void shouldIgnoreCaseAndDiacritics() {
        assertEquals("yes", classifier.classify("ZATWIERDŹ wniosek"));
        assertEquals("no", classifier.classify("Zgłoś blad"));
    }

    @Test
    void shouldPreferFailureWhenBothMatch() {
        assertEquals("no", classifier.classify("Confirm rejection"));
    }

    @Test
    void shouldReturnNullWithoutHint() {
        assertNull(classifier.classify("Send reminder"));
        assertNull(classifier.classify(null));
        assertNull(classifier.classify(" "));
        assertNull(new BranchClassifier(null, null).classify("Approve"));
    }
}
