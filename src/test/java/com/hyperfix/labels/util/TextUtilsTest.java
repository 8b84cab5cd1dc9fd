package com.hyperfix.labels.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextUtilsTest {

    @Test
    public void collapsesWhitespaceAndTrims() {
        assertEquals("a b c", TextUtils.collapseWhitespace("  a \t b\n\nc  "));
        assertEquals("", TextUtils.collapseWhitespace(null));
    }

    @Test
    public void removesEveryWholeWordOccurrenceIgnoringCase() {
        String out = TextUtils.removeWholeWord("crf jus CRF pomme Crf", "CRF");
        assertEquals("jus pomme", TextUtils.collapseWhitespace(out));
    }

    @Test
    public void keepsOccurrencesGluedToLettersOrDigits() {
        String out = TextUtils.removeWholeWord("CRFX 6CRF CRF-BIO", "CRF");
        assertEquals("CRFX 6CRF -BIO", TextUtils.collapseWhitespace(out));
    }

    @Test
    public void treatsRegexMetacharactersLiterally() {
        String out = TextUtils.removeWholeWord("a 1+1 b 1.5L c 1X5L", "1.5L");
        assertEquals("a 1+1 b c 1X5L", TextUtils.collapseWhitespace(out));
        assertEquals("a b", TextUtils.collapseWhitespace(TextUtils.removeWholeWord("a 1+1 b", "1+1")));
    }

    @Test
    public void containsWholeWordRespectsBoundaries() {
        assertTrue(TextUtils.containsWholeWord("STYLO PM BLEU", "PM"));
        assertFalse(TextUtils.containsWholeWord("RDV 6PM", "PM"));
        assertFalse(TextUtils.containsWholeWord("PMU", "PM"));
        assertFalse(TextUtils.containsWholeWord("PMU", ""));
    }

    @Test
    public void swapsCommaDecimalToPeriod() {
        assertEquals("1.5L", TextUtils.commaToPeriod("1,5L"));
        assertEquals("6X30G", TextUtils.commaToPeriod("6X30G"));
    }
}
