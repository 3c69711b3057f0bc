package com.junctionvision.core.ocr;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PlateNormalizerTest {

    @Test void stripsPunctuationAndUppercases() { assertEquals("ABC1234D", PlateNormalizer.normalize("aBC-12.34-d")); }
    @Test void emptyStaysEmpty() { assertEquals("", PlateNormalizer.normalize("")); }
    @Test void nullIsEmpty() { assertEquals("", PlateNormalizer.normalize(null)); }
    @Test void confusableLettersToDigits() { assertEquals("0CR1231", PlateNormalizer.normalize("0CR1Z3I")); }
    @Test void lowercaseConfusablesAfterUppercasing() { assertEquals("10200", PlateNormalizer.normalize("i o z o o")); }
    @Test void garbageOnly() { assertEquals("", PlateNormalizer.normalize("#*-. ")); }
}
