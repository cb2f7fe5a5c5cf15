package com.spreadsheet.calc.engine.format;

import com.spreadsheet.calc.models.ErrorKind;
import com.spreadsheet.calc.models.EvaluationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DisplayFormatterTest {

    private DisplayFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new DisplayFormatter();
    }

    @Test
    void testDefaultNumberFormat() {
        assertEquals("15", formatter.formatNumber(15d, null));
        assertEquals("2.5", formatter.formatNumber(2.5d, null));
        assertEquals("-0.125", formatter.formatNumber(-0.125d, null));
        assertEquals("0", formatter.formatNumber(-0d, null));
        assertEquals("100000000000000000000", formatter.formatNumber(1e20, null));
    }

    @Test
    void testFixedDecimalPlaces() {
        assertEquals("3.14", formatter.formatNumber(3.14159d, 2));
        assertEquals("2.00", formatter.formatNumber(2d, 2));
        assertEquals("2.35", formatter.formatNumber(2.345d, 2));
        assertEquals("3", formatter.formatNumber(2.5d, 0));
    }

    @Test
    void testNonFiniteNumbersShowAsError() {
        assertEquals("#ERROR!", formatter.formatNumber(Double.NaN, null));
        assertEquals("#ERROR!", formatter.formatNumber(Double.POSITIVE_INFINITY, 2));
    }

    @Test
    void testFormatResults() {
        assertEquals("hi", formatter.format(EvaluationResult.text("hi"), 2));
        assertEquals("#N/A", formatter.format(EvaluationResult.error(ErrorKind.LOOKUP_NOT_FOUND), null));
        assertEquals("#ERROR!", formatter.format(EvaluationResult.error(ErrorKind.CIRCULAR_REFERENCE), null));
        assertEquals("0.33", formatter.format(EvaluationResult.number(1d / 3), 2));
        assertEquals("TRUE", formatter.formatBoolean(true));
        assertEquals("FALSE", formatter.formatBoolean(false));
    }
}
