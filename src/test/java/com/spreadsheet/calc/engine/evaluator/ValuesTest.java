package com.spreadsheet.calc.engine.evaluator;

import com.spreadsheet.calc.exceptions.FormulaException;
import com.spreadsheet.calc.models.ErrorKind;
import com.spreadsheet.calc.models.EvaluationResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Test
    void testFromLiteral() {
        assertEquals(EvaluationResult.number(0d), Values.fromLiteral(null));
        assertEquals(EvaluationResult.number(0d), Values.fromLiteral(""));
        assertEquals(EvaluationResult.number(2.5d), Values.fromLiteral(2.5d));
        assertEquals(EvaluationResult.number(1d), Values.fromLiteral(Boolean.TRUE));
        assertEquals(EvaluationResult.text("abc"), Values.fromLiteral("abc"));
    }

    @Test
    void testDecimalText() {
        assertTrue(Values.isDecimal("42"));
        assertTrue(Values.isDecimal("-3.5"));
        assertTrue(Values.isDecimal(".5"));
        assertFalse(Values.isDecimal("1e5"));
        assertFalse(Values.isDecimal("NaN"));
        assertFalse(Values.isDecimal("12abc"));
        assertEquals(3.5d, Values.toNumber(EvaluationResult.text(" 3.5 ")));
        assertNull(Values.toNumber(EvaluationResult.text("abc")));
        assertNull(Values.toNumber(EvaluationResult.error(ErrorKind.FORMULA_ERROR)));
    }

    @Test
    void testRequireNumber() {
        assertEquals(4d, Values.requireNumber(EvaluationResult.number(4d)));
        assertThrows(FormulaException.class, () -> Values.requireNumber(EvaluationResult.text("x")));
    }

    @Test
    void testTruthiness() {
        assertTrue(Values.isTruthy(EvaluationResult.number(-1d)));
        assertFalse(Values.isTruthy(EvaluationResult.number(0d)));
        assertTrue(Values.isTruthy(EvaluationResult.text("true")));
        assertFalse(Values.isTruthy(EvaluationResult.text("FALSE")));
        assertFalse(Values.isTruthy(EvaluationResult.text("yes")));
        assertFalse(Values.isTruthy(EvaluationResult.error(ErrorKind.LOOKUP_NOT_FOUND)));
    }

    @Test
    void testCompare() {
        assertTrue(Values.compare(EvaluationResult.number(2d), EvaluationResult.text("10")) < 0);
        assertEquals(0, Values.compare(EvaluationResult.text("Apple"), EvaluationResult.text("apple")));
        assertTrue(Values.compare(EvaluationResult.text("b"), EvaluationResult.text("A")) > 0);
        assertEquals(0, Values.compare(EvaluationResult.number(0d), EvaluationResult.number(-0d)));
    }

    @Test
    void testToText() {
        assertEquals("15", Values.toText(EvaluationResult.number(15d)));
        assertEquals("0.1", Values.toText(EvaluationResult.number(0.1d)));
        assertEquals("#N/A", Values.toText(EvaluationResult.error(ErrorKind.LOOKUP_NOT_FOUND)));
    }
}
