package com.spreadsheet.calc.engine.format;

import com.spreadsheet.calc.models.ErrorKind;
import com.spreadsheet.calc.models.EvaluationResult;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns evaluation results into the text a cell shows.
 * Numbers use the shortest exact decimal form ("15", "2.5", "0.1") unless the
 * cell asks for a fixed number of decimal places.
 */
public class DisplayFormatter {

    public String format(EvaluationResult result, Integer decimalPlaces) {
        switch (result.getKind()) {
            case NUMBER:
                return formatNumber(result.getNumber(), decimalPlaces);
            case TEXT:
                return result.getText();
            default:
                return result.getError().getDisplayText();
        }
    }

    public String formatNumber(double value, Integer decimalPlaces) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return ErrorKind.ERROR_TEXT;
        }
        BigDecimal decimal = BigDecimal.valueOf(value);
        if (decimalPlaces != null && decimalPlaces >= 0) {
            return decimal.setScale(decimalPlaces, RoundingMode.HALF_UP).toPlainString();
        }
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }

    public String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }
}
