package com.spreadsheet.calc.engine.rewrite;

public enum Axis {
    ROW,
    COLUMN
}
