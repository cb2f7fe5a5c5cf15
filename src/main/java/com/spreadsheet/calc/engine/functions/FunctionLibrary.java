package com.spreadsheet.calc.engine.functions;

import java.util.Map;
import java.util.TreeMap;

/**
 * Registry of built-in functions by upper-case name.
 */
public class FunctionLibrary {

    private final Map<String, FormulaFunction> functions = new TreeMap<>();

    /**
     * A library holding every built-in function.
     */
    public FunctionLibrary() {
        AggregateFunctions.registerAll(this);
        StatisticalFunctions.registerAll(this);
        LogicalFunctions.registerAll(this);
        LookupFunctions.registerAll(this);
    }

    public void register(String name, FormulaFunction function) {
        functions.put(name.toUpperCase(), function);
    }

    /**
     * @return the function, or null if no function has that name
     */
    public FormulaFunction lookup(String name) {
        return functions.get(name.toUpperCase());
    }
}
