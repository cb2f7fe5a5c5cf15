package com.spreadsheet.calc.config;

import com.spreadsheet.calc.engine.evaluator.FormulaEvaluator;
import com.spreadsheet.calc.engine.format.DisplayFormatter;
import com.spreadsheet.calc.engine.functions.FunctionLibrary;
import com.spreadsheet.calc.engine.parser.FormulaParser;
import com.spreadsheet.calc.engine.recalc.RecalculationEngine;
import com.spreadsheet.calc.engine.rewrite.ReferenceRewriter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the formula engine. The engine classes are plain Java and know nothing about Spring.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    @Bean
    public FormulaParser formulaParser() {
        return new FormulaParser();
    }

    @Bean
    public FunctionLibrary functionLibrary() {
        return new FunctionLibrary();
    }

    @Bean
    public FormulaEvaluator formulaEvaluator(FormulaParser parser, FunctionLibrary functions) {
        return new FormulaEvaluator(parser, functions);
    }

    @Bean
    public DisplayFormatter displayFormatter() {
        return new DisplayFormatter();
    }

    @Bean
    public RecalculationEngine recalculationEngine(FormulaParser parser, FormulaEvaluator evaluator,
                                                   DisplayFormatter formatter, EngineProperties properties) {
        return new RecalculationEngine(parser, evaluator, formatter, properties.getRecalc().getMaxPasses());
    }

    @Bean
    public ReferenceRewriter referenceRewriter() {
        return new ReferenceRewriter();
    }
}
