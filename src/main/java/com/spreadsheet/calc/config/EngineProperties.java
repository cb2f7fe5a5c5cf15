package com.spreadsheet.calc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables under the "spreadsheet" prefix.
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class EngineProperties {

    private final Recalc recalc = new Recalc();
    private final Sheet sheet = new Sheet();

    public Recalc getRecalc() {
        return recalc;
    }

    public Sheet getSheet() {
        return sheet;
    }

    public static class Recalc {
        // Upper bound on evaluation passes per recalculation
        private int maxPasses = 10;

        public int getMaxPasses() {
            return maxPasses;
        }

        public void setMaxPasses(int maxPasses) {
            this.maxPasses = maxPasses;
        }
    }

    /**
     * Size of a sheet created without explicit dimensions.
     */
    public static class Sheet {
        private int defaultRows = 100;
        private int defaultColumns = 26;

        public int getDefaultRows() {
            return defaultRows;
        }

        public void setDefaultRows(int defaultRows) {
            this.defaultRows = defaultRows;
        }

        public int getDefaultColumns() {
            return defaultColumns;
        }

        public void setDefaultColumns(int defaultColumns) {
            this.defaultColumns = defaultColumns;
        }
    }
}
