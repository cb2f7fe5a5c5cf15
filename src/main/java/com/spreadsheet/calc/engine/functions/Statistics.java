package com.spreadsheet.calc.engine.functions;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Plain numeric kernels behind the statistical functions.
 * Empty inputs give 0 rather than an error.
 */
public final class Statistics {

    private static final double[] QUARTILE_POINTS = {0d, 0.25d, 0.5d, 0.75d, 1d};

    private Statistics() {
    }

    public static double sum(double[] values) {
        double total = 0d;
        for (double value : values) {
            total += value;
        }
        return total;
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0d : sum(values) / values.length;
    }

    public static double product(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double product = 1d;
        for (double value : values) {
            product *= value;
        }
        return product;
    }

    public static double min(double[] values) {
        return values.length == 0 ? 0d : Arrays.stream(values).min().getAsDouble();
    }

    public static double max(double[] values) {
        return values.length == 0 ? 0d : Arrays.stream(values).max().getAsDouble();
    }

    /**
     * Middle value; the mean of the two middle values for an even count.
     */
    public static double median(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double[] sorted = sorted(values);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2 : sorted[mid];
    }

    /**
     * The value that first reaches the highest count while scanning in order.
     */
    public static double mode(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        Map<Double, Integer> frequency = new HashMap<>();
        int maxFrequency = 0;
        double mode = values[0];
        for (double value : values) {
            int count = frequency.merge(value, 1, Integer::sum);
            if (count > maxFrequency) {
                maxFrequency = count;
                mode = value;
            }
        }
        return mode;
    }

    /**
     * Sample variance (n - 1 denominator); 0 for fewer than two values.
     */
    public static double sampleVariance(double[] values) {
        if (values.length < 2) {
            return 0d;
        }
        double mean = mean(values);
        double squares = 0d;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return squares / (values.length - 1);
    }

    public static double sampleStdev(double[] values) {
        return Math.sqrt(sampleVariance(values));
    }

    /**
     * Pearson correlation; 0 when the inputs are empty, differ in length, or either has no variance.
     */
    public static double correlation(double[] xs, double[] ys) {
        if (xs.length == 0 || xs.length != ys.length) {
            return 0d;
        }
        double meanX = mean(xs);
        double meanY = mean(ys);
        double numerator = 0d;
        double sumSqX = 0d;
        double sumSqY = 0d;
        for (int i = 0; i < xs.length; i++) {
            double dx = xs[i] - meanX;
            double dy = ys[i] - meanY;
            numerator += dx * dy;
            sumSqX += dx * dx;
            sumSqY += dy * dy;
        }
        double denominator = Math.sqrt(sumSqX * sumSqY);
        return denominator == 0d ? 0d : numerator / denominator;
    }

    /**
     * k-th percentile (0 &lt;= k &lt;= 1), interpolating linearly between order statistics.
     * Returns 0 for empty input or k outside [0, 1].
     */
    public static double percentile(double[] values, double k) {
        if (values.length == 0 || k < 0d || k > 1d) {
            return 0d;
        }
        double[] sorted = sorted(values);
        double index = k * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    /**
     * Quartile 0..4 maps to percentile 0, .25, .5, .75, 1; anything else gives 0.
     */
    public static double quartile(double[] values, int quart) {
        if (quart < 0 || quart >= QUARTILE_POINTS.length) {
            return 0d;
        }
        return percentile(values, QUARTILE_POINTS[quart]);
    }

    /**
     * 1-based position of {@code number} in the sorted values (first match on ties),
     * or {@code values.length + 1} if it is not present.
     */
    public static int rank(double number, double[] values, boolean ascending) {
        double[] sorted = sorted(values);
        if (!ascending) {
            for (int i = 0, j = sorted.length - 1; i < j; i++, j--) {
                double tmp = sorted[i];
                sorted[i] = sorted[j];
                sorted[j] = tmp;
            }
        }
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] == number) {
                return i + 1;
            }
        }
        return values.length + 1;
    }

    private static double[] sorted(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }
}
