package com.raditha.approx.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Compares numeric program outputs point by point.
 * <p>
 * Values are separated by whitespace, commas or semicolons; {@code nan} is accepted and
 * points where either side is NaN are left out. A point is a miss when the absolute
 * difference exceeds the tolerance. The error reported to the search is the miss rate.
 */
public class NumericOutputComparator implements ErrorCollaborator {

    private static final Logger logger = LoggerFactory.getLogger(NumericOutputComparator.class);

    public static final double DEFAULT_TOLERANCE = 1e-5;

    private static final Pattern SEPARATORS = Pattern.compile("[\\s,;]+");

    private final double tolerance;

    public NumericOutputComparator() {
        this(DEFAULT_TOLERANCE);
    }

    public NumericOutputComparator(double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        this.tolerance = tolerance;
    }

    /**
     * Accuracy figures over the valid points.
     */
    public record OutputMetrics(
            double meanAbsoluteError,
            double meanSquaredError,
            double rootMeanSquaredError,
            double meanRelativeError,
            double maxError,
            double accuracy,
            double missRate,
            int validPoints,
            int totalPoints) {
    }

    @Override
    public double compareOutputs(Path referencePath, Path candidatePath) throws ComparisonException {
        OutputMetrics metrics = measure(referencePath, candidatePath);
        logger.debug("Accuracy for {}: {}", candidatePath.getFileName(),
                String.format(Locale.ROOT, "%.4f", metrics.accuracy()));
        return metrics.missRate();
    }

    public OutputMetrics measure(Path referencePath, Path candidatePath) throws ComparisonException {
        double[] reference = readValues(referencePath);
        double[] candidate = readValues(candidatePath);
        return measure(reference, candidate);
    }

    public OutputMetrics measure(double[] reference, double[] candidate) throws ComparisonException {
        if (reference.length != candidate.length) {
            throw new ComparisonException("Output sizes differ: reference=" + reference.length
                    + ", candidate=" + candidate.length);
        }

        int valid = 0;
        int misses = 0;
        int nonZero = 0;
        double sumAbs = 0;
        double sumSq = 0;
        double sumRel = 0;
        double max = 0;
        for (int i = 0; i < reference.length; i++) {
            if (Double.isNaN(reference[i]) || Double.isNaN(candidate[i])) {
                continue;
            }
            double diff = Math.abs(reference[i] - candidate[i]);
            valid++;
            sumAbs += diff;
            sumSq += diff * diff;
            max = Math.max(max, diff);
            if (diff > tolerance || Double.isNaN(diff)) {
                misses++;
            }
            if (reference[i] != 0) {
                nonZero++;
                sumRel += diff / Math.abs(reference[i]);
            }
        }
        if (valid == 0) {
            throw new ComparisonException("No valid points to compare");
        }

        double missRate = (double) misses / valid;
        double mse = sumSq / valid;
        return new OutputMetrics(
                sumAbs / valid,
                mse,
                Math.sqrt(mse),
                nonZero > 0 ? sumRel / nonZero : 0.0,
                max,
                1.0 - missRate,
                missRate,
                valid,
                reference.length);
    }

    private static double[] readValues(Path file) throws ComparisonException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ComparisonException("Cannot read output " + file + ": " + e.getMessage(), e);
        }

        List<Double> values = new ArrayList<>();
        for (String token : SEPARATORS.split(content.strip())) {
            if (token.isEmpty()) {
                continue;
            }
            values.add(parse(token, file));
        }
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    private static double parse(String token, Path file) throws ComparisonException {
        switch (token.toLowerCase(Locale.ROOT)) {
            case "nan", "-nan", "+nan":
                return Double.NaN;
            case "inf", "+inf", "infinity":
                return Double.POSITIVE_INFINITY;
            case "-inf", "-infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new ComparisonException("Non-numeric value '" + token + "' in " + file.getFileName(), e);
        }
    }
}
