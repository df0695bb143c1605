package in.ashwanthkumar.stationarizer.plugins;

import com.google.common.base.Preconditions;
import in.ashwanthkumar.stationarizer.exception.CorrectionMethodException;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Built-in multiple testing procedures. Methods are looked up by name, see {@link #fromName(String)},
 * and accept the short names statsmodels uses for them.
 * <p>
 * The family-wise procedures (Bonferroni, Sidak, Holm, Holm-Sidak, Simes-Hochberg) read alpha as
 * the family-wise error rate, the two FDR procedures read it as the false discovery rate.
 * </p>
 */
public enum CorrectionMethod implements MultipleTestingCorrection {
    BONFERRONI("bonferroni", "b") {
        @Override
        CorrectionOutcome correctSorted(double[] sorted, double alpha) {
            int n = sorted.length;
            boolean[] reject = new boolean[n];
            double[] adjusted = new double[n];
            for (int i = 0; i < n; i++) {
                reject[i] = sorted[i] <= alpha / n;
                adjusted[i] = sorted[i] * n;
            }
            return CorrectionOutcome.of(reject, adjusted);
        }
    },
    SIDAK("sidak", "s") {
        @Override
        CorrectionOutcome correctSorted(double[] sorted, double alpha) {
            int n = sorted.length;
            double threshold = sidakThreshold(alpha, n);
            boolean[] reject = new boolean[n];
            double[] adjusted = new double[n];
            for (int i = 0; i < n; i++) {
                reject[i] = sorted[i] <= threshold;
                adjusted[i] = sidakAdjusted(sorted[i], n);
            }
            return CorrectionOutcome.of(reject, adjusted);
        }
    },
    HOLM("holm", "h") {
        @Override
        CorrectionOutcome correctSorted(double[] sorted, double alpha) {
            int n = sorted.length;
            double[] thresholds = new double[n];
            double[] adjusted = new double[n];
            for (int i = 0; i < n; i++) {
                thresholds[i] = alpha / (n - i);
                adjusted[i] = Math.min(1.0, sorted[i] * (n - i));
            }
            return CorrectionOutcome.of(stepDown(sorted, thresholds), cumulativeMax(adjusted));
        }
    },
    HOLM_SIDAK("holm-sidak", "hs") {
        @Override
        CorrectionOutcome correctSorted(double[] sorted, double alpha) {
            int n = sorted.length;
            double[] thresholds = new double[n];
            double[] adjusted = new double[n];
            for (int i = 0; i < n; i++) {
                thresholds[i] = sidakThreshold(alpha, n - i);
                adjusted[i] = sidakAdjusted(sorted[i], n - i);
            }
            return CorrectionOutcome.of(stepDown(sorted, thresholds), cumulativeMax(adjusted));
        }
    },
    SIMES_HOCHBERG("simes-hochberg", "sh") {
        @Override
        CorrectionOutcome correctSorted(double[] sorted, double alpha) {
            int n = sorted.length;
            double[] thresholds = new double[n];
            double[] adjusted = new double[n];
            for (int i = 0; i < n; i++) {
                thresholds[i] = alpha / (n - i);
                adjusted[i] = sorted[i] * (n - i);
            }
            return CorrectionOutcome.of(stepUp(sorted, thresholds), cumulativeMinFromEnd(adjusted));
        }
    },
    BENJAMINI_HOCHBERG("benjamini-hochberg", "fdr_bh", "fdr_i") {
        @Override
        CorrectionOutcome correctSorted(double[] sorted, double alpha) {
            return falseDiscoveryRate(sorted, alpha, 1.0);
        }
    },
    BENJAMINI_YEKUTIELI("benjamini-yekutieli", "fdr_by", "fdr_n") {
        @Override
        CorrectionOutcome correctSorted(double[] sorted, double alpha) {
            // c(m) = 1 + 1/2 + ... + 1/m, valid under arbitrary dependence between the tests
            double harmonic = 0.0;
            for (int i = 1; i <= sorted.length; i++) {
                harmonic += 1.0 / i;
            }
            return falseDiscoveryRate(sorted, alpha, harmonic);
        }
    };

    private final String label;
    private final List<String> aliases;

    CorrectionMethod(String label, String... aliases) {
        this.label = label;
        this.aliases = List.of(aliases);
    }

    @Override
    public String label() {
        return label;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Correct p-values that are already sorted in ascending order. Adjusted values may exceed 1,
     * they are clipped by {@link #correct(double[], double)}.
     */
    abstract CorrectionOutcome correctSorted(double[] sorted, double alpha);

    @Override
    public CorrectionOutcome correct(double[] pValues, double alpha) {
        Preconditions.checkArgument(alpha > 0.0 && alpha < 1.0, "alpha must be in (0, 1), got %s", alpha);
        int n = pValues.length;
        if (n == 0) {
            return CorrectionOutcome.of(new boolean[0], new double[0]);
        }
        for (double pValue : pValues) {
            Preconditions.checkArgument(pValue >= 0.0 && pValue <= 1.0, "p-value %s is outside [0, 1]", pValue);
        }

        // stable sort so that ties keep their input order
        int[] order = IntStream.range(0, n)
                .boxed()
                .sorted(Comparator.comparingDouble(i -> pValues[i]))
                .mapToInt(Integer::intValue)
                .toArray();
        double[] sorted = new double[n];
        for (int i = 0; i < n; i++) {
            sorted[i] = pValues[order[i]];
        }

        CorrectionOutcome sortedOutcome = correctSorted(sorted, alpha);
        boolean[] rejected = new boolean[n];
        double[] adjusted = new double[n];
        for (int i = 0; i < n; i++) {
            rejected[order[i]] = sortedOutcome.isRejected(i);
            adjusted[order[i]] = Math.min(1.0, sortedOutcome.adjustedPValue(i));
        }
        return CorrectionOutcome.of(rejected, adjusted);
    }

    /**
     * Resolve a method by its label, one of its aliases or its constant name, ignoring case.
     *
     * @throws CorrectionMethodException when no method goes by that name
     */
    public static CorrectionMethod fromName(String name) {
        String normalized = StringUtils.lowerCase(StringUtils.trimToEmpty(name));
        for (CorrectionMethod method : values()) {
            if (method.label.equals(normalized)
                    || method.aliases.contains(normalized)
                    || StringUtils.equalsIgnoreCase(method.name(), normalized)) {
                return method;
            }
        }
        throw new CorrectionMethodException(name, supportedNames());
    }

    public static String supportedNames() {
        return Arrays.stream(values())
                .map(method -> method.label + " " + method.aliases)
                .collect(Collectors.joining(", "));
    }

    private static CorrectionOutcome falseDiscoveryRate(double[] sorted, double alpha, double dependenceFactor) {
        int n = sorted.length;
        double[] thresholds = new double[n];
        double[] adjusted = new double[n];
        for (int i = 0; i < n; i++) {
            double ecdf = (i + 1.0) / n;
            thresholds[i] = ecdf * alpha / dependenceFactor;
            adjusted[i] = sorted[i] * dependenceFactor / ecdf;
        }
        return CorrectionOutcome.of(stepUp(sorted, thresholds), cumulativeMinFromEnd(adjusted));
    }

    // reject the smallest p-values up to the first one that exceeds its threshold
    private static boolean[] stepDown(double[] sorted, double[] thresholds) {
        boolean[] reject = new boolean[sorted.length];
        for (int i = 0; i < sorted.length && sorted[i] <= thresholds[i]; i++) {
            reject[i] = true;
        }
        return reject;
    }

    // reject every p-value up to the largest one that is under its threshold
    private static boolean[] stepUp(double[] sorted, double[] thresholds) {
        boolean[] reject = new boolean[sorted.length];
        int last = -1;
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] <= thresholds[i]) {
                last = i;
            }
        }
        Arrays.fill(reject, 0, last + 1, true);
        return reject;
    }

    private static double[] cumulativeMax(double[] values) {
        double[] result = values.clone();
        for (int i = 1; i < result.length; i++) {
            result[i] = Math.max(result[i], result[i - 1]);
        }
        return result;
    }

    private static double[] cumulativeMinFromEnd(double[] values) {
        double[] result = values.clone();
        for (int i = result.length - 2; i >= 0; i--) {
            result[i] = Math.min(result[i], result[i + 1]);
        }
        return result;
    }

    private static double sidakThreshold(double alpha, int tests) {
        return -Math.expm1(Math.log1p(-alpha) / tests);
    }

    private static double sidakAdjusted(double pValue, int tests) {
        return -Math.expm1(tests * Math.log1p(-pValue));
    }

}
