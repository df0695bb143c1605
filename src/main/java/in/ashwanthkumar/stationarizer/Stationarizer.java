package in.ashwanthkumar.stationarizer;

import in.ashwanthkumar.stationarizer.exception.InsufficientDataException;
import in.ashwanthkumar.stationarizer.model.ColumnReport;
import in.ashwanthkumar.stationarizer.model.Conclusion;
import in.ashwanthkumar.stationarizer.model.CorrectedResult;
import in.ashwanthkumar.stationarizer.model.Decision;
import in.ashwanthkumar.stationarizer.model.InsufficientDataPolicy;
import in.ashwanthkumar.stationarizer.model.ShapeWarning;
import in.ashwanthkumar.stationarizer.model.TestFamily;
import in.ashwanthkumar.stationarizer.model.TestResult;
import in.ashwanthkumar.stationarizer.model.TransformRecord;
import in.ashwanthkumar.stationarizer.plugins.AugmentedDickeyFuller;
import in.ashwanthkumar.stationarizer.plugins.Kpss;
import in.ashwanthkumar.stationarizer.plugins.MultipleTestingCorrection;
import in.ashwanthkumar.stationarizer.plugins.TrendStationarityTest;
import in.ashwanthkumar.stationarizer.plugins.UnitRootTest;
import in.ashwanthkumar.stationarizer.plugins.WarningListener;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import tech.tablesaw.api.DoubleColumn;
import tech.tablesaw.api.NumericColumn;
import tech.tablesaw.api.Table;
import tech.tablesaw.columns.Column;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides, per column, whether a time series table needs differencing and/or detrending to become
 * stationary, and applies it.
 * <p>
 * A run goes through: validation, both stationarity tests on every column, the multiple testing
 * correction over all columns, one decision per column, the transformations, and finally trimming
 * every column to the length of the shortest one. Each stage completes for all columns before the
 * next one starts. Either a full table is returned or an exception is thrown, nothing in between.
 * </p>
 * Instances hold no state between runs and can be shared.
 */
@Slf4j
@Getter
public class Stationarizer {
    private final StationarizerConfig config;
    private final TableValidator validator;
    private final StationarityTestRunner testRunner;
    private final PValueCorrector corrector;
    private final DecisionInterpreter interpreter;
    private final SeriesTransformer transformer;
    private final LengthReconciler reconciler;
    private final WarningListener warningListener;

    public Stationarizer(StationarizerConfig config) {
        this(config, new AugmentedDickeyFuller(config.getRegression()), new Kpss(config.getRegression()), WarningListener.NOOP);
    }

    public Stationarizer(StationarizerConfig config, UnitRootTest unitRootTest, TrendStationarityTest trendStationarityTest,
                         WarningListener warningListener) {
        this(config, unitRootTest, trendStationarityTest, config.validate().correctionMethod(), warningListener);
    }

    /**
     * @param correction Used instead of the method named by {@link StationarizerConfig#getMultitestMethod()}
     */
    public Stationarizer(@NonNull StationarizerConfig config, @NonNull UnitRootTest unitRootTest,
                         @NonNull TrendStationarityTest trendStationarityTest, @NonNull MultipleTestingCorrection correction,
                         @NonNull WarningListener warningListener) {
        this.config = config.validate();
        this.validator = new TableValidator();
        this.testRunner = new StationarityTestRunner(unitRootTest, trendStationarityTest);
        this.corrector = new PValueCorrector(correction, config.getAlpha(), config.getPoolingMode());
        this.interpreter = new DecisionInterpreter();
        this.transformer = new SeriesTransformer();
        this.reconciler = new LengthReconciler();
        this.warningListener = warningListener;
    }

    public static Stationarizer withDefaults() {
        return new Stationarizer(StationarizerConfig.defaults());
    }

    /**
     * @param input Table with one numeric column per series and one row per time step, it is not modified
     * @return Stationarized copy of the table, all of its columns have the same length
     */
    public Table stationarize(Table input) {
        return analyze(input).getTable();
    }

    /**
     * Same as {@link #stationarize(Table)}, but also reports the test results, conclusions and
     * transformations of every column.
     */
    public StationarizationResult analyze(@NonNull Table input) {
        log.info("Starting to auto-stationarize table {}", input.name());
        List<ShapeWarning> warnings = new ArrayList<>();
        Optional<ShapeWarning> shapeWarning = validator.validate(input);
        shapeWarning.ifPresent(warning -> {
            warnings.add(warning);
            deliver(warning);
        });

        Map<String, double[]> series = new LinkedHashMap<>();
        for (Column<?> column : input.columns()) {
            series.put(column.name(), ((NumericColumn<?>) column).asDoubleArray());
        }

        // Stage 1: both tests on every series
        log.info("Checking for the presence of a unit root (ADF, H0: the series has a unit root) "
                + "and for trend stationarity (KPSS, H0: the series is trend stationary).");
        List<TestResult> testResults = new ArrayList<>();
        Map<String, Map<TestFamily, TestResult>> resultsByColumn = new LinkedHashMap<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        series.forEach((column, values) -> {
            try {
                Map<TestFamily, TestResult> results = testRunner.run(column, values);
                resultsByColumn.put(column, results);
                testResults.addAll(results.values());
            } catch (InsufficientDataException e) {
                if (config.getInsufficientDataPolicy() == InsufficientDataPolicy.ABORT) {
                    throw e;
                }
                log.warn("Skipping column {}, it is left untransformed: {}", column, e.getMessage());
                skipped.put(column, e.getMessage());
            }
        });

        // Stage 2: needs every p-value of the run
        Map<String, Map<TestFamily, CorrectedResult>> corrected = corrector.correct(testResults);

        // Stage 3: decide and transform each series on its own
        log.info("Interpreting test results after error rate control and applying transformations...");
        Map<String, ColumnReport> reports = new LinkedHashMap<>();
        Map<String, double[]> transformed = new LinkedHashMap<>();
        Map<Conclusion, Integer> conclusionCounts = new EnumMap<>(Conclusion.class);
        series.forEach((column, values) -> {
            if (skipped.containsKey(column)) {
                transformed.put(column, values);
                TransformRecord record = TransformRecord.of(column, Decision.NONE.transformations(), values.length, values.length, 0);
                reports.put(column, ColumnReport.skipped(column, skipped.get(column)).withRecord(record));
                return;
            }
            CorrectedResult unitRoot = corrected.get(column).get(TestFamily.UNIT_ROOT);
            CorrectedResult trendStationarity = corrected.get(column).get(TestFamily.TREND_STATIONARITY);
            Decision decision = interpreter.decide(unitRoot, trendStationarity);
            Conclusion conclusion = interpreter.conclude(unitRoot, trendStationarity);
            conclusionCounts.merge(conclusion, 1, Integer::sum);

            double[] result = transformer.apply(values, decision);
            transformed.put(column, result);
            TransformRecord record = TransformRecord.of(column, decision.transformations(), values.length, result.length, 0);
            log.info("--{}-- ADF corrected p-val: {}, H0 rejected: {}. KPSS corrected p-val: {}, H0 rejected: {}. "
                            + "Conclusion: {} Transformations: {}.", column,
                    unitRoot.getAdjustedPValue(), unitRoot.isRejectNull(),
                    trendStationarity.getAdjustedPValue(), trendStationarity.isRejectNull(),
                    conclusion.getDescription(), record.getApplied());

            Map<TestFamily, TestResult> raw = resultsByColumn.get(column);
            reports.put(column, ColumnReport.of(column, raw.get(TestFamily.UNIT_ROOT), raw.get(TestFamily.TREND_STATIONARITY),
                    unitRoot, trendStationarity, decision, conclusion, record, null));
        });

        // Stage 4: needs the length of every transformed series
        Map<String, double[]> reconciled = reconciler.reconcile(transformed);
        List<ColumnReport> finalReports = new ArrayList<>();
        List<Column<?>> columns = new ArrayList<>();
        reconciled.forEach((column, values) -> {
            ColumnReport report = reports.get(column);
            int trimmed = transformed.get(column).length - values.length;
            finalReports.add(report.withRecord(report.getRecord().withTrimmed(trimmed)));
            columns.add(DoubleColumn.create(column, values));
        });
        Table output = Table.create(input.name(), columns.toArray(new Column<?>[0]));
        log.info("Post transformation shape: ({}, {})", output.rowCount(), output.columnCount());

        int tested = resultsByColumn.size();
        conclusionCounts.forEach((conclusion, count) ->
                log.info("{} series ({}%) found with conclusion: {}", count, 100.0 * count / tested, conclusion.getDescription()));
        if (!skipped.isEmpty()) {
            log.info("{} series skipped: {}", skipped.size(), skipped.keySet());
        }

        return new StationarizationResult(output, List.copyOf(finalReports), List.copyOf(warnings));
    }

    private void deliver(ShapeWarning warning) {
        try {
            warningListener.onWarning(warning);
        } catch (RuntimeException e) {
            log.error("Warning listener {} failed, continuing without it", warningListener, e);
        }
    }
}
