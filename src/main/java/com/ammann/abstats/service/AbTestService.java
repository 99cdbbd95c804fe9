/* (C)2026 */
package com.ammann.abstats.service;

import com.ammann.abstats.enumeration.AllocationMode;
import com.ammann.abstats.enumeration.ProportionVarianceMode;
import com.ammann.abstats.enumeration.TestType;
import com.ammann.abstats.exception.DomainException;
import com.ammann.abstats.exception.UndefinedMssException;
import com.ammann.abstats.exception.ValidationException;
import com.ammann.abstats.model.AbTestResult;
import com.ammann.abstats.model.AnalysisOptions;
import com.ammann.abstats.model.ConfidenceInterval;
import com.ammann.abstats.model.MssOutcome;
import com.ammann.abstats.model.TwoSampleComparison;
import com.ammann.abstats.model.UpliftEstimate;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.EnumMap;
import java.util.Map;
import org.apache.commons.math3.util.Precision;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Entry point for A/B comparisons: the proportion z-test and Welch's t-test, each followed by the
 * shared uplift, confidence interval and post-hoc sample size stages.
 *
 * <p>The two pipelines differ only in how they reduce raw input to per-arm summaries and which
 * critical value they hand to the interval stage. Results are assembled best-effort: when the
 * relative uplift (zero control estimate) or the sample size (zero observed effect) is undefined,
 * those fields are left empty and the rest of the row is still returned.
 *
 * <p>All methods are pure and stateless apart from metric counters; identical inputs always
 * produce identical results.
 */
@ApplicationScoped
public class AbTestService {

    private static final Logger LOG = Logger.getLogger(AbTestService.class);

    static final int FORMULA_SUM_SCALE = 9;

    @ConfigProperty(name = "abstats.defaults.alpha", defaultValue = "0.05")
    double defaultAlpha = AnalysisOptions.DEFAULT_ALPHA;

    @ConfigProperty(name = "abstats.defaults.power", defaultValue = "0.8")
    double defaultPower = AnalysisOptions.DEFAULT_POWER;

    @ConfigProperty(name = "abstats.proportion.variance-mode", defaultValue = "UNPOOLED")
    ProportionVarianceMode varianceMode = ProportionVarianceMode.UNPOOLED;

    @ConfigProperty(name = "abstats.mss.allocation-mode", defaultValue = "OBSERVED")
    AllocationMode allocationMode = AllocationMode.OBSERVED;

    private final DistributionService distributions;
    private final ProportionTestService proportionTests;
    private final MeanTestService meanTests;
    private final DeltaMethodService deltaMethod;
    private final MinimumSampleSizeService sampleSizes;
    private final MeterRegistry meterRegistry;

    private final Map<TestType, Counter> evaluationCounters = new EnumMap<>(TestType.class);
    private final Map<TestType, Counter> partialResultCounters = new EnumMap<>(TestType.class);

    @Inject
    public AbTestService(DistributionService distributions,
                         ProportionTestService proportionTests,
                         MeanTestService meanTests,
                         DeltaMethodService deltaMethod,
                         MinimumSampleSizeService sampleSizes,
                         MeterRegistry meterRegistry) {
        this.distributions = distributions;
        this.proportionTests = proportionTests;
        this.meanTests = meanTests;
        this.deltaMethod = deltaMethod;
        this.sampleSizes = sampleSizes;
        this.meterRegistry = meterRegistry;
        initMetrics();
    }

    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }
        for (TestType type : TestType.values()) {
            evaluationCounters.put(type, Counter.builder("abtest_evaluations_total")
                    .description("Completed A/B test evaluations")
                    .tag("test", type.metricTag())
                    .register(meterRegistry));
            partialResultCounters.put(type, Counter.builder("abtest_partial_results_total")
                    .description("A/B test results with undefined relative uplift or sample size")
                    .tag("test", type.metricTag())
                    .register(meterRegistry));
        }
    }

    /**
     * Proportion z-test with the configured alpha and power.
     */
    public AbTestResult proportionsZTest(
            long controlN, long controlSuccess, long treatmentN, long treatmentSuccess) {
        return proportionsZTest(controlN, controlSuccess, treatmentN, treatmentSuccess,
                resolveOptions(null, null, null));
    }

    public AbTestResult proportionsZTest(
            long controlN, long controlSuccess, long treatmentN, long treatmentSuccess,
            double alpha, double power) {
        return proportionsZTest(controlN, controlSuccess, treatmentN, treatmentSuccess,
                resolveOptions(alpha, power, null));
    }

    /**
     * Two-sample proportion z-test on success counts.
     *
     * @throws ValidationException for malformed counts or options
     */
    public AbTestResult proportionsZTest(
            long controlN, long controlSuccess, long treatmentN, long treatmentSuccess,
            AnalysisOptions options) {
        validate(options);
        TwoSampleComparison comparison = proportionTests.test(
                controlN, controlSuccess, treatmentN, treatmentSuccess, varianceMode);

        double criticalValue = distributions.standardNormalQuantile(1.0 - options.alpha() / 2.0);
        String formula = treatmentSuccess + "/" + treatmentN;

        return assemble(TestType.PROPORTION_Z, formula, comparison, criticalValue, options);
    }

    /**
     * Welch t-test with the configured alpha and power.
     */
    public AbTestResult ttestIndWelch(
            Iterable<? extends Number> controlValues, Iterable<? extends Number> treatmentValues) {
        return ttestIndWelch(controlValues, treatmentValues, resolveOptions(null, null, null));
    }

    public AbTestResult ttestIndWelch(
            Iterable<? extends Number> controlValues, Iterable<? extends Number> treatmentValues,
            double alpha, double power) {
        return ttestIndWelch(controlValues, treatmentValues, resolveOptions(alpha, power, null));
    }

    /**
     * Welch's unequal-variance t-test on raw observation sequences.
     *
     * @throws ValidationException for short or malformed sequences or options
     */
    public AbTestResult ttestIndWelch(
            Iterable<? extends Number> controlValues, Iterable<? extends Number> treatmentValues,
            AnalysisOptions options) {
        validate(options);
        MeanTestService.SampleReduction control = meanTests.reduce("control", controlValues);
        MeanTestService.SampleReduction treatment = meanTests.reduce("treatment", treatmentValues);
        TwoSampleComparison comparison = meanTests.test(control.summary(), treatment.summary());

        double df = comparison.test().degreesOfFreedom();
        double criticalValue = distributions.studentTQuantile(1.0 - options.alpha() / 2.0, df);
        // snap summation noise (20.999999999999996 for 0.1..2.0) before truncating
        long numerator = (long) Precision.round(treatment.sum(), FORMULA_SUM_SCALE);
        String formula = numerator + "/" + treatment.summary().count();

        return assemble(TestType.WELCH_T, formula, comparison, criticalValue, options);
    }

    /**
     * Fills unset request values from configuration and validates the result.
     */
    public AnalysisOptions resolveOptions(Double alpha, Double power, Double allocationRatio) {
        AnalysisOptions options = new AnalysisOptions(
                alpha != null ? alpha : defaultAlpha,
                power != null ? power : defaultPower,
                allocationRatio);
        validate(options);
        return options;
    }

    private AbTestResult assemble(
            TestType type,
            String formula,
            TwoSampleComparison comparison,
            double criticalValue,
            AnalysisOptions options) {
        ConfidenceInterval absoluteInterval =
                deltaMethod.absoluteInterval(comparison.control(), comparison.treatment(), criticalValue);

        UpliftEstimate uplift = null;
        ConfidenceInterval relativeInterval = null;
        try {
            uplift = deltaMethod.uplift(comparison.control(), comparison.treatment());
            relativeInterval =
                    deltaMethod.relativeInterval(comparison.control(), comparison.treatment(), criticalValue);
        } catch (DomainException e) {
            LOG.debugf("%s: relative uplift left empty: %s", type, e.getMessage());
        }

        double ratio = options.allocationRatio() != null
                ? options.allocationRatio()
                : MinimumSampleSizeService.allocationRatio(comparison, allocationMode);
        MssOutcome mss = null;
        try {
            mss = sampleSizes.solve(comparison, options.alpha(), options.power(), ratio);
        } catch (UndefinedMssException e) {
            LOG.debugf("%s: post-hoc sample size left empty: %s", type, e.getMessage());
        }

        AbTestResult result = new AbTestResult(
                type,
                formula,
                comparison,
                comparison.absoluteDifference(),
                uplift,
                absoluteInterval,
                relativeInterval,
                criticalValue,
                mss,
                options);

        increment(evaluationCounters, type);
        if (result.partial()) {
            increment(partialResultCounters, type);
        }

        LOG.infof("%s completed: metric=%s statistic=%.4f p=%.5f mss=%s",
                type, formula, comparison.test().statistic(), comparison.test().pValue(),
                mss != null ? mss.requiredN() : "n/a");
        return result;
    }

    private static void validate(AnalysisOptions options) {
        if (options == null) {
            throw ValidationException.invalidParameter("options", null, "non-null analysis options");
        }
        if (!(options.alpha() > 0.0 && options.alpha() < 1.0)) {
            throw ValidationException.notAProbability("alpha", options.alpha());
        }
        if (!(options.power() > 0.0 && options.power() < 1.0)) {
            throw ValidationException.notAProbability("power", options.power());
        }
        Double ratio = options.allocationRatio();
        if (ratio != null && (!(ratio > 0.0) || ratio.isInfinite())) {
            throw ValidationException.invalidParameter("allocationRatio", ratio, "a positive finite ratio");
        }
    }

    private static void increment(Map<TestType, Counter> counters, TestType type) {
        Counter counter = counters.get(type);
        if (counter != null) {
            counter.increment();
        }
    }
}
