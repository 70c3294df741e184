package org.puneet.abtest;

import org.puneet.abtest.exceptions.StatisticalValidationException;
import org.puneet.abtest.exceptions.ValidationException;
import org.puneet.abtest.model.Alternative;
import org.puneet.abtest.model.AnalysisReport;
import org.puneet.abtest.model.AnalysisRequest;
import org.puneet.abtest.model.ImbalanceReport;
import org.puneet.abtest.model.PowerReport;
import org.puneet.abtest.model.Recommendation;
import org.puneet.abtest.model.SampleSizePlan;
import org.puneet.abtest.model.TestMethod;
import org.puneet.abtest.model.TestOutcome;
import org.puneet.abtest.model.TrialPair;
import org.puneet.abtest.statistical.HypothesisTestDispatcher;
import org.puneet.abtest.statistical.ImbalanceClassifier;
import org.puneet.abtest.statistical.PowerAnalyzer;
import org.puneet.abtest.statistical.RecommendationComposer;
import org.puneet.abtest.util.AnalysisConfig;
import org.puneet.abtest.validation.TrialValidator;
import org.puneet.abtest.validation.ValidatedTrials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine: validates a request, picks and runs a test,
 * computes power and composes the final recommendation.
 * 
 * <p>The same request always produces an equal report.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public class AbTestAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(AbTestAnalyzer.class);
    
    private final HypothesisTestDispatcher dispatcher;
    private final PowerAnalyzer powerAnalyzer;
    private final double targetPower;
    
    public AbTestAnalyzer() {
        this(new HypothesisTestDispatcher(), new PowerAnalyzer(), AnalysisConfig.getTargetPower());
    }
    
    public AbTestAnalyzer(HypothesisTestDispatcher dispatcher, PowerAnalyzer powerAnalyzer, double targetPower) {
        if (dispatcher == null || powerAnalyzer == null) {
            throw new IllegalArgumentException("Dispatcher and power analyzer cannot be null");
        }
        this.dispatcher = dispatcher;
        this.powerAnalyzer = powerAnalyzer;
        this.targetPower = targetPower;
    }
    
    /**
     * Runs the full analysis.
     * 
     * @throws ValidationException if the trials, alpha or the alternative are invalid
     * @throws StatisticalValidationException if the method is unknown or the power is undefined
     */
    public AnalysisReport analyze(AnalysisRequest request)
            throws ValidationException, StatisticalValidationException {
        if (request == null) {
            throw ValidationException.nullValue("request");
        }
        logger.info("Analyzing {}", request);
        
        ValidatedTrials trials = TrialValidator.validate(
            request.getNameA(), request.getNA(), request.getWinRateA(),
            request.getNameB(), request.getNB(), request.getWinRateB());
        TrialPair pair = trials.getTrialPair();
        Alternative alternative = Alternative.fromId(request.getAlternative());
        
        ImbalanceReport imbalance = ImbalanceClassifier.classify(pair);
        TestMethod method = request.isAutoMethod()
            ? imbalance.getRecommendedMethod()
            : TestMethod.fromId(request.getMethod());
        if (request.isAutoMethod()) {
            logger.info("Method 'auto' resolved to {}", method.getDisplayName());
        }
        
        TestOutcome outcome = dispatcher.run(pair, method, request.getAlpha(), alternative);
        PowerReport power = powerAnalyzer.analyze(pair, request.getAlpha(), targetPower);
        Recommendation recommendation = RecommendationComposer.compose(outcome, pair, imbalance);
        
        logger.info("Decision: {} ({})", recommendation.getDecision(), recommendation.getHeadline());
        return new AnalysisReport(request, pair, trials.getAdvisories(), imbalance, outcome, power, recommendation);
    }
    
    /**
     * Runs another method on the same trials and adds its outcome to the report.
     * The executed method and the recommendation are left unchanged.
     */
    public AnalysisReport runAdditionalTest(AnalysisReport report, TestMethod method)
            throws ValidationException, StatisticalValidationException {
        TestOutcome primary = report.getOutcome();
        TestOutcome outcome = dispatcher.run(report.getTrialPair(), method, primary.getAlpha(),
            Alternative.fromId(report.getRequest().getAlternative()));
        return report.withOutcome(outcome);
    }
    
    /**
     * Adds the outcome of every supported method to the report.
     */
    public AnalysisReport compareAllMethods(AnalysisReport report)
            throws ValidationException, StatisticalValidationException {
        AnalysisReport result = report;
        for (TestMethod method : TestMethod.values()) {
            if (result.getOutcome(method) == null) {
                result = runAdditionalTest(result, method);
            }
        }
        return result;
    }
    
    /**
     * Sample size plan for the next collection round.
     * 
     * @param effectSizeOverride effect size to plan for, or {@code null} for the observed one
     */
    public SampleSizePlan planSampleSize(AnalysisReport report, Double effectSizeOverride)
            throws StatisticalValidationException {
        return powerAnalyzer.planSampleSize(report.getTrialPair(), report.getOutcome().getAlpha(),
            targetPower, effectSizeOverride);
    }
}
