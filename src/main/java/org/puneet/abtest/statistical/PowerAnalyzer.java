package org.puneet.abtest.statistical;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.puneet.abtest.exceptions.StatisticalValidationException;
import org.puneet.abtest.exceptions.StatisticalValidationException.StatisticalErrorType;
import org.puneet.abtest.model.PowerReport;
import org.puneet.abtest.model.SampleSizePlan;
import org.puneet.abtest.model.TrialPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statistical power of the two-proportion comparison, measured with Cohen's h.
 * 
 * <p>Power is the normal approximation for two independent samples, two-sided,
 * with effective size {@code nobs = 1 / (1/nA + 1/nB)}. Group B is sized as
 * {@code ratio * nA} when solving for the required sample size.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class PowerAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(PowerAnalyzer.class);
    
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);
    
    /** Returned by {@link #requiredSampleSize} when no finite size reaches the target */
    public static final long UNATTAINABLE = -1L;
    
    private static final double MAX_SAMPLE_SIZE = 1e15;
    private static final int MAX_SOLVER_EVALUATIONS = 200;
    private static final double SOLVER_ACCURACY = 1e-6;
    
    // Imbalance thresholds for the allocation of a new collection round
    private static final double SEVERE_PLAN_RATIO = 0.2;
    private static final double MODERATE_PLAN_RATIO = 0.5;
    private static final double MODERATE_ALLOCATION = 0.7;
    
    /**
     * Power analysis for the reported win rates of a validated pair.
     */
    public PowerReport analyze(TrialPair pair, double alpha, double targetPower)
            throws StatisticalValidationException {
        return analyze(pair.getTrialA().getN(), pair.getTrialA().getWinRate(),
            pair.getTrialB().getN(), pair.getTrialB().getWinRate(), alpha, targetPower);
    }
    
    /**
     * @throws StatisticalValidationException UNDEFINED_POWER when a sample size is not
     *         positive, or when alpha or the target power lies outside (0, 1)
     */
    public PowerReport analyze(int nA, double rateA, int nB, double rateB, double alpha, double targetPower)
            throws StatisticalValidationException {
        if (nA <= 0 || nB <= 0) {
            throw StatisticalValidationException.undefinedPower(
                "Power needs positive sample sizes in both groups", nA, nB);
        }
        checkProbabilities(alpha, targetPower, nA, nB);
        
        double h = cohensH(rateA, rateB);
        if (Double.isNaN(h)) {
            throw StatisticalValidationException.undefinedPower(
                String.format("Cohen's h is undefined for rates %s and %s", rateA, rateB), nA, nB);
        }
        double ratio = (double) nB / nA;
        double currentPower = power(h, nA, ratio, alpha);
        long required = requiredSampleSize(h, alpha, targetPower, ratio);
        long requiredTotal = required == UNATTAINABLE ? UNATTAINABLE : (long) Math.ceil(required * (1 + ratio));
        
        logger.info("Power analysis: h={}, current power={}, required per group={}",
            h, currentPower, required == UNATTAINABLE ? "unattainable" : required);
        return new PowerReport(h, alpha, targetPower, currentPower, required, (long) nA + nB, requiredTotal,
            interpret(currentPower));
    }
    
    /**
     * Sample size plan for a new collection round. The allocation of group B
     * shrinks toward a balanced design when the current split is lopsided.
     * 
     * @param effectSizeOverride effect size to plan for, or {@code null} for the observed |h|
     * @throws StatisticalValidationException UNDEFINED_POWER when no finite size reaches the target
     */
    public SampleSizePlan planSampleSize(TrialPair pair, double alpha, double targetPower, Double effectSizeOverride)
            throws StatisticalValidationException {
        int nA = pair.getTrialA().getN();
        int nB = pair.getTrialB().getN();
        checkProbabilities(alpha, targetPower, nA, nB);
        
        double effect = effectSizeOverride != null
            ? Math.abs(effectSizeOverride)
            : Math.abs(cohensH(pair.getTrialA().getWinRate(), pair.getTrialB().getWinRate()));
        double ratio = pair.getAllocationRatio();
        long perGroup = requiredSampleSize(effect, alpha, targetPower, ratio);
        if (perGroup == UNATTAINABLE) {
            throw StatisticalValidationException.undefinedPower(
                "No finite sample size detects an effect of " + effect, nA, nB);
        }
        
        double imbalance = pair.getImbalanceRatio();
        double optimalRatio;
        String recommendation;
        if (imbalance < SEVERE_PLAN_RATIO) {
            optimalRatio = 1.0;
            recommendation = String.format("Samples are severely imbalanced, collect a balanced %d:%d design",
                perGroup, perGroup);
        } else if (imbalance < MODERATE_PLAN_RATIO) {
            optimalRatio = MODERATE_ALLOCATION;
            recommendation = String.format("Samples are moderately imbalanced, collect in a %d:%d split",
                perGroup, (long) (perGroup * MODERATE_ALLOCATION));
        } else {
            optimalRatio = ratio;
            recommendation = String.format("Samples are reasonably balanced, collect in a %d:%d split",
                perGroup, (long) (perGroup * ratio));
        }
        logger.debug("Sample size plan: effect={}, per group={}, allocation={}", effect, perGroup, optimalRatio);
        return new SampleSizePlan(effect, alpha, targetPower, ratio, perGroup, optimalRatio, recommendation);
    }
    
    /**
     * Cohen's h for two proportions, {@code 2 asin(sqrt(rateB)) - 2 asin(sqrt(rateA))}.
     */
    public static double cohensH(double rateA, double rateB) {
        return 2 * Math.asin(Math.sqrt(rateB)) - 2 * Math.asin(Math.sqrt(rateA));
    }
    
    /**
     * Two-sided power for an effect of size {@code effect} with {@code nA} trials
     * in group A and {@code ratio * nA} in group B.
     */
    public static double power(double effect, double nA, double ratio, double alpha) {
        double nobs = nA * ratio / (1 + ratio);
        double critical = STANDARD_NORMAL.inverseCumulativeProbability(1 - alpha / 2);
        double shift = Math.abs(effect) * Math.sqrt(nobs);
        return 1 - STANDARD_NORMAL.cumulativeProbability(critical - shift)
            + STANDARD_NORMAL.cumulativeProbability(-critical - shift);
    }
    
    /**
     * Smallest size of group A whose power reaches {@code targetPower}.
     * 
     * @return the size, or {@link #UNATTAINABLE} for a zero effect
     */
    public static long requiredSampleSize(double effect, double alpha, double targetPower, double ratio) {
        if (Double.isNaN(effect) || effect == 0.0) {
            return UNATTAINABLE;
        }
        UnivariateFunction shortfall = size -> power(effect, size, ratio, alpha) - targetPower;
        if (shortfall.value(1.0) >= 0) {
            return 1L;
        }
        
        double upper = 2.0;
        while (shortfall.value(upper) < 0) {
            upper *= 2;
            if (upper > MAX_SAMPLE_SIZE) {
                logger.warn("Effect {} needs more than {} samples per group", effect, MAX_SAMPLE_SIZE);
                return UNATTAINABLE;
            }
        }
        
        double root;
        try {
            root = new BrentSolver(SOLVER_ACCURACY).solve(MAX_SOLVER_EVALUATIONS, shortfall, 1.0, upper);
        } catch (MathIllegalStateException e) {
            logger.warn("Root solve did not converge for effect {}, falling back to the bracket bound", effect);
            root = upper;
        }
        
        long n = Math.max(1L, (long) Math.ceil(root));
        while (n > 1 && shortfall.value(n - 1) >= 0) {
            n--;
        }
        while (shortfall.value(n) < 0) {
            n++;
        }
        return n;
    }
    
    static String interpret(double power) {
        if (power < 0.5) {
            return "Power is very low, likely to miss a true difference";
        } else if (power < 0.8) {
            return "Power is insufficient, increase sample size";
        }
        return "Power is sufficient, result is reliable";
    }
    
    private static void checkProbabilities(double alpha, double targetPower, long nA, long nB)
            throws StatisticalValidationException {
        if (!(alpha > 0.0 && alpha < 1.0)) {
            StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.UNDEFINED_POWER, "Alpha must lie in (0, 1): " + alpha);
            ex.addContext("alpha", alpha);
            throw ex;
        }
        if (!(targetPower > 0.0 && targetPower < 1.0)) {
            throw StatisticalValidationException.undefinedPower(
                "Target power must lie in (0, 1): " + targetPower, nA, nB);
        }
    }
}
