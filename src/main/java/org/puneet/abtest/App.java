package org.puneet.abtest;

import org.puneet.abtest.model.Alternative;
import org.puneet.abtest.model.AnalysisReport;
import org.puneet.abtest.model.AnalysisRequest;
import org.puneet.abtest.model.SampleSizePlan;
import org.puneet.abtest.model.TestOutcome;
import org.puneet.abtest.util.CSVReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line demonstration: analyzes a heavily imbalanced comparison,
 * then prints every method's outcome and the CSV report.
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);
    
    public static void main(String[] args) {
        logger.info("Starting A/B test engine");
        
        try {
            AnalysisRequest request = AnalysisRequest.builder()
                .groupA("Strategy A", 1000, 0.52)
                .groupB("Strategy B", 50, 0.62)
                .alternative(Alternative.GREATER)
                .build();
            
            AbTestAnalyzer analyzer = new AbTestAnalyzer();
            AnalysisReport report = analyzer.compareAllMethods(analyzer.analyze(request));
            
            for (TestOutcome outcome : report.getOutcomes().values()) {
                logger.info("{}: p={}, {}", outcome.getMethod().getDisplayName(),
                    String.format("%.4f", outcome.getPValue()), outcome.getRecommendation());
            }
            logger.info("Executed method: {}", report.getExecutedMethod().getDisplayName());
            logger.info("Recommendation: {}", report.getRecommendation().getHeadline());
            
            SampleSizePlan plan = analyzer.planSampleSize(report, null);
            logger.info("Next round: {}", plan.getRecommendation());
            
            System.out.print(CSVReportWriter.toCsv(report));
        } catch (Exception e) {
            logger.error("Critical error in application execution", e);
            System.exit(1);
        }
    }
}
