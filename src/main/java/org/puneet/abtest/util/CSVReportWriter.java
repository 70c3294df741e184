package org.puneet.abtest.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.puneet.abtest.model.Advisory;
import org.puneet.abtest.model.AnalysisReport;
import org.puneet.abtest.model.BasicStats;
import org.puneet.abtest.model.BasicStats.GroupStats;
import org.puneet.abtest.model.ImbalanceReport;
import org.puneet.abtest.model.PowerReport;
import org.puneet.abtest.model.Recommendation;
import org.puneet.abtest.model.TestOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Exports an analysis report as CSV with one {@code Section,Field,Value} row per figure.
 * 
 * <p>Sections appear in a fixed order: basic statistics, advisories,
 * imbalance, one block per test outcome, power and recommendation.</p>
 * 
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public final class CSVReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(CSVReportWriter.class);
    
    private static final CSVFormat REPORT_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader("Section", "Field", "Value")
        .setRecordSeparator("\n")
        .build();
    
    private CSVReportWriter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
    
    public static String toCsv(AnalysisReport report) {
        StringWriter out = new StringWriter();
        try {
            write(report, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render report", e);
        }
        return out.toString();
    }
    
    /**
     * Writes the report to a file, creating parent directories when missing.
     */
    public static void writeToFile(AnalysisReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(report, writer);
        }
        logger.info("Report written to {}", file);
    }
    
    public static void write(AnalysisReport report, Appendable out) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, REPORT_FORMAT);
        writeBasicStats(printer, report.getBasicStats());
        for (Advisory advisory : report.getAdvisories()) {
            printer.printRecord("advisory", advisory.getType(), advisory.getMessage());
        }
        writeImbalance(printer, report.getImbalanceReport());
        for (TestOutcome outcome : report.getOutcomes().values()) {
            writeOutcome(printer, outcome);
        }
        writePower(printer, report.getPowerReport());
        writeRecommendation(printer, report.getRecommendation());
        printer.flush();
    }
    
    private static void writeBasicStats(CSVPrinter printer, BasicStats stats) throws IOException {
        writeGroup(printer, stats.getGroupA());
        writeGroup(printer, stats.getGroupB());
        String section = "basic_stats.delta";
        printer.printRecord(section, "total", stats.getTotalDelta());
        printer.printRecord(section, "wins", stats.getWinsDelta());
        printer.printRecord(section, "losses", stats.getLossesDelta());
        printer.printRecord(section, "win_rate", stats.getWinRateDelta());
        printer.printRecord(section, "loss_rate", stats.getLossRateDelta());
        printer.printRecord(section, "sample_share", stats.getSampleShareDelta());
    }
    
    private static void writeGroup(CSVPrinter printer, GroupStats group) throws IOException {
        String section = "basic_stats." + group.getName();
        printer.printRecord(section, "total", group.getTotal());
        printer.printRecord(section, "wins", group.getWins());
        printer.printRecord(section, "losses", group.getLosses());
        printer.printRecord(section, "win_rate", group.getWinRate());
        printer.printRecord(section, "loss_rate", group.getLossRate());
        printer.printRecord(section, "sample_share", group.getSampleShare());
    }
    
    private static void writeImbalance(CSVPrinter printer, ImbalanceReport imbalance) throws IOException {
        String section = "imbalance";
        printer.printRecord(section, "total_samples", imbalance.getTotalSamples());
        printer.printRecord(section, "ratio", imbalance.getRatio());
        printer.printRecord(section, "level", imbalance.getBalanceLevel().getDisplayName());
        printer.printRecord(section, "small_sample", imbalance.isSmallSample());
        printer.printRecord(section, "recommended_method", imbalance.getRecommendedMethod().getId());
        printer.printRecord(section, "min_cell_count", imbalance.getMinExpectedCount());
        printer.printRecord(section, "min_recommended_sample", imbalance.getMinRecommendedSampleSize());
        for (String advice : imbalance.getAdvice()) {
            printer.printRecord(section, "advice", advice);
        }
    }
    
    private static void writeOutcome(CSVPrinter printer, TestOutcome outcome) throws IOException {
        String section = "test." + outcome.getMethod().getId();
        printer.printRecord(section, "method", outcome.getMethod().getDisplayName());
        printer.printRecord(section, "alternative", outcome.getAlternative().getId());
        printer.printRecord(section, "alpha", outcome.getAlpha());
        printer.printRecord(section, outcome.getStatisticName(), outcome.getStatistic());
        printer.printRecord(section, "p_value", outcome.getPValue());
        printer.printRecord(section, "significant", outcome.isSignificant());
        printer.printRecord(section, "status", outcome.getStatus());
        if (outcome.hasConfidenceInterval()) {
            printer.printRecord(section, "ci_lower", outcome.getCiLower());
            printer.printRecord(section, "ci_upper", outcome.getCiUpper());
        }
        if (outcome.getDegreesOfFreedom() != null) {
            printer.printRecord(section, "degrees_of_freedom", outcome.getDegreesOfFreedom());
        }
        if (!Double.isNaN(outcome.getEffectCoefficient())) {
            printer.printRecord(section, "effect_coefficient", outcome.getEffectCoefficient());
        }
        if (outcome.getSeed() != null) {
            printer.printRecord(section, "iterations", outcome.getIterations());
            printer.printRecord(section, "seed", outcome.getSeed());
        }
        printer.printRecord(section, "recommendation", outcome.getRecommendation());
    }
    
    private static void writePower(CSVPrinter printer, PowerReport power) throws IOException {
        String section = "power";
        printer.printRecord(section, "observed_effect_size", power.getObservedEffectSize());
        printer.printRecord(section, "current_power", power.getCurrentPower());
        printer.printRecord(section, "required_sample_size_per_group",
            power.getRequiredSampleSizePerGroup().isPresent()
                ? String.valueOf(power.getRequiredSampleSizePerGroup().getAsLong()) : "unattainable");
        printer.printRecord(section, "current_total_samples", power.getCurrentTotalSamples());
        printer.printRecord(section, "required_total_samples",
            power.getRequiredTotalSamples().isPresent()
                ? String.valueOf(power.getRequiredTotalSamples().getAsLong()) : "unattainable");
        if (power.getSampleShortfall().isPresent()) {
            printer.printRecord(section, "sample_shortfall", power.getSampleShortfall().getAsLong());
        }
        printer.printRecord(section, "interpretation", power.getInterpretation());
    }
    
    private static void writeRecommendation(CSVPrinter printer, Recommendation recommendation) throws IOException {
        String section = "recommendation";
        printer.printRecord(section, "decision", recommendation.getDecision());
        printer.printRecord(section, "headline", recommendation.getHeadline());
        printer.printRecord(section, "reason", recommendation.getReason());
        for (String action : recommendation.getActions()) {
            printer.printRecord(section, "action", action);
        }
    }
}
