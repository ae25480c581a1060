package scorer;

import data.Observations;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import priors.ConjugatePrior;
import priors.PosteriorResult;
import priors.PriorState;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores a stream of observations online: every observation is given its predictive log density under a conjugate
 * prior fitted to everything before it, and is then absorbed into the prior.
 * <p>
 * Usage: {@code StreamScorer <model> <inputFile> <outputFile> [warmup] [stateFile]}
 * <ul>
 * <li>model: BetaBernoulli, NormInvGamma, MVNormInvWishart, BayesianLinReg or BayesianMVLinReg</li>
 * <li>inputFile: one observation per line, columns separated by whitespace or commas; blank lines and lines
 * starting with '#' are skipped</li>
 * <li>outputFile: receives one log density per scored observation</li>
 * <li>warmup: number of leading observations only used to seed the prior (default 1)</li>
 * <li>stateFile: receives the final state of the prior as JSON</li>
 * </ul>
 */
public class StreamScorer {
    private static final Logger logger = LoggerFactory.getLogger(StreamScorer.class);

    private ConjugatePrior prior;

    public StreamScorer(ConjugatePrior prior) {
        this.prior = prior;
    }

    /**
     * The prior after everything scored so far; a scored row replaces it with the updated copy.
     */
    public ConjugatePrior getPrior() {
        return prior;
    }

    /**
     * Seeds the prior with the first {@code warmup} rows, then scores and absorbs the remaining ones.
     *
     * @return one log density per row after the warm-up
     */
    public double[] score(double[][] rows, int warmup) {
        int seed = Math.min(Math.max(warmup, 0), rows.length);
        if (seed > 0) {
            double[][] head = new double[seed][];
            System.arraycopy(rows, 0, head, 0, seed);
            prior.update(Observations.of(head));
        }
        double[] scores = new double[rows.length - seed];
        for (int i = seed; i < rows.length; i++) {
            Observations row = Observations.of(new double[][]{rows[i]});
            PosteriorResult result = prior.posterior(row, false, true, true);
            scores[i - seed] = result.getDensities()[0];
            prior = result.getUpdated();
        }
        return scores;
    }

    /**
     * Parses one observation per line.
     */
    public static double[][] parseRows(List<String> lines) {
        List<double[]> rows = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#"))
                continue;
            String[] split = trimmed.split("[,\\s]+");
            double[] row = new double[split.length];
            for (int i = 0; i < split.length; i++) {
                try {
                    row[i] = Double.parseDouble(split[i]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Not a number: '" + split[i] + "' in line '" + line + "'", e);
                }
            }
            rows.add(row);
        }
        return rows.toArray(new double[0][]);
    }

    public static void main(String[] args) throws IOException {
        if (args.length < 3) {
            System.err.println("Usage: StreamScorer <model> <inputFile> <outputFile> [warmup] [stateFile]");
            System.err.println("  model: one of " + PriorState.getTypeNames());
            System.exit(1);
        }
        long startTime = System.currentTimeMillis();

        String model = args[0];
        File inputFile = new File(args[1]);
        File outputFile = new File(args[2]);
        int warmup = args.length > 3 ? Integer.parseInt(args[3]) : 1;
        File stateFile = args.length > 4 ? new File(args[4]) : null;

        double[][] rows = parseRows(FileUtils.readLines(inputFile, StandardCharsets.UTF_8));
        logger.info("model: {}, observations: {}, warmup: {}", model, rows.length, warmup);

        StreamScorer scorer = new StreamScorer(PriorState.create(model));
        double[] scores = scorer.score(rows, warmup);

        StringBuilder output = new StringBuilder();
        for (double score : scores)
            output.append(String.format(Locale.ROOT, "%.6f%n", score));
        FileUtils.writeStringToFile(outputFile, output.toString(), StandardCharsets.UTF_8);

        if (stateFile != null) {
            FileUtils.writeStringToFile(stateFile, scorer.getPrior().toJson(), StandardCharsets.UTF_8);
            logger.info("Wrote state of {} to {}", model, stateFile);
        }
        long elapsedTime = System.currentTimeMillis() - startTime;
        logger.info("Scored {} observations in {} ms", scores.length, elapsedTime);
    }
}
