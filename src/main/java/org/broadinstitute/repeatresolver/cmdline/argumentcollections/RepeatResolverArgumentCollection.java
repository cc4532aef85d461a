package org.broadinstitute.repeatresolver.cmdline.argumentcollections;

import org.broadinstitute.barclay.argparser.Advanced;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.repeatresolver.exceptions.UserException;

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Tuning parameters for repeat resolution.
 */
public final class RepeatResolverArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String MAX_ITERATIONS_LONG_NAME = "max-iterations";
    public static final String MIN_PRUNE_CONFIDENCE_LONG_NAME = "min-prune-confidence";
    public static final String SUPPORT_THRESHOLD_LONG_NAME = "support-threshold";
    public static final String MIN_FLANK_CONFIDENCE_LONG_NAME = "min-flank-confidence";
    public static final String EXTRACTION_THREADS_LONG_NAME = "extraction-threads";
    public static final String REPEATS_DUMP_LONG_NAME = "repeats-dump";

    public static final int MAX_ITERATIONS_DEFAULT = 100;
    public static final double MIN_PRUNE_CONFIDENCE_DEFAULT = 0.5;
    public static final double MIN_FLANK_CONFIDENCE_DEFAULT = 0.0;
    public static final int EXTRACTION_THREADS_DEFAULT = 1;

    @Argument(fullName = MAX_ITERATIONS_LONG_NAME,
            doc = "Upper bound on resolution iterations. Resolution normally stops earlier, when an iteration " +
                    "neither separates a path nor removes an edge.", optional = true)
    public int maxIterations = MAX_ITERATIONS_DEFAULT;

    @Argument(fullName = MIN_PRUNE_CONFIDENCE_LONG_NAME,
            doc = "Repeat edges that never gained read support are deleted when the multiplicity estimator's " +
                    "confidence in them is below this value.", optional = true)
    public double minPruneConfidence = MIN_PRUNE_CONFIDENCE_DEFAULT;

    @Argument(fullName = SUPPORT_THRESHOLD_LONG_NAME,
            doc = "Number of spanning reads a path needs to be separated. If unset, the threshold reported by the " +
                    "multiplicity estimator is used.", optional = true)
    public Integer supportThreshold = null;

    @Advanced
    @Argument(fullName = MIN_FLANK_CONFIDENCE_LONG_NAME,
            doc = "Minimum ratio between a path's support and the mean support of all paths leaving its entry " +
                    "edge or reaching its exit edge. 0 turns the check off.", optional = true)
    public double minFlankConfidence = MIN_FLANK_CONFIDENCE_DEFAULT;

    @Argument(fullName = EXTRACTION_THREADS_LONG_NAME,
            doc = "Number of threads used to query read alignments.", optional = true)
    public int extractionThreads = EXTRACTION_THREADS_DEFAULT;

    @Argument(fullName = REPEATS_DUMP_LONG_NAME,
            doc = "If given, repeats still unresolved after resolution are written here with the reads that " +
                    "enter, leave and traverse them.", optional = true)
    public String repeatsDump = null;

    /**
     * @throws UserException.BadArgumentValue if any value is out of range
     */
    public void validate() {
        if ( maxIterations < 1 ) {
            throw new UserException.BadArgumentValue(MAX_ITERATIONS_LONG_NAME, Integer.toString(maxIterations),
                    "Must be at least 1.");
        }
        if ( !(minPruneConfidence >= 0.0 && minPruneConfidence <= 1.0) ) {
            throw new UserException.BadArgumentValue(MIN_PRUNE_CONFIDENCE_LONG_NAME,
                    Double.toString(minPruneConfidence), "Must lie in [0, 1].");
        }
        if ( supportThreshold != null && supportThreshold < 1 ) {
            throw new UserException.BadArgumentValue(SUPPORT_THRESHOLD_LONG_NAME, supportThreshold.toString(),
                    "Must be at least 1.");
        }
        if ( !(minFlankConfidence >= 0.0) ) {
            throw new UserException.BadArgumentValue(MIN_FLANK_CONFIDENCE_LONG_NAME,
                    Double.toString(minFlankConfidence), "Must not be negative.");
        }
        if ( extractionThreads < 1 ) {
            throw new UserException.BadArgumentValue(EXTRACTION_THREADS_LONG_NAME,
                    Integer.toString(extractionThreads), "Must be at least 1.");
        }
    }

    public Path getRepeatsDumpPath() {
        return repeatsDump == null ? null : Paths.get(repeatsDump);
    }
}
