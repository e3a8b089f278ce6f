package tripod.curvefit.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Orders the fitted models of a {@link ResultSet} from best to worst
 * by a {@link FitScore}. Inapplicable and failed entries never take
 * part, and neither do models whose score is NaN. Equal scores keep
 * the insertion order of the result set.
 */
public class ModelRanker implements Comparator<FitResult> {
    private static final Logger logger = 
        Logger.getLogger(ModelRanker.class.getName());

    private final FitScore scorer;

    public ModelRanker () {
        this (new RmseFitScore ());
    }

    public ModelRanker (FitScore scorer) {
        if (scorer == null) {
            throw new IllegalArgumentException ("No scorer given!");
        }
        this.scorer = scorer;
    }

    public FitScore getScorer () { return scorer; }

    public int compare (FitResult r1, FitResult r2) {
        return Double.compare(scorer.eval(r1.getFit()), 
                              scorer.eval(r2.getFit()));
    }

    /**
     * @return fitted results, best first; empty if nothing was fitted
     */
    public List<FitResult> rank (ResultSet results) {
        List<FitResult> ranked = new ArrayList<FitResult>();
        for (FitResult r : results) {
            if (!r.isFitted()) 
                continue;

            if (Double.isNaN(scorer.eval(r.getFit()))) {
                logger.warning(r.getModelId().getId()
                               +": score is NaN; excluded from ranking");
            }
            else {
                ranked.add(r);
            }
        }
        Collections.sort(ranked, this); // stable
        return ranked;
    }

    /**
     * @return the best fitted result, or null when there's no winner
     */
    public FitResult best (ResultSet results) {
        List<FitResult> ranked = rank (results);
        return ranked.isEmpty() ? null : ranked.get(0);
    }
}
