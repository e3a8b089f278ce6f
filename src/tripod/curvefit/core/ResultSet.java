package tripod.curvefit.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered, read-only collection of {@link FitResult}s keyed
 * by their {@link ModelId}. Instances are assembled through a
 * {@link Builder} in one go and never change afterwards.
 */
public class ResultSet implements Iterable<FitResult> {
    private final Map<ModelId, FitResult> results;

    ResultSet (Map<ModelId, FitResult> results) {
        this.results = Collections.unmodifiableMap
            (new LinkedHashMap<ModelId, FitResult>(results));
    }

    public static class Builder {
        private final Map<ModelId, FitResult> results = 
            new LinkedHashMap<ModelId, FitResult>();

        public Builder add (FitResult result) {
            if (results.containsKey(result.getModelId())) {
                throw new IllegalArgumentException
                    ("Duplicate result for "+result.getModelId().getId());
            }
            results.put(result.getModelId(), result);
            return this;
        }

        public ResultSet build () { return new ResultSet (results); }
    }

    public static Builder builder () { return new Builder (); }

    public int size () { return results.size(); }
    public boolean isEmpty () { return results.isEmpty(); }
    public boolean contains (ModelId model) { 
        return results.containsKey(model); 
    }

    /**
     * @return the result for the given model or null if it wasn't run
     */
    public FitResult get (ModelId model) { return results.get(model); }

    public List<ModelId> models () {
        return Collections.unmodifiableList
            (new ArrayList<ModelId>(results.keySet()));
    }

    public List<FitResult> results () {
        return Collections.unmodifiableList
            (new ArrayList<FitResult>(results.values()));
    }

    public List<FitResult> results (FitResult.Status status) {
        List<FitResult> matched = new ArrayList<FitResult>();
        for (FitResult r : results.values()) {
            if (r.getStatus() == status)
                matched.add(r);
        }
        return matched;
    }

    public Iterator<FitResult> iterator () {
        return results.values().iterator();
    }

    public String toString () {
        StringBuilder sb = new StringBuilder ("ResultSet{\n");
        for (FitResult r : results.values()) {
            sb.append(" "+r+"\n");
        }
        sb.append("}");
        return sb.toString();
    }
}
