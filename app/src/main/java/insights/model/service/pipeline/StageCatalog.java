package insights.model.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The stages available to a run, in reporting order. Built once and passed to
 * the orchestrator; a stage that is not registered simply does not run.
 */
public final class StageCatalog {
    private static final Logger log = LoggerFactory.getLogger(StageCatalog.class);

    private final Map<String, StageDefinition> stages;

    private StageCatalog(Map<String, StageDefinition> stages) {
        this.stages = stages;
    }

    public static Builder builder() { return new Builder(); }

    public Collection<StageDefinition> stages() { return stages.values(); }

    public List<String> names() { return new ArrayList<>(stages.keySet()); }

    public Optional<StageDefinition> get(String name) { return Optional.ofNullable(stages.get(name)); }

    public int size() { return stages.size(); }

    /** Subset in the order given; unknown names are logged and ignored. */
    public StageCatalog select(List<String> names) {
        Map<String, StageDefinition> picked = new LinkedHashMap<>();
        for (String n : names) {
            StageDefinition d = stages.get(n);
            if (d == null) log.warn("Stage '{}' is not registered, ignoring", n);
            else picked.put(n, d);
        }
        return new StageCatalog(picked);
    }

    public static final class Builder {
        private final Map<String, StageDefinition> stages = new LinkedHashMap<>();

        public Builder register(StageDefinition def) {
            if (stages.putIfAbsent(def.name(), def) != null) {
                throw new IllegalArgumentException("Stage already registered: " + def.name());
            }
            return this;
        }

        public StageCatalog build() { return new StageCatalog(new LinkedHashMap<>(stages)); }
    }
}
