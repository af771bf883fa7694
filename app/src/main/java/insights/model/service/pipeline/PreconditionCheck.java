package insights.model.service.pipeline;

import insights.model.service.preprocess.PreparedDataset;

import java.util.Optional;

/** Returns the reason a stage cannot run on this dataset, or empty when it can. */
@FunctionalInterface
public interface PreconditionCheck {
    Optional<String> unmet(PreparedDataset data);

    PreconditionCheck ALWAYS = data -> Optional.empty();
}
