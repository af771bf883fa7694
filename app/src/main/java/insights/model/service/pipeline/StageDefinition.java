package insights.model.service.pipeline;

import java.util.Objects;

public record StageDefinition(String name, StageFunction primary, StageFunction fallback, PreconditionCheck precondition) {
    public StageDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(primary, "primary");
        if (precondition == null) precondition = PreconditionCheck.ALWAYS;
    }

    public static StageDefinition of(String name, StageFunction primary) {
        return new StageDefinition(name, primary, null, null);
    }
}
