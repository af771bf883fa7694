package insights.model.service.ingest;

import insights.model.domain.FormatVariant;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** One adapter per known variant. */
public final class SchemaAdapters {
    private final Map<FormatVariant, SchemaAdapter> byVariant = new EnumMap<>(FormatVariant.class);

    public SchemaAdapters(List<SchemaAdapter> adapters) {
        for (SchemaAdapter a : adapters) byVariant.put(a.variant(), a);
    }

    public static SchemaAdapters defaults() {
        return new SchemaAdapters(List.of(
                new InstagramPostAdapter(),
                new FacebookVideoAdapter(),
                new StandardSchemaAdapter()));
    }

    public SchemaAdapter forVariant(FormatVariant variant) {
        SchemaAdapter a = byVariant.get(variant);
        if (a == null) throw new IllegalArgumentException("No adapter registered for " + variant);
        return a;
    }
}
