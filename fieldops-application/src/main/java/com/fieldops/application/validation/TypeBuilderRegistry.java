package com.fieldops.application.validation;

import com.fieldops.domain.error.ConfigurationException;
import com.fieldops.domain.metadata.SemanticType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Semantic type to {@link TypeBuilder}. The only place type-specific behavior is looked up;
 * supporting a new type means registering one more builder.
 */
public final class TypeBuilderRegistry {

    private final Map<SemanticType, TypeBuilder> builders = new EnumMap<>(SemanticType.class);

    /** Registry with a builder for every {@link SemanticType}. */
    public static TypeBuilderRegistry standard() {
        TypeBuilderRegistry r = new TypeBuilderRegistry();
        StandardTypes.registerAll(r);
        return r;
    }

    /** Adds or replaces the builder for its type. */
    public TypeBuilderRegistry register(TypeBuilder builder) {
        Objects.requireNonNull(builder, "builder");
        builders.put(builder.type(), builder);
        return this;
    }

    /**
     * @throws ConfigurationException when nothing is registered for the type
     */
    public TypeBuilder builderFor(SemanticType type) {
        TypeBuilder b = builders.get(type);
        if (b == null) {
            throw new ConfigurationException("No type builder registered for type: " + (type == null ? null : type.tag()));
        }
        return b;
    }

    public boolean supports(SemanticType type) {
        return builders.containsKey(type);
    }

    public Set<SemanticType> types() {
        return Set.copyOf(builders.keySet());
    }
}
