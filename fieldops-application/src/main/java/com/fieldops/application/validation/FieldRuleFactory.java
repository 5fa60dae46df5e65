package com.fieldops.application.validation;

import com.fieldops.application.hygiene.DataHygiene;
import com.fieldops.domain.error.ConfigurationException;
import com.fieldops.domain.error.ViolationKind;
import com.fieldops.domain.metadata.FieldDef;
import com.fieldops.domain.metadata.SemanticType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Composes a field's rule in three layers: the registry's base rule, the modifier layer of its
 * {@link TypeFamily}, then the common layer (required/optional and custom messages).
 */
public class FieldRuleFactory {

    private final TypeBuilderRegistry registry;

    public FieldRuleFactory(TypeBuilderRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public FieldRule build(FieldDef def, boolean required) {
        Objects.requireNonNull(def, "def");
        TypeBuilder builder = registry.builderFor(def.type());
        FieldRule base = builder.baseRule().apply(def);

        FieldRule typed = switch (builder.family()) {
            case STRING -> directives(def).andThen(base).andThen(stringModifiers(def));
            case NUMERIC -> base.andThen(numericModifiers(def));
            case OTHER -> base;
        };

        FieldRule common = (field, value) -> {
            if (DataHygiene.isEmpty(value)) {
                return required
                        ? RuleOutcome.fail(ViolationKind.REQUIRED, field + " is required")
                        : RuleOutcome.ok(null);
            }
            return typed.check(field, value);
        };

        if (def.messages().isEmpty()) return common;
        return (field, value) -> {
            RuleOutcome o = common.check(field, value);
            if (o.isOk()) return o;
            String custom = def.messageFor(o.kind());
            return custom == null ? o : o.withMessage(custom);
        };
    }

    // explicit trim/lowercase directives run before the base rule so format checks see clean input
    private static FieldRule directives(FieldDef def) {
        if (!def.trim() && !def.lowercase()) return FieldRule.accept();
        return (field, value) -> {
            if (!(value instanceof String s)) return RuleOutcome.ok(value);
            if (def.trim()) s = s.trim();
            if (def.lowercase()) s = s.toLowerCase(Locale.ROOT);
            return RuleOutcome.ok(s);
        };
    }

    private static FieldRule stringModifiers(FieldDef def) {
        FieldRule rule = FieldRule.accept();
        Integer minLength = def.minLength();
        Integer maxLength = def.maxLength();
        if (minLength != null) {
            rule = rule.andThen((field, value) -> ((String) value).length() >= minLength
                    ? RuleOutcome.ok(value)
                    : RuleOutcome.fail(ViolationKind.LENGTH,
                    field + " must be at least " + minLength + " characters long"));
        }
        if (maxLength != null) {
            rule = rule.andThen((field, value) -> ((String) value).length() <= maxLength
                    ? RuleOutcome.ok(value)
                    : RuleOutcome.fail(ViolationKind.LENGTH,
                    field + " must be at most " + maxLength + " characters long"));
        }
        if (def.pattern() != null && !def.pattern().isBlank()) {
            Pattern p = compile(def.pattern());
            rule = rule.andThen((field, value) -> p.matcher((String) value).matches()
                    ? RuleOutcome.ok(value)
                    : RuleOutcome.fail(ViolationKind.PATTERN, field + " has an invalid format"));
        }
        // enum already checks membership in its base rule
        if (def.hasValues() && def.type() != SemanticType.ENUM) {
            List<String> allowed = def.values();
            rule = rule.andThen((field, value) -> allowed.contains(value)
                    ? RuleOutcome.ok(value)
                    : RuleOutcome.fail(ViolationKind.ENUM, field + " must be one of: " + String.join(", ", allowed)));
        }
        return rule;
    }

    private static FieldRule numericModifiers(FieldDef def) {
        FieldRule rule = FieldRule.accept();
        BigDecimal min = def.min();
        BigDecimal max = def.max();
        if (def.positive()) {
            rule = rule.andThen((field, value) -> StandardTypes.toDecimal(value).signum() > 0
                    ? RuleOutcome.ok(value)
                    : RuleOutcome.fail(ViolationKind.RANGE, field + " must be a positive number"));
        }
        if (min != null) {
            rule = rule.andThen((field, value) -> StandardTypes.toDecimal(value).compareTo(min) >= 0
                    ? RuleOutcome.ok(value)
                    : RuleOutcome.fail(ViolationKind.RANGE,
                    field + " must be greater than or equal to " + min.toPlainString()));
        }
        if (max != null) {
            rule = rule.andThen((field, value) -> StandardTypes.toDecimal(value).compareTo(max) <= 0
                    ? RuleOutcome.ok(value)
                    : RuleOutcome.fail(ViolationKind.RANGE,
                    field + " must be less than or equal to " + max.toPlainString()));
        }
        return rule;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid pattern in field metadata: " + regex);
        }
    }
}
