package com.fieldops.application.metadata;

import com.fieldops.application.validation.TypeBuilderRegistry;
import com.fieldops.domain.error.ConfigurationException;
import com.fieldops.domain.metadata.CrudAccess;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.FieldDef;
import com.fieldops.domain.metadata.ForeignKeyRef;
import com.fieldops.domain.metadata.Operation;
import com.fieldops.domain.metadata.SemanticType;
import com.fieldops.domain.role.RoleHierarchy;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Startup checks over the whole registry. Collects every problem instead of stopping at the first.
 */
public final class MetadataValidator {

    private static final Pattern PREFIX = Pattern.compile("^[A-Z]+$");

    private static final Set<SemanticType> SEARCHABLE_TYPES = EnumSet.of(
            SemanticType.STRING, SemanticType.TEXT, SemanticType.EMAIL, SemanticType.PHONE, SemanticType.URL,
            SemanticType.ENUM);

    private final TypeBuilderRegistry types;

    public MetadataValidator(TypeBuilderRegistry types) {
        this.types = types;
    }

    public MetadataValidationResult validate(MetadataRegistry registry, RoleHierarchy roles) {
        MetadataValidationResult res = new MetadataValidationResult();
        Set<String> tables = registry.tableNames();
        for (EntityMetadata m : registry.all()) {
            validateEntity(m, roles, tables, res);
        }
        return res;
    }

    /**
     * @throws ConfigurationException listing every problem found
     */
    public void validateOrThrow(MetadataRegistry registry, RoleHierarchy roles) {
        MetadataValidationResult res = validate(registry, roles);
        if (!res.isValid()) {
            throw new ConfigurationException("Invalid entity metadata (" + res.errors().size() + " problem(s))",
                    res.errors());
        }
    }

    private void validateEntity(EntityMetadata m, RoleHierarchy roles, Set<String> tables,
                                MetadataValidationResult res) {
        String e = m.entityName();

        for (Map.Entry<String, FieldDef> f : m.fields().entrySet()) {
            FieldDef def = f.getValue();
            if (!types.supports(def.type())) {
                res.addError(e + "." + f.getKey() + ": no type builder for " + def.type().tag());
            }
            if (def.type() == SemanticType.ENUM && !def.hasValues()) {
                res.addError(e + "." + f.getKey() + ": enum field has no values");
            }
            // enum input is lowercased before validation
            if (def.type() == SemanticType.ENUM) {
                for (String v : def.values()) {
                    if (!v.equals(v.toLowerCase(Locale.ROOT))) {
                        res.addError(e + "." + f.getKey() + ": enum value '" + v + "' must be lower-case");
                    }
                }
            }
            if (def.positive() && def.min() != null && def.min().signum() < 0) {
                res.addError(e + "." + f.getKey() + ": positive field cannot have a negative min");
            }
            if (def.pattern() != null) {
                try {
                    Pattern.compile(def.pattern());
                } catch (PatternSyntaxException ex) {
                    res.addError(e + "." + f.getKey() + ": invalid pattern " + def.pattern());
                }
            }
        }

        for (Map.Entry<String, CrudAccess> a : m.fieldAccess().entrySet()) {
            checkRoles(e + ".fieldAccess." + a.getKey(), a.getValue(), roles, res);
        }
        checkRoles(e + ".entityPermissions", m.entityPermissions(), roles, res);

        CrudAccess idAccess = m.effectiveFieldAccess().get(m.primaryKey());
        if (idAccess == null || CrudAccess.isNone(idAccess.read())) {
            res.addError(e + ": primary key '" + m.primaryKey() + "' must be readable");
        }

        for (String r : m.requiredFields()) {
            if (!m.fields().containsKey(r)) res.addError(e + ": required field '" + r + "' is not defined");
        }
        for (String i : m.immutableFields()) {
            if (!m.fields().containsKey(i)) res.addError(e + ": immutable field '" + i + "' is not defined");
        }

        for (Map.Entry<String, ForeignKeyRef> fk : m.foreignKeys().entrySet()) {
            if (!m.fields().containsKey(fk.getKey())) {
                res.addError(e + ": foreign key field '" + fk.getKey() + "' is not defined");
            }
            if (!tables.contains(fk.getValue().table())) {
                res.addError(e + "." + fk.getKey() + ": references unknown table '" + fk.getValue().table() + "'");
            }
        }

        checkListColumns(m, "searchableFields", m.searchableFields(), res);
        checkListColumns(m, "filterableFields", m.filterableFields(), res);
        checkListColumns(m, "sortableFields", m.sortableFields(), res);
        for (String s : m.searchableFields()) {
            FieldDef def = m.field(s);
            if (def != null && !SEARCHABLE_TYPES.contains(def.type())) {
                res.addError(e + ": searchable field '" + s + "' must be a text type, got " + def.type().tag());
            }
        }
        String sortField = m.defaultSort().field();
        if (!m.hasColumn(sortField)) {
            res.addError(e + ": default sort field '" + sortField + "' is not defined");
        } else if (!sortField.equals(m.primaryKey()) && !m.sortableFields().contains(sortField)) {
            res.addError(e + ": default sort field '" + sortField + "' must be sortable");
        }

        if (m.identifierPrefix() != null) {
            if (!PREFIX.matcher(m.identifierPrefix()).matches()) {
                res.addError(e + ": identifierPrefix must be upper-case letters, got " + m.identifierPrefix());
            }
            if (m.identityField() == null || !m.fields().containsKey(m.identityField())) {
                res.addError(e + ": identifierPrefix needs a defined identityField");
            } else if (m.isRequired(m.identityField())) {
                res.addError(e + ": minted identity field '" + m.identityField() + "' cannot be required input");
            }
        }
    }

    private static void checkListColumns(EntityMetadata m, String list, List<String> names,
                                         MetadataValidationResult res) {
        for (String n : names) {
            if (!m.hasColumn(n)) {
                res.addError(m.entityName() + ": " + list + " names undefined field '" + n + "'");
            } else if (m.field(n) != null && m.field(n).type() == SemanticType.OBJECT) {
                res.addError(m.entityName() + ": " + list + " cannot include object field '" + n + "'");
            }
        }
    }

    private static void checkRoles(String where, CrudAccess access, RoleHierarchy roles,
                                   MetadataValidationResult res) {
        for (Operation op : Operation.values()) {
            String r = access.requirementFor(op);
            if (!CrudAccess.isNone(r) && !roles.contains(r)) {
                res.addError(where + "." + op.key() + ": unknown role '" + r + "'");
            }
        }
    }
}
