package com.fieldops.infrastructure.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.application.ports.MetadataSource;
import com.fieldops.domain.error.ConfigurationException;
import com.fieldops.domain.error.ViolationKind;
import com.fieldops.domain.metadata.CrudAccess;
import com.fieldops.domain.metadata.EntityMetadata;
import com.fieldops.domain.metadata.FieldDef;
import com.fieldops.domain.metadata.ForeignKeyRef;
import com.fieldops.domain.metadata.SemanticType;
import com.fieldops.domain.metadata.SortDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads one JSON document per entity, e.g. {@code metadata/work_order.json}:
 *
 * <pre>
 * {
 *   "entityName": "work_order",
 *   "tableName": "work_orders",
 *   "identityField": "work_order_number",
 *   "identifierPrefix": "WO",
 *   "entityPermissions": {"create": "dispatcher", "read": "customer", "update": "technician", "delete": "manager"},
 *   "fields": {"title": {"type": "string", "maxLength": 200, "trim": true, "messages": {"required": "..."}}},
 *   "fieldAccess": {"title": {"create": "dispatcher", "read": "customer", "update": "dispatcher", "delete": "none"}},
 *   "requiredFields": ["title"],
 *   "immutableFields": ["customer_id"],
 *   "foreignKeys": {"customer_id": {"table": "customers", "displayName": "Customer"}},
 *   "searchableFields": ["title"],
 *   "filterableFields": ["status", "customer_id"],
 *   "sortableFields": ["created_at", "status"],
 *   "defaultSort": {"field": "created_at", "order": "DESC"}
 * }
 * </pre>
 *
 * Any structural problem is a {@link ConfigurationException} naming the resource.
 */
public final class JsonMetadataLoader implements MetadataSource {

  private static final Logger log = LoggerFactory.getLogger(JsonMetadataLoader.class);

  private final ObjectMapper mapper;
  private final ResourcePatternResolver resolver;
  private final String locationPattern;

  public JsonMetadataLoader(ObjectMapper mapper, String locationPattern) {
    this(mapper, new PathMatchingResourcePatternResolver(), locationPattern);
  }

  public JsonMetadataLoader(ObjectMapper mapper, ResourcePatternResolver resolver, String locationPattern) {
    this.mapper = mapper;
    this.resolver = resolver;
    this.locationPattern = locationPattern;
  }

  @Override
  public List<EntityMetadata> loadAll() {
    Resource[] resources;
    try {
      resources = resolver.getResources(locationPattern);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot list metadata at " + locationPattern + ": " + e.getMessage());
    }
    if (resources.length == 0) {
      throw new ConfigurationException("No entity metadata found at " + locationPattern);
    }

    List<Resource> sorted = new ArrayList<>(Arrays.asList(resources));
    sorted.sort(Comparator.comparing(r -> String.valueOf(r.getFilename())));

    List<EntityMetadata> out = new ArrayList<>();
    for (Resource r : sorted) {
      out.add(load(r));
    }
    log.info("[METADATA] loaded entities={} from={}", out.size(), locationPattern);
    return out;
  }

  EntityMetadata load(Resource resource) {
    String name = resource.getFilename();
    JsonNode root;
    try (InputStream in = resource.getInputStream()) {
      root = mapper.readTree(in);
    } catch (IOException e) {
      throw new ConfigurationException("Unreadable metadata document " + name + ": " + e.getMessage());
    }
    try {
      return parse(root);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new ConfigurationException("Malformed metadata document " + name + ": " + e.getMessage());
    }
  }

  EntityMetadata parse(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("document must be a JSON object");
    }
    EntityMetadata.Builder b = EntityMetadata.builder(
        requiredText(root, "entityName"),
        requiredText(root, "tableName"));

    String pk = text(root, "primaryKey");
    if (pk != null) b.primaryKey(pk);
    b.identityField(text(root, "identityField"));
    b.identifierPrefix(text(root, "identifierPrefix"));

    JsonNode fields = root.path("fields");
    if (!fields.isObject()) throw new IllegalArgumentException("fields must be an object");
    for (Iterator<Map.Entry<String, JsonNode>> it = fields.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      b.field(e.getKey(), fieldDef(e.getKey(), e.getValue()));
    }

    for (Iterator<Map.Entry<String, JsonNode>> it = root.path("fieldAccess").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      b.access(e.getKey(), crud(e.getValue()));
    }
    if (root.has("entityPermissions")) {
      b.entityPermissions(crud(root.get("entityPermissions")));
    }

    b.required(strings(root.path("requiredFields")));
    b.immutable(strings(root.path("immutableFields")));

    for (Iterator<Map.Entry<String, JsonNode>> it = root.path("foreignKeys").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode fk = e.getValue();
      ForeignKeyRef ref = fk.isTextual()
          ? new ForeignKeyRef(fk.asText(), null)
          : new ForeignKeyRef(requiredText(fk, "table"), text(fk, "displayName"));
      b.foreignKey(e.getKey(), ref);
    }

    b.searchable(strings(root.path("searchableFields")));
    b.filterable(strings(root.path("filterableFields")));
    b.sortable(strings(root.path("sortableFields")));
    JsonNode sort = root.path("defaultSort");
    if (!sort.isMissingNode() && !sort.isNull()) {
      if (!sort.isObject()) throw new IllegalArgumentException("defaultSort must be an object");
      String order = text(sort, "order");
      SortDirection direction = SortDirection.parse(order, null);
      if (order != null && direction == null) {
        throw new IllegalArgumentException("defaultSort order must be ASC or DESC, got " + order);
      }
      b.defaultSort(requiredText(sort, "field"), direction);
    }
    return b.build();
  }

  private static FieldDef fieldDef(String name, JsonNode node) {
    if (!node.isObject()) throw new IllegalArgumentException("field " + name + " must be an object");
    String type = text(node, "type");
    if (type == null) throw new IllegalArgumentException("field " + name + " has no type");

    FieldDef.Builder f = FieldDef.builder(SemanticType.fromTag(type))
        .required(node.path("required").asBoolean(false))
        .trim(node.path("trim").asBoolean(false))
        .lowercase(node.path("lowercase").asBoolean(false))
        .positive(node.path("positive").asBoolean(false))
        .pattern(text(node, "pattern"));
    if (node.hasNonNull("min")) f.min(node.get("min").decimalValue());
    if (node.hasNonNull("max")) f.max(node.get("max").decimalValue());
    if (node.hasNonNull("minLength")) f.minLength(node.get("minLength").asInt());
    if (node.hasNonNull("maxLength")) f.maxLength(node.get("maxLength").asInt());
    if (node.has("values")) f.values(List.of(strings(node.get("values"))));
    if (node.hasNonNull("default")) f.defaultValue(scalar(node.get("default")));

    for (Iterator<Map.Entry<String, JsonNode>> it = node.path("messages").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> m = it.next();
      f.message(ViolationKind.fromKey(m.getKey()), m.getValue().asText());
    }
    return f.build();
  }

  private static CrudAccess crud(JsonNode node) {
    if (!node.isObject()) throw new IllegalArgumentException("access entry must be an object");
    return CrudAccess.of(text(node, "create"), text(node, "read"), text(node, "update"), text(node, "delete"));
  }

  private static Object scalar(JsonNode n) {
    if (n.isBoolean()) return n.booleanValue();
    if (n.isIntegralNumber()) return n.longValue();
    if (n.isNumber()) return n.decimalValue();
    return n.asText();
  }

  private static String[] strings(JsonNode node) {
    if (node.isMissingNode() || node.isNull()) return new String[0];
    if (!node.isArray()) throw new IllegalArgumentException("expected an array of strings");
    String[] out = new String[node.size()];
    for (int i = 0; i < node.size(); i++) {
      out[i] = node.get(i).asText();
    }
    return out;
  }

  private static String requiredText(JsonNode node, String key) {
    String v = text(node, key);
    if (v == null || v.isBlank()) throw new IllegalArgumentException(key + " is missing");
    return v;
  }

  private static String text(JsonNode node, String key) {
    JsonNode n = node.get(key);
    return (n != null && n.isValueNode() && !n.isNull()) ? n.asText() : null;
  }
}
