package com.fieldops.api.web;

import com.fieldops.api.security.SecurityActor;
import com.fieldops.application.query.ListRequest;
import com.fieldops.application.service.EntityReadService;
import com.fieldops.application.service.EntityWriteService;
import com.fieldops.application.service.ResourceNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generic CRUD over every entity in the metadata catalog. Routing only; all rules live in the services.
 */
@RestController
@RequestMapping("/api/v1/entities/{entity}")
public class EntityController {

  private static final Set<String> RESERVED_PARAMS = Set.of("limit", "offset", "search", "sortBy", "sortOrder");

  private final EntityWriteService writes;
  private final EntityReadService reads;

  public EntityController(EntityWriteService writes, EntityReadService reads) {
    this.writes = writes;
    this.reads = reads;
  }

  @PostMapping
  public ResponseEntity<Map<String, Object>> create(@PathVariable String entity,
                                                    @RequestBody Map<String, Object> payload) {
    return ResponseEntity.status(HttpStatus.CREATED).body(writes.create(entity, payload, SecurityActor.current()));
  }

  /**
   * Paged list. {@code search}, {@code sortBy} and {@code sortOrder} are reserved; every other parameter is a
   * filter, written {@code field=value} or {@code field[op]=value}.
   */
  @GetMapping
  public List<Map<String, Object>> list(@PathVariable String entity,
                                        @RequestParam(defaultValue = "50") int limit,
                                        @RequestParam(defaultValue = "0") int offset,
                                        @RequestParam(required = false) String search,
                                        @RequestParam(required = false) String sortBy,
                                        @RequestParam(required = false) String sortOrder,
                                        @RequestParam MultiValueMap<String, String> params) {
    Map<String, List<String>> filters = new LinkedHashMap<>(params);
    filters.keySet().removeAll(RESERVED_PARAMS);
    ListRequest request = new ListRequest(search, filters, sortBy, sortOrder, limit, offset);
    return reads.list(entity, request, SecurityActor.current());
  }

  @GetMapping("/{id}")
  public Map<String, Object> get(@PathVariable String entity, @PathVariable String id) {
    return reads.findById(entity, id, SecurityActor.current())
        .orElseThrow(() -> ResourceNotFoundException.record(entity, id));
  }

  @PatchMapping("/{id}")
  public Map<String, Object> update(@PathVariable String entity, @PathVariable String id,
                                    @RequestBody Map<String, Object> payload) {
    return writes.update(entity, id, payload, SecurityActor.current());
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable String entity, @PathVariable String id) {
    writes.delete(entity, id, SecurityActor.current());
    return ResponseEntity.noContent().build();
  }
}
