package com.evoila.argus.common.indirection;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational scope for name lookups: always a project, optionally narrowed to a signal (the
 * parent entity that owns event clusters).
 */
public record IndirectionScope(UUID projectId, UUID signalId) {

  public IndirectionScope {
    Objects.requireNonNull(projectId, "Project id cannot be null");
  }

  public static IndirectionScope project(UUID projectId) {
    return new IndirectionScope(projectId, null);
  }

  public static IndirectionScope signal(UUID projectId, UUID signalId) {
    return new IndirectionScope(projectId, Objects.requireNonNull(signalId));
  }

  public Optional<UUID> signal() {
    return Optional.ofNullable(signalId);
  }
}
