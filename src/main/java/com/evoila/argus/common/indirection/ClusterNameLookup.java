package com.evoila.argus.common.indirection;

import reactor.core.publisher.Mono;

/** Read-only lookup of cluster ids by human-facing name in the relational store. */
public interface ClusterNameLookup {

  /**
   * Finds the id of the cluster with the given name.
   *
   * @param scope Project, and optionally the signal, the cluster belongs to
   * @param name Cluster name as shown to users
   * @return The cluster id, or empty when no such cluster exists
   */
  Mono<String> findClusterId(IndirectionScope scope, String name);

  /**
   * Forgets anything remembered for one name. Called when a cluster with that name is created,
   * renamed or deleted.
   */
  default void invalidate(String projectId, String name) {}

  /** Forgets everything remembered for a project. */
  default void invalidateProject(String projectId) {}
}
