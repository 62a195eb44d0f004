package com.evoila.argus.common.indirection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Remembers lookups, including misses, in a bounded cache whose entries expire after a fixed time.
 * Writers of the {@code clusters} table call {@link #invalidate} or {@link #invalidateProject} to
 * make changes visible before that.
 *
 * <p>A lookup that was started before an invalidation does not store its result, so an
 * invalidation is never undone by a slow lookup.
 */
@Slf4j
public class CachingClusterNameLookup implements ClusterNameLookup {

  private record CacheKey(String projectId, String signalId, String name) {}

  private final ClusterNameLookup delegate;
  private final Cache<CacheKey, Optional<String>> cache;
  private final Object lock = new Object();
  private long generation;

  public CachingClusterNameLookup(
      ClusterNameLookup delegate, long maximumSize, Duration expireAfterWrite) {
    this(delegate, maximumSize, expireAfterWrite, Ticker.systemTicker());
  }

  CachingClusterNameLookup(
      ClusterNameLookup delegate, long maximumSize, Duration expireAfterWrite, Ticker ticker) {
    this.delegate = delegate;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(expireAfterWrite)
            .ticker(ticker)
            .build();
  }

  @Override
  public Mono<String> findClusterId(IndirectionScope scope, String name) {
    CacheKey key =
        new CacheKey(
            scope.projectId().toString(),
            scope.signal().map(Object::toString).orElse(null),
            name);
    return Mono.defer(
        () -> {
          Optional<String> cached = cache.getIfPresent(key);
          if (cached != null) {
            log.debug("Cluster lookup cache hit for '{}'", name);
            return Mono.justOrEmpty(cached);
          }
          long observed = currentGeneration();
          return delegate
              .findClusterId(scope, name)
              .map(Optional::of)
              .defaultIfEmpty(Optional.empty())
              .doOnNext(result -> store(key, result, observed))
              .flatMap(Mono::justOrEmpty);
        });
  }

  @Override
  public void invalidate(String projectId, String name) {
    synchronized (lock) {
      generation++;
      cache
          .asMap()
          .keySet()
          .removeIf(key -> key.projectId().equals(projectId) && key.name().equals(name));
    }
    log.info("Invalidated cluster lookups for '{}' in project {}", name, projectId);
  }

  @Override
  public void invalidateProject(String projectId) {
    synchronized (lock) {
      generation++;
      cache.asMap().keySet().removeIf(key -> key.projectId().equals(projectId));
    }
    log.info("Invalidated cluster lookups for project {}", projectId);
  }

  private long currentGeneration() {
    synchronized (lock) {
      return generation;
    }
  }

  private void store(CacheKey key, Optional<String> result, long observed) {
    synchronized (lock) {
      if (generation != observed) {
        log.debug("Discarding lookup of '{}' started before an invalidation", key.name());
        return;
      }
      cache.put(key, result);
    }
  }

  long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
