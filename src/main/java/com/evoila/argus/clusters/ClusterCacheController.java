package com.evoila.argus.clusters;

import com.evoila.argus.common.indirection.ClusterNameLookup;
import com.evoila.argus.common.request.RequestParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Lets the owner of the clusters table drop remembered name lookups after a cluster is created,
 * renamed or deleted.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/projects/{projectId}/clusters/cache")
@RequiredArgsConstructor
public class ClusterCacheController {

  private final ClusterNameLookup clusterNameLookup;

  @PostMapping("/invalidate")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public Mono<Void> invalidate(
      @PathVariable("projectId") String projectId,
      @RequestParam(name = "name", required = false) String name) {
    String project = RequestParameters.uuid("projectId", projectId).toString();
    return Mono.fromRunnable(
        () -> {
          if (name == null || name.isBlank()) {
            log.debug("Invalidating cluster lookups of project {}", project);
            clusterNameLookup.invalidateProject(project);
          } else {
            log.debug("Invalidating cluster lookup '{}' of project {}", name, project);
            clusterNameLookup.invalidate(project, name);
          }
        });
  }
}
