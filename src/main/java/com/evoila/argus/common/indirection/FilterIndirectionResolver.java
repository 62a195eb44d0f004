package com.evoila.argus.common.indirection;

import com.evoila.argus.common.query.model.Filter;
import com.evoila.argus.common.query.model.FilterValue;
import com.evoila.argus.common.query.operator.OperatorKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Rewrites friendly-name filters into id filters before a query is built.
 *
 * <p>The relational store is only queried when a filter actually uses one of the given rules. A
 * name without a match is reported in {@link ResolvedFilters#unresolvedNames()}. If a positive
 * filter ({@code eq}, {@code has}) is left with no ids it cannot match anything, and the result is
 * marked unsatisfiable. A negative filter with no ids excludes nothing and is simply dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterIndirectionResolver {

  private final ClusterNameLookup clusterNameLookup;

  private record Outcome(Optional<Filter> filter, List<String> unresolved, boolean unsatisfiable) {}

  /**
   * Resolves all filters covered by {@code rules}.
   *
   * @param scope Project and optional parent entity to resolve names in
   * @param filters Filters as parsed from the request
   * @param rules Friendly-name columns of the target table
   * @return Rewritten filters in their original order
   */
  public Mono<ResolvedFilters> resolve(
      IndirectionScope scope, List<Filter> filters, Collection<IndirectionRule> rules) {
    if (filters.stream().noneMatch(filter -> ruleFor(filter, rules).isPresent())) {
      return Mono.just(ResolvedFilters.unchanged(filters));
    }

    log.debug("Step 1: Resolving friendly-name filters in {}", scope);
    return Flux.fromIterable(filters)
        .concatMap(
            filter ->
                ruleFor(filter, rules)
                    .map(rule -> resolveFilter(scope, filter, rule))
                    .orElseGet(
                        () -> Mono.just(new Outcome(Optional.of(filter), List.of(), false))))
        .collectList()
        .map(FilterIndirectionResolver::combine);
  }

  private Mono<Outcome> resolveFilter(IndirectionScope scope, Filter filter, IndirectionRule rule) {
    Optional<OperatorKind> operator = filter.operatorKind();
    if (operator.isEmpty()) {
      log.warn("Unknown operator '{}' on '{}', filter skipped", filter.operator(), rule.column());
      return Mono.just(new Outcome(Optional.empty(), List.of(), false));
    }
    List<String> names =
        filter.value().asStrings().stream().filter(name -> !name.isBlank()).distinct().toList();

    return Flux.fromIterable(names)
        .concatMap(
            name ->
                clusterNameLookup
                    .findClusterId(scope, name)
                    .map(id -> Map.entry(name, Optional.of(id)))
                    .defaultIfEmpty(Map.entry(name, Optional.<String>empty())))
        .collectList()
        .map(results -> toOutcome(filter, rule, operator.get(), results));
  }

  private static Outcome toOutcome(
      Filter filter,
      IndirectionRule rule,
      OperatorKind operator,
      List<Map.Entry<String, Optional<String>>> results) {
    List<String> ids = new ArrayList<>();
    List<String> unresolved = new ArrayList<>();
    for (Map.Entry<String, Optional<String>> result : results) {
      if (result.getValue().isPresent()) {
        ids.add(result.getValue().get());
      } else {
        unresolved.add(result.getKey());
      }
    }
    if (!unresolved.isEmpty()) {
      log.warn("Unknown {} name(s) {}, no matching id", rule.column(), unresolved);
    }

    if (ids.isEmpty()) {
      return new Outcome(Optional.empty(), unresolved, !operator.isNegative());
    }
    FilterValue value =
        ids.size() == 1 && !filter.value().isArray()
            ? FilterValue.ofString(ids.get(0))
            : FilterValue.ofStrings(ids);
    return new Outcome(
        Optional.of(new Filter(rule.targetColumn(), filter.operator(), value)), unresolved, false);
  }

  private static ResolvedFilters combine(List<Outcome> outcomes) {
    List<Filter> filters = new ArrayList<>();
    List<String> unresolved = new ArrayList<>();
    boolean unsatisfiable = false;
    for (Outcome outcome : outcomes) {
      outcome.filter().ifPresent(filters::add);
      unresolved.addAll(outcome.unresolved());
      unsatisfiable |= outcome.unsatisfiable();
    }
    return new ResolvedFilters(filters, unresolved, unsatisfiable);
  }

  private static Optional<IndirectionRule> ruleFor(
      Filter filter, Collection<IndirectionRule> rules) {
    return rules.stream().filter(rule -> rule.column().equals(filter.column())).findFirst();
  }
}
