package strata.adapter.in.dto;

import java.util.List;

/**
 * DTO for dependency invalidation requests.
 *
 * @param dependencies upstream data sources whose derived entries should be removed, e.g. {@code cars_table}
 */
public record InvalidateDependenciesRequest(List<String> dependencies) {}
