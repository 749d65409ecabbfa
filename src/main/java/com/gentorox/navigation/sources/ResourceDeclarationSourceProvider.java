package com.gentorox.navigation.sources;

import com.gentorox.navigation.dsl.DeclarationEvaluator;
import com.gentorox.navigation.exception.NavigationErrorCode;
import com.gentorox.navigation.exception.NavigationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Finds YAML declaration scripts by resource pattern. Patterns are applied in configured order;
 * resources matched by one pattern are ordered by file name, then by full description. A resource
 * matched by several patterns is used once, at its first position.
 */
public class ResourceDeclarationSourceProvider implements DeclarationSourceProvider {
  private static final Logger logger = LoggerFactory.getLogger(ResourceDeclarationSourceProvider.class);

  private static final Comparator<Resource> BY_NAME = Comparator
      .comparing((Resource r) -> String.valueOf(r.getFilename()))
      .thenComparing(Resource::getDescription);

  private final ResourcePatternResolver resolver;
  private final List<String> locations;
  private final DeclarationEvaluator evaluator;

  public ResourceDeclarationSourceProvider(ResourcePatternResolver resolver, List<String> locations,
                                           DeclarationEvaluator evaluator) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.locations = locations == null ? List.of() : List.copyOf(locations);
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
  }

  @Override
  public List<DeclarationSource> sources() {
    Set<String> seen = new LinkedHashSet<>();
    List<DeclarationSource> sources = new ArrayList<>();
    for (String location : locations) {
      Resource[] resources;
      try {
        resources = resolver.getResources(location);
      } catch (IOException e) {
        throw new NavigationException(NavigationErrorCode.IO_ERROR,
            "Failed to resolve navigation location " + location, Map.of("location", location), e);
      }
      if (resources.length == 0) {
        logger.debug("No navigation scripts found at {}", location);
        continue;
      }
      Arrays.sort(resources, BY_NAME);
      for (Resource r : resources) {
        if (!r.exists()) {
          logger.warn("Skipping missing navigation script {}", r.getDescription());
          continue;
        }
        if (seen.add(r.getDescription())) {
          sources.add(new YamlDeclarationSource(r, null, evaluator));
        }
      }
    }
    logger.debug("Resolved {} navigation scripts from {}", sources.size(), locations);
    return sources;
  }
}
