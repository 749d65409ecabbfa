package com.gentorox.navigation.sources;

import com.gentorox.navigation.dsl.DeclarationEvaluator;
import com.gentorox.navigation.dsl.DslCommand;
import com.gentorox.navigation.exception.NavigationErrorCode;
import com.gentorox.navigation.exception.NavigationException;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Declaration read from a YAML resource. */
public class YamlDeclarationSource implements DeclarationSource {
  private final Resource resource;
  private final String definingModule;
  private final DeclarationEvaluator evaluator;

  public YamlDeclarationSource(Resource resource, String definingModule, DeclarationEvaluator evaluator) {
    this.resource = Objects.requireNonNull(resource, "resource");
    this.definingModule = definingModule;
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
  }

  @Override
  public String name() {
    return resource.getDescription();
  }

  @Override
  public String definingModule() {
    return definingModule;
  }

  @Override
  public List<DslCommand> commands() {
    try (InputStream in = resource.getInputStream()) {
      return evaluator.evaluate(in, name());
    } catch (IOException e) {
      throw new NavigationException(NavigationErrorCode.IO_ERROR,
          "Failed to read navigation script " + name(), Map.of("source", name()), e);
    }
  }
}
