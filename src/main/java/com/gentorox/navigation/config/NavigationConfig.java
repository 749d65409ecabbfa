package com.gentorox.navigation.config;

import com.gentorox.navigation.discovery.HandlerDirectory;
import com.gentorox.navigation.discovery.SpringHandlerDirectory;
import com.gentorox.navigation.dsl.DeclarationEvaluator;
import com.gentorox.navigation.graph.NavigationConditions;
import com.gentorox.navigation.model.NavigationCondition;
import com.gentorox.navigation.registry.NavigationRegistry;
import com.gentorox.navigation.sources.DeclarationSource;
import com.gentorox.navigation.sources.DeclarationSourceProvider;
import com.gentorox.navigation.sources.ResourceDeclarationSourceProvider;
import com.gentorox.navigation.telemetry.NavigationTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring configuration wiring the navigation registry.
 *
 * <p>Declaration sources are the YAML scripts found at {@code navigation.locations}, followed by
 * any {@link DeclarationSource} beans in their {@code @Order}. Conditions referenced by name from
 * scripts are the {@link NavigationCondition} beans, keyed by bean name.
 */
@Configuration
@EnableConfigurationProperties(NavigationProperties.class)
public class NavigationConfig {
  private static final Logger logger = LoggerFactory.getLogger(NavigationConfig.class);

  @Bean
  public DeclarationEvaluator declarationEvaluator() {
    return new DeclarationEvaluator();
  }

  @Bean
  public DeclarationSourceProvider declarationSourceProvider(ApplicationContext applicationContext,
                                                             NavigationProperties properties,
                                                             DeclarationEvaluator evaluator,
                                                             ObjectProvider<DeclarationSource> declaredSources) {
    ResourceDeclarationSourceProvider scripts =
        new ResourceDeclarationSourceProvider(applicationContext, properties.getLocations(), evaluator);
    return () -> {
      List<DeclarationSource> all = new ArrayList<>(scripts.sources());
      declaredSources.orderedStream().forEach(all::add);
      return all;
    };
  }

  @Bean
  public HandlerDirectory handlerDirectory(ApplicationContext applicationContext, NavigationProperties properties) {
    return new SpringHandlerDirectory(applicationContext, properties);
  }

  @Bean
  public NavigationRegistry navigationRegistry(DeclarationSourceProvider declarationSourceProvider,
                                               HandlerDirectory handlerDirectory,
                                               ApplicationContext applicationContext,
                                               NavigationProperties properties,
                                               NavigationTelemetry navigationTelemetry) {
    var conditions = applicationContext.getBeansOfType(NavigationCondition.class);
    logger.info("Initializing NavigationRegistry with locations {} and conditions {}",
        properties.getLocations(), conditions.keySet());
    return new NavigationRegistry(declarationSourceProvider, handlerDirectory,
        new NavigationConditions(conditions), properties, navigationTelemetry);
  }
}
