package com.gentorox.navigation;

import com.gentorox.navigation.config.NavigationProperties;
import com.gentorox.navigation.registry.NavigationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Loads the navigation structure once the application context is ready.
 */
@Component
public class NavigationStartup implements ApplicationRunner {
  private static final Logger LOG = LoggerFactory.getLogger(NavigationStartup.class);

  private final NavigationRegistry registry;
  private final NavigationProperties properties;

  public NavigationStartup(NavigationRegistry registry, NavigationProperties properties) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.isReloadOnStartup()) {
      LOG.info("Navigation reload on startup is disabled");
      return;
    }
    registry.reloadAll();
  }
}
