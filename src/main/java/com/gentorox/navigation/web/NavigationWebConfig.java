package com.gentorox.navigation.web;

import com.gentorox.navigation.registry.NavigationRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers {@link ActivePathInterceptor} for every request unless
 * {@code navigation.interceptor-enabled} is false.
 */
@Configuration
@ConditionalOnProperty(name = "navigation.interceptor-enabled", havingValue = "true", matchIfMissing = true)
public class NavigationWebConfig implements WebMvcConfigurer {
  private final NavigationRegistry registry;

  public NavigationWebConfig(NavigationRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void addInterceptors(InterceptorRegistry interceptors) {
    interceptors.addInterceptor(new ActivePathInterceptor(registry));
  }
}
