package com.gentorox.navigation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly-typed navigation settings.
 *
 * Expected configuration shape (application.yaml):
 *
 * navigation:
 *   locations:
 *     - classpath*:navigation/*.yaml
 *   default-action: index
 *   app-scope: app
 *   internal-module: navigation
 *   internal-scope: dev
 *   internal-package: com.gentorox.navigation
 *   modules:
 *     billing: com.example.billing
 *   auto-discovery: true
 *   reload-on-startup: true
 *   dev-reload-enabled: false
 *   interceptor-enabled: true
 */
@ConfigurationProperties(prefix = "navigation")
public class NavigationProperties {

  /** Resource patterns of declaration scripts, applied in this order. */
  private List<String> locations = new ArrayList<>(List.of("classpath*:navigation/*.yaml"));

  /** Action used when a handler does not name its own default. */
  private String defaultAction = "index";

  /** Scope for discovered handlers that belong to no module. */
  private String appScope = "app";

  /** Module name of this library's own handlers. */
  private String internalModule = "navigation";

  /** Scope for discovered handlers of the internal module. */
  private String internalScope = "dev";

  /** Package holding this library's own handlers. */
  private String internalPackage = "com.gentorox.navigation";

  /** Module name to base package; a handler belongs to the module with the longest matching package. */
  private Map<String, String> modules = new LinkedHashMap<>();

  private boolean autoDiscovery = true;
  private boolean reloadOnStartup = true;
  private boolean devReloadEnabled = false;
  private boolean interceptorEnabled = true;

  public List<String> getLocations() {
    return locations;
  }

  public void setLocations(List<String> locations) {
    this.locations = locations;
  }

  public String getDefaultAction() {
    return defaultAction;
  }

  public void setDefaultAction(String defaultAction) {
    this.defaultAction = defaultAction;
  }

  public String getAppScope() {
    return appScope;
  }

  public void setAppScope(String appScope) {
    this.appScope = appScope;
  }

  public String getInternalModule() {
    return internalModule;
  }

  public void setInternalModule(String internalModule) {
    this.internalModule = internalModule;
  }

  public String getInternalScope() {
    return internalScope;
  }

  public void setInternalScope(String internalScope) {
    this.internalScope = internalScope;
  }

  public String getInternalPackage() {
    return internalPackage;
  }

  public void setInternalPackage(String internalPackage) {
    this.internalPackage = internalPackage;
  }

  public Map<String, String> getModules() {
    return modules;
  }

  public void setModules(Map<String, String> modules) {
    this.modules = modules;
  }

  public boolean isAutoDiscovery() {
    return autoDiscovery;
  }

  public void setAutoDiscovery(boolean autoDiscovery) {
    this.autoDiscovery = autoDiscovery;
  }

  public boolean isReloadOnStartup() {
    return reloadOnStartup;
  }

  public void setReloadOnStartup(boolean reloadOnStartup) {
    this.reloadOnStartup = reloadOnStartup;
  }

  public boolean isDevReloadEnabled() {
    return devReloadEnabled;
  }

  public void setDevReloadEnabled(boolean devReloadEnabled) {
    this.devReloadEnabled = devReloadEnabled;
  }

  public boolean isInterceptorEnabled() {
    return interceptorEnabled;
  }

  public void setInterceptorEnabled(boolean interceptorEnabled) {
    this.interceptorEnabled = interceptorEnabled;
  }

  /**
   * Resolves the module owning a class in {@code packageName}: the module whose base package is the
   * longest prefix of it, the internal module for this library's package, or null.
   */
  public String moduleForPackage(String packageName) {
    String best = null;
    int bestLength = -1;
    Map<String, String> candidates = new LinkedHashMap<>(modules == null ? Map.of() : modules);
    if (internalPackage != null && !internalPackage.isBlank()) {
      candidates.putIfAbsent(internalModule, internalPackage);
    }
    for (Map.Entry<String, String> e : candidates.entrySet()) {
      String base = e.getValue();
      if (base == null || base.isBlank()) continue;
      boolean matches = packageName.equals(base) || packageName.startsWith(base + ".");
      if (matches && base.length() > bestLength) {
        best = e.getKey();
        bestLength = base.length();
      }
    }
    return best;
  }
}
