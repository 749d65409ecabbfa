package com.gentorox.navigation.web;

import com.gentorox.navigation.discovery.SpringHandlerDirectory;
import com.gentorox.navigation.registry.NavigationRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Objects;

/**
 * Marks the navigation item linked to the controller method serving a request as active, unless
 * an active path was already set for the request.
 */
public class ActivePathInterceptor implements HandlerInterceptor {
  private final NavigationRegistry registry;

  public ActivePathInterceptor(NavigationRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (handler instanceof HandlerMethod method && registry.getActivePath(request) == null) {
      registry.setActivePathFromRequest(request,
          SpringHandlerDirectory.handlerName(method.getBeanType()),
          method.getMethod().getName());
    }
    return true;
  }
}
