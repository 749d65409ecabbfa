package com.gentorox.navigation.discovery;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Navigation hints for a controller that is picked up by auto-discovery.
 *
 * <pre>
 * &#64;Controller
 * &#64;NavigationHandler(scope = "admin", defaultAction = "list")
 * public class UsersController { ... }
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface NavigationHandler {

  /** Scope receiving the discovered nodes; empty to let the owning module decide. */
  String scope() default "";

  /** Action served when a request names the controller only; empty for the configured default. */
  String defaultAction() default "";
}
