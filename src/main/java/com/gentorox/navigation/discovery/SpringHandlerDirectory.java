package com.gentorox.navigation.discovery;

import com.gentorox.navigation.config.NavigationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Controller;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RequestMapping;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * {@link HandlerDirectory} over the Spring MVC controllers of an application context.
 *
 * <p>Every {@code @Controller} bean (including {@code @RestController}) outside Spring's own
 * packages is a handler. Its name is the class simple name without the {@code Controller}
 * suffix, starting lower case, so {@code OrderHistoryController} becomes {@code orderHistory}.
 * Its actions are the public methods carrying {@code @RequestMapping} or one of the composed
 * mapping annotations, named after the method.
 */
public class SpringHandlerDirectory implements HandlerDirectory {
  private static final Logger logger = LoggerFactory.getLogger(SpringHandlerDirectory.class);
  private static final String CONTROLLER_SUFFIX = "Controller";
  private static final String FRAMEWORK_PACKAGE = "org.springframework.";

  private final ApplicationContext applicationContext;
  private final NavigationProperties properties;

  public SpringHandlerDirectory(ApplicationContext applicationContext, NavigationProperties properties) {
    this.applicationContext = Objects.requireNonNull(applicationContext, "applicationContext");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public List<HandlerDescriptor> handlers() {
    List<HandlerDescriptor> handlers = new ArrayList<>();
    for (String beanName : applicationContext.getBeanNamesForAnnotation(Controller.class)) {
      Class<?> type = applicationContext.getType(beanName);
      if (type == null) {
        logger.debug("Skipping controller bean [{}] with unknown type", beanName);
        continue;
      }
      Class<?> userType = ClassUtils.getUserClass(type);
      if (userType.getName().startsWith(FRAMEWORK_PACKAGE)) {
        logger.debug("Skipping framework controller [{}]", userType.getName());
        continue;
      }
      handlers.add(describe(userType));
    }
    handlers.sort(Comparator.comparing(HandlerDescriptor::name));
    return handlers;
  }

  /** Builds the descriptor for one controller class. */
  public HandlerDescriptor describe(Class<?> controllerClass) {
    NavigationHandler hints = AnnotatedElementUtils.findMergedAnnotation(controllerClass, NavigationHandler.class);
    String scope = hints != null && StringUtils.hasText(hints.scope()) ? hints.scope() : null;
    String defaultAction = hints != null && StringUtils.hasText(hints.defaultAction())
        ? hints.defaultAction()
        : properties.getDefaultAction();

    return new HandlerDescriptor(
        handlerName(controllerClass),
        properties.moduleForPackage(controllerClass.getPackageName()),
        scope,
        defaultAction,
        actionNames(controllerClass));
  }

  /** Handler name of a controller class as used in link targets. */
  public static String handlerName(Class<?> controllerClass) {
    String simpleName = ClassUtils.getUserClass(controllerClass).getSimpleName();
    if (simpleName.endsWith(CONTROLLER_SUFFIX) && simpleName.length() > CONTROLLER_SUFFIX.length()) {
      simpleName = simpleName.substring(0, simpleName.length() - CONTROLLER_SUFFIX.length());
    }
    return StringUtils.uncapitalize(simpleName);
  }

  private static List<String> actionNames(Class<?> controllerClass) {
    TreeSet<String> names = new TreeSet<>();
    for (Method m : ReflectionUtils.getUniqueDeclaredMethods(controllerClass, ReflectionUtils.USER_DECLARED_METHODS)) {
      if (Modifier.isPublic(m.getModifiers()) && AnnotatedElementUtils.hasAnnotation(m, RequestMapping.class)) {
        names.add(m.getName());
      }
    }
    return new ArrayList<>(names);
  }
}
