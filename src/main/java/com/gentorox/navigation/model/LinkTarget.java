package com.gentorox.navigation.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where a navigation item points: a handler action, a named mapping, a URI, an absolute URL or a view.
 * Any attribute may be null.
 */
public record LinkTarget(String controller, String action, String mapping, String uri, String url, String view) {

  /** Argument names recognized as link attributes, in the order they are reported. */
  public static final List<String> KEYS = List.of("controller", "action", "mapping", "uri", "url", "view");

  public static final LinkTarget NONE = new LinkTarget(null, null, null, null, null, null);

  public static LinkTarget forAction(String controller, String action) {
    return new LinkTarget(controller, action, null, null, null, null);
  }

  /** Builds a target from keyword arguments, ignoring keys that are not link attributes. */
  public static LinkTarget fromArguments(Map<String, ?> args) {
    return new LinkTarget(
        str(args.get("controller")),
        str(args.get("action")),
        str(args.get("mapping")),
        str(args.get("uri")),
        str(args.get("url")),
        str(args.get("view")));
  }

  public LinkTarget withController(String newController) {
    return new LinkTarget(newController, action, mapping, uri, url, view);
  }

  public boolean hasController() {
    return controller != null && !controller.isEmpty();
  }

  /** Key under which this target is indexed, {@code controller:action}. A missing action is empty. */
  public String handlerActionKey() {
    return key(controller, action);
  }

  public static String key(String controller, String action) {
    return controller + ":" + (action == null ? "" : action);
  }

  /** Non-null attributes as an ordered map, for rendering and JSON. */
  public Map<String, String> toMap() {
    Map<String, String> m = new LinkedHashMap<>();
    put(m, "controller", controller);
    put(m, "action", action);
    put(m, "mapping", mapping);
    put(m, "uri", uri);
    put(m, "url", url);
    put(m, "view", view);
    return m;
  }

  private static void put(Map<String, String> m, String k, String v) {
    if (v != null) m.put(k, v);
  }

  private static String str(Object o) {
    return o == null ? null : String.valueOf(o);
  }
}
