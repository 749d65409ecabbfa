package com.gentorox.navigation.web;

import com.gentorox.navigation.config.NavigationProperties;
import com.gentorox.navigation.exception.ErrorDetails;
import com.gentorox.navigation.exception.NavigationErrorCode;
import com.gentorox.navigation.exception.NavigationException;
import com.gentorox.navigation.model.NavigationNode;
import com.gentorox.navigation.registry.NavigationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only JSON view of the navigation structure, plus a reload hook for development.
 *
 * <pre>
 * GET  /api/navigation/scopes            every scope with its tree
 * GET  /api/navigation/node?id=a/b       one node with its subtree
 * GET  /api/navigation/path?id=a/b/c     nodes from the top of the tree down to the given one
 * POST /api/navigation/reload            rebuild, only when navigation.dev-reload-enabled=true
 * </pre>
 */
@RestController
@RequestMapping(path = "/api/navigation", produces = MediaType.APPLICATION_JSON_VALUE)
public class NavigationController {
  private static final Logger LOG = LoggerFactory.getLogger(NavigationController.class);

  private final NavigationRegistry registry;
  private final NavigationProperties properties;

  public NavigationController(NavigationRegistry registry, NavigationProperties properties) {
    this.registry = registry;
    this.properties = properties;
  }

  @GetMapping("/scopes")
  public List<NodeView> scopes() {
    return registry.getScopes().stream().map(NodeView::of).toList();
  }

  @GetMapping("/node")
  public ResponseEntity<NodeView> node(@RequestParam("id") String id) {
    NavigationNode node = registry.nodeForId(id);
    return node == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(NodeView.of(node));
  }

  @GetMapping("/path")
  public List<NodeView> path(@RequestParam("id") String id) {
    return registry.nodesForPath(id).stream().map(NodeView::shallow).toList();
  }

  @PostMapping("/reload")
  public ResponseEntity<Map<String, Object>> reload() {
    if (!properties.isDevReloadEnabled()) {
      return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("status", "disabled"));
    }
    LOG.info("Navigation reload requested over HTTP");
    registry.reloadAll();
    return ResponseEntity.ok(Map.of(
        "status", "ok",
        "scopes", registry.getScopes().size(),
        "nodes", registry.snapshot().index().size()));
  }

  @ExceptionHandler(NavigationException.class)
  public ResponseEntity<ErrorDetails> handleNavigationException(NavigationException e) {
    HttpStatus status = e.getCode() == NavigationErrorCode.IO_ERROR || e.getCode() == NavigationErrorCode.UNKNOWN
        ? HttpStatus.INTERNAL_SERVER_ERROR
        : HttpStatus.BAD_REQUEST;
    LOG.warn("Navigation request failed: {}", e.toString());
    return ResponseEntity.status(status).body(ErrorDetails.of(e));
  }
}
