package com.gentorox.navigation.model;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NavigationNodeTest {

  @Test
  void idsAreNamePathsBelowTheScope() {
    NavigationScope main = new NavigationScope("main");
    NavigationItem orders = NavigationItem.builder("orders").build();
    NavigationItem history = NavigationItem.builder("history").build();
    main.add(orders);
    orders.add(history);

    assertEquals("main", main.getId());
    assertEquals("orders", orders.getId());
    assertEquals("orders/history", history.getId());
    assertEquals("orders/history/recent", NavigationItem.idFor(history, "recent"));
    assertSame(main, history.getScope());
    assertSame(main, main.getScope());
  }

  @Test
  void detachedItemHasNoScope() {
    assertNull(NavigationItem.builder("lonely").build().getScope());
  }

  @Test
  void childrenCannotBeReparented() {
    NavigationItem child = NavigationItem.builder("child").build();
    new NavigationScope("a").add(child);

    assertThatThrownBy(() -> new NavigationScope("b").add(child)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void freezeIsRecursive() {
    NavigationScope main = new NavigationScope("main");
    NavigationItem orders = NavigationItem.builder("orders").build();
    main.add(orders);

    main.freeze();

    assertTrue(orders.isFrozen());
    assertThatThrownBy(() -> orders.add(NavigationItem.builder("late").build()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("frozen");
    assertThatThrownBy(() -> main.getChildren().add(NavigationItem.builder("x").build()))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void itemDefaultsToAlwaysVisibleAndEnabledWithoutLink() {
    NavigationItem item = NavigationItem.builder("plain").build();
    MockHttpServletRequest request = new MockHttpServletRequest();

    assertTrue(item.isVisible(request));
    assertTrue(item.isEnabled(request));
    assertSame(LinkTarget.NONE, item.getLinkTarget());
  }

  @Test
  void linkTargetReadsOnlyLinkArguments() {
    LinkTarget link = LinkTarget.fromArguments(Map.of("controller", "orders", "action", "list", "titleText", "x"));

    assertEquals("orders:list", link.handlerActionKey());
    assertThat(link.toMap()).containsExactly(Map.entry("controller", "orders"), Map.entry("action", "list"));
    assertEquals("orders:", LinkTarget.key("orders", null));
  }
}
