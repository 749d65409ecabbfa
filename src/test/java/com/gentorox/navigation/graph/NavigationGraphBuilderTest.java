package com.gentorox.navigation.graph;

import com.gentorox.navigation.dsl.DslCommand;
import com.gentorox.navigation.dsl.DslCommand.BlockCommand;
import com.gentorox.navigation.dsl.DslCommand.NamedArgsBlockCommand;
import com.gentorox.navigation.dsl.DslCommand.NamedArgsCallCommand;
import com.gentorox.navigation.dsl.DslCommand.PlainCallCommand;
import com.gentorox.navigation.dsl.DslCommand.SetValueCommand;
import com.gentorox.navigation.exception.DeclarationException;
import com.gentorox.navigation.exception.DuplicateIdException;
import com.gentorox.navigation.exception.NavigationErrorCode;
import com.gentorox.navigation.model.LinkTarget;
import com.gentorox.navigation.model.NavigationCondition;
import com.gentorox.navigation.model.NavigationItem;
import com.gentorox.navigation.model.NavigationScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NavigationGraphBuilderTest {

  private NavigationGraph graph;
  private NavigationGraphBuilder builder;

  @BeforeEach
  void setUp() {
    graph = new NavigationGraph();
    NavigationCondition admin = request -> request.isUserInRole("ADMIN");
    builder = new NavigationGraphBuilder(graph, new NavigationConditions(Map.of("isAdmin", admin)));
  }

  private static BlockCommand scope(String name, DslCommand... children) {
    return new BlockCommand(name, List.of(children));
  }

  private static NamedArgsCallCommand leaf(String name, Map<String, Object> args) {
    return new NamedArgsCallCommand(name, args);
  }

  @Test
  void buildsScopesAndItemsWithPathIds() {
    builder.build(List.of(scope("main",
        new NamedArgsBlockCommand("orders", Map.of("controller", "orders", "action", "list"), List.of(
            new NamedArgsBlockCommand("history", Map.of("action", "history"), List.of(
                leaf("recent", Map.of("action", "recent"))))))
    )), null, null);

    NavigationScope main = graph.scope("main");
    assertThat(main.getId()).isEqualTo("main");
    NavigationItem orders = main.getChildren().get(0);
    NavigationItem history = orders.getChildren().get(0);
    NavigationItem recent = history.getChildren().get(0);

    assertThat(orders.getId()).isEqualTo("orders");
    assertThat(history.getId()).isEqualTo("orders/history");
    assertThat(recent.getId()).isEqualTo("orders/history/recent");
    assertThat(recent.getScope()).isSameAs(main);
    assertThat(graph.containsId("orders/history/recent")).isTrue();
    assertThat(graph.size()).isEqualTo(4);
  }

  @Test
  @DisplayName("action without controller inherits the parent item's controller, transitively")
  void inheritsControllerFromParentItem() {
    builder.build(List.of(scope("main",
        new NamedArgsBlockCommand("orders", Map.of("controller", "orders"), List.of(
            new NamedArgsBlockCommand("history", Map.of("action", "history"), List.of(
                leaf("recent", Map.of("action", "recent"))))))
    )), null, null);

    NavigationItem history = graph.scope("main").getChildren().get(0).getChildren().get(0);
    assertThat(history.getLinkTarget()).isEqualTo(LinkTarget.forAction("orders", "history"));
    assertThat(history.getChildren().get(0).getLinkTarget()).isEqualTo(LinkTarget.forAction("orders", "recent"));
  }

  @Test
  void topLevelItemsDoNotInheritFromTheScope() {
    builder.build(List.of(scope("main", leaf("stray", Map.of("action", "show")))), null, null);

    LinkTarget link = graph.scope("main").getChildren().get(0).getLinkTarget();
    assertThat(link.hasController()).isFalse();
    assertThat(link.action()).isEqualTo("show");
  }

  @Test
  void titlesComeFromTitleTextOrTheNaturalName() {
    builder.build(List.of(scope("main",
        leaf("orderHistory", Map.of("controller", "orders", "title", "nav.orders")),
        leaf("reports", Map.of("titleText", "All Reports", "view", "reports"))
    )), null, null);

    List<NavigationItem> items = graph.scope("main").getChildren();
    assertThat(items.get(0).getTitleDefault()).isEqualTo("Order History");
    assertThat(items.get(0).getTitleMessageCode()).isEqualTo("nav.orders");
    assertThat(items.get(1).getTitleDefault()).isEqualTo("All Reports");
    assertThat(items.get(1).getTitleMessageCode()).isNull();
    assertThat(items.get(1).getLinkTarget().view()).isEqualTo("reports");
  }

  @Test
  void reopeningAScopeAddsToIt() {
    builder.build(List.of(scope("main", leaf("home", Map.of("controller", "home")))), null, null);
    builder.build(List.of(scope("main", leaf("help", Map.of("controller", "help")))), null, "help");

    assertThat(graph.scopes()).hasSize(1);
    assertThat(graph.scope("main").getChildren()).extracting(NavigationItem::getName).containsExactly("home", "help");
  }

  @Test
  void duplicateIdIsRejected() {
    builder.build(List.of(scope("main", leaf("home", Map.of("controller", "home")))), null, null);

    assertThatThrownBy(() -> builder.build(List.of(scope("footer", leaf("home", Map.of("view", "home")))), null, null))
        .isInstanceOf(DuplicateIdException.class)
        .satisfies(e -> assertThat(((DuplicateIdException) e).getId()).isEqualTo("home"));
  }

  @Test
  void scopeAndItemShareTheIdNamespace() {
    builder.build(List.of(scope("main", leaf("footer", Map.of("view", "f")))), null, null);

    assertThatThrownBy(() -> builder.build(List.of(scope("footer")), null, null))
        .isInstanceOf(DuplicateIdException.class);
  }

  @Test
  void scopeWithArgumentsIsRejected() {
    List<DslCommand> commands = List.of(new NamedArgsBlockCommand("main", Map.of("controller", "x"), List.of()));

    assertThatThrownBy(() -> builder.build(commands, null, null))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("root scope cannot take arguments");
  }

  @Test
  void namedArgsCallAtTopLevelIsRejected() {
    assertThatThrownBy(() -> builder.build(List.of(leaf("home", Map.of("controller", "home"))), null, null))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("only supported inside a scope");
  }

  @Test
  void overridesBlockIsNotImplementedAnywhere() {
    assertThatThrownBy(() -> builder.build(List.of(scope("overrides")), null, "app"))
        .isInstanceOf(DeclarationException.class)
        .hasMessage("The 'overrides' block is not yet implemented")
        .extracting(e -> ((DeclarationException) e).getCode())
        .isEqualTo(NavigationErrorCode.UNSUPPORTED_FEATURE);

    assertThatThrownBy(() -> builder.build(List.of(scope("main", scope("overrides"))), null, null))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("not valid except at the scope level");
  }

  @Test
  void propertySettingIsRejectedAtAnyDepth() {
    assertThatThrownBy(() -> builder.build(List.of(new SetValueCommand("title", "x")), null, null))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("[title]");

    assertThatThrownBy(() -> builder.build(List.of(scope("main", new SetValueCommand("color", "red"))), null, null))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("[color]");
  }

  @Test
  void plainCallsAreRejected() {
    assertThatThrownBy(() -> builder.build(List.of(new PlainCallCommand("register", List.of("a"))), null, null))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("[register]");
  }

  @Test
  void conditionsResolveFromBooleansAndNames() {
    builder.build(List.of(scope("main",
        leaf("hidden", Map.of("view", "h", "visible", false)),
        leaf("admin", Map.of("view", "a", "visible", "isAdmin", "enabled", "true"))
    )), null, null);

    MockHttpServletRequest user = new MockHttpServletRequest();
    MockHttpServletRequest admin = new MockHttpServletRequest();
    admin.addUserRole("ADMIN");

    List<NavigationItem> items = graph.scope("main").getChildren();
    assertThat(items.get(0).isVisible(user)).isFalse();
    assertThat(items.get(0).isEnabled(user)).isTrue();
    assertThat(items.get(1).isVisible(user)).isFalse();
    assertThat(items.get(1).isVisible(admin)).isTrue();
    assertThat(items.get(1).isEnabled(user)).isTrue();
  }

  @Test
  void unknownConditionNameIsRejected() {
    assertThatThrownBy(() -> builder.build(List.of(scope("main", leaf("x", Map.of("visible", "isRoot")))), null, null))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("unknown visible condition [isRoot]");
  }
}
