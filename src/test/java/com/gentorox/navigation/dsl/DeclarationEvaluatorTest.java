package com.gentorox.navigation.dsl;

import com.gentorox.navigation.dsl.DslCommand.BlockCommand;
import com.gentorox.navigation.dsl.DslCommand.NamedArgsBlockCommand;
import com.gentorox.navigation.dsl.DslCommand.NamedArgsCallCommand;
import com.gentorox.navigation.dsl.DslCommand.PlainCallCommand;
import com.gentorox.navigation.dsl.DslCommand.SetValueCommand;
import com.gentorox.navigation.exception.DeclarationException;
import com.gentorox.navigation.exception.DuplicateIdException;
import com.gentorox.navigation.graph.NavigationConditions;
import com.gentorox.navigation.graph.NavigationGraph;
import com.gentorox.navigation.graph.NavigationGraphBuilder;
import com.gentorox.navigation.model.NavigationItem;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeclarationEvaluatorTest {

  private final DeclarationEvaluator evaluator = new DeclarationEvaluator();

  private List<DslCommand> eval(String yaml) throws Exception {
    return evaluator.evaluate(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yaml");
  }

  @Test
  void mapsValueShapesToCommandVariants() throws Exception {
    List<DslCommand> commands = eval("""
        main:
          home:
            controller: home
            action: index
          orders:
            controller: orders
            history:
              action: history
          reports: {}
        """);

    assertThat(commands).hasSize(1);
    BlockCommand main = (BlockCommand) commands.get(0);
    assertThat(main.name()).isEqualTo("main");
    assertThat(main.children()).extracting(DslCommand::name).containsExactly("home", "orders", "reports");

    NamedArgsCallCommand home = (NamedArgsCallCommand) main.children().get(0);
    assertThat(home.arguments()).containsEntry("controller", "home").containsEntry("action", "index");

    NamedArgsBlockCommand orders = (NamedArgsBlockCommand) main.children().get(1);
    assertThat(orders.arguments()).containsOnlyKeys("controller");
    assertThat(orders.children()).singleElement().isInstanceOf(NamedArgsCallCommand.class);

    BlockCommand reports = (BlockCommand) main.children().get(2);
    assertThat(reports.children()).isEmpty();
  }

  @Test
  void scalarsBecomeSetValueAndListsOrEmptyValuesBecomePlainCalls() throws Exception {
    List<DslCommand> commands = eval("""
        title: Main menu
        register: [a, b]
        ping:
        """);

    assertThat(commands.get(0)).isEqualTo(new SetValueCommand("title", "Main menu"));
    assertThat(commands.get(1)).isEqualTo(new PlainCallCommand("register", List.of("a", "b")));
    assertThat(commands.get(2)).isEqualTo(new PlainCallCommand("ping", List.of()));
  }

  @Test
  void keepsDeclarationOrderOfArgumentsAndChildren() throws Exception {
    List<DslCommand> commands = eval("""
        main:
          zeta: {view: z}
          alpha: {view: a}
          mid: {view: m}
        """);

    BlockCommand main = (BlockCommand) commands.get(0);
    assertThat(main.children()).extracting(DslCommand::name).containsExactly("zeta", "alpha", "mid");
  }

  @Test
  void repeatedSiblingIsKeptAndRejectedAsDuplicateId() throws Exception {
    List<DslCommand> commands = eval("""
        main:
          home:
            controller: a
          home:
            controller: b
        """);

    BlockCommand main = (BlockCommand) commands.get(0);
    assertThat(main.children()).extracting(DslCommand::name).containsExactly("home", "home");

    NavigationGraphBuilder builder = new NavigationGraphBuilder(new NavigationGraph(), NavigationConditions.none());
    assertThatThrownBy(() -> builder.build(commands, null, null))
        .isInstanceOf(DuplicateIdException.class)
        .hasMessageContaining("[home]");
  }

  @Test
  void scopeRepeatedInOneScriptIsReopened() throws Exception {
    List<DslCommand> commands = eval("""
        main:
          home: {controller: home}
        footer:
          about: {view: about}
        main:
          help: {controller: help}
        """);

    assertThat(commands).extracting(DslCommand::name).containsExactly("main", "footer", "main");

    NavigationGraph graph = new NavigationGraph();
    new NavigationGraphBuilder(graph, NavigationConditions.none()).build(commands, null, null);
    assertThat(graph.scope("main").getChildren()).extracting(NavigationItem::getName).containsExactly("home", "help");
    assertThat(graph.containsId("home")).isTrue();
  }

  @Test
  void repeatedArgumentIsRejected() {
    assertThatThrownBy(() -> eval("""
        main:
          home:
            controller: a
            controller: b
        """))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("argument [controller] twice");
  }

  @Test
  void scalarArgumentsKeepTheirYamlTypes() throws Exception {
    List<DslCommand> commands = eval("""
        main:
          logout: {uri: /logout, visible: false, order: 3}
        """);

    NamedArgsCallCommand logout = (NamedArgsCallCommand) ((BlockCommand) commands.get(0)).children().get(0);
    assertThat(logout.arguments()).containsEntry("visible", false).containsEntry("order", 3);
  }

  @Test
  void emptyDocumentYieldsNoCommands() throws Exception {
    assertThat(eval("")).isEmpty();
  }

  @Test
  void rejectsDocumentsThatAreNotMappings() {
    assertThatThrownBy(() -> eval("- main\n- footer\n"))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("test.yaml")
        .hasMessageContaining("must be a mapping");
  }

  @Test
  void rejectsMalformedYaml() {
    assertThatThrownBy(() -> eval("main:\n  home: {controller: home\n"))
        .isInstanceOf(DeclarationException.class)
        .hasMessageContaining("not valid YAML");
  }
}
