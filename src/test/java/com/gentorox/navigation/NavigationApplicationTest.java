package com.gentorox.navigation;

import com.gentorox.navigation.model.NavigationItem;
import com.gentorox.navigation.registry.NavigationRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "navigation.internal-package=com.gentorox.navigation.web")
@AutoConfigureMockMvc
class NavigationApplicationTest {

  @Autowired
  private NavigationRegistry registry;

  @Autowired
  private MockMvc mvc;

  @Test
  void loadsDeclarationsAndDiscoveredHandlersOnStartup() {
    assertThat(registry.scopeByName("main").getChildren()).extracting(NavigationItem::getName)
        .containsExactly("home", "orders", "help");
    assertEquals("app", registry.getScopeForId("widgets"));
    assertEquals("admin", registry.getScopeForId("adminReports"));
    assertEquals("dev", registry.getScopeForId("navigation"));
    assertThat(registry.nodeForId("navigation").getChildren()).extracting(NavigationItem::getName)
        .containsExactly("node", "path", "reload", "scopes");
    assertNull(registry.nodeForId("orders/export"));
    assertNull(registry.nodeForId("basicError"));
  }

  @Test
  void requestsMarkTheMatchingItemActive() throws Exception {
    mvc.perform(get("/widgets/show"))
        .andExpect(status().isOk())
        .andExpect(request().attribute(NavigationRegistry.ATTR_ACTIVE_PATH, "widgets/show"))
        .andExpect(request().attribute(NavigationRegistry.ATTR_ACTIVE_PATH_AUTO, true));

    mvc.perform(get("/orders/history"))
        .andExpect(request().attribute(NavigationRegistry.ATTR_ACTIVE_PATH, "orders/history"));

    mvc.perform(get("/admin/reports"))
        .andExpect(request().attribute(NavigationRegistry.ATTR_ACTIVE_PATH, "adminReports"));
  }

  @Test
  void requestsWithoutAMatchingItemLeaveNoActivePath() throws Exception {
    mvc.perform(get("/orders/export"))
        .andExpect(status().isOk())
        .andExpect(request().attribute(NavigationRegistry.ATTR_ACTIVE_PATH, (Object) null));
  }

  @Test
  void navigationApiServesTheLoadedStructure() throws Exception {
    mvc.perform(get("/api/navigation/node").param("id", "orders/history/recent"))
        .andExpect(status().isOk());
  }
}
