package com.gentorox.navigation.model;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Objects;

/**
 * A navigation entry below a scope, optionally linked to a handler action or another target.
 *
 * <p>The id is the chain of names from the first item below the scope down to this item, joined by
 * {@link #NODE_PATH_SEPARATOR}; the scope name is not part of it.
 */
public class NavigationItem extends NavigationNode {
  private final String titleDefault;
  private final String titleMessageCode;
  private final LinkTarget linkTarget;
  private final NavigationCondition visible;
  private final NavigationCondition enabled;

  private NavigationItem(Builder b) {
    super(b.name);
    this.titleDefault = b.titleDefault;
    this.titleMessageCode = b.titleMessageCode;
    this.linkTarget = b.linkTarget == null ? LinkTarget.NONE : b.linkTarget;
    this.visible = b.visible == null ? NavigationCondition.ALWAYS : b.visible;
    this.enabled = b.enabled == null ? NavigationCondition.ALWAYS : b.enabled;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** The id a node named {@code name} gets when placed under {@code parent}. */
  public static String idFor(NavigationNode parent, String name) {
    if (parent == null || parent instanceof NavigationScope) {
      return name;
    }
    return parent.getId() + NODE_PATH_SEPARATOR + name;
  }

  @Override
  public String getId() {
    return idFor(getParent(), getName());
  }

  /** Literal title used when no message code is set or it cannot be resolved. */
  public String getTitleDefault() {
    return titleDefault;
  }

  /** Localization code for the title; may be null. */
  public String getTitleMessageCode() {
    return titleMessageCode;
  }

  public LinkTarget getLinkTarget() {
    return linkTarget;
  }

  public boolean isVisible(HttpServletRequest request) {
    return visible.test(request);
  }

  public boolean isEnabled(HttpServletRequest request) {
    return enabled.test(request);
  }

  public static final class Builder {
    private final String name;
    private String titleDefault;
    private String titleMessageCode;
    private LinkTarget linkTarget;
    private NavigationCondition visible;
    private NavigationCondition enabled;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder titleDefault(String titleDefault) {
      this.titleDefault = titleDefault;
      return this;
    }

    public Builder titleMessageCode(String titleMessageCode) {
      this.titleMessageCode = titleMessageCode;
      return this;
    }

    public Builder linkTarget(LinkTarget linkTarget) {
      this.linkTarget = linkTarget;
      return this;
    }

    public Builder visible(NavigationCondition visible) {
      this.visible = visible;
      return this;
    }

    public Builder enabled(NavigationCondition enabled) {
      this.enabled = enabled;
      return this;
    }

    public NavigationItem build() {
      return new NavigationItem(this);
    }
  }
}
