package io.github.themoah.edgepulse.model;

import java.util.Locale;

/**
 * Traffic category an anomaly belongs to.
 *
 * <p>{@link #RED}, {@link #YELLOW} and {@link #GREEN} are the three status classes
 * the multi-anomaly detector tracks independently. {@link #ERROR} and {@link #SUCCESS}
 * are the coarser categories of the legacy single-result detector, and
 * {@link #SELECTION} tags operator-selected windows that have no category.
 */
public enum TrafficCategory {
  RED("red"),
  YELLOW("yellow"),
  GREEN("green"),
  ERROR("error"),
  SUCCESS("success"),
  SELECTION("blue");

  private final String value;

  TrafficCategory(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Resolves a category from its wire name.
   *
   * @param value wire name such as "red"
   * @return the category
   * @throws IllegalArgumentException if the name is unknown
   */
  public static TrafficCategory fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("category cannot be null");
    }
    String normalized = value.toLowerCase(Locale.ROOT);
    for (TrafficCategory category : values()) {
      if (category.value.equals(normalized)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown traffic category: " + value);
  }
}
