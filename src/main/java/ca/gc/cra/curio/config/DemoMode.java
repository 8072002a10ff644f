package ca.gc.cra.curio.config;

import java.util.Locale;

/**
 * Demo selected on the command line; names the YAML section read for it.
 *
 * @since 0.1.0
 */
public enum DemoMode {
  /** Library catalog demo. */
  LIBRARY,
  /** Zoo animal registry demo. */
  ZOO;

  /**
   * Returns the lowercase section name used in YAML files and CLI dispatch.
   *
   * @return section name such as {@code library}
   */
  public String sectionName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
