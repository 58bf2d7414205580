package io.intellixity.sqlbuilder;

import io.intellixity.sqlbuilder.flavor.Flavor;

/**
 * Anything that renders to SQL + ordered args.
 *
 * <p>A builder passed as a bound value to another builder is compiled in place: its SQL is inlined and its
 * arguments are merged at that position, continuing the outer placeholder numbering.</p>
 */
public interface Builder {
  /** Render with this builder's own flavor. */
  SqlStatement build();

  /**
   * Render with {@code flavor}. {@code initialArgs} are placed before this builder's own arguments and count
   * towards placeholder ordinals; the returned args include them.
   */
  SqlStatement buildWithFlavor(Flavor flavor, Object... initialArgs);

  Flavor flavor();
}
