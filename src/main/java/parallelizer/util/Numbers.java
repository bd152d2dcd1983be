package parallelizer.util;

import java.util.Locale;

/** Fixed-precision rendering of number literals. */
public class Numbers {

  private Numbers() {}

  public static String format(double value, int decimals) {
    return String.format(Locale.ROOT, "%." + decimals + "f", value);
  }
}
