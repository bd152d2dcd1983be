package parallelizer;

import java.util.ArrayList;

public enum EnvVar {
  PZ_WORKERS("Number of threads simulating equivalent forms. Defaults to the processor count."),
  PZ_TRACE_TICKS("Set to \"0\" to leave the tick-by-tick log out of simulation reports.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  public String value() {
    if (isAvailable()) {
      return getValue();
    }
    return "";
  }

  /** The value as a positive number, or {@code fallback} if unset or not a positive number. */
  public int intValue(int fallback) {
    try {
      int parsed = Integer.parseInt(value().trim());
      return parsed > 0 ? parsed : fallback;
    } catch (NumberFormatException e) {
      return fallback;
    }
  }

  public boolean isSetToZero() {
    return isAvailable() && isSetToValue("0");
  }

  public boolean isSetToValue(String varValue) {
    String value = getValue();
    return value != null && value.equals(varValue);
  }

  private String getValue() {
    return System.getenv(this.name());
  }

  public boolean isAvailable() {
    return System.getenv().containsKey(this.name());
  }

  public static String[] getAllEnvVarDescriptions() {
    ArrayList<String> descriptions = new ArrayList<String>();
    for (EnvVar envVariable : EnvVar.values()) {
      descriptions.add(envVariable.name() + ": " + envVariable.description);
    }
    return descriptions.toArray(new String[0]);
  }
}
