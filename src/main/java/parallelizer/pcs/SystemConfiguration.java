package parallelizer.pcs;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The machine a schedule is simulated on. Immutable; use {@link #builder()} to derive variations
 * of the default of one unit per kind and costs of 1, 1, 2 and 4 ticks for add, sub, mul and div.
 */
public class SystemConfiguration {

  public static final SystemConfiguration DEFAULT =
      new SystemConfiguration(TimeConfiguration.DEFAULT, ProcessorConfiguration.DEFAULT);

  public final TimeConfiguration time;
  public final ProcessorConfiguration processors;

  public SystemConfiguration(TimeConfiguration time, ProcessorConfiguration processors) {
    this.time = checkNotNull(time);
    this.processors = checkNotNull(processors);
  }

  public int latency(OperationType type) {
    return time.latency(type);
  }

  public int units(OperationType type) {
    return processors.count(type);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SystemConfiguration)) {
      return false;
    }
    SystemConfiguration that = (SystemConfiguration) o;
    return time.equals(that.time) && processors.equals(that.processors);
  }

  @Override
  public int hashCode() {
    return Objects.hash(time, processors);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("time", time)
        .add("processors", processors)
        .toString();
  }

  public static class Builder {
    private final Map<OperationType, Integer> latencies = new EnumMap<>(OperationType.class);
    private final Map<OperationType, Integer> units = new EnumMap<>(OperationType.class);

    private Builder() {
      for (OperationType type : OperationType.values()) {
        if (type.needsUnit()) {
          latencies.put(type, DEFAULT.latency(type));
          units.put(type, DEFAULT.units(type));
        }
      }
    }

    public Builder latency(OperationType type, int ticks) {
      checkArgument(type.needsUnit(), "%s has no configurable latency", type);
      checkArgument(ticks >= 0, "Tick costs must not be negative");
      latencies.put(type, ticks);
      return this;
    }

    public Builder units(OperationType type, int count) {
      checkArgument(type.needsUnit(), "%s runs without units", type);
      checkArgument(count >= 0, "Unit counts must not be negative");
      units.put(type, count);
      return this;
    }

    public SystemConfiguration build() {
      return new SystemConfiguration(
          new TimeConfiguration(
              latencies.get(OperationType.ADD),
              latencies.get(OperationType.SUB),
              latencies.get(OperationType.MUL),
              latencies.get(OperationType.DIV)),
          new ProcessorConfiguration(
              units.get(OperationType.ADD),
              units.get(OperationType.SUB),
              units.get(OperationType.MUL),
              units.get(OperationType.DIV)));
    }
  }
}
