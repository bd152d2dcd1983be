package parallelizer.pcs;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import java.util.Objects;

/** Ticks an operation occupies its unit's pipeline, per operator kind. */
public class TimeConfiguration {

  public static final TimeConfiguration DEFAULT = new TimeConfiguration(1, 1, 2, 4);

  public final int add;
  public final int sub;
  public final int mul;
  public final int div;

  public TimeConfiguration(int add, int sub, int mul, int div) {
    checkArgument(add >= 0 && sub >= 0 && mul >= 0 && div >= 0, "Tick costs must not be negative");
    this.add = add;
    this.sub = sub;
    this.mul = mul;
    this.div = div;
  }

  public int latency(OperationType type) {
    switch (type) {
      case ADD:
        return add;
      case SUB:
        return sub;
      case MUL:
        return mul;
      case DIV:
        return div;
      default:
        return 0;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeConfiguration)) {
      return false;
    }
    TimeConfiguration that = (TimeConfiguration) o;
    return add == that.add && sub == that.sub && mul == that.mul && div == that.div;
  }

  @Override
  public int hashCode() {
    return Objects.hash(add, sub, mul, div);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("add", add)
        .add("sub", sub)
        .add("mul", mul)
        .add("div", div)
        .toString();
  }
}
