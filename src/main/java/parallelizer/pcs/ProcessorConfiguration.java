package parallelizer.pcs;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import java.util.Objects;

/** Number of pipelined functional units per operator kind. */
public class ProcessorConfiguration {

  public static final ProcessorConfiguration DEFAULT = new ProcessorConfiguration(1, 1, 1, 1);

  public final int add;
  public final int sub;
  public final int mul;
  public final int div;

  public ProcessorConfiguration(int add, int sub, int mul, int div) {
    checkArgument(add >= 0 && sub >= 0 && mul >= 0 && div >= 0, "Unit counts must not be negative");
    this.add = add;
    this.sub = sub;
    this.mul = mul;
    this.div = div;
  }

  public int count(OperationType type) {
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

  public int total() {
    return add + sub + mul + div;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProcessorConfiguration)) {
      return false;
    }
    ProcessorConfiguration that = (ProcessorConfiguration) o;
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
