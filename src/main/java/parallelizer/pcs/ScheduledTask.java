package parallelizer.pcs;

import com.google.common.base.MoreObjects;

/** A task placed on a functional unit: it occupies the unit's pipeline from start to end. */
public class ScheduledTask {

  public final Task task;
  public final int unitIndex;
  public final int start;
  public final int end;

  public ScheduledTask(Task task, int unitIndex, int start, int end) {
    this.task = task;
    this.unitIndex = unitIndex;
    this.start = start;
    this.end = end;
  }

  public OperationType type() {
    return task.type;
  }

  public int duration() {
    return end - start;
  }

  /** E.g. {@code MUL #1} for the first multiplier. */
  public String unitName() {
    return unitName(task.type, unitIndex);
  }

  static String unitName(OperationType type, int unitIndex) {
    return type + " #" + (unitIndex + 1);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("task", task.label)
        .add("unit", unitName())
        .add("start", start)
        .add("end", end)
        .toString();
  }
}
