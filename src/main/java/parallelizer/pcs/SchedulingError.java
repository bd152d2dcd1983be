package parallelizer.pcs;

import parallelizer.ParallelizerError;

/** Raised when a task graph can't be scheduled to completion. */
public abstract class SchedulingError extends ParallelizerError {

  SchedulingError(String message) {
    super(message);
  }

  /** The simulation ran past the tick ceiling without finishing every task. */
  public static class TickLimitExceeded extends SchedulingError {

    public final int limit;

    public TickLimitExceeded(int limit) {
      super("Schedule did not complete within " + limit + " ticks");
      this.limit = limit;
    }
  }

  /** An operator kind present in the graph has no functional unit to run on. */
  public static class Unschedulable extends SchedulingError {

    public final OperationType type;

    public Unschedulable(OperationType type) {
      super("No " + type + " unit configured, but the expression needs one");
      this.type = type;
    }
  }
}
