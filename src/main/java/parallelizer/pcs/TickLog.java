package parallelizer.pcs;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/** What the machine looked like during one tick of a simulation. */
public class TickLog {

  public static final String IDLE = "Idle";

  public final int tick;

  /** Labels of the tasks that were ready at the start of the tick, in priority order. */
  public final ImmutableList<String> readyQueue;

  /**
   * Occupancy per unit, keyed by unit name. A busy unit lists its pipeline stages like {@code
   * [Stage 2: (a * b)] [Stage 1: (c * d)]}, oldest operation first.
   */
  public final ImmutableSortedMap<String, String> unitStates;

  public TickLog(
      int tick, ImmutableList<String> readyQueue, ImmutableSortedMap<String, String> unitStates) {
    this.tick = tick;
    this.readyQueue = readyQueue;
    this.unitStates = unitStates;
  }

  /** True if nothing was ready and every unit was idle. */
  public boolean isIdle() {
    return readyQueue.isEmpty() && unitStates.values().stream().allMatch(IDLE::equals);
  }
}
