package parallelizer.pcs;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;

/** The schedule of one expression on one machine and its metrics. */
public class SimulationResult {

  public final SystemConfiguration configuration;
  public final TaskGraph graph;

  /** Every task placed on a unit, in placement order. Load tasks never show up here. */
  public final ImmutableList<ScheduledTask> schedule;

  public final ImmutableList<TickLog> tickLogs;

  /** Total work: the sum of all placed tasks' durations. */
  public final int t1;

  /** Makespan: the tick the last task ends. */
  public final int tp;

  public final double speedup;
  public final double efficiency;

  SimulationResult(
      SystemConfiguration configuration,
      TaskGraph graph,
      ImmutableList<ScheduledTask> schedule,
      ImmutableList<TickLog> tickLogs) {
    this.configuration = configuration;
    this.graph = graph;
    this.schedule = schedule;
    this.tickLogs = tickLogs;
    this.t1 =
        seq(schedule).filter(s -> s.type().needsUnit()).mapToInt(ScheduledTask::duration).sum();
    this.tp = seq(schedule).mapToInt(s -> s.end).max().orElse(0);
    this.speedup = tp > 0 ? (double) t1 / tp : 0.0;
    int units = configuration.processors.total();
    this.efficiency = units > 0 ? speedup / units : 0.0;
  }

  /** The schedule ordered by start tick, placement order breaking ties. */
  public ImmutableList<ScheduledTask> byStart() {
    return seq(schedule)
        .sorted(Comparator.comparingInt(s -> s.start))
        .collect(ImmutableList.toImmutableList());
  }
}
