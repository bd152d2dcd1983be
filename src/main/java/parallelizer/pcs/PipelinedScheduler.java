package parallelizer.pcs;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parallelizer.ast.Expression;

/**
 * Greedy list scheduling of a {@link TaskGraph} onto pipelined functional units, simulated tick by
 * tick.
 *
 * <p>Every tick, the unscheduled tasks whose dependencies have all finished are sorted by rank
 * (lowest first), then by latency (highest first), then by id. Each is placed on the first unit of
 * its kind that accepts input this tick. A unit accepts new input one tick after it started its
 * previous operation, regardless of that operation's latency.
 *
 * <p>Load tasks need no unit and are finished at tick 0, logical operators included.
 */
public class PipelinedScheduler {
  private static final Logger LOGGER = LoggerFactory.getLogger("PipelinedScheduler");

  /** Simulating past this tick fails with {@link SchedulingError.TickLimitExceeded}. */
  public static final int MAX_TICKS = 10_000;

  private static final int UNFINISHED = -1;

  private final SystemConfiguration configuration;
  private final TaskGraph graph;
  private final Comparator<Task> priority;

  private final int[] finishTime;
  private final boolean[] scheduled;
  private int scheduledCount = 0;
  private final Map<OperationType, int[]> nextInputAt = new EnumMap<>(OperationType.class);
  private final List<ScheduledTask> active = new ArrayList<>();

  private final ImmutableList.Builder<ScheduledTask> schedule = ImmutableList.builder();
  private final ImmutableList.Builder<TickLog> tickLogs = ImmutableList.builder();

  private PipelinedScheduler(SystemConfiguration configuration, TaskGraph graph) {
    this.configuration = configuration;
    this.graph = graph;
    this.priority =
        Comparator.<Task>comparingInt(t -> t.rank)
            .thenComparing(
                Comparator.<Task>comparingInt(t -> configuration.latency(t.type)).reversed())
            .thenComparingInt(t -> t.id);
    this.finishTime = new int[graph.size()];
    Arrays.fill(finishTime, UNFINISHED);
    this.scheduled = new boolean[graph.size()];
    for (OperationType type : OperationType.values()) {
      if (type.needsUnit()) {
        nextInputAt.put(type, new int[configuration.units(type)]);
      }
    }
  }

  public static SimulationResult simulate(
      Expression expression, SystemConfiguration configuration) {
    return schedule(TaskGraphBuilder.build(expression), configuration);
  }

  /**
   * @throws SchedulingError.Unschedulable if an operator kind of the graph has no units
   * @throws SchedulingError.TickLimitExceeded if the schedule doesn't finish within {@link
   *     #MAX_TICKS}
   */
  public static SimulationResult schedule(TaskGraph graph, SystemConfiguration configuration) {
    for (OperationType type : graph.usedUnitTypes()) {
      if (configuration.units(type) == 0) {
        throw new SchedulingError.Unschedulable(type);
      }
    }
    return new PipelinedScheduler(configuration, graph).run();
  }

  private SimulationResult run() {
    finishLoads();
    int tick = 0;
    while (true) {
      final int now = tick;
      active.removeIf(s -> s.end <= now);
      if (scheduledCount == graph.size() && active.isEmpty()) {
        break;
      }

      List<Task> ready = readyTasks(tick);
      ImmutableList<String> readyLabels =
          seq(ready).map(t -> t.label).collect(ImmutableList.toImmutableList());
      for (Task task : ready) {
        tryPlace(task, tick);
      }
      tickLogs.add(new TickLog(tick, readyLabels, unitStates(tick)));

      tick++;
      if (tick > MAX_TICKS) {
        throw new SchedulingError.TickLimitExceeded(MAX_TICKS);
      }
    }
    SimulationResult result =
        new SimulationResult(configuration, graph, schedule.build(), tickLogs.build());
    LOGGER.debug("Scheduled " + graph.size() + " tasks: t1=" + result.t1 + ", tp=" + result.tp);
    return result;
  }

  private void finishLoads() {
    for (Task task : graph.tasks) {
      if (!task.type.needsUnit()) {
        finishTime[task.id] = 0;
        markScheduled(task.id);
      }
    }
  }

  private boolean dependenciesFinished(Task task, int tick) {
    for (int dependency : task.dependencies) {
      if (finishTime[dependency] == UNFINISHED || finishTime[dependency] > tick) {
        return false;
      }
    }
    return true;
  }

  private List<Task> readyTasks(int tick) {
    return seq(graph.tasks)
        .filter(t -> !scheduled[t.id] && t.type.needsUnit())
        .filter(t -> dependenciesFinished(t, tick))
        .sorted(priority)
        .toList();
  }

  private void tryPlace(Task task, int tick) {
    int[] units = nextInputAt.get(task.type);
    for (int unit = 0; unit < units.length; ++unit) {
      if (units[unit] <= tick) {
        ScheduledTask placed =
            new ScheduledTask(task, unit, tick, tick + configuration.latency(task.type));
        units[unit] = tick + 1;
        finishTime[task.id] = placed.end;
        markScheduled(task.id);
        schedule.add(placed);
        active.add(placed);
        return;
      }
    }
  }

  private void markScheduled(int id) {
    scheduled[id] = true;
    scheduledCount++;
  }

  private ImmutableSortedMap<String, String> unitStates(int tick) {
    ImmutableSortedMap.Builder<String, String> states = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<OperationType, int[]> entry : nextInputAt.entrySet()) {
      OperationType type = entry.getKey();
      for (int unit = 0; unit < entry.getValue().length; ++unit) {
        final int index = unit;
        List<ScheduledTask> inPipeline =
            seq(active)
                .filter(s -> s.type() == type && s.unitIndex == index)
                .filter(s -> s.start <= tick && tick < s.end)
                .sorted(Comparator.comparingInt(s -> s.start))
                .toList();
        String state =
            inPipeline.isEmpty()
                ? TickLog.IDLE
                : seq(inPipeline)
                    .map(s -> "[Stage " + (tick - s.start + 1) + ": " + shorten(s.task.label) + "]")
                    .toString(" ");
        states.put(ScheduledTask.unitName(type, unit), state);
      }
    }
    return states.build();
  }

  static String shorten(String label) {
    return label.length() > 15 ? label.substring(0, 12) + "..." : label;
  }
}
