package parallelizer.pcs;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.Set;

/**
 * The tasks of one expression, indexed by id. Ids are dense and assigned in pre-order, so the root
 * task has id 0 and every task's id is smaller than the ids of its dependencies.
 */
public class TaskGraph {

  public final ImmutableList<Task> tasks;

  TaskGraph(ImmutableList<Task> tasks) {
    this.tasks = tasks;
  }

  public Task get(int id) {
    return tasks.get(id);
  }

  public Task root() {
    return tasks.get(0);
  }

  public int size() {
    return tasks.size();
  }

  /** The operator kinds that need a functional unit somewhere in this graph. */
  public Set<OperationType> usedUnitTypes() {
    Set<OperationType> used = EnumSet.noneOf(OperationType.class);
    seq(tasks).map(t -> t.type).filter(OperationType::needsUnit).forEach(used::add);
    return Sets.immutableEnumSet(used);
  }

  @Override
  public String toString() {
    return tasks.toString();
  }
}
