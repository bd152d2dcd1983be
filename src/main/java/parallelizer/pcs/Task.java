package parallelizer.pcs;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/** One node of a {@link TaskGraph}: an operation waiting for the tasks it depends on. */
public class Task {

  public final int id;
  public final OperationType type;
  public final ImmutableList<Integer> dependencies;

  /** Longest distance to a leaf task. Leaves have rank 0. */
  public final int rank;

  public final String label;

  public Task(
      int id, OperationType type, ImmutableList<Integer> dependencies, int rank, String label) {
    this.id = id;
    this.type = type;
    this.dependencies = dependencies;
    this.rank = rank;
    this.label = label;
  }

  public boolean isLeaf() {
    return dependencies.isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("type", type)
        .add("dependencies", dependencies)
        .add("rank", rank)
        .add("label", label)
        .toString();
  }
}
