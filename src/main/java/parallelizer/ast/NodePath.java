package parallelizer.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * Addresses a node inside an {@link Expression} by the operand indices leading to it from the
 * root. For binary operations 0 is the left and 1 the right operand.
 *
 * <p>Paths are persistent, so extending one during a recursive walk is cheap and never disturbs
 * the parent's path.
 */
public class NodePath {

  public static final NodePath ROOT = new NodePath(TreePVector.empty());

  private final PVector<Integer> steps;

  private NodePath(PVector<Integer> steps) {
    this.steps = steps;
  }

  public NodePath child(int operand) {
    checkArgument(operand >= 0, "Operand index must not be negative");
    return new NodePath(steps.plus(operand));
  }

  public int depth() {
    return steps.size();
  }

  public Optional<Expression> lookup(Expression root) {
    Expression current = root;
    for (int step : steps) {
      ImmutableList<Expression> children = current.children();
      if (step >= children.size()) {
        return Optional.empty();
      }
      current = children.get(step);
    }
    return Optional.of(current);
  }

  /**
   * Rebuilds the spine from {@code root} down to the addressed node, replacing that node by the
   * result of {@code rewrite}. Subtrees off the spine are reused as they are.
   *
   * @throws IllegalArgumentException if this path doesn't address a node of {@code root}
   */
  public Expression replace(Expression root, UnaryOperator<Expression> rewrite) {
    return replace(root, 0, rewrite);
  }

  private Expression replace(Expression current, int depth, UnaryOperator<Expression> rewrite) {
    if (depth == steps.size()) {
      return rewrite.apply(current);
    }
    int step = steps.get(depth);
    ImmutableList<Expression> children = current.children();
    checkArgument(step < children.size(), "Path %s leaves the tree at depth %s", this, depth);
    List<Expression> rebuilt = new ArrayList<>(children);
    rebuilt.set(step, replace(children.get(step), depth + 1, rewrite));
    return current.withChildren(rebuilt);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof NodePath && steps.equals(((NodePath) o).steps));
  }

  @Override
  public int hashCode() {
    return steps.hashCode();
  }

  @Override
  public String toString() {
    return "/" + Joiner.on('/').join(steps);
  }
}
