package parallelizer.equivalence;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.BinOp;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expressions;
import parallelizer.ast.NodePath;

/**
 * Single-step bracket expansion:
 *
 * <ul>
 *   <li>(A ± B) * C = A * C ± B * C
 *   <li>C * (A ± B) = C * A ± C * B
 *   <li>(A ± B) / C = A / C ± B / C
 * </ul>
 *
 * {@code C / (A ± B)} is never expanded.
 */
public class DistributiveLaw {

  private DistributiveLaw() {}

  /** Which operand of the matched node holds the sum or difference. */
  enum Side {
    LEFT,
    RIGHT
  }

  /** A node that can be expanded, addressed from the root of the tree it was found in. */
  static class Site {
    final NodePath path;
    final Side side;

    Site(NodePath path, Side side) {
      this.path = path;
      this.side = side;
    }
  }

  /**
   * Returns one tree per expandable site, each differing from {@code root} in exactly that site.
   * Sites are visited in pre-order; a product with sums on both sides yields the expansion of its
   * left operand before the one of its right operand.
   */
  public static ImmutableList<Expression> singleStepExpansions(Expression root) {
    ImmutableList.Builder<Site> sites = ImmutableList.builder();
    findSites(root, NodePath.ROOT, sites);
    ImmutableList.Builder<Expression> expansions = ImmutableList.builder();
    for (Site site : sites.build()) {
      expansions.add(site.path.replace(root, node -> expand((BinaryOperation) node, site.side)));
    }
    return expansions.build();
  }

  static void findSites(Expression node, NodePath path, ImmutableList.Builder<Site> sites) {
    if (node instanceof BinaryOperation) {
      BinaryOperation binary = (BinaryOperation) node;
      boolean scalable = binary.is(BinOp.MULTIPLY) || binary.is(BinOp.DIVIDE);
      if (scalable && Expressions.asAdditive(binary.left).isPresent()) {
        sites.add(new Site(path, Side.LEFT));
      }
      if (binary.is(BinOp.MULTIPLY) && Expressions.asAdditive(binary.right).isPresent()) {
        sites.add(new Site(path, Side.RIGHT));
      }
    }
    ImmutableList<Expression> children = node.children();
    for (int i = 0; i < children.size(); ++i) {
      findSites(children.get(i), path.child(i), sites);
    }
  }

  static Expression expand(BinaryOperation node, Side side) {
    if (side == Side.LEFT) {
      Optional<BinaryOperation> sum = Expressions.asAdditive(node.left);
      if (sum.isPresent()) {
        return Expressions.binary(
            sum.get().op,
            Expressions.binary(node.op, sum.get().left, node.right),
            Expressions.binary(node.op, sum.get().right, node.right));
      }
    } else {
      Optional<BinaryOperation> sum = Expressions.asAdditive(node.right);
      if (sum.isPresent()) {
        return Expressions.binary(
            sum.get().op,
            Expressions.binary(node.op, node.left, sum.get().left),
            Expressions.binary(node.op, node.left, sum.get().right));
      }
    }
    return node;
  }
}
