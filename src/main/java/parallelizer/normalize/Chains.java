package parallelizer.normalize;

import static org.jooq.lambda.tuple.Tuple.tuple;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.jooq.lambda.tuple.Tuple2;
import parallelizer.ast.AstError;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.BinOp;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expressions;

/** Flattening and reassembly of operator chains like {@code a + b + c}. */
public class Chains {

  private Chains() {}

  /**
   * Unfolds the maximal chain of {@code op} rooted at {@code node} into its operands, left to
   * right. {@code (a + (b + c)) + d} becomes {@code [a, b, c, d]}.
   */
  public static List<Expression> collectOperands(Expression node, BinOp op) {
    List<Expression> operands = new ArrayList<>();
    collectOperands(node, op, operands);
    return operands;
  }

  private static void collectOperands(Expression node, BinOp op, List<Expression> operands) {
    Optional<BinaryOperation> binary = Expressions.asBinary(node, op);
    if (binary.isPresent()) {
      collectOperands(binary.get().left, op, operands);
      collectOperands(binary.get().right, op, operands);
    } else {
      operands.add(node);
    }
  }

  /**
   * Builds a tree of minimal height joining {@code operands} with {@code op}. Every level pairs
   * adjacent operands; an odd operand left over is carried to the next level. {@code [a, b, c, d,
   * e]} becomes {@code ((a + b) + (c + d)) + e}.
   *
   * @throws AstError.CannotBuildEmptyTree if there are no operands
   */
  public static Expression buildBalancedTree(List<Expression> operands, BinOp op) {
    if (operands.isEmpty()) {
      throw new AstError.CannotBuildEmptyTree();
    }
    Deque<Expression> queue = new ArrayDeque<>(operands);
    while (queue.size() > 1) {
      int levelSize = queue.size();
      for (int i = 0; i < levelSize / 2; ++i) {
        Expression left = pop(queue);
        Expression right = pop(queue);
        queue.addLast(Expressions.binary(op, left, right));
      }
      if (levelSize % 2 != 0) {
        queue.addLast(pop(queue));
      }
    }
    return pop(queue);
  }

  private static Expression pop(Deque<Expression> queue) {
    Expression node = queue.pollFirst();
    if (node == null) {
      throw new AstError.FailedPopFromQueue();
    }
    return node;
  }

  /**
   * Splits a left-associative chain of {@code op}: {@code (A op B) op C} yields {@code (A, [B,
   * C])}. The head is the leftmost operand that is no {@code op} itself.
   */
  public static Tuple2<Expression, ImmutableList<Expression>> collectLeftAssociativeChain(
      Expression node, BinOp op) {
    List<Expression> terms = new ArrayList<>();
    Expression current = node;
    Optional<BinaryOperation> binary = Expressions.asBinary(current, op);
    while (binary.isPresent()) {
      terms.add(binary.get().right);
      current = binary.get().left;
      binary = Expressions.asBinary(current, op);
    }
    return tuple(current, ImmutableList.copyOf(Lists.reverse(terms)));
  }

  /** {@code [B, C, D]} becomes {@code (B op C) op D}. */
  public static Expression buildLeftAssociativeTree(List<Expression> terms, BinOp op) {
    if (terms.isEmpty()) {
      throw new AstError.CannotBuildEmptyTree();
    }
    Expression current = terms.get(0);
    for (Expression term : terms.subList(1, terms.size())) {
      current = Expressions.binary(op, current, term);
    }
    return current;
  }
}
