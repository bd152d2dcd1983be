package parallelizer.equivalence;

import static parallelizer.ast.Expressions.neg;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.BinOp;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expressions;
import parallelizer.normalize.Chains;

/**
 * Single-step factoring of a sum: all terms sharing a multiplicative factor {@code F} are
 * replaced by {@code F * (r_1 + r_2 + ...)}, where {@code r_i} is what remains of the i-th term
 * once {@code F} is taken out. Only the chain at the root of the tree is factored.
 */
public class AssociativeLaw {

  private AssociativeLaw() {}

  /**
   * Returns one tree per distinct factor shared by at least two terms of the root sum, ordered by
   * the first term carrying the factor and then by the factor's position in that term.
   */
  public static ImmutableList<Expression> singleStepFactorings(Expression root) {
    if (!Expressions.asAdditive(root).isPresent()) {
      return ImmutableList.of();
    }
    List<Expression> terms = signedTerms(root);
    ImmutableList.Builder<Expression> factorings = ImmutableList.builder();
    if (terms.size() < 2) {
      return factorings.build();
    }

    Set<String> seenFactors = new HashSet<>();
    for (int i = 0; i < terms.size(); ++i) {
      for (Expression factor : factors(terms.get(i))) {
        if (!seenFactors.add(factor.toCanonicalString())) {
          continue;
        }
        Optional<Expression> first = remainder(terms.get(i), factor);
        if (!first.isPresent()) {
          continue;
        }
        List<Expression> remainders = new ArrayList<>();
        Set<Integer> grouped = new HashSet<>();
        remainders.add(first.get());
        grouped.add(i);
        for (int j = i + 1; j < terms.size(); ++j) {
          Optional<Expression> rest = remainder(terms.get(j), factor);
          if (rest.isPresent()) {
            remainders.add(rest.get());
            grouped.add(j);
          }
        }
        if (remainders.size() > 1) {
          factorings.add(regroup(factor, remainders, terms, grouped));
        }
      }
    }
    return factorings.build();
  }

  private static Expression regroup(
      Expression factor,
      List<Expression> remainders,
      List<Expression> terms,
      Set<Integer> grouped) {
    List<Expression> summands = new ArrayList<>();
    summands.add(Expressions.mul(factor, Chains.buildBalancedTree(remainders, BinOp.PLUS)));
    for (int k = 0; k < terms.size(); ++k) {
      if (!grouped.contains(k)) {
        summands.add(terms.get(k));
      }
    }
    return Chains.buildBalancedTree(summands, BinOp.PLUS);
  }

  /** {@code a*k - c*k - a*x} becomes {@code [a*k, -(c*k), -(a*x)]}. */
  static List<Expression> signedTerms(Expression sum) {
    List<Expression> terms = new ArrayList<>();
    collect(sum, terms);
    return terms;
  }

  private static void collect(Expression node, List<Expression> terms) {
    Optional<BinaryOperation> additive = Expressions.asAdditive(node);
    if (!additive.isPresent()) {
      terms.add(node);
      return;
    }
    collect(additive.get().left, terms);
    if (additive.get().is(BinOp.PLUS)) {
      collect(additive.get().right, terms);
    } else {
      collectNegated(additive.get().right, terms);
    }
  }

  private static void collectNegated(Expression node, List<Expression> terms) {
    Optional<Expression> negated = Expressions.negated(node);
    if (negated.isPresent()) {
      collect(negated.get(), terms);
      return;
    }
    Optional<BinaryOperation> additive = Expressions.asAdditive(node);
    if (!additive.isPresent()) {
      terms.add(neg(node));
      return;
    }
    collectNegated(additive.get().left, terms);
    if (additive.get().is(BinOp.PLUS)) {
      collectNegated(additive.get().right, terms);
    } else {
      collect(additive.get().right, terms);
    }
  }

  private static Optional<BinaryOperation> product(Expression term) {
    Optional<BinaryOperation> direct = Expressions.asBinary(term, BinOp.MULTIPLY);
    if (direct.isPresent()) {
      return direct;
    }
    return Expressions.negated(term).flatMap(e -> Expressions.asBinary(e, BinOp.MULTIPLY));
  }

  /** {@code A*B} and {@code -(A*B)} have the factors {@code [A, B]}, anything else none. */
  static ImmutableList<Expression> factors(Expression term) {
    return product(term)
        .map(p -> ImmutableList.of(p.left, p.right))
        .orElse(ImmutableList.of());
  }

  /**
   * Divides {@code term} by {@code factor}: {@code A*B} by {@code A} is {@code B} and {@code
   * -(A*B)} by {@code A} is {@code -B}. Matching compares trees structurally, numbers included.
   */
  static Optional<Expression> remainder(Expression term, Expression factor) {
    Optional<BinaryOperation> product = product(term);
    if (!product.isPresent()) {
      return Optional.empty();
    }
    Expression other;
    if (product.get().left.equals(factor)) {
      other = product.get().right;
    } else if (product.get().right.equals(factor)) {
      other = product.get().left;
    } else {
      return Optional.empty();
    }
    return Optional.of(product.get() == term ? other : neg(other));
  }
}
