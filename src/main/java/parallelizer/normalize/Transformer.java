package parallelizer.normalize;

import static parallelizer.ast.Expressions.neg;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.jooq.lambda.tuple.Tuple2;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.ArrayAccess;
import parallelizer.ast.Expression.BinOp;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expression.FunctionCall;
import parallelizer.ast.Expression.Identifier;
import parallelizer.ast.Expression.NumberLiteral;
import parallelizer.ast.Expression.StringLiteral;
import parallelizer.ast.Expression.UnOp;
import parallelizer.ast.Expression.UnaryOperation;
import parallelizer.ast.Expressions;

/**
 * Brings a tree into the shape the balancer can parallelize:
 *
 * <ul>
 *   <li>A - B = A + (-B)
 *   <li>A / B / C / ... = A / (B * C * ...)
 *   <li>-(A + B) = (-A) + (-B)
 *   <li>-(-A) = A
 * </ul>
 */
public class Transformer implements Normalizer, Expression.Visitor<Expression> {

  @Override
  public Expression normalize(Expression expression) {
    return expression.acceptVisitor(this);
  }

  @Override
  public Expression visitNumber(NumberLiteral that) {
    return that;
  }

  @Override
  public Expression visitIdentifier(Identifier that) {
    return that;
  }

  @Override
  public Expression visitStringLiteral(StringLiteral that) {
    return that;
  }

  @Override
  public Expression visitUnaryOperation(UnaryOperation that) {
    Expression operand = that.expression.acceptVisitor(this);
    if (that.is(UnOp.NOT)) {
      return Expressions.not(operand);
    }
    return negate(operand);
  }

  /** Negates an already transformed tree, pushing the minus into sums. */
  private Expression negate(Expression transformed) {
    Optional<Expression> doubleNegated = Expressions.negated(transformed);
    if (doubleNegated.isPresent()) {
      return doubleNegated.get();
    }
    Optional<BinaryOperation> sum = Expressions.asBinary(transformed, BinOp.PLUS);
    if (sum.isPresent()) {
      return Expressions.plus(negate(sum.get().left), negate(sum.get().right));
    }
    return neg(transformed);
  }

  @Override
  public Expression visitBinaryOperation(BinaryOperation that) {
    switch (that.op) {
      case MINUS:
        return Expressions.plus(
            that.left.acceptVisitor(this), negate(that.right.acceptVisitor(this)));
      case DIVIDE:
        return transformDivisionChain(that);
      default:
        return Expressions.binary(
            that.op, that.left.acceptVisitor(this), that.right.acceptVisitor(this));
    }
  }

  private Expression transformDivisionChain(BinaryOperation division) {
    Tuple2<Expression, ImmutableList<Expression>> chain =
        Chains.collectLeftAssociativeChain(division, BinOp.DIVIDE);
    Expression head = chain.v1.acceptVisitor(this);
    ImmutableList<Expression> divisors =
        chain.v2.stream().map(d -> d.acceptVisitor(this)).collect(ImmutableList.toImmutableList());
    Expression product = Chains.buildLeftAssociativeTree(divisors, BinOp.MULTIPLY);
    return Expressions.div(head, product);
  }

  @Override
  public Expression visitFunctionCall(FunctionCall that) {
    return that.withChildren(Expressions.mapChildren(that, c -> c.acceptVisitor(this)));
  }

  @Override
  public Expression visitArrayAccess(ArrayAccess that) {
    return that.withChildren(Expressions.mapChildren(that, c -> c.acceptVisitor(this)));
  }
}
