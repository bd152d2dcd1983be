package parallelizer.normalize;

import static org.jooq.lambda.Seq.seq;

import java.util.List;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.ArrayAccess;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expression.FunctionCall;
import parallelizer.ast.Expression.Identifier;
import parallelizer.ast.Expression.NumberLiteral;
import parallelizer.ast.Expression.StringLiteral;
import parallelizer.ast.Expression.UnaryOperation;
import parallelizer.ast.Expressions;

/**
 * Rebuilds every maximal chain of {@code +} or {@code *} as a tree of minimal height, so {@code n}
 * operands end up at most {@code ceil(log2(n))} levels below the chain's root. Operand order is
 * kept. All other operators keep their shape.
 */
public class Balancer implements Normalizer, Expression.Visitor<Expression> {

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
    return new UnaryOperation(that.op, that.expression.acceptVisitor(this));
  }

  @Override
  public Expression visitBinaryOperation(BinaryOperation that) {
    if (!that.op.isCommutative()) {
      return Expressions.binary(
          that.op, that.left.acceptVisitor(this), that.right.acceptVisitor(this));
    }
    List<Expression> operands =
        seq(Chains.collectOperands(that, that.op)).map(o -> o.acceptVisitor(this)).toList();
    return Chains.buildBalancedTree(operands, that.op);
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
