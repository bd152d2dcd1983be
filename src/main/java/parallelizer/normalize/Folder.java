package parallelizer.normalize;

import java.util.Optional;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.ArrayAccess;
import parallelizer.ast.Expression.BinOp;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expression.FunctionCall;
import parallelizer.ast.Expression.Identifier;
import parallelizer.ast.Expression.NumberLiteral;
import parallelizer.ast.Expression.StringLiteral;
import parallelizer.ast.Expression.UnaryOperation;
import parallelizer.ast.Expressions;

/**
 * Undoes the parts of {@link Transformer} that only hurt readability:
 *
 * <ul>
 *   <li>A + (-B) = A - B
 *   <li>A + (-c) = A - c for a negative literal
 *   <li>A * (1 / B) = A / B
 * </ul>
 */
public class Folder implements Normalizer, Expression.Visitor<Expression> {

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
    Expression left = that.left.acceptVisitor(this);
    Expression right = that.right.acceptVisitor(this);
    if (that.is(BinOp.PLUS)) {
      Optional<Expression> subtrahend = Expressions.negated(right);
      if (subtrahend.isPresent()) {
        return Expressions.minus(left, subtrahend.get());
      }
      Optional<NumberLiteral> number = Expressions.asNumber(right);
      if (number.isPresent() && number.get().value < 0) {
        return Expressions.minus(left, Expressions.num(-number.get().value));
      }
    } else if (that.is(BinOp.MULTIPLY)) {
      Optional<BinaryOperation> reciprocal = Expressions.asBinary(right, BinOp.DIVIDE);
      if (reciprocal.isPresent() && Expressions.isNumber(reciprocal.get().left, 1)) {
        return Expressions.div(left, reciprocal.get().right);
      }
    }
    return Expressions.binary(that.op, left, right);
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
