package parallelizer.normalize;

import static parallelizer.ast.Expressions.asNumber;
import static parallelizer.ast.Expressions.isNumber;
import static parallelizer.ast.Expressions.neg;
import static parallelizer.ast.Expressions.num;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parallelizer.ast.AstError;
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
 * Folds constant subexpressions and applies the arithmetic identities below, repeating whole passes
 * until a pass doesn't change the tree anymore.
 *
 * <ul>
 *   <li>x + 0 = x = 0 + x, x - 0 = x, 0 - x = -x
 *   <li>x * 1 = x = 1 * x, x / 1 = x
 *   <li>x * 0 = 0 = 0 * x, 0 / x = 0
 *   <li>x - x = 0, x / x = 1 (unless x is 0)
 *   <li>-(c) = (-c), -(A - B) = (-A) + B, A - (-B) = A + B
 *   <li>(X ± c_1) ± c_2 = X + c, where c folds the signed constants
 * </ul>
 *
 * <p>A division whose right operand folds to the literal 0 fails with {@link
 * AstError.DivisionByZero}.
 */
public class ConstantFolder implements Normalizer, Expression.Visitor<Expression> {

  private static final Logger LOGGER = LoggerFactory.getLogger("ConstantFolder");

  @Override
  public Expression normalize(Expression expression) {
    Expression current = expression;
    int passes = 0;
    while (true) {
      Expression next = current.acceptVisitor(this);
      passes++;
      if (next.equals(current)) {
        LOGGER.debug("Reached fixed point after " + passes + " pass(es)");
        return next;
      }
      current = next;
    }
  }

  /** True if the tree is a single number, so there is nothing left to optimize. */
  public static boolean isSolved(Expression expression) {
    return expression instanceof NumberLiteral;
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
    Optional<NumberLiteral> number = asNumber(operand);
    if (number.isPresent()) {
      return num(-number.get().value);
    }
    Optional<BinaryOperation> difference = Expressions.asBinary(operand, BinOp.MINUS);
    if (difference.isPresent()) {
      return Expressions.plus(neg(difference.get().left), difference.get().right);
    }
    return neg(operand);
  }

  @Override
  public Expression visitBinaryOperation(BinaryOperation that) {
    Expression left = that.left.acceptVisitor(this);
    Expression right = that.right.acceptVisitor(this);
    BinOp op = that.op;
    if (!op.isArithmetic()) {
      return Expressions.binary(op, left, right);
    }

    if (left.equals(right)) {
      if (op == BinOp.MINUS) {
        return num(0);
      }
      if (op == BinOp.DIVIDE) {
        if (isNumber(left, 0)) {
          throw new AstError.DivisionByZero(that);
        }
        return num(1);
      }
    }

    Optional<NumberLiteral> leftNumber = asNumber(left);
    Optional<NumberLiteral> rightNumber = asNumber(right);
    if (leftNumber.isPresent() && rightNumber.isPresent()) {
      return num(evaluate(that, leftNumber.get().value, rightNumber.get().value));
    }
    if (leftNumber.isPresent()) {
      return withConstantLeft(op, leftNumber.get(), right);
    }
    if (rightNumber.isPresent()) {
      return withConstantRight(that, left, rightNumber.get());
    }

    Optional<Expression> subtrahend = Expressions.negated(right);
    if (op == BinOp.MINUS && subtrahend.isPresent()) {
      return Expressions.plus(left, subtrahend.get());
    }
    return Expressions.binary(op, left, right);
  }

  private static double evaluate(BinaryOperation node, double left, double right) {
    switch (node.op) {
      case PLUS:
        return left + right;
      case MINUS:
        return left - right;
      case MULTIPLY:
        return left * right;
      case DIVIDE:
        if (right == 0.0) {
          throw new AstError.DivisionByZero(node);
        }
        return left / right;
      default:
        throw new UnsupportedOperationException("Can't evaluate " + node.op);
    }
  }

  private static Expression withConstantLeft(BinOp op, NumberLiteral left, Expression right) {
    if (left.is(0)) {
      switch (op) {
        case MULTIPLY:
        case DIVIDE:
          return num(0);
        case PLUS:
          return right;
        case MINUS:
          return neg(right);
        default:
          break;
      }
    }
    if (left.is(1) && op == BinOp.MULTIPLY) {
      return right;
    }
    return Expressions.binary(op, left, right);
  }

  private static Expression withConstantRight(
      BinaryOperation node, Expression left, NumberLiteral right) {
    BinOp op = node.op;
    if (right.is(0)) {
      switch (op) {
        case DIVIDE:
          throw new AstError.DivisionByZero(node);
        case MULTIPLY:
          return num(0);
        case PLUS:
        case MINUS:
          return left;
        default:
          break;
      }
    }
    if (right.is(1) && (op == BinOp.MULTIPLY || op == BinOp.DIVIDE)) {
      return left;
    }

    // ((a * 2) - 5) + 5 becomes (a * 2) + 0, which the next pass reduces to a * 2
    Optional<BinaryOperation> inner = Expressions.asAdditive(left);
    if (op.isAdditive() && inner.isPresent()) {
      Optional<NumberLiteral> innerNumber = asNumber(inner.get().right);
      if (innerNumber.isPresent()) {
        double innerValue =
            inner.get().is(BinOp.MINUS) ? -innerNumber.get().value : innerNumber.get().value;
        double value = op == BinOp.MINUS ? -right.value + innerValue : right.value + innerValue;
        return Expressions.plus(inner.get().left, num(value));
      }
    }
    return Expressions.binary(op, left, right);
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
