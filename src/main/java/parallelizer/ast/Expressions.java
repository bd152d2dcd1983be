package parallelizer.ast;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.function.Function;
import parallelizer.ast.Expression.ArrayAccess;
import parallelizer.ast.Expression.BinOp;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expression.FunctionCall;
import parallelizer.ast.Expression.Identifier;
import parallelizer.ast.Expression.NumberLiteral;
import parallelizer.ast.Expression.StringLiteral;
import parallelizer.ast.Expression.UnOp;
import parallelizer.ast.Expression.UnaryOperation;

/** Factory methods and shape queries for {@link Expression} trees. */
public class Expressions {

  private Expressions() {}

  public static NumberLiteral num(double value) {
    return new NumberLiteral(value);
  }

  public static Identifier id(String name) {
    return new Identifier(name);
  }

  public static StringLiteral str(String text) {
    return new StringLiteral(text);
  }

  public static UnaryOperation neg(Expression expression) {
    return new UnaryOperation(UnOp.MINUS, expression);
  }

  public static UnaryOperation not(Expression expression) {
    return new UnaryOperation(UnOp.NOT, expression);
  }

  public static BinaryOperation binary(BinOp op, Expression left, Expression right) {
    return new BinaryOperation(op, left, right);
  }

  public static BinaryOperation plus(Expression left, Expression right) {
    return binary(BinOp.PLUS, left, right);
  }

  public static BinaryOperation minus(Expression left, Expression right) {
    return binary(BinOp.MINUS, left, right);
  }

  public static BinaryOperation mul(Expression left, Expression right) {
    return binary(BinOp.MULTIPLY, left, right);
  }

  public static BinaryOperation div(Expression left, Expression right) {
    return binary(BinOp.DIVIDE, left, right);
  }

  public static BinaryOperation or(Expression left, Expression right) {
    return binary(BinOp.OR, left, right);
  }

  public static BinaryOperation and(Expression left, Expression right) {
    return binary(BinOp.AND, left, right);
  }

  public static FunctionCall call(String name, Expression... arguments) {
    return new FunctionCall(name, ImmutableList.copyOf(arguments));
  }

  public static ArrayAccess index(String identifier, Expression... indices) {
    return new ArrayAccess(identifier, ImmutableList.copyOf(indices));
  }

  public static Optional<NumberLiteral> asNumber(Expression expression) {
    return expression instanceof NumberLiteral
        ? Optional.of((NumberLiteral) expression)
        : Optional.empty();
  }

  public static boolean isNumber(Expression expression, double value) {
    return asNumber(expression).map(n -> n.is(value)).orElse(false);
  }

  public static Optional<BinaryOperation> asBinary(Expression expression, BinOp op) {
    return expression instanceof BinaryOperation && ((BinaryOperation) expression).is(op)
        ? Optional.of((BinaryOperation) expression)
        : Optional.empty();
  }

  /** Matches {@code A + B} and {@code A - B}. */
  public static Optional<BinaryOperation> asAdditive(Expression expression) {
    return expression instanceof BinaryOperation && ((BinaryOperation) expression).op.isAdditive()
        ? Optional.of((BinaryOperation) expression)
        : Optional.empty();
  }

  public static Optional<UnaryOperation> asUnary(Expression expression, UnOp op) {
    return expression instanceof UnaryOperation && ((UnaryOperation) expression).is(op)
        ? Optional.of((UnaryOperation) expression)
        : Optional.empty();
  }

  /** Returns {@code A} for {@code -A}. */
  public static Optional<Expression> negated(Expression expression) {
    return asUnary(expression, UnOp.MINUS).map(u -> u.expression);
  }

  /** Applies {@code f} to every operand of {@code expression}, keeping their order. */
  public static ImmutableList<Expression> mapChildren(
      Expression expression, Function<Expression, Expression> f) {
    return seq(expression.children()).map(f).collect(ImmutableList.toImmutableList());
  }

  /** The number of edges on the longest path from the root to a leaf. */
  public static int height(Expression expression) {
    int max = -1;
    for (Expression child : expression.children()) {
      max = Math.max(max, height(child));
    }
    return max + 1;
  }
}
