package parallelizer.util;

import static org.jooq.lambda.Seq.seq;

import java.util.stream.Collectors;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.ArrayAccess;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expression.FunctionCall;
import parallelizer.ast.Expression.Identifier;
import parallelizer.ast.Expression.NumberLiteral;
import parallelizer.ast.Expression.StringLiteral;
import parallelizer.ast.Expression.UnaryOperation;

/**
 * Renders the key used to recognize trees that only differ in the operand order of commutative
 * operators. Every operation is fully parenthesized and the rendered operands of {@code +} and
 * {@code *} are sorted lexicographically. The output is not meant to be parsed back.
 *
 * <p>Number literals are rounded to two decimals, so literals closer than that collide.
 */
public class CanonicalPrinter implements Expression.Visitor<String> {

  private static final CanonicalPrinter INSTANCE = new CanonicalPrinter();

  private CanonicalPrinter() {}

  public static String print(Expression expression) {
    return expression.acceptVisitor(INSTANCE);
  }

  @Override
  public String visitNumber(NumberLiteral that) {
    return Numbers.format(that.value, 2);
  }

  @Override
  public String visitIdentifier(Identifier that) {
    return that.name;
  }

  @Override
  public String visitStringLiteral(StringLiteral that) {
    return "\"" + that.text + "\"";
  }

  @Override
  public String visitUnaryOperation(UnaryOperation that) {
    return "(" + that.op.string + that.expression.acceptVisitor(this) + ")";
  }

  @Override
  public String visitBinaryOperation(BinaryOperation that) {
    String left = that.left.acceptVisitor(this);
    String right = that.right.acceptVisitor(this);
    if (that.op.isCommutative() && left.compareTo(right) > 0) {
      String swap = left;
      left = right;
      right = swap;
    }
    return "(" + left + " " + that.op.string + " " + right + ")";
  }

  @Override
  public String visitFunctionCall(FunctionCall that) {
    return that.name
        + "("
        + seq(that.arguments).map(a -> a.acceptVisitor(this)).collect(Collectors.joining(", "))
        + ")";
  }

  @Override
  public String visitArrayAccess(ArrayAccess that) {
    StringBuilder b = new StringBuilder(that.identifier);
    that.indices.forEach(i -> b.append("[").append(i.acceptVisitor(this)).append("]"));
    return b.toString();
  }
}
