package parallelizer.util;

import static org.jooq.lambda.Seq.seq;

import java.util.stream.Collectors;
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
 * Renders an expression in infix notation, adding parentheses only where operator precedence
 * requires them. Sums with a negated operand are shown as a subtraction, so {@code A+(-B)} reads
 * {@code A - B} and {@code (-A)+B} reads {@code B - A}.
 *
 * <p>Instances of this class <em>are</em> stateful (the precedence of the enclosing operator).
 * It is very cheap to create new instances of this class and therefore it is generally not
 * advisable to reuse instances.
 */
public class PrettyPrinter implements Expression.Visitor<CharSequence> {

  private static final int UNARY_PRECEDENCE = 3;

  private int parentPrecedence = 0;

  public PrettyPrinter() {}

  public static String print(Expression expression) {
    return expression.acceptVisitor(new PrettyPrinter()).toString();
  }

  private CharSequence print(Expression expression, int precedence) {
    int saved = parentPrecedence;
    parentPrecedence = precedence;
    CharSequence printed = expression.acceptVisitor(this);
    parentPrecedence = saved;
    return printed;
  }

  private static CharSequence bracketed(CharSequence seq, int own, int parent) {
    if (own < parent) {
      return new StringBuilder("(").append(seq).append(")");
    }
    return seq;
  }

  @Override
  public CharSequence visitNumber(NumberLiteral that) {
    return Numbers.format(that.value, 2);
  }

  @Override
  public CharSequence visitIdentifier(Identifier that) {
    return that.name;
  }

  @Override
  public CharSequence visitStringLiteral(StringLiteral that) {
    return "\"" + that.text + "\"";
  }

  @Override
  public CharSequence visitUnaryOperation(UnaryOperation that) {
    int parent = parentPrecedence;
    StringBuilder b = new StringBuilder(that.op.string);
    b.append(print(that.expression, UNARY_PRECEDENCE));
    return bracketed(b, UNARY_PRECEDENCE, parent);
  }

  @Override
  public CharSequence visitBinaryOperation(BinaryOperation that) {
    int parent = parentPrecedence;
    int own = that.op.precedence;

    if (that.is(BinOp.PLUS)) {
      if (Expressions.negated(that.right).isPresent()) {
        Expression subtrahend = Expressions.negated(that.right).get();
        StringBuilder b = new StringBuilder();
        b.append(print(that.left, own)).append(" - ").append(print(subtrahend, own + 1));
        return bracketed(b, own, parent);
      }
      if (Expressions.negated(that.left).isPresent()) {
        Expression subtrahend = Expressions.negated(that.left).get();
        StringBuilder b = new StringBuilder();
        b.append(print(that.right, own)).append(" - ").append(print(subtrahend, own + 1));
        return bracketed(b, own, parent);
      }
    }

    // A - (B - C) and A / (B / C) have to keep their parentheses
    int rightPrecedence = that.is(BinOp.MINUS) || that.is(BinOp.DIVIDE) ? own + 1 : own;
    StringBuilder b = new StringBuilder();
    b.append(print(that.left, own));
    b.append(" ").append(that.op.string).append(" ");
    b.append(print(that.right, rightPrecedence));
    return bracketed(b, own, parent);
  }

  @Override
  public CharSequence visitFunctionCall(FunctionCall that) {
    return new StringBuilder(that.name)
        .append("(")
        .append(seq(that.arguments).map(a -> print(a, 0)).collect(Collectors.joining(", ")))
        .append(")");
  }

  @Override
  public CharSequence visitArrayAccess(ArrayAccess that) {
    StringBuilder b = new StringBuilder(that.identifier);
    for (Expression index : that.indices) {
      b.append("[").append(print(index, 0)).append("]");
    }
    return b;
  }
}
