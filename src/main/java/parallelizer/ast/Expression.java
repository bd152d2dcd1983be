package parallelizer.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import parallelizer.util.CanonicalPrinter;
import parallelizer.util.OutlinePrinter;
import parallelizer.util.PrettyPrinter;

/**
 * An immutable arithmetic/boolean expression tree.
 *
 * <p>Nodes are never shared between trees and never mutated. Every transformation consumes a tree
 * and produces a new one; untouched subtrees may be reused by the new tree since they can't change
 * anymore.
 */
public abstract class Expression {

  Expression() {}

  public abstract <T> T acceptVisitor(Visitor<T> visitor);

  /** The direct operands of this node, left to right. */
  public abstract ImmutableList<Expression> children();

  /**
   * Returns a node of the same kind and operator with {@code children} as its operands. The number
   * of children has to match {@link #children()}.
   */
  public abstract Expression withChildren(List<Expression> children);

  /** Renders the minimal-parentheses infix form, e.g. {@code a + b * c}. */
  public String toPrettyString() {
    return PrettyPrinter.print(this);
  }

  /**
   * Renders the deduplication key. Operands of {@code +} and {@code *} are sorted, so {@code a+b}
   * and {@code b+a} have the same key.
   */
  public String toCanonicalString() {
    return CanonicalPrinter.print(this);
  }

  /** Renders an indented outline of the tree, one node per line. */
  public String prettyPrint() {
    return OutlinePrinter.print(this);
  }

  @Override
  public String toString() {
    return toPrettyString();
  }

  public static class NumberLiteral extends Expression {

    public final double value;

    public NumberLiteral(double value) {
      this.value = value;
    }

    public boolean is(double number) {
      return value == number;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitNumber(this);
    }

    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      checkArgument(children.isEmpty(), "A number has no operands");
      return this;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof NumberLiteral)) {
        return false;
      }
      // exact comparison; 0.0 and -0.0 are the same literal and NaN equals NaN
      return Double.compare(normalized(value), normalized(((NumberLiteral) o).value)) == 0;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(normalized(value));
    }

    private static double normalized(double value) {
      return value == 0.0 ? 0.0 : value;
    }
  }

  public static class Identifier extends Expression {

    public final String name;

    public Identifier(String name) {
      this.name = checkNotNull(name);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitIdentifier(this);
    }

    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      checkArgument(children.isEmpty(), "An identifier has no operands");
      return this;
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Identifier && name.equals(((Identifier) o).name));
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  public static class StringLiteral extends Expression {

    public final String text;

    public StringLiteral(String text) {
      this.text = checkNotNull(text);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitStringLiteral(this);
    }

    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      checkArgument(children.isEmpty(), "A string literal has no operands");
      return this;
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof StringLiteral && text.equals(((StringLiteral) o).text));
    }

    @Override
    public int hashCode() {
      return 31 * text.hashCode() + 7;
    }
  }

  public static class UnaryOperation extends Expression {

    public final UnOp op;
    public final Expression expression;

    public UnaryOperation(UnOp op, Expression expression) {
      this.op = checkNotNull(op);
      this.expression = checkNotNull(expression);
    }

    public boolean is(UnOp op) {
      return this.op == op;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitUnaryOperation(this);
    }

    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of(expression);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      checkArgument(children.size() == 1, "A unary operation has exactly one operand");
      return new UnaryOperation(op, children.get(0));
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof UnaryOperation)) {
        return false;
      }
      UnaryOperation that = (UnaryOperation) o;
      return op == that.op && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, expression);
    }
  }

  public static class BinaryOperation extends Expression {

    public final BinOp op;
    public final Expression left;
    public final Expression right;

    public BinaryOperation(BinOp op, Expression left, Expression right) {
      this.op = checkNotNull(op);
      this.left = checkNotNull(left);
      this.right = checkNotNull(right);
    }

    public boolean is(BinOp op) {
      return this.op == op;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitBinaryOperation(this);
    }

    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      checkArgument(children.size() == 2, "A binary operation has exactly two operands");
      return new BinaryOperation(op, children.get(0), children.get(1));
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof BinaryOperation)) {
        return false;
      }
      BinaryOperation that = (BinaryOperation) o;
      return op == that.op && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }
  }

  public static class FunctionCall extends Expression {

    public final String name;
    public final ImmutableList<Expression> arguments;

    public FunctionCall(String name, List<Expression> arguments) {
      this.name = checkNotNull(name);
      this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitFunctionCall(this);
    }

    @Override
    public ImmutableList<Expression> children() {
      return arguments;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      checkArgument(children.size() == arguments.size(), "Argument count must not change");
      return new FunctionCall(name, children);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof FunctionCall)) {
        return false;
      }
      FunctionCall that = (FunctionCall) o;
      return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, arguments);
    }
  }

  public static class ArrayAccess extends Expression {

    public final String identifier;
    public final ImmutableList<Expression> indices;

    public ArrayAccess(String identifier, List<Expression> indices) {
      this.identifier = checkNotNull(identifier);
      this.indices = ImmutableList.copyOf(indices);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitArrayAccess(this);
    }

    @Override
    public ImmutableList<Expression> children() {
      return indices;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
      checkArgument(children.size() == indices.size(), "Dimension must not change");
      return new ArrayAccess(identifier, children);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof ArrayAccess)) {
        return false;
      }
      ArrayAccess that = (ArrayAccess) o;
      return identifier.equals(that.identifier) && indices.equals(that.indices);
    }

    @Override
    public int hashCode() {
      return Objects.hash(identifier, indices, 17);
    }
  }

  public enum UnOp {
    MINUS("-"),
    NOT("!");

    public final String string;

    UnOp(String string) {
      this.string = string;
    }
  }

  public enum BinOp {
    PLUS("+", 1),
    MINUS("-", 1),
    MULTIPLY("*", 2),
    DIVIDE("/", 2),
    OR("|", 1),
    AND("&", 2);

    public final String string;
    public final int precedence;

    BinOp(String string, int precedence) {
      this.string = string;
      this.precedence = precedence;
    }

    public boolean isCommutative() {
      return this == PLUS || this == MULTIPLY;
    }

    public boolean isAdditive() {
      return this == PLUS || this == MINUS;
    }

    public boolean isArithmetic() {
      return this != OR && this != AND;
    }
  }

  public interface Visitor<T> {

    T visitNumber(NumberLiteral that);

    T visitIdentifier(Identifier that);

    T visitStringLiteral(StringLiteral that);

    T visitUnaryOperation(UnaryOperation that);

    T visitBinaryOperation(BinaryOperation that);

    T visitFunctionCall(FunctionCall that);

    T visitArrayAccess(ArrayAccess that);
  }
}
