package parallelizer.util;

import com.google.common.collect.ImmutableList;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.ArrayAccess;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expression.FunctionCall;
import parallelizer.ast.Expression.Identifier;
import parallelizer.ast.Expression.NumberLiteral;
import parallelizer.ast.Expression.StringLiteral;
import parallelizer.ast.Expression.UnaryOperation;

/**
 * Prints a tree as an indented outline:
 *
 * <pre>
 * └── +
 *     ├── a
 *     └── *
 *         ├── b
 *         └── c
 * </pre>
 */
public class OutlinePrinter implements Expression.Visitor<String> {

  private static final OutlinePrinter LABELS = new OutlinePrinter();

  private OutlinePrinter() {}

  public static String print(Expression expression) {
    StringBuilder out = new StringBuilder();
    print(expression, out, "", true);
    return out.toString();
  }

  private static void print(Expression node, StringBuilder out, String prefix, boolean isLast) {
    out.append(prefix)
        .append(isLast ? "└── " : "├── ")
        .append(node.acceptVisitor(LABELS))
        .append(System.lineSeparator());
    String childPrefix = prefix + (isLast ? "    " : "│   ");
    ImmutableList<Expression> children = node.children();
    for (int i = 0; i < children.size(); ++i) {
      print(children.get(i), out, childPrefix, i == children.size() - 1);
    }
  }

  @Override
  public String visitNumber(NumberLiteral that) {
    return Numbers.format(that.value, 3);
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
    return that.op.string;
  }

  @Override
  public String visitBinaryOperation(BinaryOperation that) {
    return that.op.string;
  }

  @Override
  public String visitFunctionCall(FunctionCall that) {
    return that.name + "(...)";
  }

  @Override
  public String visitArrayAccess(ArrayAccess that) {
    return that.identifier + "[...]";
  }
}
