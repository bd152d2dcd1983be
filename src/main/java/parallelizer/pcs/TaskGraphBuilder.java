package parallelizer.pcs;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.ArrayAccess;
import parallelizer.ast.Expression.BinaryOperation;
import parallelizer.ast.Expression.FunctionCall;
import parallelizer.ast.Expression.Identifier;
import parallelizer.ast.Expression.NumberLiteral;
import parallelizer.ast.Expression.StringLiteral;
import parallelizer.ast.Expression.UnaryOperation;
import parallelizer.util.Numbers;

/**
 * Flattens an expression into a {@link TaskGraph}. Operands (numbers, identifiers, calls, array
 * accesses) become {@link OperationType#LOAD} leaves; calls and array accesses are not looked
 * into.
 */
public class TaskGraphBuilder implements Expression.Visitor<Task> {

  /** Indexed by id; a slot is reserved before the operands of its node are visited. */
  private final List<Task> tasks = new ArrayList<>();

  private TaskGraphBuilder() {}

  public static TaskGraph build(Expression expression) {
    TaskGraphBuilder builder = new TaskGraphBuilder();
    expression.acceptVisitor(builder);
    return new TaskGraph(ImmutableList.copyOf(builder.tasks));
  }

  private int reserveId() {
    tasks.add(null);
    return tasks.size() - 1;
  }

  private Task leaf(String label) {
    int id = reserveId();
    return register(new Task(id, OperationType.LOAD, ImmutableList.of(), 0, label));
  }

  private Task register(Task task) {
    tasks.set(task.id, task);
    return task;
  }

  @Override
  public Task visitNumber(NumberLiteral that) {
    return leaf(Numbers.format(that.value, 1));
  }

  @Override
  public Task visitIdentifier(Identifier that) {
    return leaf(that.name);
  }

  @Override
  public Task visitStringLiteral(StringLiteral that) {
    return leaf("\"" + that.text + "\"");
  }

  @Override
  public Task visitUnaryOperation(UnaryOperation that) {
    int id = reserveId();
    Task operand = that.expression.acceptVisitor(this);
    return register(
        new Task(
            id,
            OperationType.fromUnary(that.op),
            ImmutableList.of(operand.id),
            operand.rank + 1,
            that.op.string + operand.label));
  }

  @Override
  public Task visitBinaryOperation(BinaryOperation that) {
    int id = reserveId();
    Task left = that.left.acceptVisitor(this);
    Task right = that.right.acceptVisitor(this);
    return register(
        new Task(
            id,
            OperationType.fromBinary(that.op),
            ImmutableList.of(left.id, right.id),
            Math.max(left.rank, right.rank) + 1,
            "(" + left.label + " " + that.op.string + " " + right.label + ")"));
  }

  @Override
  public Task visitFunctionCall(FunctionCall that) {
    return leaf(that.name + "()");
  }

  @Override
  public Task visitArrayAccess(ArrayAccess that) {
    return leaf(that.identifier + "[..]");
  }
}
