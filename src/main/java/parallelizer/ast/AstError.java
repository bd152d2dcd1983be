package parallelizer.ast;

import parallelizer.ParallelizerError;

/** Raised when a tree rewriting stage can't produce a result. */
public abstract class AstError extends ParallelizerError {

  AstError(String message) {
    super(message);
  }

  /** A divisor resolved to the literal 0 during constant folding. */
  public static class DivisionByZero extends AstError {

    /** The division whose right operand folded to 0, as it was before folding. */
    public final Expression node;

    public DivisionByZero(Expression node) {
      super("Division by zero. Node: " + node.toPrettyString());
      this.node = node;
    }
  }

  public static class CannotBuildEmptyTree extends AstError {

    public CannotBuildEmptyTree() {
      super("Cannot build a balanced tree from zero operands");
    }
  }

  public static class FailedPopFromQueue extends AstError {

    public FailedPopFromQueue() {
      super("Failed to pop node from the queue during tree construction");
    }
  }
}
