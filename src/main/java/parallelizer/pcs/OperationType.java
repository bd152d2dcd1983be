package parallelizer.pcs;

import parallelizer.ast.Expression.BinOp;
import parallelizer.ast.Expression.UnOp;

/** The kind of functional unit a task needs. {@link #LOAD} tasks need none and take no time. */
public enum OperationType {
  ADD,
  SUB,
  MUL,
  DIV,
  LOAD;

  public boolean needsUnit() {
    return this != LOAD;
  }

  public static OperationType fromBinary(BinOp op) {
    switch (op) {
      case PLUS:
        return ADD;
      case MINUS:
        return SUB;
      case MULTIPLY:
        return MUL;
      case DIVIDE:
        return DIV;
      default:
        // logical operators are free
        return LOAD;
    }
  }

  public static OperationType fromUnary(UnOp op) {
    return op == UnOp.MINUS ? SUB : LOAD;
  }
}
