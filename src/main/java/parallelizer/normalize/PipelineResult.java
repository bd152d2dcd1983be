package parallelizer.normalize;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import parallelizer.ast.Expression;

public class PipelineResult {

  public static final String SOLVED_MESSAGE =
      "Tree is fully solved by computation. Further optimization is not needed";

  public final ImmutableList<StageResult> stages;
  private final boolean solved;

  PipelineResult(ImmutableList<StageResult> stages, boolean solved) {
    this.stages = stages;
    this.solved = solved;
  }

  /** True if a compute stage reduced the tree to a single number and later stages were skipped. */
  public boolean isSolved() {
    return solved;
  }

  public boolean isFailed() {
    return !stages.isEmpty() && !stages.get(stages.size() - 1).isSuccess();
  }

  /** The tree after the last stage that ran, empty if any stage failed. */
  public Optional<Expression> result() {
    if (stages.isEmpty() || isFailed()) {
      return Optional.empty();
    }
    return stages.get(stages.size() - 1).tree();
  }
}
