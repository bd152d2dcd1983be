package parallelizer.normalize;

import com.google.common.collect.ImmutableList;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parallelizer.ast.AstError;
import parallelizer.ast.Expression;
import parallelizer.util.Either;

/**
 * Runs a fixed sequence of {@link Normalizer} stages over a tree. The first failing stage aborts
 * the run, and a compute stage that reduces the tree to a single number ends it early.
 */
public class NormalizationPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger("NormalizationPipeline");

  private final ImmutableList<Stage> stages;

  private NormalizationPipeline(ImmutableList<Stage> stages) {
    this.stages = stages;
  }

  /**
   * compute, transform, compute, balance, compute, fold, compute. This is what {@link
   * parallelizer.Parallelizer#normalize} runs.
   */
  public static NormalizationPipeline standard() {
    return new Builder()
        .compute()
        .add(
            "transform",
            new Transformer(),
            "Transformed Abstract-Syntax Tree generation success!",
            "Transformed Abstract-Syntax Tree generation error: ")
        .compute()
        .add(
            "balance",
            new Balancer(),
            "Balanced Abstract-Syntax Tree generation succeed!",
            "Balancing AST error: ")
        .compute()
        .add("fold", new Folder(), "Folding Abstract-Syntax Tree success!", "Folding AST error: ")
        .compute()
        .build();
  }

  public PipelineResult run(Expression expression) {
    ImmutableList.Builder<StageResult> results = ImmutableList.builder();
    Expression current = expression;
    for (int i = 0; i < stages.size(); ++i) {
      Stage stage = stages.get(i);
      LOGGER.debug("Running " + stage.name);
      Either<Expression, AstError> outcome;
      try {
        outcome = Either.first(stage.normalizer.normalize(current));
      } catch (AstError e) {
        LOGGER.debug(stage.name + " failed: " + e.getMessage());
        results.add(stage.result(Either.second(e)));
        return new PipelineResult(results.build(), false);
      }
      results.add(stage.result(outcome));
      current = outcome.s.get();
      boolean stagesRemain = i + 1 < stages.size();
      if (stage.stopWhenSolved && stagesRemain && ConstantFolder.isSolved(current)) {
        LOGGER.debug("Solved after " + stage.name + ", skipping remaining stages");
        return new PipelineResult(results.build(), true);
      }
    }
    return new PipelineResult(results.build(), false);
  }

  private static class Stage {
    final String name;
    final Normalizer normalizer;
    final String successMessage;
    final String errorPrefix;
    final boolean stopWhenSolved;

    Stage(
        String name,
        Normalizer normalizer,
        String successMessage,
        String errorPrefix,
        boolean stopWhenSolved) {
      this.name = name;
      this.normalizer = normalizer;
      this.successMessage = successMessage;
      this.errorPrefix = errorPrefix;
      this.stopWhenSolved = stopWhenSolved;
    }

    StageResult result(Either<Expression, AstError> outcome) {
      return new StageResult(name, successMessage, errorPrefix, outcome);
    }
  }

  public static class Builder {
    private final PVector<Stage> stages;
    private final int computeRuns;

    private Builder(PVector<Stage> stages, int computeRuns) {
      this.stages = stages;
      this.computeRuns = computeRuns;
    }

    public Builder() {
      this(TreePVector.empty(), 0);
    }

    public Builder add(
        String name, Normalizer normalizer, String successMessage, String errorPrefix) {
      return new Builder(
          stages.plus(new Stage(name, normalizer, successMessage, errorPrefix, false)),
          computeRuns);
    }

    /** Appends a numbered {@link ConstantFolder} run, after which a solved tree ends the run. */
    public Builder compute() {
      int run = computeRuns + 1;
      Stage stage =
          new Stage(
              "compute #" + run,
              new ConstantFolder(),
              "Computing constants of Abstract-Syntax Tree (Run #" + run + ") succeed!",
              "Computing constants of Abstract-Syntax Tree error: ",
              true);
      return new Builder(stages.plus(stage), run);
    }

    public NormalizationPipeline build() {
      return new NormalizationPipeline(ImmutableList.copyOf(stages));
    }
  }
}
