package parallelizer;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import parallelizer.ast.AstError;
import parallelizer.ast.Expression;
import parallelizer.equivalence.EquivalenceExplorer;
import parallelizer.normalize.NormalizationPipeline;
import parallelizer.normalize.PipelineResult;
import parallelizer.normalize.StageResult;
import parallelizer.pcs.PipelinedScheduler;
import parallelizer.pcs.SimulationResult;
import parallelizer.pcs.SystemConfiguration;
import parallelizer.report.Reporter;
import parallelizer.research.OptimizationReport;
import parallelizer.research.Researcher;

/**
 * Entry points for callers that already hold a validated tree.
 *
 * <p>The plain operations work on the tree they are given and throw {@link ParallelizerError}s.
 * The {@code *Report} operations first run the {@link NormalizationPipeline#standard() standard
 * normalization} and always return text, carrying the error message if something failed.
 */
public class Parallelizer {

  private Parallelizer() {}

  public static PipelineResult normalize(Expression expression) {
    return NormalizationPipeline.standard().run(expression);
  }

  /**
   * The tree after the last normalization stage that ran.
   *
   * @throws AstError raised by the first failing stage
   */
  public static Expression normalized(Expression expression) {
    PipelineResult result = normalize(expression);
    for (StageResult stage : result.stages) {
      Optional<AstError> error = stage.error();
      if (error.isPresent()) {
        throw error.get();
      }
    }
    return result.result().orElse(expression);
  }

  public static ImmutableList<Expression> findEquivalentForms(Expression expression) {
    return EquivalenceExplorer.findEquivalentForms(expression);
  }

  public static SimulationResult simulate(
      Expression expression, SystemConfiguration configuration) {
    return PipelinedScheduler.simulate(expression, configuration);
  }

  /** Simulates every equivalent form of {@code expression}, in the order they were found. */
  public static ImmutableList<OptimizationReport> research(
      Expression expression, SystemConfiguration configuration) {
    return new Researcher(configuration).run(findEquivalentForms(expression));
  }

  public static String normalizationReport(Expression expression) {
    return Reporter.normalization(normalize(expression));
  }

  public static String equivalentFormsReport(Expression expression) {
    PipelineResult normalization = normalize(expression);
    if (normalization.isFailed()) {
      return failure(normalization);
    }
    return Reporter.equivalentForms(findEquivalentForms(normalization.result().get()));
  }

  /** Leaves out the tick-by-tick log if {@link EnvVar#PZ_TRACE_TICKS} is set to "0". */
  public static String simulationReport(Expression expression, SystemConfiguration configuration) {
    PipelineResult normalization = normalize(expression);
    if (normalization.isFailed()) {
      return failure(normalization);
    }
    try {
      SimulationResult result = simulate(normalization.result().get(), configuration);
      return Reporter.simulation(result, !EnvVar.PZ_TRACE_TICKS.isSetToZero());
    } catch (ParallelizerError e) {
      return e.getMessage();
    }
  }

  public static String researchReport(Expression expression, SystemConfiguration configuration) {
    PipelineResult normalization = normalize(expression);
    if (normalization.isFailed()) {
      return failure(normalization);
    }
    try {
      return Reporter.research(research(normalization.result().get(), configuration));
    } catch (ParallelizerError e) {
      return e.getMessage();
    }
  }

  /** The message of the stage that failed. */
  private static String failure(PipelineResult normalization) {
    return normalization.stages.get(normalization.stages.size() - 1).message();
  }
}
