package parallelizer.normalize;

import java.util.Optional;
import parallelizer.ast.AstError;
import parallelizer.ast.Expression;
import parallelizer.util.Either;

/** The outcome of one stage of a {@link NormalizationPipeline} run. */
public class StageResult {

  public final String stageName;
  private final String successMessage;
  private final String errorPrefix;
  private final Either<Expression, AstError> outcome;

  StageResult(
      String stageName,
      String successMessage,
      String errorPrefix,
      Either<Expression, AstError> outcome) {
    this.stageName = stageName;
    this.successMessage = successMessage;
    this.errorPrefix = errorPrefix;
    this.outcome = outcome;
  }

  public boolean isSuccess() {
    return outcome.s.isPresent();
  }

  public Optional<Expression> tree() {
    return outcome.s;
  }

  public Optional<AstError> error() {
    return outcome.t;
  }

  /** The success message, or the error prefix followed by the error's message. */
  public String message() {
    return outcome.fold(tree -> successMessage, error -> errorPrefix + error.getMessage());
  }

  @Override
  public String toString() {
    return stageName + ": " + message();
  }
}
