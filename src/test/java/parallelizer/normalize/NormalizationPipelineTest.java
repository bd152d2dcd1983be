package parallelizer.normalize;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static parallelizer.ast.Expressions.div;
import static parallelizer.ast.Expressions.id;
import static parallelizer.ast.Expressions.minus;
import static parallelizer.ast.Expressions.mul;
import static parallelizer.ast.Expressions.neg;
import static parallelizer.ast.Expressions.num;
import static parallelizer.ast.Expressions.plus;

import org.junit.Test;
import parallelizer.ast.AstError;
import parallelizer.ast.Expression;

public class NormalizationPipelineTest {

  private static final Expression A = id("a");
  private static final Expression B = id("b");

  @Test
  public void standard_runsAllSevenStages() throws Exception {
    PipelineResult result = NormalizationPipeline.standard().run(minus(A, B));
    assertThat(result.stages.size(), is(7));
    assertThat(result.stages.get(0).stageName, is(equalTo("compute #1")));
    assertThat(result.stages.get(1).stageName, is(equalTo("transform")));
    assertThat(result.stages.get(3).stageName, is(equalTo("balance")));
    assertThat(result.stages.get(5).stageName, is(equalTo("fold")));
    assertThat(result.stages.get(6).stageName, is(equalTo("compute #4")));
    assertThat(result.isSolved(), is(false));
    assertThat(result.isFailed(), is(false));
  }

  @Test
  public void standard_foldsSubtractionBack() throws Exception {
    PipelineResult result = NormalizationPipeline.standard().run(minus(A, B));
    assertThat(result.stages.get(1).tree(), isPresentAndIs(plus(A, neg(B))));
    assertThat(result.result(), isPresentAndIs(minus(A, B)));
  }

  @Test
  public void standard_stageMessages() throws Exception {
    PipelineResult result = NormalizationPipeline.standard().run(mul(A, B));
    assertThat(
        result.stages.get(0).message(),
        is(equalTo("Computing constants of Abstract-Syntax Tree (Run #1) succeed!")));
    assertThat(
        result.stages.get(1).message(),
        is(equalTo("Transformed Abstract-Syntax Tree generation success!")));
    assertThat(
        result.stages.get(3).message(),
        is(equalTo("Balanced Abstract-Syntax Tree generation succeed!")));
    assertThat(
        result.stages.get(5).message(), is(equalTo("Folding Abstract-Syntax Tree success!")));
  }

  @Test
  public void constantTree_stopsAfterFirstCompute() throws Exception {
    Expression chain = num(5040);
    for (int divisor = 8; divisor >= 2; --divisor) {
      chain = div(chain, num(divisor));
    }
    PipelineResult result = NormalizationPipeline.standard().run(chain);
    assertThat(result.stages.size(), is(1));
    assertThat(result.isSolved(), is(true));
    assertThat(result.result(), isPresentAndIs(num(0.125)));
  }

  @Test
  public void divisionByZero_failsFirstStage() throws Exception {
    PipelineResult result = NormalizationPipeline.standard().run(div(mul(A, num(2)), num(0)));
    assertThat(result.stages.size(), is(1));
    assertThat(result.isFailed(), is(true));
    assertThat(result.result(), isEmpty());
    StageResult failed = result.stages.get(0);
    assertThat(failed.tree(), isEmpty());
    assertThat(
        failed.message(),
        startsWith("Computing constants of Abstract-Syntax Tree error: Division by zero"));
    assertThat(failed.error().get() instanceof AstError.DivisionByZero, is(true));
  }

  @Test
  public void customPipeline_runsGivenStagesOnly() throws Exception {
    NormalizationPipeline pipeline =
        new NormalizationPipeline.Builder()
            .add("transform", new Transformer(), "ok", "failed: ")
            .compute()
            .build();
    PipelineResult result = pipeline.run(minus(A, num(2)));
    assertThat(result.stages.size(), is(2));
    assertThat(result.stages.get(1).stageName, is(equalTo("compute #1")));
    assertThat(result.result(), isPresentAndIs(plus(A, num(-2))));
  }

  @Test
  public void solvedByLastStage_isNotReportedAsEarlyStop() throws Exception {
    NormalizationPipeline pipeline = new NormalizationPipeline.Builder().compute().build();
    PipelineResult result = pipeline.run(plus(num(1), num(2)));
    assertThat(result.isSolved(), is(false));
    assertThat(result.result(), isPresentAndIs(num(3)));
  }
}
