package parallelizer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static parallelizer.ast.Expressions.div;
import static parallelizer.ast.Expressions.id;
import static parallelizer.ast.Expressions.minus;
import static parallelizer.ast.Expressions.mul;
import static parallelizer.ast.Expressions.num;
import static parallelizer.ast.Expressions.plus;

import org.junit.Test;
import parallelizer.ast.AstError;
import parallelizer.ast.Expression;
import parallelizer.pcs.OperationType;
import parallelizer.pcs.SystemConfiguration;

public class ParallelizerTest {

  private static final Expression A = id("a");
  private static final Expression B = id("b");
  private static final Expression C = id("c");

  private static final Expression DIVISION_BY_ZERO = div(mul(A, num(2)), num(0));

  @Test
  public void normalized_returnsLastTree() throws Exception {
    assertThat(Parallelizer.normalized(minus(A, B)), is(equalTo(minus(A, B))));
    assertThat(Parallelizer.normalized(plus(num(1), num(2))), is(equalTo(num(3))));
  }

  @Test(expected = AstError.DivisionByZero.class)
  public void normalized_throwsStageError() throws Exception {
    Parallelizer.normalized(DIVISION_BY_ZERO);
  }

  @Test
  public void normalizationReport_carriesError() throws Exception {
    assertThat(
        Parallelizer.normalizationReport(DIVISION_BY_ZERO),
        startsWith("Computing constants of Abstract-Syntax Tree error: Division by zero"));
  }

  @Test
  public void equivalentFormsReport_ofNormalizedTree() throws Exception {
    String report = Parallelizer.equivalentFormsReport(mul(A, plus(B, C)));
    assertThat(report, startsWith("Found 1 equivalent forms!"));
    assertThat(report, containsString("1) a * b + a * c"));
  }

  @Test
  public void equivalentFormsReport_ofSolvedTree() throws Exception {
    String report = Parallelizer.equivalentFormsReport(plus(num(1), num(2)));
    assertThat(report, startsWith("Found 0 equivalent forms!"));
    assertThat(report, containsString("0) 3.00"));
  }

  @Test
  public void reports_stopAtNormalizationErrors() throws Exception {
    String expected =
        "Computing constants of Abstract-Syntax Tree error: "
            + "Division by zero. Node: a * 2.00 / 0.00";
    assertThat(Parallelizer.equivalentFormsReport(DIVISION_BY_ZERO), is(equalTo(expected)));
    assertThat(
        Parallelizer.simulationReport(DIVISION_BY_ZERO, SystemConfiguration.DEFAULT),
        is(equalTo(expected)));
    assertThat(
        Parallelizer.researchReport(DIVISION_BY_ZERO, SystemConfiguration.DEFAULT),
        is(equalTo(expected)));
  }

  @Test
  public void simulationReport_carriesSchedulingError() throws Exception {
    SystemConfiguration noMultiplier =
        SystemConfiguration.builder().units(OperationType.MUL, 0).build();
    assertThat(
        Parallelizer.simulationReport(mul(A, B), noMultiplier),
        is(equalTo("No MUL unit configured, but the expression needs one")));
  }

  @Test
  public void simulationReport_ofNormalizedTree() throws Exception {
    String report = Parallelizer.simulationReport(plus(A, mul(B, C)), SystemConfiguration.DEFAULT);
    assertThat(report, startsWith("Parallel Pipelined System Simulation"));
    assertThat(report, containsString("T1 (Seq): 3     | Tp (Par): 3     |"));
  }

  @Test
  public void researchReport_findsOptimalForm() throws Exception {
    String report = Parallelizer.researchReport(mul(A, plus(B, C)), SystemConfiguration.DEFAULT);
    assertThat(report, startsWith("Optimization Research"));
    assertThat(report, containsString("Optimal Form Found: ID #0"));
  }

  @Test
  public void research_simulatesEveryForm() throws Exception {
    assertThat(
        Parallelizer.research(mul(A, plus(B, C)), SystemConfiguration.DEFAULT).size(), is(2));
  }
}
