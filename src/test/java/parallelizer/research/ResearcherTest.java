package parallelizer.research;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.jooq.lambda.Seq.seq;
import static org.junit.Assert.fail;
import static parallelizer.ast.Expressions.id;
import static parallelizer.ast.Expressions.mul;
import static parallelizer.ast.Expressions.plus;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import parallelizer.ast.Expression;
import parallelizer.equivalence.EquivalenceExplorer;
import parallelizer.pcs.OperationType;
import parallelizer.pcs.SchedulingError;
import parallelizer.pcs.SystemConfiguration;

public class ResearcherTest {

  private static final Expression A = id("a");
  private static final Expression B = id("b");
  private static final Expression C = id("c");

  @Test
  public void reportsComeBackInFormOrder() throws Exception {
    ImmutableList<Expression> forms = EquivalenceExplorer.findEquivalentForms(mul(A, plus(B, C)));
    ImmutableList<OptimizationReport> reports =
        new Researcher(SystemConfiguration.DEFAULT, 4).run(forms);

    assertThat(reports.size(), is(2));
    assertThat(seq(reports).map(r -> r.index).toList(), is(equalTo(ImmutableList.of(0, 1))));
    assertThat(reports.get(0).form, is(equalTo(forms.get(0))));
    assertThat(reports.get(0).result.tp, is(3));
    assertThat(reports.get(0).result.t1, is(3));
    assertThat(reports.get(1).result.tp, is(4));
    assertThat(reports.get(1).result.t1, is(5));
    assertThat(Ranking.best(reports).get().index, is(0));
  }

  @Test
  public void singleWorker_givesSameReports() throws Exception {
    ImmutableList<Expression> forms = EquivalenceExplorer.findEquivalentForms(mul(A, plus(B, C)));
    ImmutableList<OptimizationReport> parallel =
        new Researcher(SystemConfiguration.DEFAULT, 8).run(forms);
    ImmutableList<OptimizationReport> sequential =
        new Researcher(SystemConfiguration.DEFAULT, 1).run(forms);
    assertThat(
        seq(parallel).map(OptimizationReport::toString).toList(),
        is(equalTo(seq(sequential).map(OptimizationReport::toString).toList())));
  }

  @Test
  public void noForms_noReports() throws Exception {
    assertThat(new Researcher(SystemConfiguration.DEFAULT, 2).run(ImmutableList.of()), is(empty()));
  }

  @Test
  public void schedulingErrors_arePropagated() throws Exception {
    SystemConfiguration noMultiplier =
        SystemConfiguration.builder().units(OperationType.MUL, 0).build();
    try {
      new Researcher(noMultiplier, 2).run(ImmutableList.of(plus(A, B), mul(A, B)));
      fail("Expected the product to be unschedulable");
    } catch (SchedulingError.Unschedulable e) {
      assertThat(e.type, is(OperationType.MUL));
    }
  }
}
