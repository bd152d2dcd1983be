package parallelizer.normalize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.InRange;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import java.util.ArrayList;
import java.util.List;
import org.junit.runner.RunWith;
import parallelizer.ast.Expression;
import parallelizer.ast.Expression.BinOp;
import parallelizer.ast.ExpressionGenerator;
import parallelizer.ast.Expressions;

@RunWith(JUnitQuickcheck.class)
public class BalancerPropertiesTest {

  private static List<Expression> identifiers(int n) {
    List<Expression> operands = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      operands.add(Expressions.id("x" + i));
    }
    return operands;
  }

  @Property
  public void balancedChainHasMinimalHeight(@InRange(minInt = 1, maxInt = 200) int n) {
    Expression tree = Chains.buildBalancedTree(identifiers(n), BinOp.PLUS);
    int expected = 32 - Integer.numberOfLeadingZeros(n - 1);
    assertThat(Expressions.height(tree), is(expected));
  }

  @Property
  public void balancedChainKeepsOperandOrder(@InRange(minInt = 1, maxInt = 200) int n) {
    List<Expression> operands = identifiers(n);
    Expression tree = Chains.buildBalancedTree(operands, BinOp.MULTIPLY);
    assertThat(Chains.collectOperands(tree, BinOp.MULTIPLY), is(equalTo(operands)));
  }

  @Property(trials = 300)
  public void balancingIsIdempotent(@From(ExpressionGenerator.class) Expression expression) {
    Balancer balancer = new Balancer();
    Expression once = balancer.normalize(expression);
    assertThat(balancer.normalize(once), is(equalTo(once)));
  }
}
