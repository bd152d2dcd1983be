package parallelizer.normalize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;
import static parallelizer.ast.Expressions.call;
import static parallelizer.ast.Expressions.div;
import static parallelizer.ast.Expressions.id;
import static parallelizer.ast.Expressions.minus;
import static parallelizer.ast.Expressions.mul;
import static parallelizer.ast.Expressions.neg;
import static parallelizer.ast.Expressions.num;
import static parallelizer.ast.Expressions.or;
import static parallelizer.ast.Expressions.plus;

import org.junit.Before;
import org.junit.Test;
import parallelizer.ast.AstError;
import parallelizer.ast.Expression;

public class ConstantFolderTest {

  private static final Expression A = id("a");
  private static final Expression B = id("b");

  private ConstantFolder folder;

  @Before
  public void setUp() {
    folder = new ConstantFolder();
  }

  @Test
  public void divisionChain_foldsToSingleNumber() throws Exception {
    Expression chain = num(5040);
    for (int divisor = 8; divisor >= 2; --divisor) {
      chain = div(chain, num(divisor));
    }
    assertThat(folder.normalize(chain), is(equalTo(num(0.125))));
  }

  @Test
  public void subtractionChain_foldsToSingleNumber() throws Exception {
    Expression chain = num(10);
    for (int subtrahend = 9; subtrahend >= 1; --subtrahend) {
      chain = minus(chain, num(subtrahend));
    }
    assertThat(folder.normalize(chain), is(equalTo(num(-35))));
  }

  @Test
  public void literalZeroDivisor_namesTheFirstOffendingDivision() throws Exception {
    // a*2/0 + b/(b+b*0-1*b) - 1/(c*2*4.76*(1-2+1))
    Expression offending = div(mul(A, num(2)), num(0));
    Expression second = div(B, minus(plus(B, mul(B, num(0))), mul(num(1), B)));
    Expression third =
        div(
            num(1),
            mul(
                mul(mul(id("c"), num(2)), num(4.76)),
                plus(minus(num(1), num(2)), num(1))));
    Expression input = minus(plus(offending, second), third);
    try {
      folder.normalize(input);
      fail("Expected a division by zero");
    } catch (AstError.DivisionByZero e) {
      assertThat(e.node, is(equalTo(offending)));
      assertThat(e.getMessage(), is(equalTo("Division by zero. Node: a * 2.00 / 0.00")));
    }
  }

  @Test(expected = AstError.DivisionByZero.class)
  public void divisorFoldingToZero_throws() throws Exception {
    folder.normalize(div(A, minus(num(3), num(3))));
  }

  @Test(expected = AstError.DivisionByZero.class)
  public void zeroDividedByZero_throws() throws Exception {
    folder.normalize(div(num(0), num(0)));
  }

  @Test
  public void additiveIdentities() throws Exception {
    assertThat(folder.normalize(plus(A, num(0))), is(equalTo(A)));
    assertThat(folder.normalize(plus(num(0), A)), is(equalTo(A)));
    assertThat(folder.normalize(minus(A, num(0))), is(equalTo(A)));
    assertThat(folder.normalize(minus(num(0), A)), is(equalTo(neg(A))));
    assertThat(folder.normalize(minus(A, A)), is(equalTo(num(0))));
  }

  @Test
  public void multiplicativeIdentities() throws Exception {
    assertThat(folder.normalize(mul(A, num(1))), is(equalTo(A)));
    assertThat(folder.normalize(mul(num(1), A)), is(equalTo(A)));
    assertThat(folder.normalize(div(A, num(1))), is(equalTo(A)));
    assertThat(folder.normalize(mul(A, num(0))), is(equalTo(num(0))));
    assertThat(folder.normalize(mul(num(0), A)), is(equalTo(num(0))));
    assertThat(folder.normalize(div(num(0), A)), is(equalTo(num(0))));
    assertThat(folder.normalize(div(plus(A, B), plus(A, B))), is(equalTo(num(1))));
  }

  @Test
  public void unaryMinus() throws Exception {
    assertThat(folder.normalize(neg(num(3))), is(equalTo(num(-3))));
    assertThat(folder.normalize(neg(minus(A, B))), is(equalTo(plus(neg(A), B))));
    assertThat(folder.normalize(minus(A, neg(B))), is(equalTo(plus(A, B))));
  }

  @Test
  public void trailingConstants_areReassociated() throws Exception {
    Expression input = plus(minus(mul(A, num(2)), num(5)), num(5));
    assertThat(folder.normalize(input), is(equalTo(mul(A, num(2)))));
    assertThat(folder.normalize(minus(plus(A, num(3)), num(1))), is(equalTo(plus(A, num(2)))));
  }

  @Test
  public void identitiesApplyOnlyAfterOperandsAreFolded() throws Exception {
    Expression input = plus(A, mul(B, minus(num(2), num(2))));
    assertThat(folder.normalize(input), is(equalTo(A)));
  }

  @Test
  public void nothingToFold_returnsEqualTree() throws Exception {
    Expression input = plus(mul(A, B), div(A, id("c")));
    assertThat(folder.normalize(input), is(equalTo(input)));
  }

  @Test
  public void foldsInsideLogicalOperatorsAndCalls() throws Exception {
    assertThat(folder.normalize(or(plus(num(1), num(2)), A)), is(equalTo(or(num(3), A))));
    assertThat(
        folder.normalize(call("f", plus(num(1), num(1)), A)), is(equalTo(call("f", num(2), A))));
  }

  @Test
  public void isSolved_onlyForNumbers() throws Exception {
    assertThat(ConstantFolder.isSolved(num(1)), is(true));
    assertThat(ConstantFolder.isSolved(A), is(false));
    assertThat(ConstantFolder.isSolved(neg(num(1))), is(false));
  }

  @Test
  public void notANumberOperand_reachesFixedPoint() throws Exception {
    Expression input = plus(A, num(Double.NaN));
    assertThat(folder.normalize(input), is(equalTo(input)));
  }
}
