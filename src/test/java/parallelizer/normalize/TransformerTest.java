package parallelizer.normalize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static parallelizer.ast.Expressions.div;
import static parallelizer.ast.Expressions.id;
import static parallelizer.ast.Expressions.minus;
import static parallelizer.ast.Expressions.mul;
import static parallelizer.ast.Expressions.neg;
import static parallelizer.ast.Expressions.not;
import static parallelizer.ast.Expressions.plus;

import org.junit.Test;
import parallelizer.ast.Expression;

public class TransformerTest {

  private static final Expression A = id("a");
  private static final Expression B = id("b");
  private static final Expression C = id("c");
  private static final Expression D = id("d");

  private final Transformer transformer = new Transformer();

  @Test
  public void subtraction_becomesNegatedAddition() throws Exception {
    assertThat(transformer.normalize(minus(A, B)), is(equalTo(plus(A, neg(B)))));
  }

  @Test
  public void subtractedSum_negatesEverySummand() throws Exception {
    assertThat(
        transformer.normalize(minus(A, plus(B, C))), is(equalTo(plus(A, plus(neg(B), neg(C))))));
  }

  @Test
  public void subtractedDifference_cancelsInnerMinus() throws Exception {
    // a - (b - c) = a + ((-b) + c)
    assertThat(
        transformer.normalize(minus(A, minus(B, C))), is(equalTo(plus(A, plus(neg(B), C)))));
  }

  @Test
  public void doubleNegation_cancels() throws Exception {
    assertThat(transformer.normalize(neg(neg(A))), is(equalTo(A)));
    assertThat(transformer.normalize(minus(A, neg(B))), is(equalTo(plus(A, B))));
  }

  @Test
  public void negatedSum_isDistributed() throws Exception {
    assertThat(transformer.normalize(neg(plus(A, B))), is(equalTo(plus(neg(A), neg(B)))));
  }

  @Test
  public void divisionChain_becomesSingleDivisionByProduct() throws Exception {
    Expression input = div(div(div(A, B), C), D);
    assertThat(transformer.normalize(input), is(equalTo(div(A, mul(mul(B, C), D)))));
  }

  @Test
  public void singleDivision_keepsShape() throws Exception {
    assertThat(transformer.normalize(div(A, B)), is(equalTo(div(A, B))));
  }

  @Test
  public void divisionChain_operandsAreTransformed() throws Exception {
    Expression input = div(div(minus(A, B), C), minus(C, D));
    assertThat(
        transformer.normalize(input),
        is(equalTo(div(plus(A, neg(B)), mul(C, plus(C, neg(D)))))));
  }

  @Test
  public void logicalNegation_isKept() throws Exception {
    assertThat(transformer.normalize(not(minus(A, B))), is(equalTo(not(plus(A, neg(B))))));
  }
}
