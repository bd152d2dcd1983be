package parallelizer.ast;

import static parallelizer.ast.Expressions.binary;
import static parallelizer.ast.Expressions.id;
import static parallelizer.ast.Expressions.neg;
import static parallelizer.ast.Expressions.num;

import com.google.common.collect.ImmutableList;
import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.generator.Size;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import parallelizer.ast.Expression.BinOp;

/**
 * Generates arithmetic trees over the identifiers {@code a} to {@code e} and small integer
 * literals. {@link Size#max()} bounds the height of the generated trees.
 */
public class ExpressionGenerator extends Generator<Expression> {

  private static final ImmutableList<String> NAMES = ImmutableList.of("a", "b", "c", "d", "e");
  private static final ImmutableList<BinOp> OPERATORS =
      ImmutableList.of(BinOp.PLUS, BinOp.MINUS, BinOp.MULTIPLY, BinOp.DIVIDE);

  private int maxHeight = 4;

  public ExpressionGenerator() {
    super(Expression.class);
  }

  public void configure(Size size) {
    maxHeight = size.max();
  }

  @Override
  public Expression generate(SourceOfRandomness random, GenerationStatus status) {
    return genExpression(random, maxHeight);
  }

  private Expression genExpression(SourceOfRandomness random, int height) {
    if (height <= 0 || random.nextDouble() < 0.2) {
      return genOperand(random);
    }
    if (random.nextDouble() < 0.1) {
      return neg(genExpression(random, height - 1));
    }
    return binary(
        random.choose(OPERATORS),
        genExpression(random, height - 1),
        genExpression(random, height - 1));
  }

  private Expression genOperand(SourceOfRandomness random) {
    if (random.nextDouble() < 0.8) {
      return id(random.choose(NAMES));
    }
    return num(random.nextInt(1, 9));
  }
}
