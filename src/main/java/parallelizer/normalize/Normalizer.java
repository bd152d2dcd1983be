package parallelizer.normalize;

import parallelizer.ast.AstError;
import parallelizer.ast.Expression;

public interface Normalizer {

  /**
   * Rewrites the given tree into a new one. The argument is left untouched.
   *
   * @param expression the tree to rewrite
   * @return the rewritten tree, which is equal to the argument if nothing applied
   * @throws AstError if the rewrite is undefined for the tree
   */
  Expression normalize(Expression expression);
}
