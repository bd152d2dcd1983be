package parallelizer.equivalence;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parallelizer.ast.AstError;
import parallelizer.ast.Expression;
import parallelizer.normalize.Folder;
import parallelizer.normalize.Transformer;

/**
 * Collects the equivalence class of a tree under {@link DistributiveLaw} and {@link
 * AssociativeLaw}.
 *
 * <p>The search runs in two breadth-first phases. The first one expands brackets until it reaches
 * a form that can't be expanded anymore. That form is flattened by {@link Transformer} and {@link
 * Folder} and then seeds the second phase, which factors common terms back out. Every form is
 * reported once, identified by its canonical string, and the input is always the first form.
 */
public class EquivalenceExplorer {
  private static final Logger LOGGER = LoggerFactory.getLogger("EquivalenceExplorer");

  private final ImmutableList.Builder<Expression> forms = ImmutableList.builder();
  private final Worklist worklist = new Worklist();

  private EquivalenceExplorer() {}

  public static ImmutableList<Expression> findEquivalentForms(Expression expression) {
    return new EquivalenceExplorer().explore(expression);
  }

  private ImmutableList<Expression> explore(Expression expression) {
    worklist.offer(expression);
    forms.add(expression);

    Optional<Expression> fullyExpanded = expand();
    if (!fullyExpanded.isPresent()) {
      LOGGER.warn("No fully expanded form found, skipping factoring");
      return forms.build();
    }
    LOGGER.debug("Fully expanded form: " + fullyExpanded.get());
    factor(flatten(fullyExpanded.get()));
    return forms.build();
  }

  /** Returns the first form reached that offers no further expansion. */
  private Optional<Expression> expand() {
    Optional<Expression> fullyExpanded = Optional.empty();
    while (!worklist.isEmpty()) {
      Expression current = worklist.dequeue();
      ImmutableList<Expression> next = DistributiveLaw.singleStepExpansions(current);
      if (next.isEmpty() && !fullyExpanded.isPresent()) {
        fullyExpanded = Optional.of(current);
      }
      for (Expression expanded : next) {
        if (worklist.offer(expanded)) {
          forms.add(expanded);
        }
      }
    }
    return fullyExpanded;
  }

  private Expression flatten(Expression fullyExpanded) {
    Expression flat;
    try {
      flat = new Folder().normalize(new Transformer().normalize(fullyExpanded));
    } catch (AstError e) {
      LOGGER.warn("Failed to flatten " + fullyExpanded + ", factoring the unflattened form", e);
      return fullyExpanded;
    }
    if (worklist.markVisited(flat)) {
      forms.add(flat);
    }
    return flat;
  }

  /** Runs after {@link #expand()} has drained the work list; the seed may already be visited. */
  private void factor(Expression seed) {
    worklist.enqueue(seed);
    while (!worklist.isEmpty()) {
      Expression current = worklist.dequeue();
      for (Expression factored : AssociativeLaw.singleStepFactorings(current)) {
        if (worklist.offer(factored)) {
          forms.add(factored);
        }
      }
    }
  }
}
