package parallelizer.equivalence;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.NoSuchElementException;
import java.util.Set;
import parallelizer.ast.Expression;

/** A FIFO queue of trees that admits every canonical form at most once over its lifetime. */
class Worklist {
  /** Canonical strings of every tree ever offered, so a form is never enqueued twice. */
  private final Set<String> visited;

  private final Deque<Expression> queue;

  Worklist() {
    queue = new ArrayDeque<>();
    visited = new HashSet<>();
  }

  /**
   * Marks {@code expression} as seen and enqueues it, unless its canonical form was seen before.
   *
   * @return true if the tree is new
   */
  boolean offer(Expression expression) {
    if (!markVisited(expression)) {
      return false;
    }
    queue.addLast(expression);
    return true;
  }

  /** Records the canonical form without enqueueing the tree. Returns true if it was new. */
  boolean markVisited(Expression expression) {
    return visited.add(expression.toCanonicalString());
  }

  /** Enqueues a tree regardless of whether it was seen before. */
  void enqueue(Expression expression) {
    queue.addLast(expression);
  }

  /**
   * Dequeues the next item of the work list.
   *
   * @throws NoSuchElementException if this work list is empty
   */
  Expression dequeue() {
    return queue.removeFirst();
  }

  /** Returns true if this work list contains no elements. */
  boolean isEmpty() {
    return queue.isEmpty();
  }
}
