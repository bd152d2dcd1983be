package parallelizer.research;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Orders reports from fastest to slowest: lowest makespan, then highest efficiency. */
public class Ranking {

  public static final Comparator<OptimizationReport> BEST_FIRST =
      Comparator.<OptimizationReport>comparingInt(r -> r.result.tp)
          .thenComparing(
              Comparator.<OptimizationReport>comparingDouble(r -> r.result.efficiency).reversed())
          .thenComparingInt(r -> r.index);

  private Ranking() {}

  public static ImmutableList<OptimizationReport> ranked(List<OptimizationReport> reports) {
    return seq(reports).sorted(BEST_FIRST).collect(ImmutableList.toImmutableList());
  }

  public static Optional<OptimizationReport> best(List<OptimizationReport> reports) {
    return seq(reports).min(BEST_FIRST);
  }
}
