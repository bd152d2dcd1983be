package parallelizer.research;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import org.jooq.lambda.tuple.Tuple2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parallelizer.EnvVar;
import parallelizer.ParallelizerError;
import parallelizer.ast.Expression;
import parallelizer.pcs.PipelinedScheduler;
import parallelizer.pcs.SystemConfiguration;

/**
 * Simulates every form of an equivalence class on the same machine. The simulations are
 * independent of each other, so they run on a thread pool; the reports come back in the order of
 * the forms.
 */
public class Researcher {
  private static final Logger LOGGER = LoggerFactory.getLogger("Researcher");

  private final SystemConfiguration configuration;
  private final int workers;

  public Researcher(SystemConfiguration configuration, int workers) {
    this.configuration = configuration;
    this.workers = workers;
  }

  /** Uses {@link EnvVar#PZ_WORKERS} threads. */
  public Researcher(SystemConfiguration configuration) {
    this(configuration, EnvVar.PZ_WORKERS.intValue(Runtime.getRuntime().availableProcessors()));
  }

  public ImmutableList<OptimizationReport> run(List<Expression> forms) {
    if (forms.isEmpty()) {
      return ImmutableList.of();
    }
    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(Math.max(1, Math.min(workers, forms.size()))));
    try {
      List<ListenableFuture<OptimizationReport>> futures =
          seq(forms)
              .zipWithIndex()
              .map(form -> executor.submit(() -> simulate(form)))
              .toList();
      ImmutableList<OptimizationReport> reports =
          ImmutableList.copyOf(Futures.allAsList(futures).get());
      Ranking.best(reports)
          .ifPresent(best -> LOGGER.debug("Optimal form #" + best.index + ": " + best.form));
      return reports;
    } catch (ExecutionException e) {
      if (e.getCause() instanceof ParallelizerError) {
        throw (ParallelizerError) e.getCause();
      }
      throw new ParallelizerError("Simulating an equivalent form failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ParallelizerError("Interrupted while simulating equivalent forms", e);
    } finally {
      executor.shutdownNow();
    }
  }

  private OptimizationReport simulate(Tuple2<Expression, Long> form) {
    return new OptimizationReport(
        form.v2.intValue(), form.v1, PipelinedScheduler.simulate(form.v1, configuration));
  }
}
