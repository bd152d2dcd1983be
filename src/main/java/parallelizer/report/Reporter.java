package parallelizer.report;

import static org.jooq.lambda.Seq.seq;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import parallelizer.ast.Expression;
import parallelizer.normalize.PipelineResult;
import parallelizer.normalize.StageResult;
import parallelizer.pcs.ProcessorConfiguration;
import parallelizer.pcs.ScheduledTask;
import parallelizer.pcs.SimulationResult;
import parallelizer.pcs.SystemConfiguration;
import parallelizer.pcs.TickLog;
import parallelizer.pcs.TimeConfiguration;
import parallelizer.research.OptimizationReport;
import parallelizer.research.Ranking;

/** Renders results as plain text for humans. The layout is not meant to be parsed. */
public class Reporter {

  static final String RULE = Strings.repeat("-", 100);
  private static final Joiner LINES = Joiner.on(System.lineSeparator());

  private final List<String> lines = new ArrayList<>();

  private Reporter() {}

  private Reporter line(String line) {
    lines.add(line);
    return this;
  }

  private Reporter line(String format, Object... args) {
    return line(String.format(Locale.ROOT, format, args));
  }

  private Reporter blank() {
    return line("");
  }

  private Reporter outline(Expression tree) {
    // the outline brings its own line breaks
    String outline = tree.prettyPrint();
    return line(outline.substring(0, outline.length() - System.lineSeparator().length()));
  }

  private String build() {
    return LINES.join(lines);
  }

  /** Every stage's message followed by the outline of the tree it produced. */
  public static String normalization(PipelineResult result) {
    Reporter out = new Reporter();
    for (StageResult stage : result.stages) {
      out.line(stage.message());
      Optional<Expression> tree = stage.tree();
      if (tree.isPresent()) {
        out.blank().outline(tree.get());
      }
      out.blank();
    }
    if (result.isSolved()) {
      out.line(PipelineResult.SOLVED_MESSAGE);
    }
    return out.build();
  }

  /** The numbered forms, 0 being the input form. */
  public static String equivalentForms(List<Expression> forms) {
    Reporter out = new Reporter();
    out.line("Found %d equivalent forms!", Math.max(0, forms.size() - 1)).blank();
    for (int i = 0; i < forms.size(); ++i) {
      out.line("%d) %s", i, forms.get(i).toPrettyString());
      if (i == 0) {
        out.blank();
      }
    }
    return out.build();
  }

  public static String simulation(SimulationResult result, boolean withTicks) {
    Reporter out = new Reporter();
    ProcessorConfiguration units = result.configuration.processors;
    TimeConfiguration time = result.configuration.time;
    out.line("Parallel Pipelined System Simulation")
        .line(RULE)
        .line(
            "Configuration: ADD: %d (%dt), SUB: %d (%dt), MUL: %d (%dt), DIV: %d (%dt)",
            units.add, time.add, units.sub, time.sub, units.mul, time.mul, units.div, time.div)
        .line(RULE)
        .line(
            "T1 (Seq): %-5d | Tp (Par): %-5d | Speedup: %.4f | Efficiency: %.4f",
            result.t1, result.tp, result.speedup, result.efficiency)
        .line(RULE)
        .line("%-12s | %-8s | %-8s | %-40s", "Processor", "Start", "End", "Operation")
        .line(RULE);
    for (ScheduledTask task : result.byStart()) {
      if (!task.type().needsUnit()) {
        continue;
      }
      out.line(
          "%-12s | %-8d | %-8d | %-40s", task.unitName(), task.start, task.end, task.task.label);
    }
    if (!withTicks) {
      return out.build();
    }

    out.blank().line("Detailed Pipeline Log (Tick-by-Tick):").line(RULE);
    for (TickLog log : result.tickLogs) {
      if (log.isIdle()) {
        continue;
      }
      out.line("Tick %02d:", log.tick + 1);
      if (!log.readyQueue.isEmpty()) {
        String queue = seq(log.readyQueue).map(l -> "\"" + l + "\"").toString(", ");
        out.line("  Ready Queue: [%s]", queue);
      }
      for (Map.Entry<String, String> unit : log.unitStates.entrySet()) {
        out.line("  %-10s: %s", unit.getKey(), unit.getValue());
      }
      out.blank();
    }
    return out.build();
  }

  /** The metrics of every form and the best one according to {@link Ranking}. */
  public static String research(List<OptimizationReport> reports) {
    Reporter out = new Reporter();
    out.line("Optimization Research")
        .line("Goal: Find the optimal parallel form for the given architecture.")
        .line(RULE);
    Optional<OptimizationReport> best = Ranking.best(reports);
    if (!best.isPresent()) {
      return out.line("No optimization results available.").build();
    }

    SystemConfiguration configuration = reports.get(0).result.configuration;
    ProcessorConfiguration units = configuration.processors;
    TimeConfiguration time = configuration.time;
    out.line(
            "System Config: Add(%d), Sub(%d), Mul(%d), Div(%d) | Costs: A=%d, S=%d, M=%d, D=%d",
            units.add, units.sub, units.mul, units.div, time.add, time.sub, time.mul, time.div)
        .line(RULE)
        .line(
            "%-4s | %-40s | %-5s | %-5s | %-8s | %-8s",
            "ID", "Form (Snippet)", "T1", "Tp", "Kp (Spd)", "Ep (Eff)")
        .line(RULE);
    for (OptimizationReport report : reports) {
      SimulationResult result = report.result;
      out.line(
          "%-4d | %-40s | %-5d | %-5d | %-8.4f | %-8.4f",
          report.index,
          snippet(report.canonicalString),
          result.t1,
          result.tp,
          result.speedup,
          result.efficiency);
    }
    out.line(RULE).blank();

    SimulationResult optimum = best.get().result;
    return out.line("Optimal Form Found: ID #%d", best.get().index)
        .line("Expression: %s", best.get().canonicalString)
        .line(
            "Metrics: T1 = %d, Tp = %d ticks, Speedup = %.4f, Efficiency = %.4f",
            optimum.t1, optimum.tp, optimum.speedup, optimum.efficiency)
        .build();
  }

  static String snippet(String form) {
    return form.length() > 37 ? form.substring(0, 37) + "..." : form;
  }
}
