package parallelizer.research;

import com.google.common.base.MoreObjects;
import parallelizer.ast.Expression;
import parallelizer.pcs.SimulationResult;

/** How one equivalent form performed on the researched machine. */
public class OptimizationReport {

  /** Position of the form in the equivalence class, 0 being the input. */
  public final int index;

  public final Expression form;
  public final String canonicalString;
  public final SimulationResult result;

  public OptimizationReport(int index, Expression form, SimulationResult result) {
    this.index = index;
    this.form = form;
    this.canonicalString = form.toCanonicalString();
    this.result = result;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("index", index)
        .add("form", canonicalString)
        .add("tp", result.tp)
        .add("efficiency", result.efficiency)
        .toString();
  }
}
