package parallelizer.equivalence;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.Size;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import java.util.HashSet;
import java.util.Set;
import org.junit.runner.RunWith;
import parallelizer.ast.Expression;
import parallelizer.ast.ExpressionGenerator;

@RunWith(JUnitQuickcheck.class)
public class EquivalenceExplorerPropertiesTest {

  @Property(trials = 100)
  public void formsAreUniqueAndStartWithInput(
      @From(ExpressionGenerator.class) @Size(max = 2) Expression expression) {
    ImmutableList<Expression> forms = EquivalenceExplorer.findEquivalentForms(expression);
    assertThat(forms.get(0), is(equalTo(expression)));
    Set<String> keys = new HashSet<>();
    for (Expression form : forms) {
      assertThat(form.toCanonicalString(), keys.add(form.toCanonicalString()), is(true));
    }
  }
}
