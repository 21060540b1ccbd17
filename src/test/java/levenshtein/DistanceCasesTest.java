package levenshtein;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

/**
 * Runs the cases in {@code cases.txt} against both interpreted and compiled
 * automata.
 */
@RunWith(Parameterized.class)
public class DistanceCasesTest {

  private static final String CASES = "/levenshtein/cases.txt";

  private static final Map<String, LevenshteinAutomatonBuilder> BUILDERS = new ConcurrentHashMap<>();

  @Parameterized.Parameters(name = "{0} compiled={1}")
  public static Collection<Object[]> data() throws Exception {
    final List<Object[]> data = new ArrayList<>();
    try (var reader = new TestFileReader(CASES)) {
      reader.forEachTestCase(testCase -> {
        data.add(new Object[] { testCase, false });
        data.add(new Object[] { testCase, true });
      });
    }
    return data;
  }

  private final TestCase testCase;
  private final boolean compiled;

  public DistanceCasesTest(TestCase testCase, boolean compiled) {
    this.testCase = testCase;
    this.compiled = compiled;
  }

  private LevenshteinAutomatonBuilder builder() {
    final String key = testCase.maxDistance + "/" + testCase.transpositions + "/" + compiled;
    return BUILDERS.computeIfAbsent(
      key,
      k -> new LevenshteinAutomatonBuilder(testCase.maxDistance, testCase.transpositions, compiled, false)
    );
  }

  @Test
  public void testDistance() {
    final Dfa dfa = testCase.prefix
      ? builder().buildPrefixDfa(testCase.query)
      : builder().buildDfa(testCase.query);
    assertThat(testCase.getSummary(), dfa.eval(testCase.input), is(testCase.expected));
  }
}
