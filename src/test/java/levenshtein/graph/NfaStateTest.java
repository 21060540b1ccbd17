package levenshtein.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

import org.junit.Test;

public class NfaStateTest {

  @Test
  public void testImpliesItself() {
    final var state = new NfaState(1, 1, false);
    assertThat(state.implies(state), is(true));

    final var transposing = new NfaState(1, 1, true);
    assertThat(transposing.implies(transposing), is(true));
  }

  @Test
  public void testImpliesCheaperNeighbours() {
    final var state = new NfaState(1, 0, false);
    assertThat(state.implies(new NfaState(0, 1, false)), is(true));
    assertThat(state.implies(new NfaState(2, 1, false)), is(true));
    assertThat(state.implies(new NfaState(3, 1, false)), is(false));
    assertThat(state.implies(new NfaState(3, 2, false)), is(true));

    // Implication only goes one way
    assertThat(new NfaState(0, 1, false).implies(state), is(false));
  }

  @Test
  public void testImpliesTransposing() {
    final var plain = new NfaState(0, 1, false);
    final var transposing = new NfaState(0, 1, true);

    // A pending transposition can do more than a plain state at equal cost
    assertThat(transposing.implies(plain), is(true));
    assertThat(plain.implies(transposing), is(false));

    // ... but a plain state with a spare edit covers it
    assertThat(new NfaState(0, 0, false).implies(transposing), is(true));
    assertThat(new NfaState(1, 0, false).implies(new NfaState(0, 1, true)), is(false));
    assertThat(new NfaState(1, 0, false).implies(new NfaState(0, 2, true)), is(true));
  }

  @Test
  public void testShifted() {
    assertThat(new NfaState(3, 1, true).shifted(2), is(new NfaState(1, 1, true)));
  }

  @Test
  public void testOrdering() {
    assertThat(new NfaState(0, 2, true).compareTo(new NfaState(1, 0, false)), lessThan(0));
    assertThat(new NfaState(1, 1, false).compareTo(new NfaState(1, 0, true)), greaterThan(0));
    assertThat(new NfaState(1, 1, false).compareTo(new NfaState(1, 1, true)), lessThan(0));
    assertThat(new NfaState(1, 1, true).compareTo(new NfaState(1, 1, true)), is(0));
  }

  @Test
  public void testCompactString() {
    assertThat(new NfaState(2, 1, false).compactString(), is("(2,1)"));
    assertThat(new NfaState(0, 1, true).compactString(), is("(0,1,T)"));
  }
}
