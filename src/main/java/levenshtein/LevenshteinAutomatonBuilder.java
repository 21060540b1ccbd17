package levenshtein;

import levenshtein.codegen.CompiledTransitions;
import levenshtein.graph.LevenshteinNfa;
import levenshtein.graph.ParametricDfa;
import levenshtein.graph.ParametricTransitions;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Builder for Levenshtein automata.
 *
 * <p>The constructor does all the expensive work: it determinizes the generic
 * Levenshtein NFA for the requested maximum distance into a parametric
 * automaton whose size does not depend on any query. Building the automaton
 * for a particular query afterwards is cheap (linear in the query length) and
 * the resulting automata share the builder's tables.
 *
 * <p>Construction takes microseconds for {@code d = 1}, a few milliseconds for
 * {@code d = 2}, and grows exponentially from there. Distances above 5 are
 * accepted but rarely worth the wait (and the memory).
 *
 * <p>A builder is immutable and can be shared between threads without any
 * synchronization.
 */
public final class LevenshteinAutomatonBuilder {

  private final ParametricDfa parametricDfa;
  private final ParametricTransitions transitions;

  /**
   * Create a builder whose automata use the interpreted transition table.
   *
   * @param maxDistance maximum distance measured by the automata
   * @param transpositionCostOne count swapping two adjacent bytes as one edit
   */
  public LevenshteinAutomatonBuilder(int maxDistance, boolean transpositionCostOne) {
    this(maxDistance, transpositionCostOne, false, false);
  }

  /**
   * Create a builder.
   *
   * @param maxDistance maximum distance measured by the automata
   * @param transpositionCostOne count swapping two adjacent bytes as one edit
   * @param compiled compile the transition table into bytecode
   * @param printDebugInfo print to STDERR a trace of the construction
   */
  public LevenshteinAutomatonBuilder(
    int maxDistance,
    boolean transpositionCostOne,
    boolean compiled,
    boolean printDebugInfo
  ) {
    final var nfa = new LevenshteinNfa(maxDistance, transpositionCostOne);
    this.parametricDfa = ParametricDfa.fromNfa(nfa, printDebugInfo);
    this.transitions = compiled
      ? CompiledTransitions.compile(parametricDfa, printDebugInfo)
      : parametricDfa;
  }

  /**
   * Build an automaton measuring the distance to {@code query}.
   *
   * <p>The automaton has at most {@code C * (query.length + 1)} reachable
   * states, where {@code C} is {@link #parametricStateCount()}.
   *
   * @param query bytes to measure against (copied)
   * @return automaton for the query
   */
  public Dfa buildDfa(byte[] query) {
    return new Dfa(parametricDfa, transitions, Arrays.copyOf(query, query.length), false);
  }

  /**
   * Build an automaton measuring the distance to the UTF-8 encoding of
   * {@code query}.
   *
   * @param query text to measure against
   * @return automaton for the query
   */
  public Dfa buildDfa(String query) {
    return buildDfa(query.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Build an automaton matching inputs that start with something close to
   * {@code query}.
   *
   * <p>The automaton reports the smallest distance between the query and any
   * prefix of the input, so an input which starts with the query is at
   * distance {@code 0}. Once some prefix is within the maximum distance, the
   * input can always match.
   *
   * @param query bytes to measure against (copied)
   * @return prefix automaton for the query
   */
  public Dfa buildPrefixDfa(byte[] query) {
    return new Dfa(parametricDfa, transitions, Arrays.copyOf(query, query.length), true);
  }

  /**
   * Build a prefix automaton for the UTF-8 encoding of {@code query}.
   *
   * @param query text to measure against
   * @return prefix automaton for the query
   */
  public Dfa buildPrefixDfa(String query) {
    return buildPrefixDfa(query.getBytes(StandardCharsets.UTF_8));
  }

  public ParametricDfa parametricDfa() {
    return parametricDfa;
  }

  public int maxDistance() {
    return parametricDfa.maxDistance();
  }

  public boolean transpositionCostOne() {
    return parametricDfa.damerau();
  }

  /**
   * Whether automata from this builder use bytecode-compiled transitions.
   */
  public boolean isCompiled() {
    return transitions != parametricDfa;
  }

  /**
   * Number of parametric states, which is the same for every query.
   *
   * @return size of the parametric automaton
   */
  public int parametricStateCount() {
    return parametricDfa.numStates();
  }
}
