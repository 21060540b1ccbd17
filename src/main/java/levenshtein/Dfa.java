package levenshtein;

import levenshtein.graph.CharacteristicVector;
import levenshtein.graph.ParametricDfa;
import levenshtein.graph.ParametricTransitions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Levenshtein automaton for one query.
 *
 * <p>The automaton itself is immutable: the only thing that changes during a
 * walk is the {@link State} value, which the caller holds and passes back in.
 * Any number of walks can therefore share one automaton, on any number of
 * threads.
 *
 * <p>States are only meaningful for the automaton that produced them. Passing
 * a state from another automaton (another query, or another builder) is not
 * detected and gives unspecified results.
 *
 * <pre>{@code
 * final var builder = new LevenshteinAutomatonBuilder(2, true);
 * final Dfa dfa = builder.buildDfa("saucisson sec");
 *
 * Dfa.State state = dfa.initialState();
 * for (byte b : "saucissonsec".getBytes(StandardCharsets.UTF_8)) {
 *   state = dfa.transition(state, b);
 * }
 * dfa.distance(state); // Distance.exact(1)
 * }</pre>
 */
public final class Dfa implements DotGraph<Dfa.State, String> {

  /**
   * Position of a walk through the automaton.
   *
   * @param parametricState state in the shared parametric automaton
   * @param offset base offset in the query (in bytes)
   * @param closest smallest distance (capped at {@code d+1}) of any prefix of
   *   the input read so far, or {@link #UNTRACKED} outside of prefix automata
   */
  public record State(int parametricState, int offset, int closest) {

    /**
     * Marker for {@link #closest} in automata that measure the whole input.
     */
    public static final int UNTRACKED = Integer.MAX_VALUE;

    public State(int parametricState, int offset) {
      this(parametricState, offset, UNTRACKED);
    }

    @Override
    public String toString() {
      return parametricState + "@" + offset + (closest == UNTRACKED ? "" : "~" + closest);
    }
  }

  private final ParametricDfa parametricDfa;
  private final ParametricTransitions transitions;
  private final byte[] query;
  private final boolean prefix;
  private final int width;

  /**
   * @param parametricDfa shared tables
   * @param transitions transition function (the table itself, or compiled from it)
   * @param query query bytes (not copied)
   * @param prefix once a prefix of the input is within distance, stay there
   */
  Dfa(
    ParametricDfa parametricDfa,
    ParametricTransitions transitions,
    byte[] query,
    boolean prefix
  ) {
    this.parametricDfa = parametricDfa;
    this.transitions = transitions;
    this.query = query;
    this.prefix = prefix;
    this.width = parametricDfa.characteristicVectorWidth();
  }

  /**
   * State before any input is read.
   *
   * @return initial state
   */
  public State initialState() {
    if (!prefix) {
      return new State(ParametricDfa.INITIAL_STATE, 0);
    }
    final Distance empty = parametricDfa.distance(ParametricDfa.INITIAL_STATE, query.length);
    return new State(ParametricDfa.INITIAL_STATE, 0, empty.toInt());
  }

  /**
   * Read one byte of input.
   *
   * @param state state before the byte
   * @param inputByte next byte of input
   * @return state after the byte
   */
  public State transition(State state, byte inputByte) {
    // Dead states loop, and nothing beats a prefix matching exactly
    if (state.parametricState() == ParametricDfa.DEAD_STATE || state.closest() == 0) {
      return state;
    }

    final int vector = CharacteristicVector.of(query, state.offset(), width, inputByte);
    final int packed = transitions.transition(state.parametricState(), vector);
    final int next = ParametricTransitions.nextState(packed);
    final int offset = state.offset() + ParametricTransitions.offsetDelta(packed);
    if (!prefix) {
      return new State(next, offset);
    }

    // `AtLeast` reports `d+1`, so the minimum stays capped at the bound
    final int distance = parametricDfa.distance(next, query.length - offset).toInt();
    return new State(next, offset, Math.min(state.closest(), distance));
  }

  /**
   * Read several bytes of input, stopping early once the state can no longer
   * change.
   *
   * @param state state before the bytes
   * @param input next bytes of input
   * @return state after the bytes
   */
  public State transition(State state, byte[] input) {
    for (byte inputByte : input) {
      if (state.parametricState() == ParametricDfa.DEAD_STATE || state.closest() == 0) {
        break;
      }
      state = transition(state, inputByte);
    }
    return state;
  }

  /**
   * Distance between the query and the input read so far.
   *
   * <p>For a prefix automaton, this is the smallest distance between the query
   * and any prefix of the input (the empty prefix and the whole input
   * included).
   *
   * @param state state after reading the input
   * @return exact distance, or the lower bound {@code d+1}
   */
  public Distance distance(State state) {
    if (!prefix) {
      return parametricDfa.distance(state.parametricState(), query.length - state.offset());
    }
    final int maxDistance = parametricDfa.maxDistance();
    return state.closest() <= maxDistance
      ? Distance.exact(state.closest())
      : Distance.atLeast(maxDistance + 1);
  }

  /**
   * Can some continuation of the input read so far still match?
   *
   * <p>Once this is {@code false}, it stays {@code false} whatever comes next,
   * so an index walk can skip everything below the current node. In a prefix
   * automaton, an input with a prefix already within distance always matches.
   *
   * @param state state after reading the input
   * @return whether the state is alive
   */
  public boolean canMatch(State state) {
    return state.parametricState() != ParametricDfa.DEAD_STATE
      || state.closest() <= parametricDfa.maxDistance();
  }

  /**
   * Measure a whole input.
   *
   * @param input bytes to measure
   * @return distance between the query and the input
   */
  public Distance eval(byte[] input) {
    return distance(transition(initialState(), input));
  }

  /**
   * Measure a whole input, encoded as UTF-8.
   *
   * @param input text to measure
   * @return distance between the query and the UTF-8 bytes of the input
   */
  public Distance eval(CharSequence input) {
    return eval(input.toString().getBytes(StandardCharsets.UTF_8));
  }

  public boolean isPrefixAutomaton() {
    return prefix;
  }

  public int maxDistance() {
    return parametricDfa.maxDistance();
  }

  /**
   * Query this automaton measures against.
   *
   * @return copy of the query bytes
   */
  public byte[] query() {
    return Arrays.copyOf(query, query.length);
  }

  /**
   * Bytes that lead to distinct transitions: the bytes of the query, plus one
   * byte standing in for all the others (if the query does not use them all).
   */
  private List<Byte> representativeBytes() {
    final var used = new LinkedHashSet<Byte>();
    for (byte b : query) {
      used.add(b);
    }
    final var bytes = new ArrayList<Byte>(used);
    for (int b = 0; b < 256; b++) {
      if (!used.contains((byte) b)) {
        bytes.add((byte) b);
        break;
      }
    }
    return bytes;
  }

  private Set<State> reachableStates() {
    final var bytes = representativeBytes();
    final var seen = new LinkedHashSet<State>();
    final var toVisit = new ArrayDeque<State>();
    seen.add(initialState());
    toVisit.addLast(initialState());
    while (!toVisit.isEmpty()) {
      final State state = toVisit.removeFirst();
      for (byte b : bytes) {
        final State next = transition(state, b);
        if (seen.add(next)) {
          toVisit.addLast(next);
        }
      }
    }
    return seen;
  }

  @Override
  public Stream<DotGraph.Vertex<State>> vertices() {
    return reachableStates()
      .stream()
      .map(state -> new DotGraph.Vertex<>(state, distance(state).isExact()));
  }

  @Override
  public Stream<DotGraph.Edge<State, String>> edges() {
    final var bytes = representativeBytes();
    final var used = new LinkedHashSet<Byte>();
    for (byte b : query) {
      used.add(b);
    }
    return reachableStates()
      .stream()
      .flatMap(state -> bytes
        .stream()
        .map(b -> new DotGraph.Edge<>(state, transition(state, b), used.contains(b) ? byteLabel(b) : "*"))
      );
  }

  @Override
  public State initialVertex() {
    return initialState();
  }

  @Override
  public String renderVertexLabel(DotGraph.Vertex<State> vertex) {
    final Distance distance = distance(vertex.id());
    return vertex.id() + "<br/>" + (distance.isExact() ? "=" : "&ge;") + distance.toInt();
  }

  private static String byteLabel(byte b) {
    final int unsigned = b & 0xff;
    if (unsigned > 0x20 && unsigned < 0x7f) {
      return Character.toString((char) unsigned);
    } else {
      return String.format("\\x%02x", unsigned);
    }
  }

  @Override
  public String toString() {
    return "Dfa(" + new String(query, StandardCharsets.UTF_8) + ", d=" + maxDistance() + (prefix ? ", prefix" : "") + ")";
  }
}
