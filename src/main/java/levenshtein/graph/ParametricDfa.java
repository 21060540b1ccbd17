package levenshtein.graph;

import levenshtein.Distance;
import levenshtein.DotGraph;
import levenshtein.util.Index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Deterministic parametric Levenshtein automaton.
 *
 * <p>This is the subset construction of a {@link LevenshteinNfa}, using
 * characteristic vectors as the alphabet. Since both the NFA and the vectors
 * are relative to a moving base offset, the resulting automaton works for every
 * query: a runtime state is a parametric state plus the base offset in the
 * query, and each transition says how far the base offset moves.
 *
 * <p>The number of parametric states depends only on the maximum distance and
 * on whether transpositions are counted as one edit. Once built, the tables
 * are never modified and can be shared freely between threads.
 */
public final class ParametricDfa implements ParametricTransitions, DotGraph<Integer, String> {

  /**
   * State with no configurations left. Every transition out of it loops back
   * with no offset change.
   */
  public static final int DEAD_STATE = 0;

  /**
   * State before any input is read.
   */
  public static final int INITIAL_STATE = 1;

  private final int maxDistance;
  private final boolean damerau;
  private final int width;
  private final int numVectors;

  /**
   * Packed transitions (see {@link ParametricTransitions#pack}), indexed by
   * {@code state * numVectors + vector}.
   */
  private final int[] transitions;

  /**
   * Distance outcomes indexed by {@code state * numColumns + remaining}, where
   * {@code remaining} is capped at {@code 3d+1}.
   */
  private final Distance[] distances;
  private final int numColumns;

  /**
   * Configurations behind each parametric state, indexed by state.
   */
  private final List<MultiState> multistates;

  private ParametricDfa(
    int maxDistance,
    boolean damerau,
    int width,
    int[] transitions,
    Distance[] distances,
    int numColumns,
    List<MultiState> multistates
  ) {
    this.maxDistance = maxDistance;
    this.damerau = damerau;
    this.width = width;
    this.numVectors = CharacteristicVector.count(width);
    this.transitions = transitions;
    this.distances = distances;
    this.numColumns = numColumns;
    this.multistates = multistates;
  }

  /**
   * Determinize a Levenshtein NFA.
   *
   * <p>States are explored breadth first. Each newly found multistate is
   * normalized and interned, so equivalent configuration sets found at different
   * base offsets collapse into one parametric state.
   *
   * @param nfa generic Levenshtein NFA
   * @param printDebugInfo print to STDERR a trace of the construction
   * @return parametric DFA
   */
  public static ParametricDfa fromNfa(LevenshteinNfa nfa, boolean printDebugInfo) {
    final long startNanos = System.nanoTime();
    final int width = nfa.characteristicVectorWidth();
    final int numVectors = CharacteristicVector.count(width);

    final var index = new Index<MultiState>();
    final var toVisit = new ArrayDeque<Integer>();
    final var rows = new ArrayList<int[]>();

    // The dead state and the initial state get fixed ids
    {
      final int dead = index.getOrAllocate(new MultiState().freeze());
      final MultiState initialStates = nfa.initialStates();
      initialStates.normalize();
      final int initial = index.getOrAllocate(initialStates.freeze());
      if (dead != DEAD_STATE || initial != INITIAL_STATE) {
        throw new IllegalStateException("Unexpected ids for the dead and initial states: " + dead + ", " + initial);
      }
      toVisit.addLast(dead);
      toVisit.addLast(initial);
    }

    // Ids are allocated in discovery order and visited first-in first-out, so
    // rows are filled in id order
    while (!toVisit.isEmpty()) {
      final int state = toVisit.removeFirst();
      final MultiState from = index.get(state);
      final int[] row = new int[numVectors];

      for (int vector = 0; vector < numVectors; vector++) {
        final MultiState to = nfa.transition(from, vector);
        final int offsetDelta = to.normalize();

        final int sizeBefore = index.size();
        final int target = index.getOrAllocate(to.freeze());
        if (target == sizeBefore) {
          toVisit.addLast(target);
          if (printDebugInfo) {
            System.err.println("[ParametricDfa] discovered state " + target + " = " + to);
          }
        }
        row[vector] = ParametricTransitions.pack(target, offsetDelta);
      }

      rows.add(row);
    }

    final int numStates = index.size();
    final int[] transitions = new int[tableSize(numStates, numVectors)];
    for (int state = 0; state < numStates; state++) {
      System.arraycopy(rows.get(state), 0, transitions, state * numVectors, numVectors);
    }

    // Distance outcomes, shared across the table
    final int maxDistance = nfa.maxDistance();
    final Distance[] outcomes = new Distance[maxDistance + 2];
    for (int d = 0; d <= maxDistance; d++) {
      outcomes[d] = Distance.exact(d);
    }
    outcomes[maxDistance + 1] = Distance.atLeast(maxDistance + 1);

    final int numColumns = 3 * maxDistance + 2;
    final Distance[] distances = new Distance[tableSize(numStates, numColumns)];
    final var multistates = new ArrayList<MultiState>(numStates);
    for (int state = 0; state < numStates; state++) {
      final MultiState multistate = index.get(state);
      multistates.add(multistate);
      for (int column = 0; column < numColumns; column++) {
        final Distance distance = nfa.multistateDistance(multistate, column);
        distances[state * numColumns + column] = outcomes[distance.toInt()];
      }
    }

    if (printDebugInfo) {
      final long elapsedMicros = (System.nanoTime() - startNanos) / 1000;
      System.err.println(
        "[ParametricDfa] built " + numStates + " states over " + numVectors + " vectors" +
        " (d=" + maxDistance + ", transpositions=" + nfa.damerau() + ") in " + elapsedMicros + "us"
      );
    }

    return new ParametricDfa(
      maxDistance,
      nfa.damerau(),
      width,
      transitions,
      distances,
      numColumns,
      Collections.unmodifiableList(multistates)
    );
  }

  /**
   * Number of cells in a table with one row per state.
   *
   * <p>Lookups index the tables with plain {@code int} arithmetic, which is
   * safe once the table has been allocated.
   *
   * @param numStates number of rows
   * @param rowLength number of cells per row
   * @return size of the table
   * @throws IllegalArgumentException if the table cannot fit in an array
   */
  static int tableSize(int numStates, int rowLength) {
    try {
      return Math.multiplyExact(numStates, rowLength);
    } catch (ArithmeticException overflow) {
      throw new IllegalArgumentException(
        "Parametric automaton is too large: " + numStates + " states with rows of " + rowLength,
        overflow
      );
    }
  }

  @Override
  public int transition(int state, int vector) {
    return transitions[state * numVectors + vector];
  }

  /**
   * Distance once the input ends.
   *
   * <p>The base offset of a walk never moves past the end of the query.
   * Configurations are at most {@code 2d} positions ahead of the base offset,
   * so with more than {@code 3d} characters remaining every state is out of
   * range.
   *
   * @param state parametric state
   * @param remaining query characters left after the base offset
   * @return distance outcome
   */
  public Distance distance(int state, int remaining) {
    final int column = Math.max(0, Math.min(remaining, numColumns - 1));
    return distances[state * numColumns + column];
  }

  public int numStates() {
    return multistates.size();
  }

  public int maxDistance() {
    return maxDistance;
  }

  public boolean damerau() {
    return damerau;
  }

  public int characteristicVectorWidth() {
    return width;
  }

  public int numVectors() {
    return numVectors;
  }

  /**
   * Configurations behind a parametric state.
   *
   * @param state parametric state
   * @return normalized multistate (frozen)
   */
  public MultiState multiState(int state) {
    return multistates.get(state);
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return IntStream
      .range(0, numStates())
      .mapToObj((int state) -> new DotGraph.Vertex<Integer>(state, distance(state, 0).isExact()));
  }

  /**
   * Transitions, with all the vectors leading to the same target and offset
   * delta merged into one edge.
   */
  @Override
  public Stream<DotGraph.Edge<Integer, String>> edges() {
    return IntStream
      .range(0, numStates())
      .boxed()
      .flatMap((Integer from) -> {
        final Map<Integer, List<String>> grouped = new TreeMap<>();
        for (int vector = 0; vector < numVectors; vector++) {
          grouped
            .computeIfAbsent(transition(from, vector), k -> new ArrayList<>())
            .add(CharacteristicVector.toString(vector, width));
        }
        return grouped
          .entrySet()
          .stream()
          .map(entry -> {
            final int packed = entry.getKey();
            final String label = String.join(" ", entry.getValue()) + " / +" + ParametricTransitions.offsetDelta(packed);
            return new DotGraph.Edge<>(from, ParametricTransitions.nextState(packed), label);
          });
      });
  }

  @Override
  public Integer initialVertex() {
    return INITIAL_STATE;
  }

  @Override
  public String renderVertexLabel(DotGraph.Vertex<Integer> vertex) {
    return vertex.id() + "<br/>" + multistates.get(vertex.id());
  }

  @Override
  public String toString() {
    return multistates
      .stream()
      .map(MultiState::toString)
      .collect(Collectors.joining(", ", "ParametricDfa(d=" + maxDistance + ", transpositions=" + damerau + ", states=[", "])"));
  }
}
