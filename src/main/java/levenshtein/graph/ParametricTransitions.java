package levenshtein.graph;

/**
 * Transition function of a parametric automaton.
 *
 * <p>A transition produces two small numbers: the next parametric state and
 * how far the base offset in the query moves. Both are packed into a single
 * {@code int} so the hot path does one lookup (or one call) per input byte.
 */
public interface ParametricTransitions {

  /**
   * Look up a transition.
   *
   * @param state parametric state
   * @param vector characteristic vector of the input byte
   * @return packed next state and offset delta (see {@link #pack})
   */
  public int transition(int state, int vector);

  // Offset deltas are at most {@code 2d+1}, which fits comfortably in a byte
  static final int DELTA_BITS = 8;
  static final int DELTA_MASK = (1 << DELTA_BITS) - 1;

  public static int pack(int nextState, int offsetDelta) {
    return (nextState << DELTA_BITS) | offsetDelta;
  }

  public static int nextState(int packed) {
    return packed >>> DELTA_BITS;
  }

  public static int offsetDelta(int packed) {
    return packed & DELTA_MASK;
  }
}
