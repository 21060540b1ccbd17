package levenshtein.graph;

import levenshtein.Distance;

/**
 * Generic Levenshtein NFA for a maximum distance.
 *
 * <p>States are {@link NfaState} configurations whose offsets are relative, so
 * the automaton does not depend on any query: the query only shows up through
 * the characteristic vectors fed to {@link #transition}. A vector has one bit
 * for each of the {@code 2d+1} query characters starting at the base offset of
 * the multistate, which is enough to see every character a state may match or
 * skip over.
 *
 * <p>Construction of the parametric automaton grows exponentially with the
 * maximum distance. Anything above 5 is accepted but impractically slow.
 */
public final class LevenshteinNfa {

  /**
   * Largest supported distance: the number of characteristic vectors of
   * width {@code 2d+1} has to fit in an {@code int}.
   */
  public static final int MAX_DISTANCE = 14;

  private final int maxDistance;
  private final boolean damerau;

  /**
   * @param maxDistance largest number of edits tracked
   * @param damerau count adjacent transpositions as a single edit
   */
  public LevenshteinNfa(int maxDistance, boolean damerau) {
    if (maxDistance < 0 || maxDistance > MAX_DISTANCE) {
      throw new IllegalArgumentException(
        "Maximum distance must be between 0 and " + MAX_DISTANCE + ", got " + maxDistance
      );
    }
    this.maxDistance = maxDistance;
    this.damerau = damerau;
  }

  public int maxDistance() {
    return maxDistance;
  }

  public boolean damerau() {
    return damerau;
  }

  /**
   * Number of query characters covered by a characteristic vector.
   *
   * @return {@code 2d+1}
   */
  public int characteristicVectorWidth() {
    return 2 * maxDistance + 1;
  }

  /**
   * Configurations before any input is read.
   *
   * @return multistate containing only the start configuration
   */
  public MultiState initialStates() {
    return MultiState.of(new NfaState(0, 0, false));
  }

  /**
   * Read one input character.
   *
   * @param from configurations before reading the character
   * @param vector characteristic vector of the character at the base offset of {@code from}
   * @return configurations after reading the character (not normalized)
   */
  public MultiState transition(MultiState from, int vector) {
    final var to = new MultiState();
    for (NfaState state : from.states()) {
      transition(to, state, vector);
    }
    return to;
  }

  private void transition(MultiState to, NfaState state, int vector) {
    final int offset = state.offset();
    final int distance = state.distance();

    if (distance < maxDistance) {

      // Insertion of the input character
      to.addState(new NfaState(offset, distance + 1, false));

      // Substitution of the query character
      to.addState(new NfaState(offset + 1, distance + 1, false));

      // Deletion of some query characters, then a match
      for (int deleted = 1; deleted <= maxDistance - distance; deleted++) {
        if (isSet(vector, offset + deleted)) {
          to.addState(new NfaState(offset + deleted + 1, distance + deleted, false));
        }
      }

      // First half of a transposition: expect the current query character next
      if (damerau && isSet(vector, offset + 1)) {
        to.addState(new NfaState(offset, distance + 1, true));
      }
    }

    if (isSet(vector, offset)) {
      to.addState(new NfaState(offset + 1, distance, false));

      // Second half of a transposition (already paid for)
      if (state.inTranspose()) {
        to.addState(new NfaState(offset + 2, distance, false));
      }
    }
  }

  private static boolean isSet(int vector, int position) {
    return (vector & (1 << position)) != 0;
  }

  /**
   * Distance to the query once the input ends.
   *
   * <p>Any query characters left after a configuration's offset are deleted.
   * Configurations can be past the end of the query after substitutions at the
   * tail, in which case each extra position counts as an edit too.
   *
   * @param multistate configurations at the end of the input
   * @param remaining query characters left after the base offset of {@code multistate}
   * @return smallest distance, or the bound {@code d+1}
   */
  public Distance multistateDistance(MultiState multistate, int remaining) {
    int best = Integer.MAX_VALUE;
    for (NfaState state : multistate.states()) {
      best = Math.min(best, state.distance() + Math.abs(remaining - state.offset()));
    }
    return best <= maxDistance
      ? Distance.exact(best)
      : Distance.atLeast(maxDistance + 1);
  }
}
