package levenshtein.graph;

/**
 * Edit configuration in the Levenshtein NFA.
 *
 * <p>The offset is relative to the base offset of the enclosing
 * {@link MultiState}, so the same configuration describes the same situation
 * for every query.
 *
 * @param offset number of query characters matched, relative to the base offset
 * @param distance number of edits used so far
 * @param inTranspose the last input character was the first half of a transposition
 */
public record NfaState(
  int offset,
  int distance,
  boolean inTranspose
) implements Comparable<NfaState> {

  /**
   * Whether this state makes the other one redundant.
   *
   * <p>Every string that can still be accepted from {@code other} can also be
   * accepted from this state, using no more edits. A state waiting on a
   * transposition can do everything a plain state can, so going the other way
   * requires one spare edit.
   *
   * @param other state which might be redundant
   * @return whether {@code other} is subsumed by this state
   */
  public boolean implies(NfaState other) {
    final int deltaOffset = Math.abs(offset - other.offset);
    if (inTranspose || !other.inTranspose) {
      return distance + deltaOffset <= other.distance;
    } else {
      return distance + deltaOffset < other.distance;
    }
  }

  /**
   * Same configuration, moved back by some number of query characters.
   *
   * @param delta how many characters to subtract from the offset
   * @return shifted state
   */
  public NfaState shifted(int delta) {
    return new NfaState(offset - delta, distance, inTranspose);
  }

  @Override
  public int compareTo(NfaState other) {
    if (offset != other.offset) {
      return Integer.compare(offset, other.offset);
    } else if (distance != other.distance) {
      return Integer.compare(distance, other.distance);
    } else {
      return Boolean.compare(inTranspose, other.inTranspose);
    }
  }

  public String compactString() {
    return "(" + offset + "," + distance + (inTranspose ? ",T" : "") + ")";
  }
}
