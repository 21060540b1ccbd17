package levenshtein;

/**
 * Outcome of measuring a string against a Levenshtein automaton.
 *
 * <p>The automaton only counts edits up to its maximum distance, so beyond that
 * all it can report is a lower bound. Exceeding the bound is an ordinary
 * outcome, not an error.
 */
public interface Distance {

  /**
   * Exact distance if known, otherwise the lower bound.
   *
   * @return number of edits
   */
  public int toInt();

  /**
   * Is the distance known exactly?
   *
   * @return whether this is an {@link Exact} distance
   */
  public boolean isExact();

  public static Distance exact(int distance) {
    return new Exact(distance);
  }

  public static Distance atLeast(int distance) {
    return new AtLeast(distance);
  }

  /**
   * Edit distance known to be exactly {@code distance}.
   *
   * @param distance number of edits
   */
  record Exact(int distance) implements Distance {

    public Exact {
      if (distance < 0) {
        throw new IllegalArgumentException("Distance cannot be negative: " + distance);
      }
    }

    @Override
    public int toInt() {
      return distance;
    }

    @Override
    public boolean isExact() {
      return true;
    }
  }

  /**
   * Edit distance is {@code distance} or more.
   *
   * @param distance lower bound on the number of edits
   */
  record AtLeast(int distance) implements Distance {

    public AtLeast {
      if (distance < 0) {
        throw new IllegalArgumentException("Distance cannot be negative: " + distance);
      }
    }

    @Override
    public int toInt() {
      return distance;
    }

    @Override
    public boolean isExact() {
      return false;
    }
  }
}
