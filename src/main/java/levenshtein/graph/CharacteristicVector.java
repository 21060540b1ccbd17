package levenshtein.graph;

/**
 * Characteristic vectors: the finite alphabet of the parametric automaton.
 *
 * <p>Instead of reading bytes, the parametric automaton reads which of the
 * next few query characters are equal to the byte. Bit {@code i} of the vector
 * is set when the character {@code i} positions after the current offset
 * matches. Positions past the end of the query never match.
 */
public final class CharacteristicVector {

  private CharacteristicVector() { }

  /**
   * Compute the characteristic vector of a byte against a window of the query.
   *
   * @param query full query
   * @param offset start of the window in the query
   * @param width number of query positions examined
   * @param inputByte byte being read
   * @return bitmask of matching positions in the window
   */
  public static int of(byte[] query, int offset, int width, byte inputByte) {
    final int end = Math.min(query.length, offset + width);
    int vector = 0;
    for (int i = offset; i < end; i++) {
      if (query[i] == inputByte) {
        vector |= 1 << (i - offset);
      }
    }
    return vector;
  }

  /**
   * Number of distinct characteristic vectors of some width.
   *
   * @param width number of query positions examined
   * @return size of the alphabet
   */
  public static int count(int width) {
    return 1 << width;
  }

  /**
   * Render a vector with the first query position on the left.
   *
   * @param vector characteristic vector
   * @param width number of query positions examined
   * @return string of {@code 0} and {@code 1}
   */
  public static String toString(int vector, int width) {
    final var builder = new StringBuilder(width);
    for (int i = 0; i < width; i++) {
      builder.append((vector & (1 << i)) != 0 ? '1' : '0');
    }
    return builder.toString();
  }
}
