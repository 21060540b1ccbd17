package levenshtein.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interns values into dense integer identifiers.
 *
 * <p>Identifiers are handed out in first-seen order, starting at {@code 0}.
 * Structurally equal values (according to {@code equals} and
 * {@code hashCode}) get the same identifier. An identifier is never reused or
 * invalidated while the index is alive.
 *
 * <p>Values put in the index must not be mutated afterwards.
 *
 * @param <T> interned values
 */
public final class Index<T> {

  private final Map<T, Integer> ids = new HashMap<>();
  private final List<T> values = new ArrayList<>();

  /**
   * Look up the identifier of a value, allocating a fresh one if the value has
   * never been seen.
   *
   * @param value value to intern
   * @return identifier of the value
   */
  public int getOrAllocate(T value) {
    final Integer existing = ids.get(value);
    if (existing != null) {
      return existing;
    }
    final int fresh = values.size();
    ids.put(value, fresh);
    values.add(value);
    return fresh;
  }

  /**
   * Value associated with an identifier.
   *
   * @param id identifier previously returned by {@link #getOrAllocate}
   * @return interned value
   */
  public T get(int id) {
    return values.get(id);
  }

  /**
   * Number of distinct values interned so far.
   *
   * <p>This is also the next identifier that will be allocated.
   *
   * @return number of values
   */
  public int size() {
    return values.size();
  }
}
