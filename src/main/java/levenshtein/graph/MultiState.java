package levenshtein.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Set of NFA states reached at the same point in the input.
 *
 * <p>The set is kept free of redundant states: adding a state which is implied
 * by one already present does nothing, and adding a state removes every
 * present state it implies. Once {@link #normalize()} has been called the
 * states are sorted and the smallest offset is {@code 0}, so two multistates
 * describing the same situation at different places in the query are equal.
 *
 * <p>Multistates are mutable until {@link #freeze()} is called, which happens
 * before they are interned into a {@link ParametricDfa}. Frozen multistates
 * reject every modification, so the parametric automaton can hand them out.
 */
public final class MultiState {

  private final ArrayList<NfaState> states = new ArrayList<>();
  private boolean frozen = false;

  public static MultiState of(NfaState... states) {
    final var multistate = new MultiState();
    for (NfaState state : states) {
      multistate.addState(state);
    }
    return multistate;
  }

  /**
   * Add a state, keeping the set free of redundant states.
   *
   * @param newState state to add
   */
  public void addState(NfaState newState) {
    checkNotFrozen();
    for (NfaState state : states) {
      if (state.implies(newState)) {
        return;
      }
    }
    states.removeIf(newState::implies);
    states.add(newState);
  }

  /**
   * Shift the states so the smallest offset is zero and sort them.
   *
   * @return amount by which the offsets were shifted ({@code 0} if empty)
   */
  public int normalize() {
    checkNotFrozen();
    final int minOffset = states
      .stream()
      .mapToInt(NfaState::offset)
      .min()
      .orElse(0);
    states.replaceAll(state -> state.shifted(minOffset));
    Collections.sort(states);
    return minOffset;
  }

  /**
   * Forbid any further modification.
   *
   * @return this multistate
   */
  public MultiState freeze() {
    frozen = true;
    return this;
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkNotFrozen() {
    if (frozen) {
      throw new IllegalStateException("Multistate " + this + " is frozen");
    }
  }

  public List<NfaState> states() {
    return Collections.unmodifiableList(states);
  }

  public boolean isEmpty() {
    return states.isEmpty();
  }

  @Override
  public int hashCode() {
    return states.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof MultiState)) {
      return false;
    } else {
      return states.equals(((MultiState) obj).states);
    }
  }

  @Override
  public String toString() {
    return states
      .stream()
      .map(NfaState::compactString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
