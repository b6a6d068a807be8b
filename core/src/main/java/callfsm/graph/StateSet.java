package callfsm.graph;

import java.util.Arrays;
import java.util.Collection;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Immutable set of automaton states, used as the identity of a merged state.
 *
 * <p>Two sets are equal exactly when they contain the same state indices.
 */
public final class StateSet {

  // Sorted and distinct elements
  private final int[] elements;

  public static StateSet of(int... elems) {
    return new StateSet(Arrays.stream(elems).boxed().collect(Collectors.toList()));
  }

  public StateSet(Collection<Integer> elems) {
    this.elements = new TreeSet<Integer>(elems).stream().mapToInt((Integer i) -> i.intValue()).toArray();
  }

  public IntStream stream() {
    return Arrays.stream(elements);
  }

  int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  boolean contains(int state) {
    return Arrays.binarySearch(elements, state) >= 0;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof StateSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((StateSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return Arrays
      .stream(elements)
      .mapToObj(Integer::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
