package ENFA.Simulation;

import ENFA.Model.EpsilonNFA;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.util.HashMap;
import java.util.Map;

/**
 * Epsilon-closures of the states of one automaton, cached per state.
 * The automaton must not be mutated while an instance is in use.
 */
public final class EpsilonClosure {
  private static final int LARGE_NFA = 1000;
  private static final int INITIAL_CAPACITY = 1_000;
  private static final long MAX_CACHED_CLOSURES = 100_000;

  private final EpsilonNFA nfa;
  private final Map<Integer, IntSet> closures;

  public EpsilonClosure(EpsilonNFA nfa) {
    this.nfa = nfa;
    if (nfa.size() < LARGE_NFA) {
      closures = new HashMap<>();
    } else {
      // Upper bound on cache size; each closure may hold up to nfa.size() states.
      final Cache<Integer, IntSet> closureCache = Caffeine.newBuilder()
          .initialCapacity(INITIAL_CAPACITY)
          .maximumSize(MAX_CACHED_CLOSURES)
          .build();
      closures = closureCache.asMap();
    }
  }

  /**
   * States reachable from state through zero or more epsilon transitions, state included.
   */
  public IntSet of(int state) {
    IntSet closure = closures.get(state);
    if (closure == null) {
      closure = IntSets.unmodifiable(compute(state));
      closures.put(state, closure);
    }
    return closure;
  }

  /**
   * Union of the closures of states.
   */
  public IntSet of(IntCollection states) {
    final IntSet result = new IntOpenHashSet();
    for (int s : states) {
      if (!result.contains(s)) {
        result.addAll(of(s));
      }
    }
    return result;
  }

  // Worklist with a visited set, so epsilon cycles terminate
  private IntSet compute(int state) {
    final IntSet visited = new IntOpenHashSet();
    final IntArrayList worklist = new IntArrayList();
    visited.add(state);
    worklist.push(state);
    while (!worklist.isEmpty()) {
      final int s = worklist.popInt();
      for (int next : nfa.getEpsilonTransitions(s)) {
        if (visited.add(next)) {
          worklist.push(next);
        }
      }
    }
    return visited;
  }
}
