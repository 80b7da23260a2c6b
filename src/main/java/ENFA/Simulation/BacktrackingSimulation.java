package ENFA.Simulation;

import ENFA.Model.EpsilonNFA;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

public class BacktrackingSimulation implements Simulator {
  /**
   * Exhaustive search on an explicit stack. A (state, position) pair is expanded at most once,
   * which bounds the search by |states| * (|input| + 1) and cuts epsilon cycles.
   */
  @Override
  public boolean accepts(EpsilonNFA nfa, CharSequence input) {
    final int length = input.length();
    final Deque<IntIntPair> stack = new ArrayDeque<>();
    final Set<IntIntPair> visited = new HashSet<>();
    visit(new IntIntImmutablePair(nfa.getStart(), 0), stack, visited);

    while (!stack.isEmpty()) {
      final IntIntPair curr = stack.pop();
      final int state = curr.leftInt();
      final int position = curr.rightInt();

      if (position == length && nfa.isAccepting(state)) {
        return true;
      }
      for (int next : nfa.getEpsilonTransitions(state)) {
        visit(new IntIntImmutablePair(next, position), stack, visited);
      }
      if (position < length) {
        final char symbol = input.charAt(position);
        if (nfa.containsSymbol(symbol)) {
          for (int next : nfa.getTransitions(state, symbol)) {
            visit(new IntIntImmutablePair(next, position + 1), stack, visited);
          }
        }
      }
    }
    return false;
  }

  private static void visit(IntIntPair pair, Deque<IntIntPair> stack, Set<IntIntPair> visited) {
    if (visited.add(pair)) {
      stack.push(pair);
    }
  }

  @Override
  public String getName() {
    return BACKTRACK;
  }

  @Override
  public String toString() {
    return getName();
  }
}
