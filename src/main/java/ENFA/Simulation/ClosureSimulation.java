package ENFA.Simulation;

import ENFA.Model.EpsilonNFA;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

public class ClosureSimulation implements Simulator {
  @Override
  public boolean accepts(EpsilonNFA nfa, CharSequence input) {
    final EpsilonClosure closure = new EpsilonClosure(nfa);
    IntSet current = closure.of(nfa.getStart());

    for (int i = 0; i < input.length(); i++) {
      final char symbol = input.charAt(i);
      if (!nfa.containsSymbol(symbol)) {
        return false;
      }
      final IntSet moved = new IntOpenHashSet();
      for (int s : current) {
        moved.addAll(nfa.getTransitions(s, symbol));
      }
      if (moved.isEmpty()) {
        return false; // dead: no path can consume the rest
      }
      current = closure.of(moved);
    }

    for (int s : current) {
      if (nfa.isAccepting(s)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String getName() {
    return CLOSURE;
  }

  @Override
  public String toString() {
    return getName();
  }
}
