package ENFA;

import ENFA.Model.EpsilonNFA;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reachability analysis and pruning of states that cannot be entered from the start state.
 */
public class NFATrim {
    private static final Logger LOG = LoggerFactory.getLogger(NFATrim.class);

    /**
     * States reachable from the start state, following every symbol including epsilon.
     */
    public static IntSortedSet reachable(EpsilonNFA nfa) {
        final IntSortedSet reached = new IntRBTreeSet();
        final IntArrayList boundary = new IntArrayList();
        reached.add(nfa.getStart());
        boundary.push(nfa.getStart());

        while (!boundary.isEmpty()) {
            final int s = boundary.popInt();
            for (int next : nfa.getSuccessors(s)) {
                if (reached.add(next)) {
                    boundary.push(next);
                }
            }
        }
        return reached;
    }

    public static IntSortedSet unreachable(EpsilonNFA nfa) {
        final IntSortedSet unreachable = new IntRBTreeSet(nfa.getStates());
        unreachable.removeAll(reachable(nfa));
        return unreachable;
    }

    /**
     * Copy of nfa without its unreachable states, their accept flags and their outgoing transitions.
     * The argument is not modified.
     */
    public static EpsilonNFA prune(EpsilonNFA nfa) {
        final IntSortedSet unreachable = unreachable(nfa);
        final EpsilonNFA pruned = nfa.copy();
        if (!unreachable.isEmpty()) {
            pruned.removeStates(unreachable);
            LOG.debug("Pruned {} unreachable states, {} remain", unreachable.size(), pruned.size());
        }
        return pruned;
    }
}
