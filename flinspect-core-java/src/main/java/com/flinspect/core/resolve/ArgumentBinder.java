package com.flinspect.core.resolve;

import com.flinspect.core.model.ActualArgument;
import com.flinspect.core.model.ArgumentDescriptor;
import com.flinspect.core.model.ExpressionDescriptor;
import com.flinspect.core.model.Rank;

import java.util.List;

/**
 * Tests one candidate's dummy arguments against a call's actual arguments: arity, then
 * keyword/positional binding, then type and rank of every bound pair. Information that is
 * unknown on either side never rejects a candidate.
 */
final class ArgumentBinder {

    private ArgumentBinder() {}

    static boolean accepts(List<ArgumentDescriptor> dummies, List<ActualArgument> actuals,
                           List<ExpressionDescriptor> descriptors) {
        int total = dummies.size();
        int required = 0;
        for (ArgumentDescriptor d : dummies) {
            if (!d.optional()) required++;
        }
        int given = actuals.size();
        if (given < required || given > total) return false;

        int[] binding = bind(dummies, actuals);
        if (binding == null) return false;

        for (int i = 0; i < given; i++) {
            ArgumentDescriptor dummy = dummies.get(binding[i]);
            ExpressionDescriptor actual = descriptors.get(i);
            if (!dummy.type().matches(ExpressionDescriber.typeOf(actual))) return false;
            if (!Rank.matches(dummy.rank(), ExpressionDescriber.rankOf(actual))) return false;
        }
        return true;
    }

    /**
     * Dummy index bound to each actual, or null if a keyword names no dummy or one already bound.
     * Positional actuals take the next unbound dummy in declaration order.
     */
    static int[] bind(List<ArgumentDescriptor> dummies, List<ActualArgument> actuals) {
        boolean[] taken = new boolean[dummies.size()];
        int[] binding = new int[actuals.size()];
        int next = 0;
        for (int i = 0; i < actuals.size(); i++) {
            ActualArgument actual = actuals.get(i);
            int index;
            if (actual.hasKeyword()) {
                index = indexOf(dummies, actual.keyword());
                if (index < 0 || taken[index]) return null;
            } else {
                while (next < dummies.size() && taken[next]) next++;
                if (next >= dummies.size()) return null;
                index = next;
            }
            taken[index] = true;
            binding[i] = index;
        }
        return binding;
    }

    private static int indexOf(List<ArgumentDescriptor> dummies, String name) {
        for (int i = 0; i < dummies.size(); i++) {
            if (dummies.get(i).name().equals(name)) return i;
        }
        return -1;
    }
}
