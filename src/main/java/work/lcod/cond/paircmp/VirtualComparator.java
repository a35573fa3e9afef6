package work.lcod.cond.paircmp;

import work.lcod.cond.request.Pair;
import work.lcod.cond.request.Request;

/**
 * Callback answering a comparison against one virtual attribute; returns 0 on match.
 */
@FunctionalInterface
public interface VirtualComparator {
    int compare(Request request, Pair check) throws PairCompareException;
}
