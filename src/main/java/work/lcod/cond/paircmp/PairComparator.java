package work.lcod.cond.paircmp;

import work.lcod.cond.request.PairList;
import work.lcod.cond.request.Request;

/**
 * Legacy comparator for virtual attributes.
 */
public interface PairComparator {
    /**
     * Checks every pair of {@code check} (value plus operator) against the request.
     *
     * @return 0 when all check pairs match, non-zero otherwise
     */
    int compare(Request request, PairList requestPairs, PairList check) throws PairCompareException;
}
