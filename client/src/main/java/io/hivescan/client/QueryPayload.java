package io.hivescan.client;

import java.util.List;

import io.hivescan.spec.QueryResultLinks;
import io.hivescan.spec.QueryResultRow;
import io.hivescan.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * What a poll of a query result produced.
 *
 * @param outcome whether the server finished the computation or the poll budget ran out
 * @param rows the result rows; empty when there were none or nothing was computed yet
 * @param links UI links of the result, if the server sent any
 * @param polls how many status checks were made
 */
public record QueryPayload(PollOutcome outcome, List<QueryResultRow> rows,
                           @Nullable QueryResultLinks links, int polls) {

    private static final QueryPayload EMPTY = new QueryPayload(PollOutcome.COMPLETE, List.of(), null, 0);

    public QueryPayload {
        Assert.checkNotNullParam("outcome", outcome);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /**
     * @return a completed payload without rows, used in place of a query that failed
     */
    public static QueryPayload empty() {
        return EMPTY;
    }

    public boolean isComplete() {
        return outcome == PollOutcome.COMPLETE;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
