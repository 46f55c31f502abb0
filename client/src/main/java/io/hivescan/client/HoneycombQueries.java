package io.hivescan.client;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hivescan.util.Assert;
import io.hivescan.util.Utils;

/**
 * Ready-made query specifications. Anything else is built by the caller as a JSON tree.
 */
public final class HoneycombQueries {

    private HoneycombQueries() {
    }

    /**
     * Counts events where the column is set, broken down by its value.
     *
     * @param columnId the column key
     * @param timeRangeSeconds how far back to look
     * @return the query specification
     */
    public static ObjectNode exists(String columnId, long timeRangeSeconds) {
        Assert.checkNotNullParam("columnId", columnId);
        ObjectNode query = Utils.OBJECT_MAPPER.createObjectNode();
        query.putArray("breakdowns").add(columnId);
        query.putArray("calculations").addObject().put("op", "COUNT");
        ArrayNode filters = query.putArray("filters");
        filters.addObject()
                .put("column", columnId)
                .put("op", "exists");
        query.put("time_range", timeRangeSeconds);
        return query;
    }

    /**
     * Averages the column over the time range.
     *
     * @param columnId the column key
     * @param timeRangeSeconds how far back to look
     * @return the query specification
     */
    public static ObjectNode average(String columnId, long timeRangeSeconds) {
        Assert.checkNotNullParam("columnId", columnId);
        ObjectNode query = Utils.OBJECT_MAPPER.createObjectNode();
        query.putArray("calculations").addObject()
                .put("op", "AVG")
                .put("column", columnId);
        query.put("time_range", timeRangeSeconds);
        return query;
    }
}
