package io.brickmux.http.queries;

import io.brickmux.http.RequestUtils;
import io.brickmux.http.ResponseUtils;
import io.brickmux.mux.BrickMuxScheduler;
import io.brickmux.state.StateStoreException;
import io.brickmux.storage.StorageError.Reason;
import io.brickmux.util.LoggingUtils;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;

import javax.ws.rs.core.Response;

import java.util.Map;

/**
 * Reads and updates cluster-wide options.
 */
public class ClusterOptionQueries {

    private static final Logger LOGGER = LoggingUtils.getLogger(ClusterOptionQueries.class);

    private ClusterOptionQueries() {
        // do not instantiate
    }

    public static Response getOptions(BrickMuxScheduler scheduler) {
        try {
            return ResponseUtils.jsonOkResponse(new JSONObject(scheduler.getClusterOptions()));
        } catch (StateStoreException e) {
            LOGGER.error("Failed to fetch cluster options", e);
            return Response.serverError().build();
        }
    }

    /**
     * Stores the options in the payload, a JSON object of option name to value. Options which aren't listed are left
     * unchanged.
     */
    public static Response setOptions(BrickMuxScheduler scheduler, String payload) {
        final Map<String, String> options;
        try {
            options = RequestUtils.parseJsonStringMap(payload);
        } catch (JSONException e) {
            return ResponseUtils.badRequestResponse(String.format("Invalid options: %s", e.getMessage()));
        }
        try {
            scheduler.setClusterOptions(options);
            return ResponseUtils.jsonOkResponse(new JSONObject(scheduler.getClusterOptions()));
        } catch (StateStoreException e) {
            if (e.getReason() == Reason.LOGIC_ERROR) {
                return ResponseUtils.badRequestResponse(e.getMessage());
            }
            LOGGER.error("Failed to store cluster options", e);
            return Response.serverError().build();
        }
    }
}
