package io.brickmux.http.queries;

import io.brickmux.brick.BrickId;
import io.brickmux.brick.BrickStatusInfo;
import io.brickmux.http.RequestUtils;
import io.brickmux.http.ResponseUtils;
import io.brickmux.mux.BrickMuxScheduler;
import io.brickmux.mux.VolumeOperationResult;
import io.brickmux.state.StateStoreException;
import io.brickmux.storage.StorageError.Reason;
import io.brickmux.util.LoggingUtils;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;

import javax.ws.rs.core.Response;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Queries and actions against the bricks of a volume.
 */
public class VolumeQueries {

    private static final Logger LOGGER = LoggingUtils.getLogger(VolumeQueries.class);

    private static final String NOT_RECONCILED_MESSAGE = "Scheduler is still reconciling, try again later";

    private VolumeQueries() {
        // do not instantiate
    }

    /**
     * Produces the status of every brick in the volume.
     */
    public static Response getBricks(BrickMuxScheduler scheduler, String volume) {
        try {
            JSONArray bricks = new JSONArray();
            for (BrickStatusInfo status : scheduler.bricksStatus(volume)) {
                bricks.put(status.toJSONObject());
            }
            return ResponseUtils.jsonOkResponse(bricks);
        } catch (StateStoreException e) {
            return storeErrorResponse(e, volume, "fetch bricks of");
        }
    }

    /**
     * Starts every brick in the volume. Responds with 500 and the per-brick results if any brick failed.
     */
    public static Response start(BrickMuxScheduler scheduler, String volume, boolean force) {
        if (!scheduler.isReconciled()) {
            return ResponseUtils.conflictResponse(NOT_RECONCILED_MESSAGE);
        }
        try {
            return resultResponse(scheduler.startVolume(volume, force));
        } catch (StateStoreException e) {
            return storeErrorResponse(e, volume, "start");
        }
    }

    /**
     * Stops every brick in the volume. Responds with 500 and the per-brick results if any brick failed.
     */
    public static Response stop(BrickMuxScheduler scheduler, String volume) {
        if (!scheduler.isReconciled()) {
            return ResponseUtils.conflictResponse(NOT_RECONCILED_MESSAGE);
        }
        try {
            return resultResponse(scheduler.stopVolume(volume));
        } catch (StateStoreException e) {
            return storeErrorResponse(e, volume, "stop");
        }
    }

    /**
     * Stores a volume definition of the form:
     * <pre>
     * {"options": {"cluster.brick-multiplex": "on"}, "bricks": [{"peer": "peer-1", "path": "/bricks/b1"}]}
     * </pre>
     */
    public static Response define(BrickMuxScheduler scheduler, String volume, String payload) {
        final Map<String, String> options;
        final List<BrickId> bricks = new ArrayList<>();
        try {
            JSONObject obj = new JSONObject(payload);
            options = obj.has("options")
                    ? RequestUtils.toStringMap(obj.getJSONObject("options"))
                    : Collections.emptyMap();
            JSONArray bricksArray = obj.optJSONArray("bricks");
            if (bricksArray != null) {
                for (int i = 0; i < bricksArray.length(); ++i) {
                    JSONObject brickObj = bricksArray.getJSONObject(i);
                    BrickId brick = new BrickId(volume, brickObj.getString("peer"), brickObj.getString("path"));
                    // fails for paths which can't be stored
                    brick.getStorageName();
                    bricks.add(brick);
                }
            }
        } catch (JSONException | IllegalArgumentException e) {
            LOGGER.warn("Invalid definition for volume {}: {}", volume, e.getMessage());
            return ResponseUtils.badRequestResponse(String.format("Invalid volume definition: %s", e.getMessage()));
        }

        try {
            scheduler.defineVolume(volume, options, bricks);
        } catch (StateStoreException e) {
            return storeErrorResponse(e, volume, "define");
        }
        JSONObject response = new JSONObject();
        response.put("volume", volume);
        response.put("options", options);
        response.put("bricks", bricks.size());
        return ResponseUtils.jsonOkResponse(response);
    }

    /**
     * Stops the bricks of the volume and removes its definition.
     */
    public static Response delete(BrickMuxScheduler scheduler, String volume) {
        if (!scheduler.isReconciled()) {
            return ResponseUtils.conflictResponse(NOT_RECONCILED_MESSAGE);
        }
        try {
            return resultResponse(scheduler.deleteVolume(volume));
        } catch (StateStoreException e) {
            return storeErrorResponse(e, volume, "delete");
        }
    }

    private static Response resultResponse(VolumeOperationResult result) {
        return ResponseUtils.jsonResponse(
                result.toJSONObject(),
                result.isSuccess() ? Response.Status.OK : Response.Status.INTERNAL_SERVER_ERROR);
    }

    private static Response storeErrorResponse(StateStoreException e, String volume, String action) {
        if (e.getReason() == Reason.NOT_FOUND) {
            return ResponseUtils.notFoundResponse("Volume " + volume);
        }
        LOGGER.error(String.format("Failed to %s volume %s", action, volume), e);
        return Response.serverError().build();
    }
}
