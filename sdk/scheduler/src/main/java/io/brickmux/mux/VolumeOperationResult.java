package io.brickmux.mux;

import io.brickmux.brick.BrickId;
import io.brickmux.brick.BrickRuntimeInfo;

import com.google.common.collect.ImmutableSortedMap;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-brick outcome of starting or stopping a volume. A failed brick doesn't undo the bricks which succeeded.
 */
public final class VolumeOperationResult {

    /**
     * Outcome for one brick: either the process now serving it (for starts), or an error.
     */
    public static final class BrickResult {
        private final Optional<BrickRuntimeInfo> runtimeInfo;
        private final Optional<String> error;

        private BrickResult(Optional<BrickRuntimeInfo> runtimeInfo, Optional<String> error) {
            this.runtimeInfo = runtimeInfo;
            this.error = error;
        }

        public static BrickResult started(BrickRuntimeInfo runtimeInfo) {
            return new BrickResult(Optional.of(runtimeInfo), Optional.empty());
        }

        public static BrickResult stopped() {
            return new BrickResult(Optional.empty(), Optional.empty());
        }

        public static BrickResult failed(String error) {
            return new BrickResult(Optional.empty(), Optional.of(error));
        }

        public boolean isSuccess() {
            return !error.isPresent();
        }

        public Optional<BrickRuntimeInfo> getRuntimeInfo() {
            return runtimeInfo;
        }

        public Optional<String> getError() {
            return error;
        }

        @Override
        public String toString() {
            if (error.isPresent()) {
                return "failed: " + error.get();
            }
            return runtimeInfo.isPresent() ? runtimeInfo.get().toString() : "stopped";
        }
    }

    private final String volume;
    private final Map<BrickId, BrickResult> results;

    public VolumeOperationResult(String volume, Map<BrickId, BrickResult> results) {
        this.volume = volume;
        this.results = ImmutableSortedMap.copyOf(new TreeMap<>(results));
    }

    public String getVolume() {
        return volume;
    }

    public Map<BrickId, BrickResult> getResults() {
        return results;
    }

    /**
     * Returns whether every brick of the volume succeeded.
     */
    public boolean isSuccess() {
        for (BrickResult result : results.values()) {
            if (!result.isSuccess()) {
                return false;
            }
        }
        return true;
    }

    public JSONObject toJSONObject() {
        JSONObject obj = new JSONObject();
        obj.put("volume", volume);
        obj.put("success", isSuccess());
        obj.put("bricks", new JSONArray());
        for (Map.Entry<BrickId, BrickResult> entry : results.entrySet()) {
            JSONObject brickObj = new JSONObject();
            brickObj.put("brick", entry.getKey().getName());
            brickObj.put("success", entry.getValue().isSuccess());
            if (entry.getValue().getRuntimeInfo().isPresent()) {
                brickObj.put("pid", entry.getValue().getRuntimeInfo().get().getPid());
                brickObj.put("port", entry.getValue().getRuntimeInfo().get().getPort());
            }
            if (entry.getValue().getError().isPresent()) {
                brickObj.put("error", entry.getValue().getError().get());
            }
            obj.append("bricks", brickObj);
        }
        return obj;
    }

    @Override
    public String toString() {
        return String.format("%s: %s", volume, results);
    }
}
