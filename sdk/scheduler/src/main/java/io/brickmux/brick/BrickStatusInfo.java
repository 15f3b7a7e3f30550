package io.brickmux.brick;

import org.json.JSONObject;

/**
 * Point-in-time status of a brick, as reported to callers.
 */
public final class BrickStatusInfo {

    private final BrickId id;
    private final BrickState state;
    private final long pid;
    private final int port;

    public BrickStatusInfo(BrickId id, BrickRuntime runtime) {
        this.id = id;
        this.state = runtime.getState();
        this.pid = runtime.getPid();
        this.port = runtime.getPort();
    }

    public BrickId getId() {
        return id;
    }

    public BrickState getState() {
        return state;
    }

    public boolean isOnline() {
        return state == BrickState.ONLINE;
    }

    /**
     * Returns the PID of the serving process, or zero if the brick is not online.
     */
    public long getPid() {
        return pid;
    }

    /**
     * Returns the port of the serving process, or zero if the brick is not online.
     */
    public int getPort() {
        return port;
    }

    public JSONObject toJSONObject() {
        JSONObject obj = new JSONObject();
        obj.put("brick", id.getName());
        obj.put("volume", id.getVolume());
        obj.put("peer", id.getPeer());
        obj.put("path", id.getPath());
        obj.put("state", state.toString());
        obj.put("online", isOnline());
        obj.put("pid", pid);
        obj.put("port", port);
        return obj;
    }

    @Override
    public String toString() {
        return String.format("%s: %s pid=%d port=%d", id, state, pid, port);
    }
}
