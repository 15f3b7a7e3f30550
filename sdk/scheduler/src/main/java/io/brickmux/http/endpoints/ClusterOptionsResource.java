package io.brickmux.http.endpoints;

import io.brickmux.http.queries.ClusterOptionQueries;
import io.brickmux.mux.BrickMuxScheduler;

import javax.ws.rs.GET;
import javax.ws.rs.PUT;
import javax.ws.rs.Path;
import javax.ws.rs.core.Response;

/**
 * An API for reading and updating cluster-wide options such as {@code cluster.brick-multiplex}.
 */
@Path("/v1/cluster/options")
public class ClusterOptionsResource {

    private final BrickMuxScheduler scheduler;

    public ClusterOptionsResource(BrickMuxScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GET
    public Response getOptions() {
        return ClusterOptionQueries.getOptions(scheduler);
    }

    @PUT
    public Response setOptions(String payload) {
        return ClusterOptionQueries.setOptions(scheduler, payload);
    }
}
