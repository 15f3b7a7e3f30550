package io.brickmux.http.endpoints;

import io.brickmux.http.queries.VolumeQueries;
import io.brickmux.mux.BrickMuxScheduler;

import javax.ws.rs.DELETE;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.PUT;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.Response;

/**
 * An API for defining volumes, starting and stopping their bricks, and reading brick status.
 */
@Path("/v1/volumes")
public class VolumesResource {

    private final BrickMuxScheduler scheduler;

    public VolumesResource(BrickMuxScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * @see VolumeQueries
     */
    @Path("/{volume}/bricks")
    @GET
    public Response getBricks(@PathParam("volume") String volume) {
        return VolumeQueries.getBricks(scheduler, volume);
    }

    /**
     * @see VolumeQueries
     */
    @Path("/{volume}/start")
    @POST
    public Response start(@PathParam("volume") String volume, @QueryParam("force") boolean force) {
        return VolumeQueries.start(scheduler, volume, force);
    }

    /**
     * @see VolumeQueries
     */
    @Path("/{volume}/stop")
    @POST
    public Response stop(@PathParam("volume") String volume) {
        return VolumeQueries.stop(scheduler, volume);
    }

    /**
     * @see VolumeQueries
     */
    @Path("/{volume}")
    @PUT
    public Response define(@PathParam("volume") String volume, String payload) {
        return VolumeQueries.define(scheduler, volume, payload);
    }

    /**
     * @see VolumeQueries
     */
    @Path("/{volume}")
    @DELETE
    public Response delete(@PathParam("volume") String volume) {
        return VolumeQueries.delete(scheduler, volume);
    }
}
