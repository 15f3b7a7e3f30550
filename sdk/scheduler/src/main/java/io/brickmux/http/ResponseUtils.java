package io.brickmux.http;

import org.json.JSONArray;
import org.json.JSONObject;

import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

/**
 * Utilities for building RPC responses.
 */
public final class ResponseUtils {

    private ResponseUtils() {
        // do not instantiate
    }

    /**
     * Returns a 200 OK response containing the provided {@link JSONArray}.
     */
    public static Response jsonOkResponse(JSONArray jsonArray) {
        return jsonResponse(jsonArray, Response.Status.OK);
    }

    /**
     * Returns a 200 OK response containing the provided {@link JSONObject}.
     */
    public static Response jsonOkResponse(JSONObject jsonObject) {
        return jsonResponse(jsonObject, Response.Status.OK);
    }

    public static Response jsonResponse(JSONArray jsonArray, Response.Status status) {
        return Response.status(status).entity(jsonArray.toString(2)).type(MediaType.APPLICATION_JSON_TYPE).build();
    }

    public static Response jsonResponse(JSONObject jsonObject, Response.Status status) {
        return Response.status(status).entity(jsonObject.toString(2)).type(MediaType.APPLICATION_JSON_TYPE).build();
    }

    /**
     * Returns a response containing the provided plaintext {@link String} with the
     * provided status {@link Response.Status}.
     */
    public static Response plainResponse(String plaintext, Response.Status status) {
        return Response.status(status).entity(plaintext).type(MediaType.TEXT_PLAIN_TYPE).build();
    }

    /**
     * Returns a "404 [itemType] not found" response.
     */
    public static Response notFoundResponse(String itemType) {
        return plainResponse(itemType + " not found", Response.Status.NOT_FOUND);
    }

    /**
     * Returns a "409 Conflict" response, for requests which can't be handled in the current scheduler state.
     */
    public static Response conflictResponse(String message) {
        return plainResponse(message, Response.Status.CONFLICT);
    }

    /**
     * Returns a "400 Bad Request" response describing what was wrong with the request.
     */
    public static Response badRequestResponse(String message) {
        return plainResponse(message, Response.Status.BAD_REQUEST);
    }
}
