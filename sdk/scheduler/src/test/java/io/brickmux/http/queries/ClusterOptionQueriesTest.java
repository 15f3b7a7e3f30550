package io.brickmux.http.queries;

import io.brickmux.mux.BrickMuxScheduler;
import io.brickmux.state.StateStoreException;
import io.brickmux.storage.StorageError.Reason;

import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import javax.ws.rs.core.Response;

import java.util.Collections;
import java.util.TreeMap;

import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ClusterOptionQueriesTest {

    @Mock private BrickMuxScheduler mockScheduler;

    @Before
    public void beforeEach() {
        MockitoAnnotations.initMocks(this);
    }

    @Test
    public void testGetOptions() {
        when(mockScheduler.getClusterOptions())
                .thenReturn(new TreeMap<>(Collections.singletonMap("cluster.brick-multiplex", "on")));
        Response response = ClusterOptionQueries.getOptions(mockScheduler);
        assertEquals(200, response.getStatus());
        JSONObject json = new JSONObject((String) response.getEntity());
        assertEquals("on", json.getString("cluster.brick-multiplex"));
    }

    @Test
    public void testGetOptionsFails() {
        when(mockScheduler.getClusterOptions()).thenThrow(new StateStoreException(Reason.STORAGE_ERROR, "hi"));
        assertEquals(500, ClusterOptionQueries.getOptions(mockScheduler).getStatus());
    }

    @Test
    public void testSetOptions() {
        when(mockScheduler.getClusterOptions())
                .thenReturn(new TreeMap<>(Collections.singletonMap("cluster.max-bricks-per-process", "4")));
        Response response = ClusterOptionQueries.setOptions(mockScheduler, "{\"cluster.max-bricks-per-process\": 4}");
        assertEquals(200, response.getStatus());
        verify(mockScheduler).setClusterOptions(Collections.singletonMap("cluster.max-bricks-per-process", "4"));
    }

    @Test
    public void testSetInvalidPayload() {
        assertEquals(400, ClusterOptionQueries.setOptions(mockScheduler, "{\"a\": null}").getStatus());
        verify(mockScheduler, never()).setClusterOptions(anyMap());
    }

    @Test
    public void testSetInvalidName() {
        doThrow(new StateStoreException(Reason.LOGIC_ERROR, "bad name"))
                .when(mockScheduler).setClusterOptions(anyMap());
        Response response = ClusterOptionQueries.setOptions(mockScheduler, "{\"a/b\": \"c\"}");
        assertEquals(400, response.getStatus());
        assertEquals("bad name", response.getEntity());
    }

    @Test
    public void testSetFails() {
        doThrow(new StateStoreException(Reason.STORAGE_ERROR, "hi"))
                .when(mockScheduler).setClusterOptions(anyMap());
        assertEquals(500, ClusterOptionQueries.setOptions(mockScheduler, "{\"a\": \"b\"}").getStatus());
    }
}
