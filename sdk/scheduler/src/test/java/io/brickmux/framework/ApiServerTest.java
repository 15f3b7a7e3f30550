package io.brickmux.framework;

import org.apache.http.HttpResponse;
import org.apache.http.client.fluent.Executor;
import org.apache.http.client.fluent.Request;
import org.apache.http.entity.ContentType;
import org.apache.http.util.EntityUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import io.brickmux.http.endpoints.ClusterOptionsResource;
import io.brickmux.http.endpoints.VolumesResource;
import io.brickmux.mux.BrickMuxScheduler;
import io.brickmux.storage.MemPersister;
import io.brickmux.testutils.FakeBrickServers;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the scheduler API over HTTP, against in-memory brick servers.
 */
public class ApiServerTest {
    private static final int SHORT_TIMEOUT_MILLIS = 100;
    private static final int LONG_TIMEOUT_MILLIS = 30000;

    private final Executor executor = Executor.newInstance();
    private FakeBrickServers servers;
    private BrickMuxScheduler scheduler;
    private ApiServer server;
    private URI uri;

    @Before
    public void beforeEach() throws Exception {
        servers = new FakeBrickServers();
        scheduler = BrickMuxScheduler.newBuilder(MemPersister.newBuilder().setExitOnDeadlock(false).build(), servers)
                .setProcessInspector(servers)
                .setProcessWatcher(servers)
                .setServiceClient(servers)
                .setStopGracePeriod(Duration.ZERO)
                .setPortRange(56000, 56999)
                .setExitOnDeadlock(false)
                .build();

        Listener listener = new Listener();
        server = ApiServer.start(
                BrickMuxConfig.fromEnvStore(EnvStore.fromMap(Collections.singletonMap("API_PORT", "0"))),
                Arrays.asList(new VolumesResource(scheduler), new ClusterOptionsResource(scheduler)),
                listener);
        listener.waitForStarted();
        uri = server.getURI();
    }

    @After
    public void afterEach() throws Exception {
        server.stop();
        scheduler.shutdown();
    }

    private HttpResponse send(Request request) throws Exception {
        return executor.execute(request).returnResponse();
    }

    private String url(String path) {
        return String.format("http://%s:%d%s", uri.getHost(), uri.getPort(), path);
    }

    private static String body(HttpResponse response) throws Exception {
        return EntityUtils.toString(response.getEntity());
    }

    @Test
    public void testVolumeLifecycle() throws Exception {
        HttpResponse response = send(Request.Post(url("/v1/volumes/v1/start")));
        Assert.assertEquals(409, response.getStatusLine().getStatusCode());
        scheduler.reconcile();

        response = send(Request.Put(url("/v1/cluster/options"))
                .bodyString("{\"cluster.brick-multiplex\": \"on\"}", ContentType.APPLICATION_JSON));
        Assert.assertEquals(200, response.getStatusLine().getStatusCode());
        Assert.assertEquals("on", new JSONObject(body(response)).getString("cluster.brick-multiplex"));

        for (String volume : Arrays.asList("v1", "v2")) {
            response = send(Request.Put(url("/v1/volumes/" + volume)).bodyString(
                    "{\"bricks\": [{\"peer\": \"peer-1\", \"path\": \"/bricks/" + volume + "/b1\"}, "
                            + "{\"peer\": \"peer-1\", \"path\": \"/bricks/" + volume + "/b2\"}]}",
                    ContentType.APPLICATION_JSON));
            Assert.assertEquals(200, response.getStatusLine().getStatusCode());
            response = send(Request.Post(url("/v1/volumes/" + volume + "/start")));
            Assert.assertEquals(body(response), 200, response.getStatusLine().getStatusCode());
        }

        response = send(Request.Get(url("/v1/volumes/v2/bricks")));
        Assert.assertEquals(200, response.getStatusLine().getStatusCode());
        JSONArray bricks = new JSONArray(body(response));
        Assert.assertEquals(2, bricks.length());
        long pid = bricks.getJSONObject(0).getLong("pid");
        Assert.assertTrue(bricks.getJSONObject(0).getBoolean("online"));
        Assert.assertEquals(pid, bricks.getJSONObject(1).getLong("pid"));
        Assert.assertEquals(1, servers.getLaunchCount());

        response = send(Request.Post(url("/v1/volumes/v1/start?force=true")));
        Assert.assertEquals(200, response.getStatusLine().getStatusCode());
        Assert.assertEquals(1, servers.getLaunchCount());

        response = send(Request.Delete(url("/v1/volumes/v2")));
        Assert.assertEquals(200, response.getStatusLine().getStatusCode());
        response = send(Request.Get(url("/v1/volumes/v2/bricks")));
        Assert.assertEquals(404, response.getStatusLine().getStatusCode());

        response = send(Request.Post(url("/v1/volumes/v1/stop")));
        Assert.assertEquals(200, response.getStatusLine().getStatusCode());
        Assert.assertEquals(0, servers.getRunningCount());
    }

    @Test
    public void testBadRequests() throws Exception {
        HttpResponse response = send(Request.Put(url("/v1/volumes/v1"))
                .bodyString("{\"bricks\": [{}]}", ContentType.APPLICATION_JSON));
        Assert.assertEquals(400, response.getStatusLine().getStatusCode());

        response = send(Request.Put(url("/v1/cluster/options"))
                .bodyString("[1, 2]", ContentType.APPLICATION_JSON));
        Assert.assertEquals(400, response.getStatusLine().getStatusCode());

        response = send(Request.Get(url("/v1/volumes/missing/bricks")));
        Assert.assertEquals(404, response.getStatusLine().getStatusCode());
    }

    private static class Listener implements Runnable {
        private final AtomicBoolean apiServerStarted = new AtomicBoolean(false);

        @Override
        public void run() {
            apiServerStarted.set(true);
        }

        private void waitForStarted() {
            int maxSleepCount = LONG_TIMEOUT_MILLIS / SHORT_TIMEOUT_MILLIS;
            for (int i = 0; i < maxSleepCount && !apiServerStarted.get(); ++i) {
                try {
                    Thread.sleep(SHORT_TIMEOUT_MILLIS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            Assert.assertTrue(apiServerStarted.get());
        }
    }
}
