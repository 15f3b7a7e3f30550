package io.brickmux.http;

import java.util.Map;

import org.json.JSONException;
import org.junit.Assert;
import org.junit.Test;

public class RequestUtilsTest {

    @Test
    public void testParseStringMap() {
        Map<String, String> map = RequestUtils.parseJsonStringMap(
                "{\"cluster.brick-multiplex\": \"on\", \"cluster.max-bricks-per-process\": 3, \"x\": true}");
        Assert.assertEquals(3, map.size());
        Assert.assertEquals("on", map.get("cluster.brick-multiplex"));
        Assert.assertEquals("3", map.get("cluster.max-bricks-per-process"));
        Assert.assertEquals("true", map.get("x"));
    }

    @Test
    public void testParseEmpty() {
        Assert.assertTrue(RequestUtils.parseJsonStringMap("").isEmpty());
        Assert.assertTrue(RequestUtils.parseJsonStringMap(" ").isEmpty());
        Assert.assertTrue(RequestUtils.parseJsonStringMap(null).isEmpty());
        Assert.assertTrue(RequestUtils.parseJsonStringMap("{}").isEmpty());
    }

    @Test(expected = JSONException.class)
    public void testParseNotAnObject() {
        RequestUtils.parseJsonStringMap("[\"on\"]");
    }

    @Test(expected = JSONException.class)
    public void testParseNullValue() {
        RequestUtils.parseJsonStringMap("{\"a\": null}");
    }

    @Test(expected = JSONException.class)
    public void testParseNestedValue() {
        RequestUtils.parseJsonStringMap("{\"a\": {\"b\": \"c\"}}");
    }

    @Test(expected = JSONException.class)
    public void testParseArrayValue() {
        RequestUtils.parseJsonStringMap("{\"a\": [1]}");
    }
}
