package org.mark.capability.tools;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mark.capability.struct.ApiResponse;

import com.google.gson.JsonObject;


class JsonUtilTest {
	
	@Test
	void testLenientGetters() {
		JsonObject o = JsonUtil.tryParseObject("{\"weight\":\"0.8\",\"rank\":\"32\",\"enabled\":\"yes\",\"bad\":\"x\",\"n\":null}");
		
		Assertions.assertEquals(0.8, JsonUtil.getJsonDouble(o, "weight", 1.0));
		Assertions.assertEquals(32, JsonUtil.getJsonInt(o, "rank", 0));
		Assertions.assertTrue(JsonUtil.getJsonBoolean(o, "enabled", false));
		Assertions.assertEquals(1.0, JsonUtil.getJsonDouble(o, "bad", 1.0));
		Assertions.assertEquals(7, JsonUtil.getJsonInt(o, "n", 7));
		Assertions.assertEquals("fallback", JsonUtil.getJsonString(o, "missing", "fallback"));
	}
	
	
	@Test
	void testTryParseObject() {
		Assertions.assertNull(JsonUtil.tryParseObject("[1,2]"));
		Assertions.assertNull(JsonUtil.tryParseObject("{broken"));
		Assertions.assertNull(JsonUtil.tryParseObject(null));
	}
	
	
	@Test
	void testStringList() {
		JsonObject o = JsonUtil.tryParseObject("{\"tags\":[\" a \",null,\"\",\"b\"],\"one\":\"c\"}");
		
		Assertions.assertEquals(List.of("a", "b"), JsonUtil.getJsonStringList(o.get("tags")));
		Assertions.assertEquals(List.of("c"), JsonUtil.getJsonStringList(o.get("one")));
		Assertions.assertNull(JsonUtil.getJsonStringList(null));
	}
	
	
	@Test
	void testInstantIsWrittenAsIsoString() {
		String json = JsonUtil.toJson(ApiResponse.success(Instant.parse("2026-01-01T00:00:00Z")));
		JsonObject o = JsonUtil.tryParseObject(json);
		
		Assertions.assertTrue(o.get("success").getAsBoolean());
		Assertions.assertEquals("2026-01-01T00:00:00Z", o.get("data").getAsString());
	}
}
