package org.mark.capability.channel;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mark.capability.CapabilityEngine;
import org.mark.capability.controller.CapabilityController;
import org.mark.capability.exception.IntrospectionException;
import org.mark.capability.overlay.AdapterOverlayMapper;
import org.mark.capability.runner.Runner;
import org.mark.capability.runner.ScriptedRunner;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.tools.JsonUtil;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.google.gson.JsonObject;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;


@ExtendWith(MockitoExtension.class)
class CapabilityRouterHandlerTest {
	
	private static final String DEFAULT_BASE_URL = "http://127.0.0.1:8080";
	
	@Mock
	private CapabilityEngine engine;
	
	private final List<String> requestedBaseUrls = new ArrayList<>();
	
	private final Runner runner = ScriptedRunner.acceptingAll();
	
	private CapabilityController controller;
	
	
	@BeforeEach
	void setUp() {
		this.controller = new CapabilityController(this.engine,
				new AdapterOverlayMapper(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC)),
				baseUrl -> {
					this.requestedBaseUrls.add(baseUrl);
					return this.runner;
				},
				DEFAULT_BASE_URL);
	}
	
	
	@Test
	void testIntrospect() throws Exception {
		ModelCapabilities caps = ModelCapabilities.builder("llama-3-8b")
				.family("llama")
				.detectedAt(Instant.parse("2026-01-01T00:00:00Z"))
				.build();
		when(this.engine.introspect(eq("llama-3-8b"), any())).thenReturn(caps);
		
		JsonObject body = this.send(HttpMethod.POST, "/api/capabilities/introspect?debug=1", "{\"modelId\":\" llama-3-8b \"}");
		
		Assertions.assertTrue(body.get("success").getAsBoolean());
		JsonObject data = body.getAsJsonObject("data");
		Assertions.assertEquals("llama-3-8b", data.get("modelName").getAsString());
		Assertions.assertEquals("llama", data.get("family").getAsString());
		Assertions.assertEquals("2026-01-01T00:00:00Z", data.get("detectedAt").getAsString());
		Assertions.assertEquals(List.of(DEFAULT_BASE_URL), this.requestedBaseUrls);
	}
	
	
	@Test
	void testCustomBaseUrl() throws Exception {
		when(this.engine.introspect(eq("qwen2.5-7b"), any())).thenReturn(ModelCapabilities.builder("qwen2.5-7b").build());
		
		this.send(HttpMethod.POST, "/api/capabilities/introspect", "{\"modelId\":\"qwen2.5-7b\",\"baseUrl\":\"http://10.0.0.2:8081\"}");
		
		Assertions.assertEquals(List.of("http://10.0.0.2:8081"), this.requestedBaseUrls);
	}
	
	
	@Test
	void testOnlyPostIsAccepted() throws Exception {
		JsonObject body = this.send(HttpMethod.GET, "/api/capabilities/introspect", "");
		
		Assertions.assertFalse(body.get("success").getAsBoolean());
		Assertions.assertEquals("只支持POST请求", body.get("error").getAsString());
		verify(this.engine, never()).introspect(any(), any());
	}
	
	
	@Test
	void testBodyValidation() throws Exception {
		Assertions.assertEquals("请求体为空",
				this.send(HttpMethod.POST, "/api/capabilities/introspect", "").get("error").getAsString());
		Assertions.assertEquals("请求体不是合法的JSON对象",
				this.send(HttpMethod.POST, "/api/capabilities/introspect", "[1]").get("error").getAsString());
		Assertions.assertEquals("缺少modelId参数",
				this.send(HttpMethod.POST, "/api/capabilities/introspect", "{\"baseUrl\":\"x\"}").get("error").getAsString());
		Assertions.assertEquals("缺少adapters数组",
				this.send(HttpMethod.POST, "/api/capabilities/overlay", "{\"modelId\":\"m\"}").get("error").getAsString());
	}
	
	
	@Test
	void testIntrospectionFailure() throws Exception {
		when(this.engine.introspect(eq("broken"), any())).thenThrow(new IntrospectionException("分析失败", null));
		
		JsonObject body = this.send(HttpMethod.POST, "/api/capabilities/introspect", "{\"modelId\":\"broken\"}");
		
		Assertions.assertFalse(body.get("success").getAsBoolean());
		Assertions.assertEquals("分析失败", body.get("error").getAsString());
	}
	
	
	@Test
	@SuppressWarnings("unchecked")
	void testEvaluatePassesNumericValues() throws Exception {
		ModelCapabilities caps = ModelCapabilities.builder("llama-3-8b").build();
		when(this.engine.introspect(eq("llama-3-8b"), any())).thenReturn(caps);
		
		JsonObject body = this.send(HttpMethod.POST, "/api/capabilities/evaluate",
				"{\"modelId\":\"llama-3-8b\",\"values\":{\"temperature\":1.4,\"mirostat\":\"2\",\"note\":\"abc\"}}");
		
		Assertions.assertTrue(body.get("success").getAsBoolean());
		ArgumentCaptor<Map<String, Number>> captor = ArgumentCaptor.forClass(Map.class);
		verify(this.engine).evaluate(eq(caps), captor.capture());
		Assertions.assertEquals(Map.of("temperature", 1.4, "mirostat", 2.0), captor.getValue());
		verify(this.engine, never()).applyOverlays(any(), any());
	}
	
	
	@Test
	void testInvalidate() throws Exception {
		JsonObject all = this.send(HttpMethod.POST, "/api/capabilities/invalidate", "");
		Assertions.assertEquals("all", all.getAsJsonObject("data").get("invalidated").getAsString());
		verify(this.engine).invalidateAll();
		
		JsonObject one = this.send(HttpMethod.POST, "/api/capabilities/invalidate", "{\"modelId\":\"llama-3-8b\"}");
		Assertions.assertEquals("llama-3-8b", one.getAsJsonObject("data").get("invalidated").getAsString());
		verify(this.engine).invalidate("llama-3-8b", this.runner);
		verify(this.engine, never()).evaluate(any(), anyMap());
	}
	
	
	@Test
	void testUnknownPath() {
		FullHttpResponse response = this.exchange(HttpMethod.POST, "/api/models/list", "{}");
		
		Assertions.assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
		Assertions.assertEquals("404 Not Found", response.content().toString(CharsetUtil.UTF_8));
		response.release();
	}
	
	
	private JsonObject send(HttpMethod method, String uri, String content) {
		FullHttpResponse response = this.exchange(method, uri, content);
		try {
			Assertions.assertEquals(HttpResponseStatus.OK, response.status());
			return JsonUtil.tryParseObject(response.content().toString(CharsetUtil.UTF_8));
		} finally {
			response.release();
		}
	}
	
	
	private FullHttpResponse exchange(HttpMethod method, String uri, String content) {
		// 每次响应后连接都会关闭，所以每个请求用一个新的通道
		EmbeddedChannel channel = new EmbeddedChannel(new CapabilityRouterHandler(List.of(this.controller)));
		FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri,
				Unpooled.copiedBuffer(content, CharsetUtil.UTF_8));
		channel.writeInbound(request);
		FullHttpResponse response = channel.readOutbound();
		channel.finish();
		Assertions.assertNotNull(response);
		return response;
	}
}
