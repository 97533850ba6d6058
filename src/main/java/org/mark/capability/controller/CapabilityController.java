package org.mark.capability.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.mark.capability.CapabilityEngine;
import org.mark.capability.CapabilityServer;
import org.mark.capability.exception.IntrospectionException;
import org.mark.capability.exception.RequestMethodException;
import org.mark.capability.overlay.AdapterOverlayMapper;
import org.mark.capability.rules.EffectiveParameterView;
import org.mark.capability.runner.Runner;
import org.mark.capability.struct.AdapterOverlay;
import org.mark.capability.struct.ApiResponse;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.tools.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.util.CharsetUtil;


/**
 * 	模型能力相关的API。
 */
public class CapabilityController implements BaseController {

	private static final Logger logger = LoggerFactory.getLogger(CapabilityController.class);
	
	private final CapabilityEngine engine;
	
	private final AdapterOverlayMapper overlayMapper;
	
	/**
	 * 	根据baseUrl创建runner
	 */
	private final Function<String, Runner> runnerFactory;
	
	private final String defaultBaseUrl;
	
	
	public CapabilityController(CapabilityEngine engine, AdapterOverlayMapper overlayMapper, Function<String, Runner> runnerFactory,
			String defaultBaseUrl) {
		this.engine = engine;
		this.overlayMapper = overlayMapper;
		this.runnerFactory = runnerFactory;
		this.defaultBaseUrl = defaultBaseUrl;
	}
	
	
	@Override
	public boolean handleRequest(String uri, ChannelHandlerContext ctx, FullHttpRequest request) throws RequestMethodException {
		// 分析模型能力
		if (uri.equals("/api/capabilities/introspect")) {
			this.handleIntrospectRequest(ctx, request);
			return true;
		}
		// 叠加适配器
		if (uri.equals("/api/capabilities/overlay")) {
			this.handleOverlayRequest(ctx, request);
			return true;
		}
		// 根据当前参数值执行依赖规则
		if (uri.equals("/api/capabilities/evaluate")) {
			this.handleEvaluateRequest(ctx, request);
			return true;
		}
		// 清除缓存
		if (uri.equals("/api/capabilities/invalidate")) {
			this.handleInvalidateRequest(ctx, request);
			return true;
		}
		return false;
	}
	
	
	private void handleIntrospectRequest(ChannelHandlerContext ctx, FullHttpRequest request) throws RequestMethodException {
		this.assertRequestMethod(request.method() != HttpMethod.POST, "只支持POST请求");
		JsonObject body = this.readBody(request);
		String modelId = this.requireModelId(body);
		
		ModelCapabilities capabilities = this.introspect(ctx, modelId, body);
		if (capabilities != null) {
			CapabilityServer.sendJsonResponse(ctx, ApiResponse.success(capabilities));
		}
	}
	
	
	private void handleOverlayRequest(ChannelHandlerContext ctx, FullHttpRequest request) throws RequestMethodException {
		this.assertRequestMethod(request.method() != HttpMethod.POST, "只支持POST请求");
		JsonObject body = this.readBody(request);
		String modelId = this.requireModelId(body);
		JsonElement adaptersEl = body.get("adapters");
		this.assertRequestMethod(adaptersEl == null || !adaptersEl.isJsonArray(), "缺少adapters数组");
		
		ModelCapabilities capabilities = this.introspect(ctx, modelId, body);
		if (capabilities == null) {
			return;
		}
		List<AdapterOverlay> adapters = this.overlayMapper.mapAll(adaptersEl.getAsJsonArray());
		CapabilityServer.sendJsonResponse(ctx, ApiResponse.success(this.engine.applyOverlays(capabilities, adapters)));
	}
	
	
	private void handleEvaluateRequest(ChannelHandlerContext ctx, FullHttpRequest request) throws RequestMethodException {
		this.assertRequestMethod(request.method() != HttpMethod.POST, "只支持POST请求");
		JsonObject body = this.readBody(request);
		String modelId = this.requireModelId(body);
		
		ModelCapabilities capabilities = this.introspect(ctx, modelId, body);
		if (capabilities == null) {
			return;
		}
		JsonElement adaptersEl = body.get("adapters");
		if (adaptersEl != null && adaptersEl.isJsonArray()) {
			capabilities = this.engine.applyOverlays(capabilities, this.overlayMapper.mapAll(adaptersEl.getAsJsonArray()));
		}
		
		Map<String, Number> values = new LinkedHashMap<>();
		JsonElement valuesEl = body.get("values");
		if (valuesEl != null && valuesEl.isJsonObject()) {
			JsonObject o = valuesEl.getAsJsonObject();
			for (String key : o.keySet()) {
				Double v = JsonUtil.getJsonDouble(o, key, null);
				if (v != null) {
					values.put(key, v);
				}
			}
		}
		EffectiveParameterView view = this.engine.evaluate(capabilities, values);
		CapabilityServer.sendJsonResponse(ctx, ApiResponse.success(view));
	}
	
	
	private void handleInvalidateRequest(ChannelHandlerContext ctx, FullHttpRequest request) throws RequestMethodException {
		this.assertRequestMethod(request.method() != HttpMethod.POST, "只支持POST请求");
		JsonObject body = JsonUtil.tryParseObject(request.content().toString(CharsetUtil.UTF_8));
		String modelId = JsonUtil.getJsonString(body, "modelId", null);
		
		Map<String, Object> data = new LinkedHashMap<>();
		if (modelId == null || modelId.trim().isEmpty()) {
			this.engine.invalidateAll();
			data.put("invalidated", "all");
		} else {
			Runner runner = this.runnerFactory.apply(this.baseUrlOf(body));
			this.engine.invalidate(modelId, runner);
			data.put("invalidated", modelId);
		}
		CapabilityServer.sendJsonResponse(ctx, ApiResponse.success(data));
	}
	
	
	/**
	 * 	取得能力快照，失败时直接返回错误响应并返回null。
	 */
	private ModelCapabilities introspect(ChannelHandlerContext ctx, String modelId, JsonObject body) {
		Runner runner;
		try {
			runner = this.runnerFactory.apply(this.baseUrlOf(body));
		} catch (IllegalArgumentException e) {
			CapabilityServer.sendJsonResponse(ctx, ApiResponse.error("baseUrl不合法: " + e.getMessage()));
			return null;
		}
		try {
			return this.engine.introspect(modelId, runner);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			CapabilityServer.sendJsonResponse(ctx, ApiResponse.error("请求被中断"));
		} catch (IntrospectionException e) {
			logger.warn("分析模型能力失败: {}", modelId, e);
			CapabilityServer.sendJsonResponse(ctx, ApiResponse.error(e.getMessage()));
		}
		return null;
	}
	
	
	private JsonObject readBody(FullHttpRequest request) throws RequestMethodException {
		String content = request.content().toString(CharsetUtil.UTF_8);
		this.assertRequestMethod(content == null || content.trim().isEmpty(), "请求体为空");
		JsonObject body = JsonUtil.tryParseObject(content);
		this.assertRequestMethod(body == null, "请求体不是合法的JSON对象");
		return body;
	}
	
	
	private String requireModelId(JsonObject body) throws RequestMethodException {
		String modelId = JsonUtil.getJsonString(body, "modelId", null);
		this.assertRequestMethod(modelId == null || modelId.trim().isEmpty(), "缺少modelId参数");
		return modelId.trim();
	}
	
	
	private String baseUrlOf(JsonObject body) {
		String baseUrl = JsonUtil.getJsonString(body, "baseUrl", null);
		return baseUrl == null || baseUrl.trim().isEmpty() ? this.defaultBaseUrl : baseUrl.trim();
	}
}
