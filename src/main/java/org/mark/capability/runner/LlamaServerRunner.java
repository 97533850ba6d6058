package org.mark.capability.runner;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.mark.capability.exception.ParameterRejectedException;
import org.mark.capability.exception.ProbeException;
import org.mark.capability.exception.RunnerUnreachableException;
import org.mark.capability.tools.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * 	通过OpenAI兼容接口访问llama-server。
 * 	baseUrl为服务根地址，如http://127.0.0.1:8080
 */
public class LlamaServerRunner implements Runner {
	
	private static final Logger logger = LoggerFactory.getLogger(LlamaServerRunner.class);
	
	private final String name;
	
	private final URI baseUrl;
	
	private final HttpClient client;
	
	
	public LlamaServerRunner(String name, URI baseUrl) {
		this(name, baseUrl, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
	}
	
	
	public LlamaServerRunner(String name, URI baseUrl, HttpClient client) {
		this.name = name == null || name.isBlank() ? "llama-server" : name;
		this.baseUrl = stripTrailingSlash(baseUrl);
		this.client = client;
	}
	
	
	@Override
	public String getName() {
		return this.name;
	}
	
	
	public URI getBaseUrl() {
		return this.baseUrl;
	}
	
	
	@Override
	public String submit(RunnerRequest request, Duration timeout) throws ProbeException, InterruptedException {
		URI uri = this.baseUrl.resolve("/v1/chat/completions");
		String body = JsonUtil.toJson(request);
		logger.debug("发送探测请求: {} {}", uri, request.getParameterOverrides());
		HttpRequest httpRequest = HttpRequest.newBuilder()
				.uri(uri)
				.timeout(timeout)
				.header("Content-Type", "application/json; charset=UTF-8")
				.POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
				.build();
		
		HttpResponse<String> response;
		try {
			response = this.client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
		} catch (HttpTimeoutException e) {
			throw new RunnerUnreachableException("请求超时: " + uri, e);
		} catch (IOException e) {
			throw new RunnerUnreachableException("无法连接到runner: " + uri, e);
		}
		
		int status = response.statusCode();
		if (status == 400 || status == 422) {
			throw new ParameterRejectedException("runner拒绝了请求: " + preview(response.body()), status);
		}
		if (status < 200 || status >= 300) {
			throw new RunnerUnreachableException("runner返回错误: HTTP " + status + " " + preview(response.body()));
		}
		return extractContent(response.body());
	}
	
	
	/**
	 * 	取出choices[0].message.content，兼容/completion风格的content字段。
	 * @param body
	 * @return
	 * @throws RunnerUnreachableException 响应不是JSON
	 */
	static String extractContent(String body) throws RunnerUnreachableException {
		JsonObject obj = JsonUtil.tryParseObject(body);
		if (obj == null) {
			throw new RunnerUnreachableException("runner返回的不是JSON: " + preview(body));
		}
		JsonElement choicesEl = obj.get("choices");
		if (choicesEl != null && choicesEl.isJsonArray()) {
			JsonArray choices = choicesEl.getAsJsonArray();
			if (choices.size() > 0 && choices.get(0).isJsonObject()) {
				JsonObject choice = choices.get(0).getAsJsonObject();
				if (choice.has("message") && choice.get("message").isJsonObject()) {
					return JsonUtil.getJsonString(choice.getAsJsonObject("message"), "content", "");
				}
				return JsonUtil.getJsonString(choice, "text", "");
			}
		}
		return JsonUtil.getJsonString(obj, "content", "");
	}
	
	
	private static String preview(String body) {
		if (body == null) {
			return "";
		}
		return body.length() > 300 ? body.substring(0, 300) + "..." : body;
	}
	
	
	private static URI stripTrailingSlash(URI uri) {
		String s = uri.toString();
		while (s.endsWith("/")) {
			s = s.substring(0, s.length() - 1);
		}
		return URI.create(s);
	}
}
