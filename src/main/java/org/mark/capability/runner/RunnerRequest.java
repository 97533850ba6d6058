package org.mark.capability.runner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mark.capability.struct.SamplingParameters;

import com.google.gson.annotations.SerializedName;

/**
 * 	发给runner的试探请求，字段与/v1/chat/completions一致。
 * 	采样参数为null时不会序列化，也就是不向runner传递这个参数。
 */
public class RunnerRequest {
	
	private String model;
	
	private List<Message> messages = new ArrayList<>();
	
	@SerializedName("max_tokens")
	private Integer maxTokens;
	
	private boolean stream = false;
	
	private Double temperature;
	
	@SerializedName("top_p")
	private Double topP;
	
	@SerializedName("top_k")
	private Integer topK;
	
	@SerializedName("frequency_penalty")
	private Double frequencyPenalty;
	
	@SerializedName("presence_penalty")
	private Double presencePenalty;
	
	private Integer seed;
	
	@SerializedName("min_p")
	private Double minP;
	
	@SerializedName("typical_p")
	private Double typicalP;
	
	@SerializedName("repeat_penalty")
	private Double repeatPenalty;
	
	@SerializedName("tfs_z")
	private Double tfsZ;
	
	private Integer mirostat;
	
	@SerializedName("mirostat_tau")
	private Double mirostatTau;
	
	@SerializedName("mirostat_eta")
	private Double mirostatEta;
	
	
	public RunnerRequest(String model, String prompt, int maxTokens) {
		this.model = model;
		this.messages.add(new Message("user", prompt));
		this.maxTokens = maxTokens;
	}
	
	
	/**
	 * 	请求中设置了的采样参数，键为参数名。
	 * @return
	 */
	public Map<String, Number> getParameterOverrides() {
		Map<String, Number> map = new LinkedHashMap<>();
		put(map, SamplingParameters.TEMPERATURE, this.temperature);
		put(map, SamplingParameters.TOP_P, this.topP);
		put(map, SamplingParameters.TOP_K, this.topK);
		put(map, SamplingParameters.FREQUENCY_PENALTY, this.frequencyPenalty);
		put(map, SamplingParameters.PRESENCE_PENALTY, this.presencePenalty);
		put(map, SamplingParameters.SEED, this.seed);
		put(map, SamplingParameters.MIN_P, this.minP);
		put(map, SamplingParameters.TYPICAL_P, this.typicalP);
		put(map, SamplingParameters.REPEAT_PENALTY, this.repeatPenalty);
		put(map, SamplingParameters.TFS_Z, this.tfsZ);
		put(map, SamplingParameters.MIROSTAT, this.mirostat);
		put(map, SamplingParameters.MIROSTAT_TAU, this.mirostatTau);
		put(map, SamplingParameters.MIROSTAT_ETA, this.mirostatEta);
		return map;
	}
	
	
	private static void put(Map<String, Number> map, String key, Number value) {
		if (value != null) {
			map.put(key, value);
		}
	}
	

	public String getModel() {
		return model;
	}

	public List<Message> getMessages() {
		return Collections.unmodifiableList(messages);
	}

	public Integer getMaxTokens() {
		return maxTokens;
	}

	public boolean isStream() {
		return stream;
	}

	public RunnerRequest setTemperature(double temperature) {
		this.temperature = temperature;
		return this;
	}

	public RunnerRequest setTopP(double topP) {
		this.topP = topP;
		return this;
	}

	public RunnerRequest setTopK(int topK) {
		this.topK = topK;
		return this;
	}

	public RunnerRequest setFrequencyPenalty(double frequencyPenalty) {
		this.frequencyPenalty = frequencyPenalty;
		return this;
	}

	public RunnerRequest setPresencePenalty(double presencePenalty) {
		this.presencePenalty = presencePenalty;
		return this;
	}

	public RunnerRequest setSeed(int seed) {
		this.seed = seed;
		return this;
	}

	public RunnerRequest setMinP(double minP) {
		this.minP = minP;
		return this;
	}

	public RunnerRequest setTypicalP(double typicalP) {
		this.typicalP = typicalP;
		return this;
	}

	public RunnerRequest setRepeatPenalty(double repeatPenalty) {
		this.repeatPenalty = repeatPenalty;
		return this;
	}

	public RunnerRequest setTfsZ(double tfsZ) {
		this.tfsZ = tfsZ;
		return this;
	}

	public RunnerRequest setMirostat(int mirostat) {
		this.mirostat = mirostat;
		return this;
	}

	public RunnerRequest setMirostatTau(double mirostatTau) {
		this.mirostatTau = mirostatTau;
		return this;
	}

	public RunnerRequest setMirostatEta(double mirostatEta) {
		this.mirostatEta = mirostatEta;
		return this;
	}
	
	
	public static class Message {
		private final String role;
		private final String content;
		
		public Message(String role, String content) {
			this.role = role;
			this.content = content;
		}
		
		public String getRole() {
			return role;
		}
		
		public String getContent() {
			return content;
		}
	}
}
