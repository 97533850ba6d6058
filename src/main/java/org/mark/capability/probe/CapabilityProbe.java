package org.mark.capability.probe;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.mark.capability.exception.ParameterRejectedException;
import org.mark.capability.exception.ProbeException;
import org.mark.capability.runner.Runner;
import org.mark.capability.runner.RunnerRequest;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.struct.ParameterCapability;
import org.mark.capability.struct.ParameterType;
import org.mark.capability.struct.SamplingParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	通过实际向runner发送试探请求，确定哪些采样参数可用。
 * 	<p>
 * 	先发一个带全部核心参数的基础请求；成功后再逐个单独试探高级参数。
 * 	每个参数最多一次请求，不做重试。
 */
public class CapabilityProbe {
	
	private static final Logger logger = LoggerFactory.getLogger(CapabilityProbe.class);
	
	static final String BASELINE_PROMPT = "Hi";
	
	static final String TRIAL_PROMPT = "Test";
	
	/**
	 * 	基础探测失败时max_tokens的上限
	 */
	static final int FALLBACK_MAX_TOKENS = 2048;
	
	private final List<AdvancedTrial> advancedTrials;
	
	private final Duration timeout;
	
	
	public CapabilityProbe(Duration timeout) {
		this(AdvancedTrial.defaults(), timeout);
	}
	
	
	public CapabilityProbe(List<AdvancedTrial> advancedTrials, Duration timeout) {
		this.advancedTrials = new ArrayList<>(advancedTrials);
		this.timeout = timeout;
	}
	
	
	/**
	 * 	执行探测，把结果写入builder。
	 * 	builder里需要已经填好模型名和上下文长度。
	 * @param builder
	 * @param runner
	 * @return
	 * @throws InterruptedException 调用方取消
	 */
	public ProbeResult probe(ModelCapabilities.Builder builder, Runner runner) throws InterruptedException {
		String model = builder.getModelName();
		int calls = 0;
		
		RunnerRequest baseline = new RunnerRequest(model, BASELINE_PROMPT, 1)
				.setTemperature(0.7)
				.setTopP(0.9)
				.setTopK(40)
				.setFrequencyPenalty(0.1)
				.setPresencePenalty(0.1)
				.setSeed(12345);
		try {
			calls++;
			runner.submit(baseline, this.timeout);
		} catch (ProbeException e) {
			logger.warn("基础探测失败，只使用最保守的参数集合: {} ({})", model, e.getMessage());
			this.registerFallback(builder);
			builder.lowConfidence(true);
			builder.addWarning("无法确认runner支持的参数，只提供最基本的参数: " + e.getMessage());
			return new ProbeResult(calls, false, 0, 0, false);
		}
		logger.debug("基础探测成功，模型接受核心参数: {}", model);
		this.registerCore(builder);
		
		int accepted = 0;
		int rejected = 0;
		boolean aborted = false;
		for (AdvancedTrial trial : this.advancedTrials) {
			if (builder.unsupportedNames().contains(trial.getName())) {
				continue;
			}
			try {
				calls++;
				runner.submit(trial.createRequest(model, TRIAL_PROMPT), this.timeout);
				builder.putParameter(trial.getCapability());
				accepted++;
				logger.debug("参数 {} 可用", trial.getName());
			} catch (ParameterRejectedException e) {
				builder.markUnsupported(trial.getName());
				rejected++;
				logger.debug("参数 {} 不被支持: {}", trial.getName(), e.getMessage());
			} catch (ProbeException e) {
				// 不可达以及其他无法判断的失败都停止探测
				logger.warn("试探参数 {} 时runner不可达，停止后续探测: {}", trial.getName(), e.getMessage());
				builder.lowConfidence(true);
				builder.addWarning("高级参数探测在 " + trial.getName() + " 处中断，部分参数未经确认");
				aborted = true;
				break;
			}
		}
		ProbeResult result = new ProbeResult(calls, true, accepted, rejected, aborted);
		logger.debug("探测完成: {} {}", model, result);
		return result;
	}
	
	
	private void registerCore(ModelCapabilities.Builder builder) {
		int context = Math.max(1, builder.getContextLength());
		put(builder, floatParam(SamplingParameters.TEMPERATURE, 0.0, 2.0, 0.7));
		put(builder, floatParam(SamplingParameters.TOP_P, 0.0, 1.0, 0.9));
		put(builder, intParam(SamplingParameters.TOP_K, 1, 200, 40));
		put(builder, intParam(SamplingParameters.MAX_TOKENS, 1, context, Math.min(1024, context)));
		put(builder, floatParam(SamplingParameters.FREQUENCY_PENALTY, -2.0, 2.0, 0.0));
		put(builder, floatParam(SamplingParameters.PRESENCE_PENALTY, -2.0, 2.0, 0.0));
		put(builder, intParam(SamplingParameters.SEED, -1, Integer.MAX_VALUE, -1));
	}
	
	
	private void registerFallback(ModelCapabilities.Builder builder) {
		put(builder, floatParam(SamplingParameters.TEMPERATURE, 0.1, 1.5, 0.7));
		put(builder, intParam(SamplingParameters.MAX_TOKENS, 1, FALLBACK_MAX_TOKENS, 1024));
	}
	
	
	private static void put(ModelCapabilities.Builder builder, ParameterCapability capability) {
		if (!builder.unsupportedNames().contains(capability.getName())) {
			builder.putParameter(capability);
		}
	}
	
	
	private static ParameterCapability floatParam(String name, double min, double max, double defaultValue) {
		return ParameterCapability.builder(name, ParameterType.FLOAT).range(min, max).defaultValue(defaultValue).build();
	}
	
	
	private static ParameterCapability intParam(String name, int min, int max, int defaultValue) {
		return ParameterCapability.builder(name, ParameterType.INTEGER).range(min, max).defaultValue(defaultValue).build();
	}
}
