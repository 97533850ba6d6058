package org.mark.capability.probe;

import java.util.List;
import java.util.function.Consumer;

import org.mark.capability.runner.RunnerRequest;
import org.mark.capability.struct.ParameterCapability;
import org.mark.capability.struct.ParameterType;
import org.mark.capability.struct.SamplingParameters;

/**
 * 	一个高级参数的单独试探：往请求里设置什么值，成功后登记什么样的参数能力。
 */
public final class AdvancedTrial {
	
	private final String name;
	
	private final Consumer<RunnerRequest> setter;
	
	private final ParameterCapability capability;
	
	
	public AdvancedTrial(String name, Consumer<RunnerRequest> setter, ParameterCapability capability) {
		if (!name.equals(capability.getName())) {
			throw new IllegalArgumentException("试探名与参数名不一致: " + name + " / " + capability.getName());
		}
		this.name = name;
		this.setter = setter;
		this.capability = capability;
	}
	
	
	/**
	 * 	内置的高级参数表。
	 * @return
	 */
	public static List<AdvancedTrial> defaults() {
		return List.of(
				new AdvancedTrial(SamplingParameters.MIN_P, r -> r.setMinP(0.05),
						floatParam(SamplingParameters.MIN_P, 0.0, 1.0, 0.05).build()),
				new AdvancedTrial(SamplingParameters.TYPICAL_P, r -> r.setTypicalP(0.95),
						floatParam(SamplingParameters.TYPICAL_P, 0.0, 1.0, 0.95).build()),
				new AdvancedTrial(SamplingParameters.REPEAT_PENALTY, r -> r.setRepeatPenalty(1.1),
						floatParam(SamplingParameters.REPEAT_PENALTY, 0.5, 2.0, 1.1).build()),
				new AdvancedTrial(SamplingParameters.TFS_Z, r -> r.setTfsZ(0.95),
						floatParam(SamplingParameters.TFS_Z, 0.0, 1.0, 1.0).experimental(true).build()),
				new AdvancedTrial(SamplingParameters.MIROSTAT, r -> r.setMirostat(1),
						ParameterCapability.builder(SamplingParameters.MIROSTAT, ParameterType.ENUMERATION)
								.range(0, 2)
								.allowedValues(List.of(0, 1, 2))
								.defaultValue(0)
								.build()),
				new AdvancedTrial(SamplingParameters.MIROSTAT_TAU, r -> r.setMirostatTau(5.0),
						floatParam(SamplingParameters.MIROSTAT_TAU, 1.0, 10.0, 5.0).build()),
				new AdvancedTrial(SamplingParameters.MIROSTAT_ETA, r -> r.setMirostatEta(0.1),
						floatParam(SamplingParameters.MIROSTAT_ETA, 0.01, 1.0, 0.1).build()));
	}
	
	
	static ParameterCapability.Builder floatParam(String name, double min, double max, double defaultValue) {
		return ParameterCapability.builder(name, ParameterType.FLOAT).range(min, max).defaultValue(defaultValue);
	}
	
	
	/**
	 * 	生成只带这一个参数的试探请求。
	 * @param modelName
	 * @param prompt
	 * @return
	 */
	public RunnerRequest createRequest(String modelName, String prompt) {
		RunnerRequest request = new RunnerRequest(modelName, prompt, 1);
		this.setter.accept(request);
		return request;
	}
	

	public String getName() {
		return name;
	}

	public ParameterCapability getCapability() {
		return capability;
	}
}
