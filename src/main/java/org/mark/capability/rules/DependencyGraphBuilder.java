package org.mark.capability.rules;

import java.util.List;

import org.mark.capability.metadata.MetadataExtractor;
import org.mark.capability.struct.ComparisonType;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.struct.ParameterDependency;
import org.mark.capability.struct.SamplingParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	根据已经探测到的参数和模型结构信息，生成参数之间的依赖规则。
 * 	这里只产生数据，规则的执行见{@link DependencyEvaluator}。
 */
public class DependencyGraphBuilder {
	
	private static final Logger logger = LoggerFactory.getLogger(DependencyGraphBuilder.class);
	
	/**
	 * 	小模型上效果不稳定的实验参数
	 */
	static final List<String> SMALL_MODEL_EXPERIMENTAL = List.of(
			SamplingParameters.TFS_Z,
			SamplingParameters.ETA_CUTOFF,
			SamplingParameters.EPSILON_CUTOFF,
			SamplingParameters.DRY_MULTIPLIER);
	
	static final long SMALL_MODEL_THRESHOLD = 7_000_000_000L;
	
	static final double LOW_PRECISION_TEMPERATURE_LIMIT = 1.2;
	
	
	public void build(ModelCapabilities.Builder builder) {
		if (builder.hasParameter(SamplingParameters.MIROSTAT) && builder.hasParameter(SamplingParameters.TEMPERATURE)) {
			builder.addDependency(ParameterDependency.hide(
					SamplingParameters.MIROSTAT, ComparisonType.GREATER_THAN, 0,
					SamplingParameters.TEMPERATURE,
					"启用mirostat后temperature由mirostat接管，不再生效"));
		}
		
		if (builder.hasParameter(SamplingParameters.TEMPERATURE) && MetadataExtractor.isLowPrecision(builder.getQuantization())) {
			builder.addDependency(ParameterDependency.warn(
					SamplingParameters.TEMPERATURE, ComparisonType.GREATER_THAN, LOW_PRECISION_TEMPERATURE_LIMIT,
					SamplingParameters.TEMPERATURE,
					"Q4量化模型在较高temperature下输出容易不连贯"));
		}
		
		// 参数量未知时不做判断
		long count = builder.getParameterCount();
		if (count > 0 && count < SMALL_MODEL_THRESHOLD) {
			for (String name : SMALL_MODEL_EXPERIMENTAL) {
				builder.updateParameter(name, p -> p.toBuilder()
						.recommended(false)
						.note("小于7B的模型使用该参数效果不稳定")
						.build());
			}
		}
		logger.debug("依赖规则生成完成: {}", builder.getModelName());
	}
}
