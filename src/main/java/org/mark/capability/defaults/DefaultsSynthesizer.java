package org.mark.capability.defaults;

import java.util.Optional;

import org.mark.capability.metadata.MetadataExtractor;
import org.mark.capability.profile.FamilyProfileRegistry;
import org.mark.capability.struct.FamilyProfile;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.struct.ParameterCapability;
import org.mark.capability.struct.SamplingParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	为参数目录里的每个参数计算推荐默认值。
 * 	<p>
 * 	依次叠加：目录默认值、模型家族配置、参数量规则、量化规则、上下文长度规则。
 * 	所有值最后都收敛到参数声明的范围内，不会为目录中不存在的参数生成默认值。
 */
public class DefaultsSynthesizer {
	
	private static final Logger logger = LoggerFactory.getLogger(DefaultsSynthesizer.class);
	
	static final long LARGE_MODEL_THRESHOLD = 30_000_000_000L;
	
	static final long SMALL_MODEL_THRESHOLD = 3_000_000_000L;
	
	static final double LOW_PRECISION_TEMPERATURE_BUMP = 0.1;
	
	static final double LOW_PRECISION_TEMPERATURE_CAP = 1.2;
	
	static final int MAX_TOKENS_CAP = 2048;
	
	private final FamilyProfileRegistry profiles;
	
	
	public DefaultsSynthesizer(FamilyProfileRegistry profiles) {
		this.profiles = profiles;
	}
	
	
	public void synthesize(ModelCapabilities.Builder builder) {
		for (String name : builder.parameterNames()) {
			ParameterCapability p = builder.getParameter(name);
			if (p.getDefaultValue() != null) {
				builder.putRecommendedDefault(name, p.getDefaultValue());
			}
		}
		
		Optional<FamilyProfile> profile = this.profiles.find(builder.getFamily());
		profile.ifPresent(p -> this.applyProfile(builder, p));
		
		long count = builder.getParameterCount();
		if (count > LARGE_MODEL_THRESHOLD) {
			this.set(builder, SamplingParameters.TEMPERATURE, 0.6);
			this.set(builder, SamplingParameters.TOP_P, 0.85);
		} else if (count > 0 && count < SMALL_MODEL_THRESHOLD) {
			this.set(builder, SamplingParameters.TEMPERATURE, 0.8);
			this.set(builder, SamplingParameters.TOP_P, 0.95);
		}
		
		if (MetadataExtractor.isLowPrecision(builder.getQuantization())) {
			Number temperature = builder.getRecommendedDefault(SamplingParameters.TEMPERATURE);
			if (temperature != null) {
				this.set(builder, SamplingParameters.TEMPERATURE,
						Math.min(temperature.doubleValue() + LOW_PRECISION_TEMPERATURE_BUMP, LOW_PRECISION_TEMPERATURE_CAP));
			}
		}
		
		this.set(builder, SamplingParameters.MAX_TOKENS, Math.min(builder.getContextLength() / 4, MAX_TOKENS_CAP));
		logger.debug("推荐默认值计算完成: {}", builder.getModelName());
	}
	
	
	private void applyProfile(ModelCapabilities.Builder builder, FamilyProfile profile) {
		if (profile.getDefaultTemperature() != null) {
			this.set(builder, SamplingParameters.TEMPERATURE, profile.getDefaultTemperature());
		}
		if (profile.getDefaultTopP() != null) {
			this.set(builder, SamplingParameters.TOP_P, profile.getDefaultTopP());
		}
		for (String name : profile.getProblematicParameters()) {
			builder.updateParameter(name, p -> p.toBuilder()
					.recommended(false)
					.note(profile.getFamily() + "系列模型使用该参数效果不佳")
					.build());
		}
		// 已经被小模型规则判定为不推荐的参数保持原状
		for (String name : profile.getExcellentParameters()) {
			builder.updateParameter(name, p -> !p.isRecommended() ? p : p.toBuilder()
					.recommended(true)
					.note(profile.getFamily() + "系列模型使用该参数效果很好")
					.build());
		}
		for (String behavior : profile.getSpecialBehaviors()) {
			builder.addWarning(behavior);
		}
	}
	
	
	/**
	 * 	设置推荐默认值，超出声明范围时收敛到边界。
	 */
	private void set(ModelCapabilities.Builder builder, String name, double value) {
		ParameterCapability p = builder.getParameter(name);
		if (p == null) {
			return;
		}
		builder.putRecommendedDefault(name, p.clamp(value));
	}
}
