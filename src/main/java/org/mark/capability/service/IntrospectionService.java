package org.mark.capability.service;

import java.time.Clock;

import org.mark.capability.defaults.DefaultsSynthesizer;
import org.mark.capability.exception.IntrospectionException;
import org.mark.capability.metadata.MetadataExtractor;
import org.mark.capability.metadata.ModelMetadata;
import org.mark.capability.probe.CapabilityProbe;
import org.mark.capability.probe.ModifiabilityValidator;
import org.mark.capability.probe.ProbeResult;
import org.mark.capability.profile.FamilyProfileRegistry;
import org.mark.capability.rules.DependencyGraphBuilder;
import org.mark.capability.runner.Runner;
import org.mark.capability.struct.ModelCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	构建一个模型的能力快照：解析模型名、探测、可修改性检查、依赖规则、推荐默认值。
 * 	不做缓存，缓存见{@link org.mark.capability.cache.CapabilityCache}。
 */
public class IntrospectionService {
	
	private static final Logger logger = LoggerFactory.getLogger(IntrospectionService.class);
	
	private final MetadataExtractor metadataExtractor;
	
	private final FamilyProfileRegistry profiles;
	
	private final CapabilityProbe probe;
	
	private final ModifiabilityValidator validator;
	
	private final DependencyGraphBuilder dependencyGraphBuilder;
	
	private final DefaultsSynthesizer defaultsSynthesizer;
	
	private final Clock clock;
	
	
	public IntrospectionService(MetadataExtractor metadataExtractor, FamilyProfileRegistry profiles, CapabilityProbe probe,
			ModifiabilityValidator validator, DependencyGraphBuilder dependencyGraphBuilder, DefaultsSynthesizer defaultsSynthesizer,
			Clock clock) {
		this.metadataExtractor = metadataExtractor;
		this.profiles = profiles;
		this.probe = probe;
		this.validator = validator;
		this.dependencyGraphBuilder = dependencyGraphBuilder;
		this.defaultsSynthesizer = defaultsSynthesizer;
		this.clock = clock;
	}
	
	
	/**
	 * 	完整构建一次能力快照。
	 * @param modelIdentifier
	 * @param runner
	 * @return
	 * @throws InterruptedException 构建被取消
	 * @throws IntrospectionException 出现了意料之外的错误
	 */
	public ModelCapabilities build(String modelIdentifier, Runner runner) throws InterruptedException, IntrospectionException {
		long start = System.currentTimeMillis();
		try {
			ModelMetadata metadata = this.metadataExtractor.extract(modelIdentifier);
			String family = this.profiles.detectFamily(metadata.getModelName());
			logger.info("开始分析模型能力: {} (家族: {}, runner: {})", metadata.getModelName(), family, runner.getName());
			
			ModelCapabilities.Builder builder = ModelCapabilities.builder(metadata.getModelName())
					.family(family)
					.sizeClass(metadata.getSizeClass())
					.parameterCount(metadata.getParameterCount())
					.contextLength(metadata.getContextLength())
					.quantization(metadata.getQuantization())
					.detectedAt(this.clock.instant());
			
			ProbeResult result = this.probe.probe(builder, runner);
			if (builder.isLowConfidence()) {
				logger.info("探测结果置信度低，跳过可修改性检查: {}", metadata.getModelName());
			} else {
				this.validator.validate(builder, runner);
			}
			this.dependencyGraphBuilder.build(builder);
			this.defaultsSynthesizer.synthesize(builder);
			
			ModelCapabilities capabilities = builder.build();
			logger.info("模型能力分析完成: {}，可用参数 {} 个，不支持 {} 个，请求 {} 次，耗时 {}ms",
					capabilities.getModelName(),
					capabilities.getParameters().size(),
					capabilities.getUnsupportedParameters().size(),
					result.getCalls(),
					System.currentTimeMillis() - start);
			return capabilities;
		} catch (RuntimeException e) {
			logger.error("分析模型能力时发生错误: {}", modelIdentifier, e);
			throw new IntrospectionException("无法分析模型能力: " + modelIdentifier, e);
		}
	}
}
