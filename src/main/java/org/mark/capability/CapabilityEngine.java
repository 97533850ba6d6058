package org.mark.capability;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.mark.capability.cache.CacheState;
import org.mark.capability.cache.CapabilityCache;
import org.mark.capability.defaults.DefaultsSynthesizer;
import org.mark.capability.exception.IntrospectionException;
import org.mark.capability.metadata.MetadataExtractor;
import org.mark.capability.overlay.LoraOverlayEngine;
import org.mark.capability.probe.CapabilityProbe;
import org.mark.capability.probe.ModifiabilityValidator;
import org.mark.capability.profile.FamilyProfileRegistry;
import org.mark.capability.rules.DependencyEvaluator;
import org.mark.capability.rules.DependencyGraphBuilder;
import org.mark.capability.rules.EffectiveParameterView;
import org.mark.capability.runner.Runner;
import org.mark.capability.service.IntrospectionService;
import org.mark.capability.struct.AdapterOverlay;
import org.mark.capability.struct.EngineConfig;
import org.mark.capability.struct.ModelCapabilities;

/**
 * 	对外的入口：分析模型能力、叠加适配器、执行依赖规则。
 */
public class CapabilityEngine {
	
	private final IntrospectionService introspectionService;
	
	private final CapabilityCache cache;
	
	private final LoraOverlayEngine overlayEngine;
	
	private final DependencyEvaluator dependencyEvaluator;
	
	
	public CapabilityEngine(IntrospectionService introspectionService, CapabilityCache cache, LoraOverlayEngine overlayEngine,
			DependencyEvaluator dependencyEvaluator) {
		this.introspectionService = introspectionService;
		this.cache = cache;
		this.overlayEngine = overlayEngine;
		this.dependencyEvaluator = dependencyEvaluator;
	}
	
	
	/**
	 * 	按配置组装全部组件。
	 * @param config
	 * @param clock
	 * @return
	 */
	public static CapabilityEngine create(EngineConfig config, Clock clock) {
		Path profilesPath = null;
		if (config.getFamilyProfilesPath() != null && !config.getFamilyProfilesPath().trim().isEmpty()) {
			profilesPath = Paths.get(config.getFamilyProfilesPath().trim());
		}
		FamilyProfileRegistry profiles = FamilyProfileRegistry.load(profilesPath);
		Duration timeout = Duration.ofSeconds(config.getProbeTimeoutSeconds());
		
		IntrospectionService service = new IntrospectionService(
				new MetadataExtractor(),
				profiles,
				new CapabilityProbe(timeout),
				new ModifiabilityValidator(timeout),
				new DependencyGraphBuilder(),
				new DefaultsSynthesizer(profiles),
				clock);
		CapabilityCache cache = new CapabilityCache(clock,
				Duration.ofSeconds(config.getFreshnessSeconds()),
				Duration.ofSeconds(config.getLowConfidenceSeconds()));
		return new CapabilityEngine(service, cache, new LoraOverlayEngine(), new DependencyEvaluator());
	}
	
	
	/**
	 * 	取得模型的能力快照，缓存有效时不会访问runner。
	 * @param modelIdentifier
	 * @param runner
	 * @return
	 * @throws InterruptedException
	 * @throws IntrospectionException
	 */
	public ModelCapabilities introspect(String modelIdentifier, Runner runner) throws InterruptedException, IntrospectionException {
		return this.cache.get(cacheKey(modelIdentifier, runner), () -> this.introspectionService.build(modelIdentifier, runner));
	}
	
	
	/**
	 * 	叠加适配器，结果不缓存。
	 * @param capabilities
	 * @param adapters
	 * @return
	 */
	public ModelCapabilities applyOverlays(ModelCapabilities capabilities, List<AdapterOverlay> adapters) {
		return this.overlayEngine.applyOverlays(capabilities, adapters);
	}
	
	
	public EffectiveParameterView evaluate(ModelCapabilities capabilities, Map<String, ? extends Number> values) {
		return this.dependencyEvaluator.evaluate(capabilities, values);
	}
	
	
	public void invalidate(String modelIdentifier, Runner runner) {
		this.cache.invalidate(cacheKey(modelIdentifier, runner));
	}
	
	
	public void invalidateAll() {
		this.cache.invalidateAll();
	}
	
	
	public CacheState cacheState(String modelIdentifier, Runner runner) {
		return this.cache.state(cacheKey(modelIdentifier, runner));
	}
	
	
	/**
	 * 	缓存键：规范化后的模型名加runner名。
	 * @param modelIdentifier
	 * @param runner
	 * @return
	 */
	static String cacheKey(String modelIdentifier, Runner runner) {
		return MetadataExtractor.normalizeModelName(modelIdentifier) + "@" + runner.getName();
	}
}
