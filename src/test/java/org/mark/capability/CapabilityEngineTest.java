package org.mark.capability;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mark.capability.cache.CacheState;
import org.mark.capability.exception.IntrospectionException;
import org.mark.capability.rules.EffectiveParameterView;
import org.mark.capability.runner.ScriptedRunner;
import org.mark.capability.struct.AdapterCategory;
import org.mark.capability.struct.AdapterOverlay;
import org.mark.capability.struct.DependencyAction;
import org.mark.capability.struct.EngineConfig;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.struct.SamplingParameters;
import org.mark.capability.struct.SizeClass;


class CapabilityEngineTest {
	
	private static final String MODEL = "llama-3-8b-q4_k_m-32k";
	
	private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
	
	private final CapabilityEngine engine = CapabilityEngine.create(new EngineConfig(), clock);
	
	
	@Test
	void testSecondCallWithinFreshnessWindowIssuesNoProbes() throws Exception {
		ScriptedRunner runner = ScriptedRunner.acceptingAll();
		
		ModelCapabilities first = engine.introspect(MODEL, runner);
		int calls = runner.getCalls();
		Assertions.assertEquals(10, calls);
		
		clock.advance(Duration.ofSeconds(10));
		ModelCapabilities second = engine.introspect(MODEL, runner);
		
		Assertions.assertEquals(calls, runner.getCalls());
		Assertions.assertSame(first, second);
		Assertions.assertEquals(first, second);
		
		clock.advance(Duration.ofHours(1));
		Assertions.assertEquals(CacheState.STALE, engine.cacheState(MODEL, runner));
		engine.introspect(MODEL, runner);
		Assertions.assertEquals(calls * 2, runner.getCalls());
	}
	
	
	@Test
	void testFullPipeline() throws Exception {
		ModelCapabilities capabilities = engine.introspect("/models/" + MODEL + ".gguf", ScriptedRunner.acceptingAll());
		
		Assertions.assertEquals(MODEL, capabilities.getModelName());
		Assertions.assertEquals("llama", capabilities.getFamily());
		Assertions.assertEquals(8_000_000_000L, capabilities.getParameterCount());
		Assertions.assertEquals(SizeClass.ADVANCED, capabilities.getSizeClass());
		Assertions.assertEquals(32768, capabilities.getContextLength());
		Assertions.assertEquals("Q4_K_M", capabilities.getQuantization());
		Assertions.assertEquals(clock.instant(), capabilities.getDetectedAt());
		Assertions.assertFalse(capabilities.isLowConfidence());
		Assertions.assertEquals(14, capabilities.getParameters().size());
		Assertions.assertTrue(capabilities.getUnsupportedParameters().isEmpty());
		
		// llama默认0.8，Q4再加0.1
		Assertions.assertEquals(0.9, capabilities.getRecommendedDefaults().get(SamplingParameters.TEMPERATURE).doubleValue(), 1e-9);
		Assertions.assertEquals(2048, capabilities.getRecommendedDefaults().get(SamplingParameters.MAX_TOKENS).intValue());
		
		Assertions.assertEquals(2, capabilities.getDependencies().size());
		Assertions.assertEquals(DependencyAction.HIDE, capabilities.getDependencies().get(0).getAction());
		Assertions.assertEquals(DependencyAction.SHOW_WARNING, capabilities.getDependencies().get(1).getAction());
		Assertions.assertTrue(capabilities.getParameter(SamplingParameters.MIROSTAT).isRecommended());
		
		for (Map.Entry<String, Number> e : capabilities.getRecommendedDefaults().entrySet()) {
			Assertions.assertTrue(capabilities.getParameter(e.getKey()).accepts(e.getValue().doubleValue()), e.getKey());
		}
	}
	
	
	@Test
	void testUnreachableRunnerGivesLowConfidenceSnapshot() throws Exception {
		ScriptedRunner runner = ScriptedRunner.unreachable();
		
		ModelCapabilities capabilities = engine.introspect(MODEL, runner);
		
		Assertions.assertTrue(capabilities.isLowConfidence());
		Assertions.assertEquals(Set.of(SamplingParameters.TEMPERATURE, SamplingParameters.MAX_TOKENS), capabilities.getParameters().keySet());
		// 可修改性检查被跳过
		Assertions.assertEquals(1, runner.getCalls());
		
		clock.advance(Duration.ofSeconds(61));
		engine.introspect(MODEL, runner);
		Assertions.assertEquals(2, runner.getCalls());
	}
	
	
	@Test
	void testLockedTemperatureRemovesHideRule() throws Exception {
		ModelCapabilities capabilities = engine.introspect(MODEL, new ScriptedRunner("locked", r -> "test"));
		
		Assertions.assertFalse(capabilities.hasParameter(SamplingParameters.TEMPERATURE));
		Assertions.assertTrue(capabilities.getUnsupportedParameters().contains(SamplingParameters.TEMPERATURE));
		Assertions.assertFalse(capabilities.getRecommendedDefaults().containsKey(SamplingParameters.TEMPERATURE));
		Assertions.assertTrue(capabilities.getDependencies().isEmpty());
	}
	
	
	@Test
	void testInterruptedBuildIsNotCached() throws Exception {
		ScriptedRunner runner = new ScriptedRunner("cancel", r -> {
			throw new InterruptedException();
		});
		
		Assertions.assertThrows(InterruptedException.class, () -> engine.introspect(MODEL, runner));
		Assertions.assertEquals(CacheState.ABSENT, engine.cacheState(MODEL, runner));
	}
	
	
	@Test
	void testUnexpectedFailureIsWrapped() {
		ScriptedRunner runner = new ScriptedRunner("broken", r -> {
			throw new IllegalStateException("broken");
		});
		
		IntrospectionException e = Assertions.assertThrows(IntrospectionException.class, () -> engine.introspect(MODEL, runner));
		Assertions.assertTrue(e.getCause() instanceof IllegalStateException);
	}
	
	
	@Test
	void testOverlayAndEvaluate() throws Exception {
		ModelCapabilities base = engine.introspect(MODEL, ScriptedRunner.acceptingAll());
		
		ModelCapabilities overlaid = engine.applyOverlays(base, List.of(
				AdapterOverlay.builder("style").category(AdapterCategory.STYLE).weight(0.8).build(),
				AdapterOverlay.builder("hero").category(AdapterCategory.CHARACTER).weight(1.4).build()));
		
		Assertions.assertEquals(0.68, overlaid.getRecommendedDefaults().get(SamplingParameters.TEMPERATURE).doubleValue(), 1e-9);
		Assertions.assertEquals(0.9, base.getRecommendedDefaults().get(SamplingParameters.TEMPERATURE).doubleValue(), 1e-9);
		Assertions.assertEquals(base.getDetectedAt(), overlaid.getDetectedAt());
		
		EffectiveParameterView view = engine.evaluate(overlaid, Map.of(SamplingParameters.MIROSTAT, 1, SamplingParameters.TEMPERATURE, 1.4));
		Assertions.assertFalse(view.isVisible(SamplingParameters.TEMPERATURE));
		Assertions.assertEquals(2, view.getWarnings().size());
	}
	
	
	@Test
	void testInvalidate() throws Exception {
		ScriptedRunner runner = ScriptedRunner.acceptingAll();
		engine.introspect(MODEL, runner);
		
		engine.invalidate(MODEL + ".gguf", runner);
		
		Assertions.assertEquals(CacheState.ABSENT, engine.cacheState(MODEL, runner));
		engine.introspect(MODEL, runner);
		Assertions.assertEquals(20, runner.getCalls());
	}
}
