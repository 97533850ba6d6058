package org.mark.capability.struct;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;


class ModelCapabilitiesTest {
	
	private static ParameterCapability temperature() {
		return ParameterCapability.builder(SamplingParameters.TEMPERATURE, ParameterType.FLOAT)
				.range(0.0, 2.0)
				.defaultValue(0.7)
				.build();
	}
	
	
	@Test
	void testMarkUnsupportedRemovesParameter() {
		ModelCapabilities.Builder builder = ModelCapabilities.builder("llama-3-8b")
				.putParameter(temperature())
				.putRecommendedDefault(SamplingParameters.TEMPERATURE, 0.8);
		
		builder.markUnsupported(SamplingParameters.TEMPERATURE);
		ModelCapabilities caps = builder.build();
		
		Assertions.assertFalse(caps.hasParameter(SamplingParameters.TEMPERATURE));
		Assertions.assertTrue(caps.getUnsupportedParameters().contains(SamplingParameters.TEMPERATURE));
		Assertions.assertFalse(caps.getRecommendedDefaults().containsKey(SamplingParameters.TEMPERATURE));
		Assertions.assertThrows(IllegalStateException.class, () -> builder.putParameter(temperature()));
	}
	
	
	@Test
	void testRecommendedDefaultRequiresCatalogEntry() {
		ModelCapabilities.Builder builder = ModelCapabilities.builder("llama-3-8b");
		
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> builder.putRecommendedDefault(SamplingParameters.TOP_P, 0.9));
	}
	
	
	@Test
	void testToBuilderLeavesSnapshotUntouched() {
		ModelCapabilities base = ModelCapabilities.builder("llama-3-8b")
				.family("llama")
				.putParameter(temperature())
				.putRecommendedDefault(SamplingParameters.TEMPERATURE, 0.8)
				.addWarning("原始警告")
				.build();
		
		ModelCapabilities copy = base.toBuilder()
				.putRecommendedDefault(SamplingParameters.TEMPERATURE, 0.5)
				.addWarning("新的警告")
				.build();
		
		Assertions.assertEquals(0.8, base.getRecommendedDefaults().get(SamplingParameters.TEMPERATURE));
		Assertions.assertEquals(1, base.getWarnings().size());
		Assertions.assertEquals(0.5, copy.getRecommendedDefaults().get(SamplingParameters.TEMPERATURE));
		Assertions.assertEquals(2, copy.getWarnings().size());
		Assertions.assertEquals("llama", copy.getFamily());
		Assertions.assertThrows(UnsupportedOperationException.class, () -> base.getWarnings().add("x"));
	}
	
	
	@Test
	void testDefaults() {
		ModelCapabilities caps = ModelCapabilities.builder("mystery-model").build();
		
		Assertions.assertEquals("unknown", caps.getFamily());
		Assertions.assertEquals("Unknown", caps.getQuantization());
		Assertions.assertEquals(SizeClass.UNKNOWN, caps.getSizeClass());
		Assertions.assertFalse(caps.hasActiveAdapters());
		Assertions.assertEquals(0, caps.getTotalAdapterWeight());
		Assertions.assertEquals(1.0, caps.getSensitivityMultiplier(SamplingParameters.TEMPERATURE));
	}
}
