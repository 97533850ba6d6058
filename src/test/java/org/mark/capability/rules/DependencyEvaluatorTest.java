package org.mark.capability.rules;

import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mark.capability.struct.ComparisonType;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.struct.ParameterDependency;
import org.mark.capability.struct.SamplingParameters;


class DependencyEvaluatorTest {
	
	private final DependencyEvaluator evaluator = new DependencyEvaluator();
	
	
	private static ModelCapabilities withMirostat() {
		ModelCapabilities.Builder builder = ModelCapabilities.builder("model")
				.quantization("Q8_0")
				.putParameter(DependencyGraphBuilderTest.floatParam(SamplingParameters.TEMPERATURE, 0, 2, 0.7))
				.putParameter(DependencyGraphBuilderTest.mirostat());
		new DependencyGraphBuilder().build(builder);
		return builder.build();
	}
	
	
	@Test
	void testMirostatEnabledHidesTemperature() {
		ModelCapabilities capabilities = withMirostat();
		
		EffectiveParameterView view = evaluator.evaluate(capabilities, Map.of(SamplingParameters.MIROSTAT, 2));
		
		Assertions.assertFalse(view.isVisible(SamplingParameters.TEMPERATURE));
		Assertions.assertTrue(view.getHiddenParameters().contains(SamplingParameters.TEMPERATURE));
		Assertions.assertTrue(view.isVisible(SamplingParameters.MIROSTAT));
		Assertions.assertEquals(1, view.getWarnings().size());
		// 内部的参数目录不受影响
		Assertions.assertTrue(capabilities.hasParameter(SamplingParameters.TEMPERATURE));
	}
	
	
	@Test
	void testMirostatDefaultKeepsTemperatureVisible() {
		EffectiveParameterView view = evaluator.evaluate(withMirostat(), Map.of());
		
		Assertions.assertTrue(view.isVisible(SamplingParameters.TEMPERATURE));
		Assertions.assertTrue(view.getHiddenParameters().isEmpty());
		Assertions.assertTrue(view.getWarnings().isEmpty());
	}
	
	
	@Test
	void testRecommendedDefaultUsedWhenValueMissing() {
		ModelCapabilities capabilities = withMirostat().toBuilder()
				.putRecommendedDefault(SamplingParameters.MIROSTAT, 1)
				.build();
		
		EffectiveParameterView view = evaluator.evaluate(capabilities, null);
		
		Assertions.assertFalse(view.isVisible(SamplingParameters.TEMPERATURE));
	}
	
	
	@Test
	void testForcedValue() {
		ModelCapabilities capabilities = withMirostat().toBuilder()
				.addDependency(ParameterDependency.force(SamplingParameters.MIROSTAT, ComparisonType.EQUALS, 2,
						SamplingParameters.MIROSTAT, 2, null))
				.build();
		
		EffectiveParameterView view = evaluator.evaluate(capabilities, Map.of(SamplingParameters.MIROSTAT, 2));
		
		Assertions.assertEquals(2, view.getForcedValues().get(SamplingParameters.MIROSTAT));
		Assertions.assertEquals(1, view.getWarnings().size());
	}
}
