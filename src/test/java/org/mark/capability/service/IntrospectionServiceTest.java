package org.mark.capability.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mark.capability.defaults.DefaultsSynthesizer;
import org.mark.capability.metadata.MetadataExtractor;
import org.mark.capability.probe.CapabilityProbe;
import org.mark.capability.probe.ModifiabilityValidator;
import org.mark.capability.profile.FamilyProfileRegistry;
import org.mark.capability.rules.DependencyGraphBuilder;
import org.mark.capability.runner.ScriptedRunner;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.struct.SamplingParameters;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;


@ExtendWith(MockitoExtension.class)
class IntrospectionServiceTest {
	
	private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
	
	@Mock
	private ModifiabilityValidator validator;
	
	private IntrospectionService service;
	
	
	@BeforeEach
	void setUp() {
		FamilyProfileRegistry registry = FamilyProfileRegistry.loadDefault();
		this.service = new IntrospectionService(new MetadataExtractor(), registry, new CapabilityProbe(Duration.ofSeconds(5)),
				this.validator, new DependencyGraphBuilder(), new DefaultsSynthesizer(registry), Clock.fixed(NOW, ZoneOffset.UTC));
	}
	
	
	@Test
	void testValidatorRunsOnConfidentProbe() throws Exception {
		when(this.validator.validate(any(), any())).thenReturn(List.of());
		ScriptedRunner runner = ScriptedRunner.rejecting(Set.of("mirostat", "tfs_z"));
		
		ModelCapabilities caps = this.service.build("Qwen2.5-7B-Instruct-Q8_0.gguf", runner);
		
		verify(this.validator).validate(any(), any());
		Assertions.assertEquals("Qwen2.5-7B-Instruct-Q8_0", caps.getModelName());
		Assertions.assertEquals("qwen", caps.getFamily());
		Assertions.assertEquals(NOW, caps.getDetectedAt());
		Assertions.assertFalse(caps.isLowConfidence());
		Assertions.assertEquals(Set.of("mirostat", "tfs_z"), caps.getUnsupportedParameters());
		// 没有mirostat就不会产生隐藏temperature的依赖
		Assertions.assertTrue(caps.getDependencies().isEmpty());
		Assertions.assertEquals(0.7, caps.getRecommendedDefaults().get(SamplingParameters.TEMPERATURE).doubleValue(), 1e-9);
		Assertions.assertTrue(caps.getWarnings().contains("Qwen对min_p的响应比top_p更好"));
	}
	
	
	@Test
	void testValidatorIsSkippedOnLowConfidence() throws Exception {
		ModelCapabilities caps = this.service.build("mystery-model", ScriptedRunner.unreachable());
		
		verify(this.validator, never()).validate(any(), any());
		Assertions.assertTrue(caps.isLowConfidence());
		Assertions.assertEquals(Set.of(SamplingParameters.TEMPERATURE, SamplingParameters.MAX_TOKENS), caps.getParameters().keySet());
		Assertions.assertEquals("unknown", caps.getFamily());
		Assertions.assertEquals(2048, caps.getContextLength());
		// 上下文2048，推荐的max_tokens为2048/4
		Assertions.assertEquals(512, caps.getRecommendedDefaults().get(SamplingParameters.MAX_TOKENS).intValue());
	}
	
	
	@Test
	void testSmallModelRuleWinsOverFamilyPreference() throws Exception {
		// mistral把tfs_z列为效果很好的参数，但3B的模型仍然不推荐使用
		ModelCapabilities caps = this.service.build("mistral-3b-q8_0", ScriptedRunner.acceptingAll());
		
		Assertions.assertEquals("mistral", caps.getFamily());
		Assertions.assertTrue(caps.getParameter(SamplingParameters.TFS_Z).isExperimental());
		Assertions.assertFalse(caps.getParameter(SamplingParameters.TFS_Z).isRecommended());
		Assertions.assertEquals("小于7B的模型使用该参数效果不稳定", caps.getParameter(SamplingParameters.TFS_Z).getNote());
		Assertions.assertTrue(caps.getWarnings().contains("Mistral配合TFS效果较好"));
	}
}
