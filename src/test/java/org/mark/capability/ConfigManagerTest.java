package org.mark.capability;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mark.capability.struct.EngineConfig;


class ConfigManagerTest {
	
	@TempDir
	Path dir;
	
	
	@Test
	void testMissingFileGivesDefaults() {
		ConfigManager manager = new ConfigManager(this.dir.resolve("config").resolve("engine.json"));
		
		EngineConfig config = manager.loadEngineConfig();
		
		Assertions.assertEquals(EngineConfig.DEFAULT_FRESHNESS_SECONDS, config.getFreshnessSeconds());
		Assertions.assertEquals(EngineConfig.DEFAULT_LOW_CONFIDENCE_SECONDS, config.getLowConfidenceSeconds());
		Assertions.assertEquals(EngineConfig.DEFAULT_PORT, config.getPort());
		Assertions.assertEquals(EngineConfig.DEFAULT_RUNNER_BASE_URL, config.getDefaultRunnerBaseUrl());
		Assertions.assertNull(config.getFamilyProfilesPath());
	}
	
	
	@Test
	void testSaveAndLoad() {
		ConfigManager manager = new ConfigManager(this.dir.resolve("config").resolve("engine.json"));
		EngineConfig config = new EngineConfig();
		config.setFreshnessSeconds(600);
		config.setPort(9000);
		config.setFamilyProfilesPath("config/profiles.json");
		
		Assertions.assertTrue(manager.saveEngineConfig(config));
		Assertions.assertTrue(Files.exists(manager.getConfigFile()));
		
		EngineConfig loaded = manager.loadEngineConfig();
		Assertions.assertEquals(600, loaded.getFreshnessSeconds());
		Assertions.assertEquals(9000, loaded.getPort());
		Assertions.assertEquals("config/profiles.json", loaded.getFamilyProfilesPath());
		Assertions.assertEquals(EngineConfig.DEFAULT_PROBE_TIMEOUT_SECONDS, loaded.getProbeTimeoutSeconds());
	}
	
	
	@Test
	void testInvalidValuesAreReplaced() throws Exception {
		Path file = this.dir.resolve("engine.json");
		Files.writeString(file, "{\"freshnessSeconds\":-5,\"port\":70000,\"defaultRunnerBaseUrl\":\" \",\"probeTimeoutSeconds\":10}",
				StandardCharsets.UTF_8);
		
		EngineConfig config = new ConfigManager(file).loadEngineConfig();
		
		Assertions.assertEquals(EngineConfig.DEFAULT_FRESHNESS_SECONDS, config.getFreshnessSeconds());
		Assertions.assertEquals(EngineConfig.DEFAULT_PORT, config.getPort());
		Assertions.assertEquals(EngineConfig.DEFAULT_RUNNER_BASE_URL, config.getDefaultRunnerBaseUrl());
		Assertions.assertEquals(10, config.getProbeTimeoutSeconds());
	}
	
	
	@Test
	void testBrokenFileGivesDefaults() throws Exception {
		Path file = this.dir.resolve("engine.json");
		Files.writeString(file, "{\"port\":", StandardCharsets.UTF_8);
		
		EngineConfig config = new ConfigManager(file).loadEngineConfig();
		
		Assertions.assertEquals(EngineConfig.DEFAULT_PORT, config.getPort());
	}
}
