package org.mark.capability;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.mark.capability.struct.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * 配置文件管理类，用于加载引擎配置
 */
public class ConfigManager {
	
	private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);
	
	private static final ConfigManager INSTANCE = new ConfigManager(Paths.get("config", "engine.json"));
	
	private final Path configFile;
	
	private final Gson gson;
	
	
	ConfigManager(Path configFile) {
		this.configFile = configFile;
		this.gson = new GsonBuilder().setPrettyPrinting().create();
	}
	
	public static ConfigManager getInstance() {
		return INSTANCE;
	}
	
	/**
	 * 加载引擎配置，文件不存在或者读取失败时返回默认配置
	 * @return
	 */
	public EngineConfig loadEngineConfig() {
		if (!Files.exists(this.configFile)) {
			logger.info("配置文件不存在，使用默认配置: {}", this.configFile);
			return new EngineConfig();
		}
		try (Reader reader = Files.newBufferedReader(this.configFile, StandardCharsets.UTF_8)) {
			EngineConfig config = this.gson.fromJson(reader, EngineConfig.class);
			if (config == null) {
				logger.warn("配置文件为空，使用默认配置: {}", this.configFile);
				return new EngineConfig();
			}
			logger.info("成功加载配置: {}", this.configFile);
			return config.sanitize();
		} catch (IOException | JsonParseException e) {
			logger.error("加载配置失败，使用默认配置: {}", this.configFile, e);
			return new EngineConfig();
		}
	}
	
	/**
	 * 保存引擎配置
	 * @param config
	 * @return 是否保存成功
	 */
	public boolean saveEngineConfig(EngineConfig config) {
		try {
			Path parent = this.configFile.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.writeString(this.configFile, this.gson.toJson(config), StandardCharsets.UTF_8);
			logger.info("配置已保存到: {}", this.configFile);
			return true;
		} catch (IOException e) {
			logger.error("保存配置失败: {}", this.configFile, e);
			return false;
		}
	}
	
	public Path getConfigFile() {
		return configFile;
	}
}
