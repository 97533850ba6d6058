package org.mark.capability.profile;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.mark.capability.struct.FamilyProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * 	模型家族的知识库。
 * 	<p>
 * 	家族识别规则和家族配置都来自JSON数据：默认读取classpath下的family-profiles.json，
 * 	可以再叠加一个外部文件，外部文件中同名的家族会覆盖默认配置。
 */
public class FamilyProfileRegistry {
	
	private static final Logger logger = LoggerFactory.getLogger(FamilyProfileRegistry.class);
	
	public static final String UNKNOWN_FAMILY = "unknown";
	
	public static final String DEFAULT_RESOURCE = "/family-profiles.json";
	
	private static final Gson gson = new Gson();
	
	/**
	 * 	按顺序匹配的家族识别规则
	 */
	private final List<FamilyMatcher> matchers;
	
	private final Map<String, FamilyProfile> profiles;
	
	
	public FamilyProfileRegistry(List<FamilyMatcher> matchers, Map<String, FamilyProfile> profiles) {
		this.matchers = Collections.unmodifiableList(new ArrayList<>(matchers));
		this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
	}
	
	
	/**
	 * 	只加载内置的家族数据。
	 * @return
	 */
	public static FamilyProfileRegistry loadDefault() {
		return load(null);
	}
	
	
	/**
	 * 	加载内置的家族数据，并叠加外部文件。外部文件不存在或者格式错误时只记录日志。
	 * @param externalFile 可以为null
	 * @return
	 */
	public static FamilyProfileRegistry load(Path externalFile) {
		List<FamilyMatcher> matchers = new ArrayList<>();
		Map<String, FamilyProfile> profiles = new LinkedHashMap<>();
		
		try (InputStream in = FamilyProfileRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				logger.warn("未找到内置的家族配置: {}", DEFAULT_RESOURCE);
			} else {
				merge(readDocument(new InputStreamReader(in, StandardCharsets.UTF_8)), matchers, profiles);
			}
		} catch (IOException | JsonParseException e) {
			logger.error("读取内置的家族配置失败", e);
		}
		
		if (externalFile != null) {
			if (!Files.exists(externalFile)) {
				logger.warn("外部家族配置文件不存在: {}", externalFile);
			} else {
				try (Reader reader = Files.newBufferedReader(externalFile, StandardCharsets.UTF_8)) {
					merge(readDocument(reader), matchers, profiles);
					logger.info("已加载外部家族配置: {}", externalFile);
				} catch (IOException | JsonParseException e) {
					logger.error("读取外部家族配置失败: {}", externalFile, e);
				}
			}
		}
		return new FamilyProfileRegistry(matchers, profiles);
	}
	
	
	/**
	 * 	根据模型名识别家族，认不出来时返回unknown。
	 * @param modelName
	 * @return
	 */
	public String detectFamily(String modelName) {
		if (modelName == null) {
			return UNKNOWN_FAMILY;
		}
		String lower = modelName.toLowerCase(Locale.ROOT);
		for (FamilyMatcher m : this.matchers) {
			for (String token : m.getMatch()) {
				if (lower.contains(token.toLowerCase(Locale.ROOT))) {
					return m.getFamily();
				}
			}
		}
		return UNKNOWN_FAMILY;
	}
	
	
	/**
	 * 	查找家族配置。没有配置是正常情况，不会抛异常。
	 * @param family
	 * @return
	 */
	public Optional<FamilyProfile> find(String family) {
		if (family == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(this.profiles.get(family));
	}
	
	
	public List<String> knownFamilies() {
		List<String> list = new ArrayList<>();
		for (FamilyMatcher m : this.matchers) {
			if (!list.contains(m.getFamily())) {
				list.add(m.getFamily());
			}
		}
		return list;
	}
	
	
	private static ProfileDocument readDocument(Reader reader) {
		ProfileDocument doc = gson.fromJson(reader, ProfileDocument.class);
		return doc == null ? new ProfileDocument() : doc;
	}
	
	
	private static void merge(ProfileDocument doc, List<FamilyMatcher> matchers, Map<String, FamilyProfile> profiles) {
		if (doc.families != null) {
			for (FamilyMatcher m : doc.families) {
				if (m == null || m.getFamily() == null || m.getMatch().isEmpty()) {
					continue;
				}
				matchers.removeIf(existing -> existing.getFamily().equals(m.getFamily()));
				matchers.add(m);
			}
		}
		if (doc.profiles != null) {
			for (FamilyProfile p : doc.profiles) {
				if (p == null || p.getFamily() == null) {
					continue;
				}
				profiles.put(p.getFamily(), p);
			}
		}
	}
	
	
	/**
	 * 	family-profiles.json的结构。
	 */
	private static class ProfileDocument {
		private List<FamilyMatcher> families;
		private List<FamilyProfile> profiles;
	}
	
	
	/**
	 * 	家族识别规则：模型名包含任意一个match即属于该家族。
	 */
	public static class FamilyMatcher {
		
		private String family;
		
		private List<String> match;
		
		public FamilyMatcher() {
			
		}
		
		public FamilyMatcher(String family, List<String> match) {
			this.family = family;
			this.match = match == null ? null : new ArrayList<>(match);
		}
		
		public String getFamily() {
			return family;
		}
		
		public List<String> getMatch() {
			return match == null ? Collections.emptyList() : Collections.unmodifiableList(match);
		}
	}
}
