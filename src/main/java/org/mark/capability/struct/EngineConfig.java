package org.mark.capability.struct;

/**
 * 	引擎配置，对应config/engine.json。
 */
public class EngineConfig {
	
	public static final long DEFAULT_FRESHNESS_SECONDS = 3600;
	
	public static final long DEFAULT_LOW_CONFIDENCE_SECONDS = 60;
	
	public static final long DEFAULT_PROBE_TIMEOUT_SECONDS = 30;
	
	public static final int DEFAULT_PORT = 8090;
	
	public static final String DEFAULT_RUNNER_BASE_URL = "http://127.0.0.1:8080";
	
	/**
	 * 	能力快照的有效期（秒）
	 */
	private long freshnessSeconds = DEFAULT_FRESHNESS_SECONDS;
	
	/**
	 * 	低置信度快照的有效期（秒）
	 */
	private long lowConfidenceSeconds = DEFAULT_LOW_CONFIDENCE_SECONDS;
	
	/**
	 * 	每次探测请求的超时（秒）
	 */
	private long probeTimeoutSeconds = DEFAULT_PROBE_TIMEOUT_SECONDS;
	
	private int port = DEFAULT_PORT;
	
	/**
	 * 	请求里没有给出baseUrl时使用的runner地址
	 */
	private String defaultRunnerBaseUrl = DEFAULT_RUNNER_BASE_URL;
	
	/**
	 * 	外部的家族配置文件，可选
	 */
	private String familyProfilesPath;
	
	
	public EngineConfig() {
		
	}
	
	
	/**
	 * 	把不合法的值改回默认值。
	 * @return
	 */
	public EngineConfig sanitize() {
		if (this.freshnessSeconds <= 0) {
			this.freshnessSeconds = DEFAULT_FRESHNESS_SECONDS;
		}
		if (this.lowConfidenceSeconds <= 0) {
			this.lowConfidenceSeconds = DEFAULT_LOW_CONFIDENCE_SECONDS;
		}
		if (this.probeTimeoutSeconds <= 0) {
			this.probeTimeoutSeconds = DEFAULT_PROBE_TIMEOUT_SECONDS;
		}
		if (this.port <= 0 || this.port > 65535) {
			this.port = DEFAULT_PORT;
		}
		if (this.defaultRunnerBaseUrl == null || this.defaultRunnerBaseUrl.trim().isEmpty()) {
			this.defaultRunnerBaseUrl = DEFAULT_RUNNER_BASE_URL;
		}
		return this;
	}
	

	public long getFreshnessSeconds() {
		return freshnessSeconds;
	}

	public void setFreshnessSeconds(long freshnessSeconds) {
		this.freshnessSeconds = freshnessSeconds;
	}

	public long getLowConfidenceSeconds() {
		return lowConfidenceSeconds;
	}

	public void setLowConfidenceSeconds(long lowConfidenceSeconds) {
		this.lowConfidenceSeconds = lowConfidenceSeconds;
	}

	public long getProbeTimeoutSeconds() {
		return probeTimeoutSeconds;
	}

	public void setProbeTimeoutSeconds(long probeTimeoutSeconds) {
		this.probeTimeoutSeconds = probeTimeoutSeconds;
	}

	public int getPort() {
		return port;
	}

	public void setPort(int port) {
		this.port = port;
	}

	public String getDefaultRunnerBaseUrl() {
		return defaultRunnerBaseUrl;
	}

	public void setDefaultRunnerBaseUrl(String defaultRunnerBaseUrl) {
		this.defaultRunnerBaseUrl = defaultRunnerBaseUrl;
	}

	public String getFamilyProfilesPath() {
		return familyProfilesPath;
	}

	public void setFamilyProfilesPath(String familyProfilesPath) {
		this.familyProfilesPath = familyProfilesPath;
	}
}
