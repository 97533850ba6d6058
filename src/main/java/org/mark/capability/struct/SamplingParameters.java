package org.mark.capability.struct;

/**
 * 	采样参数的名字，与llama.cpp的/v1/chat/completions请求字段一致。
 */
public final class SamplingParameters {
	
	public static final String TEMPERATURE = "temperature";
	
	public static final String TOP_P = "top_p";
	
	public static final String TOP_K = "top_k";
	
	public static final String MAX_TOKENS = "max_tokens";
	
	public static final String FREQUENCY_PENALTY = "frequency_penalty";
	
	public static final String PRESENCE_PENALTY = "presence_penalty";
	
	public static final String SEED = "seed";
	
	public static final String MIN_P = "min_p";
	
	public static final String TYPICAL_P = "typical_p";
	
	public static final String REPEAT_PENALTY = "repeat_penalty";
	
	public static final String TFS_Z = "tfs_z";
	
	public static final String MIROSTAT = "mirostat";
	
	public static final String MIROSTAT_TAU = "mirostat_tau";
	
	public static final String MIROSTAT_ETA = "mirostat_eta";
	
	public static final String ETA_CUTOFF = "eta_cutoff";
	
	public static final String EPSILON_CUTOFF = "epsilon_cutoff";
	
	public static final String DRY_MULTIPLIER = "dry_multiplier";
	
	
	private SamplingParameters() {
		
	}
}
