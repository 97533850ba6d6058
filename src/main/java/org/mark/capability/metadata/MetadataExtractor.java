package org.mark.capability.metadata;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.mark.capability.struct.SizeClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	从模型标识（文件名或路径）中按规则提取参数量、上下文长度和量化类型。
 * 	纯函数，匹配不到时给出保守的默认值。
 */
public class MetadataExtractor {
	
	private static final Logger logger = LoggerFactory.getLogger(MetadataExtractor.class);
	
	public static final int DEFAULT_CONTEXT_LENGTH = 2048;
	
	public static final String UNKNOWN_QUANTIZATION = "Unknown";
	
	/**
	 * 	如8b、0.5b、6.7b，前后不能紧挨着字母数字，避免把bf16、8bit认成参数量。
	 */
	private static final Pattern PARAMS = Pattern.compile("(?<![a-z0-9.])(\\d+(?:\\.\\d+)?)b(?![a-z0-9])");
	
	/**
	 * 	混合专家模型，如8x7b。
	 */
	private static final Pattern MOE_PARAMS = Pattern.compile("(?<![a-z0-9.])(\\d+)x(\\d+(?:\\.\\d+)?)b(?![a-z0-9])");
	
	/**
	 * 	如32k、128k。
	 */
	private static final Pattern CONTEXT = Pattern.compile("(?<![a-z0-9.])(\\d{1,4})k(?![a-z0-9])");
	
	/**
	 * 	已知的量化标记，顺序有意义：bf16要在f16之前匹配。
	 */
	private static final String[] QUANTIZATIONS = {
			"q4_k_m", "q4_k_s", "q4_0",
			"q5_k_m", "q5_k_s", "q5_0",
			"q6_k", "q8_0",
			"bf16", "f16", "f32"
	};
	
	
	public MetadataExtractor() {
		
	}
	
	
	/**
	 * 	把路径形式的标识转换成模型名：去掉目录和.gguf扩展名。
	 * @param modelIdentifier
	 * @return
	 */
	public static String normalizeModelName(String modelIdentifier) {
		if (modelIdentifier == null) {
			return "";
		}
		String name = modelIdentifier.trim();
		int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
		if (slash >= 0) {
			name = name.substring(slash + 1);
		}
		if (name.toLowerCase(Locale.ROOT).endsWith(".gguf")) {
			name = name.substring(0, name.length() - ".gguf".length());
		}
		return name;
	}
	
	
	/**
	 * 	解析模型标识。
	 * @param modelIdentifier
	 * @return
	 */
	public ModelMetadata extract(String modelIdentifier) {
		String modelName = normalizeModelName(modelIdentifier);
		String lower = modelName.toLowerCase(Locale.ROOT);
		
		long parameterCount = this.parseParameterCount(lower);
		SizeClass sizeClass = SizeClass.fromBillions(parameterCount / 1_000_000_000.0);
		int contextLength = this.parseContextLength(lower);
		String quantization = this.parseQuantization(lower);
		
		ModelMetadata metadata = new ModelMetadata(modelName, parameterCount, sizeClass, contextLength, quantization);
		logger.debug("模型元数据: {}", metadata);
		return metadata;
	}
	
	
	/**
	 * 	量化精度是否处于最低一档（Q4系列）。
	 * @param quantization
	 * @return
	 */
	public static boolean isLowPrecision(String quantization) {
		return quantization != null && quantization.toUpperCase(Locale.ROOT).startsWith("Q4");
	}
	
	
	private long parseParameterCount(String lower) {
		Matcher moe = MOE_PARAMS.matcher(lower);
		double billions = 0;
		while (moe.find()) {
			billions = Integer.parseInt(moe.group(1)) * Double.parseDouble(moe.group(2));
		}
		if (billions <= 0) {
			// 取最后一个匹配
			Matcher m = PARAMS.matcher(lower);
			while (m.find()) {
				billions = Double.parseDouble(m.group(1));
			}
		}
		return Math.round(billions * 1_000_000_000L);
	}
	
	
	private int parseContextLength(String lower) {
		Matcher m = CONTEXT.matcher(lower);
		int context = 0;
		while (m.find()) {
			int k = Integer.parseInt(m.group(1));
			if (k > 0) {
				context = k * 1024;
			}
		}
		return context > 0 ? context : DEFAULT_CONTEXT_LENGTH;
	}
	
	
	private String parseQuantization(String lower) {
		for (String q : QUANTIZATIONS) {
			if (lower.contains(q)) {
				return q.toUpperCase(Locale.ROOT);
			}
		}
		return UNKNOWN_QUANTIZATION;
	}
}
