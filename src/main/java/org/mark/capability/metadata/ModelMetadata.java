package org.mark.capability.metadata;

import org.mark.capability.struct.SizeClass;

/**
 * 	从模型名里解析出来的结构信息。
 */
public final class ModelMetadata {
	
	private final String modelName;
	
	private final long parameterCount;
	
	private final SizeClass sizeClass;
	
	private final int contextLength;
	
	private final String quantization;
	
	
	public ModelMetadata(String modelName, long parameterCount, SizeClass sizeClass, int contextLength, String quantization) {
		this.modelName = modelName;
		this.parameterCount = parameterCount;
		this.sizeClass = sizeClass;
		this.contextLength = contextLength;
		this.quantization = quantization;
	}
	

	public String getModelName() {
		return modelName;
	}

	public long getParameterCount() {
		return parameterCount;
	}

	public SizeClass getSizeClass() {
		return sizeClass;
	}

	public int getContextLength() {
		return contextLength;
	}

	public String getQuantization() {
		return quantization;
	}
	
	/**
	 * 	参数量是否已知。
	 * @return
	 */
	public boolean hasParameterCount() {
		return parameterCount > 0;
	}

	@Override
	public String toString() {
		return String.format("%s: %.1fB params, %d context, %s quant", modelName, parameterCount / 1_000_000_000.0, contextLength, quantization);
	}
}
