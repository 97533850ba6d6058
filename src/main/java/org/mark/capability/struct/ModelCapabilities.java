package org.mark.capability.struct;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * 	一个模型（加上为它服务的runner）实际支持的参数能力快照。
 * 	<p>
 * 	快照一旦创建就不可修改。适配器叠加等操作通过{@link #toBuilder()}复制出新的实例。
 * 	同一个参数名不会同时出现在参数目录和不支持集合中。
 */
public final class ModelCapabilities {
	
	private final String modelName;
	
	private final String family;
	
	private final SizeClass sizeClass;
	
	/**
	 * 	估算的参数量，未知为0
	 */
	private final long parameterCount;
	
	private final int contextLength;
	
	private final String quantization;
	
	/**
	 * 	参数目录
	 */
	private final Map<String, ParameterCapability> parameters;
	
	private final List<ParameterDependency> dependencies;
	
	private final Map<String, Number> recommendedDefaults;
	
	private final Set<String> unsupportedParameters;
	
	private final List<String> warnings;
	
	private final Instant detectedAt;
	
	/**
	 * 	基础探测失败时只给出最保守的参数集合，此时为true。
	 */
	private final boolean lowConfidence;
	
	private final List<AdapterOverlay> appliedAdapters;
	
	private final Map<String, AdapterParameterModification> adapterModifications;
	
	/**
	 * 	叠加适配器之前的快照，没有叠加过时为null。不参与序列化和相等比较。
	 */
	private final transient ModelCapabilities overlayBase;
	
	
	private ModelCapabilities(Builder b) {
		this.modelName = Objects.requireNonNull(b.modelName, "modelName");
		this.family = b.family == null ? "unknown" : b.family;
		this.sizeClass = b.sizeClass == null ? SizeClass.UNKNOWN : b.sizeClass;
		this.parameterCount = b.parameterCount;
		this.contextLength = b.contextLength;
		this.quantization = b.quantization == null ? "Unknown" : b.quantization;
		this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameters));
		this.dependencies = Collections.unmodifiableList(new ArrayList<>(b.dependencies));
		this.recommendedDefaults = Collections.unmodifiableMap(new LinkedHashMap<>(b.recommendedDefaults));
		this.unsupportedParameters = Collections.unmodifiableSet(new LinkedHashSet<>(b.unsupportedParameters));
		this.warnings = Collections.unmodifiableList(new ArrayList<>(b.warnings));
		this.detectedAt = b.detectedAt;
		this.lowConfidence = b.lowConfidence;
		this.appliedAdapters = Collections.unmodifiableList(new ArrayList<>(b.appliedAdapters));
		this.adapterModifications = Collections.unmodifiableMap(new LinkedHashMap<>(b.adapterModifications));
		this.overlayBase = b.overlayBase;
	}
	
	
	public static Builder builder(String modelName) {
		return new Builder(modelName);
	}
	
	
	/**
	 * 	复制一份可修改的构建器，原快照不受影响。
	 * @return
	 */
	public Builder toBuilder() {
		Builder b = new Builder(this.modelName);
		b.family = this.family;
		b.sizeClass = this.sizeClass;
		b.parameterCount = this.parameterCount;
		b.contextLength = this.contextLength;
		b.quantization = this.quantization;
		b.parameters.putAll(this.parameters);
		b.dependencies.addAll(this.dependencies);
		b.recommendedDefaults.putAll(this.recommendedDefaults);
		b.unsupportedParameters.addAll(this.unsupportedParameters);
		b.warnings.addAll(this.warnings);
		b.detectedAt = this.detectedAt;
		b.lowConfidence = this.lowConfidence;
		b.appliedAdapters.addAll(this.appliedAdapters);
		b.adapterModifications.putAll(this.adapterModifications);
		b.overlayBase = this.overlayBase;
		return b;
	}
	
	
	/**
	 * 	去掉适配器叠加后的快照。本身没有叠加过时返回自己。
	 * @return
	 */
	public ModelCapabilities withoutOverlays() {
		return this.overlayBase == null ? this : this.overlayBase;
	}
	
	
	public boolean hasParameter(String name) {
		return this.parameters.containsKey(name);
	}
	
	
	public ParameterCapability getParameter(String name) {
		return this.parameters.get(name);
	}
	
	
	/**
	 * 	是否有启用中的适配器。
	 * @return
	 */
	public boolean hasActiveAdapters() {
		for (AdapterOverlay a : this.appliedAdapters) {
			if (a.isEnabled()) {
				return true;
			}
		}
		return false;
	}
	
	
	/**
	 * 	启用中的适配器的权重之和。
	 * @return
	 */
	public double getTotalAdapterWeight() {
		double total = 0;
		for (AdapterOverlay a : this.appliedAdapters) {
			if (a.isEnabled()) {
				total += a.getWeight();
			}
		}
		return total;
	}
	
	
	/**
	 * 	取某个参数的灵敏度倍数，没有被适配器修改过时为1。
	 * @param name
	 * @return
	 */
	public double getSensitivityMultiplier(String name) {
		AdapterParameterModification m = this.adapterModifications.get(AdapterParameterModification.keyOf(name, ModificationKind.SENSITIVITY_MULTIPLY));
		return m == null ? 1.0 : m.getSensitivityMultiplier();
	}
	
	
	public AdapterParameterModification getModification(String name, ModificationKind kind) {
		return this.adapterModifications.get(AdapterParameterModification.keyOf(name, kind));
	}
	

	public String getModelName() {
		return modelName;
	}

	public String getFamily() {
		return family;
	}

	public SizeClass getSizeClass() {
		return sizeClass;
	}

	public long getParameterCount() {
		return parameterCount;
	}

	public int getContextLength() {
		return contextLength;
	}

	public String getQuantization() {
		return quantization;
	}

	public Map<String, ParameterCapability> getParameters() {
		return parameters;
	}

	public List<ParameterDependency> getDependencies() {
		return dependencies;
	}

	public Map<String, Number> getRecommendedDefaults() {
		return recommendedDefaults;
	}

	public Set<String> getUnsupportedParameters() {
		return unsupportedParameters;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	public Instant getDetectedAt() {
		return detectedAt;
	}

	public boolean isLowConfidence() {
		return lowConfidence;
	}

	public List<AdapterOverlay> getAppliedAdapters() {
		return appliedAdapters;
	}

	public Map<String, AdapterParameterModification> getAdapterModifications() {
		return adapterModifications;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ModelCapabilities)) {
			return false;
		}
		ModelCapabilities that = (ModelCapabilities) o;
		return parameterCount == that.parameterCount
				&& contextLength == that.contextLength
				&& lowConfidence == that.lowConfidence
				&& modelName.equals(that.modelName)
				&& family.equals(that.family)
				&& sizeClass == that.sizeClass
				&& quantization.equals(that.quantization)
				&& parameters.equals(that.parameters)
				&& dependencies.equals(that.dependencies)
				&& recommendedDefaults.equals(that.recommendedDefaults)
				&& unsupportedParameters.equals(that.unsupportedParameters)
				&& warnings.equals(that.warnings)
				&& Objects.equals(detectedAt, that.detectedAt)
				&& appliedAdapters.equals(that.appliedAdapters)
				&& adapterModifications.equals(that.adapterModifications);
	}

	@Override
	public int hashCode() {
		return Objects.hash(modelName, family, sizeClass, parameterCount, contextLength, quantization, parameters.keySet(), detectedAt);
	}

	@Override
	public String toString() {
		return "ModelCapabilities{" + modelName + ", family=" + family + ", class=" + sizeClass + ", params=" + parameters.keySet()
				+ ", unsupported=" + unsupportedParameters + (lowConfidence ? ", lowConfidence" : "") + "}";
	}
	
	
	/**
	 * 	快照的构建器。不是线程安全的，只在构建流程或叠加流程内部使用。
	 */
	public static final class Builder {
		private final String modelName;
		private String family;
		private SizeClass sizeClass;
		private long parameterCount;
		private int contextLength;
		private String quantization;
		private final Map<String, ParameterCapability> parameters = new LinkedHashMap<>();
		private final List<ParameterDependency> dependencies = new ArrayList<>();
		private final Map<String, Number> recommendedDefaults = new LinkedHashMap<>();
		private final Set<String> unsupportedParameters = new LinkedHashSet<>();
		private final List<String> warnings = new ArrayList<>();
		private Instant detectedAt;
		private boolean lowConfidence;
		private final List<AdapterOverlay> appliedAdapters = new ArrayList<>();
		private final Map<String, AdapterParameterModification> adapterModifications = new LinkedHashMap<>();
		private ModelCapabilities overlayBase;
		
		private Builder(String modelName) {
			this.modelName = modelName;
		}
		
		public String getModelName() {
			return modelName;
		}
		
		public Builder family(String family) {
			this.family = family;
			return this;
		}
		
		public String getFamily() {
			return family;
		}
		
		public Builder sizeClass(SizeClass sizeClass) {
			this.sizeClass = sizeClass;
			return this;
		}
		
		public Builder parameterCount(long parameterCount) {
			this.parameterCount = parameterCount;
			return this;
		}
		
		public long getParameterCount() {
			return parameterCount;
		}
		
		public Builder contextLength(int contextLength) {
			this.contextLength = contextLength;
			return this;
		}
		
		public int getContextLength() {
			return contextLength;
		}
		
		public Builder quantization(String quantization) {
			this.quantization = quantization;
			return this;
		}
		
		public String getQuantization() {
			return quantization;
		}
		
		public Builder detectedAt(Instant detectedAt) {
			this.detectedAt = detectedAt;
			return this;
		}
		
		public Builder lowConfidence(boolean lowConfidence) {
			this.lowConfidence = lowConfidence;
			return this;
		}
		
		public boolean isLowConfidence() {
			return lowConfidence;
		}
		
		/**
		 * 	登记一个参数。已经被判定为不支持的参数不能再加回来。
		 * @param capability
		 * @return
		 */
		public Builder putParameter(ParameterCapability capability) {
			if (this.unsupportedParameters.contains(capability.getName())) {
				throw new IllegalStateException("参数已被标记为不支持: " + capability.getName());
			}
			this.parameters.put(capability.getName(), capability);
			return this;
		}
		
		/**
		 * 	修改目录中已有的参数，不存在时什么也不做。
		 * @param name
		 * @param change
		 * @return
		 */
		public Builder updateParameter(String name, UnaryOperator<ParameterCapability> change) {
			ParameterCapability current = this.parameters.get(name);
			if (current != null) {
				this.parameters.put(name, change.apply(current));
			}
			return this;
		}
		
		public boolean hasParameter(String name) {
			return this.parameters.containsKey(name);
		}
		
		public ParameterCapability getParameter(String name) {
			return this.parameters.get(name);
		}
		
		public Set<String> parameterNames() {
			return Collections.unmodifiableSet(new LinkedHashSet<>(this.parameters.keySet()));
		}
		
		/**
		 * 	标记为不支持，同时从参数目录和推荐默认值中移除。
		 * @param name
		 * @return
		 */
		public Builder markUnsupported(String name) {
			this.parameters.remove(name);
			this.recommendedDefaults.remove(name);
			this.unsupportedParameters.add(name);
			return this;
		}
		
		public Set<String> unsupportedNames() {
			return Collections.unmodifiableSet(new LinkedHashSet<>(this.unsupportedParameters));
		}
		
		public Builder addDependency(ParameterDependency dependency) {
			this.dependencies.add(dependency);
			return this;
		}
		
		/**
		 * 	设置推荐默认值，只允许目录中存在的参数。
		 * @param name
		 * @param value
		 * @return
		 */
		public Builder putRecommendedDefault(String name, Number value) {
			if (!this.parameters.containsKey(name)) {
				throw new IllegalArgumentException("参数目录中不存在: " + name);
			}
			this.recommendedDefaults.put(name, value);
			return this;
		}
		
		public Number getRecommendedDefault(String name) {
			return this.recommendedDefaults.get(name);
		}
		
		public Builder addWarning(String warning) {
			this.warnings.add(warning);
			return this;
		}
		
		public List<String> getWarnings() {
			return Collections.unmodifiableList(new ArrayList<>(this.warnings));
		}
		
		public Builder appliedAdapters(List<AdapterOverlay> adapters) {
			this.appliedAdapters.clear();
			if (adapters != null) {
				this.appliedAdapters.addAll(adapters);
			}
			return this;
		}
		
		public Builder putModification(AdapterParameterModification modification) {
			this.adapterModifications.put(modification.key(), modification);
			return this;
		}
		
		/**
		 * 	清空适配器造成的修改记录。
		 * @return
		 */
		public Builder clearModifications() {
			this.adapterModifications.clear();
			return this;
		}
		
		/**
		 * 	记录叠加适配器之前的快照。
		 * @param overlayBase
		 * @return
		 */
		public Builder overlayBase(ModelCapabilities overlayBase) {
			this.overlayBase = overlayBase;
			return this;
		}
		
		public AdapterParameterModification getModification(String name, ModificationKind kind) {
			return this.adapterModifications.get(AdapterParameterModification.keyOf(name, kind));
		}
		
		public ModelCapabilities build() {
			return new ModelCapabilities(this);
		}
	}
}
