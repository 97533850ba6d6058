package org.mark.capability.struct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 	适配器对一个参数造成的修改。
 * 	<p>
 * 	RANGE_SHIFT记录新的推荐默认值，SENSITIVITY_MULTIPLY记录灵敏度倍数。
 * 	同一个参数两种修改可以同时存在，因此在快照里用{@link #keyOf(String, ModificationKind)}作为键。
 */
public final class AdapterParameterModification {
	
	private final String parameterName;
	
	private final ModificationKind kind;
	
	private final Number newDefaultValue;
	
	private final double sensitivityMultiplier;
	
	private final String description;
	
	/**
	 * 	按应用顺序排列的适配器名字
	 */
	private final List<String> contributingAdapters;
	
	
	private AdapterParameterModification(String parameterName, ModificationKind kind, Number newDefaultValue,
			double sensitivityMultiplier, String description, List<String> contributingAdapters) {
		this.parameterName = Objects.requireNonNull(parameterName, "parameterName");
		this.kind = Objects.requireNonNull(kind, "kind");
		this.newDefaultValue = newDefaultValue;
		this.sensitivityMultiplier = sensitivityMultiplier;
		this.description = description;
		this.contributingAdapters = Collections.unmodifiableList(new ArrayList<>(contributingAdapters));
	}
	
	
	public static AdapterParameterModification rangeShift(String parameterName, Number newDefaultValue, String description, List<String> adapters) {
		return new AdapterParameterModification(parameterName, ModificationKind.RANGE_SHIFT, newDefaultValue, 1.0, description, adapters);
	}
	
	
	public static AdapterParameterModification sensitivity(String parameterName, double multiplier, String description, List<String> adapters) {
		return new AdapterParameterModification(parameterName, ModificationKind.SENSITIVITY_MULTIPLY, null, multiplier, description, adapters);
	}
	
	
	public static String keyOf(String parameterName, ModificationKind kind) {
		return parameterName + (kind == ModificationKind.RANGE_SHIFT ? "/range" : "/sensitivity");
	}
	
	
	public String key() {
		return keyOf(this.parameterName, this.kind);
	}
	
	
	/**
	 * 	在已有倍数上再乘一个倍数，并把适配器名字追加到末尾。
	 * @param multiplier
	 * @param adapterName
	 * @return
	 */
	public AdapterParameterModification multiply(double multiplier, String adapterName) {
		if (this.kind != ModificationKind.SENSITIVITY_MULTIPLY) {
			throw new IllegalStateException("只有SENSITIVITY_MULTIPLY类型可以叠加倍数");
		}
		List<String> adapters = new ArrayList<>(this.contributingAdapters);
		adapters.add(adapterName);
		return new AdapterParameterModification(this.parameterName, this.kind, null, this.sensitivityMultiplier * multiplier, this.description, adapters);
	}
	
	
	/**
	 * 	用新的默认值替换，并把适配器名字追加到末尾。
	 * @param newDefault
	 * @param adapterName
	 * @param description
	 * @return
	 */
	public AdapterParameterModification shift(Number newDefault, String adapterName, String description) {
		if (this.kind != ModificationKind.RANGE_SHIFT) {
			throw new IllegalStateException("只有RANGE_SHIFT类型可以修改默认值");
		}
		List<String> adapters = new ArrayList<>(this.contributingAdapters);
		adapters.add(adapterName);
		return new AdapterParameterModification(this.parameterName, this.kind, newDefault, 1.0, description, adapters);
	}
	

	public String getParameterName() {
		return parameterName;
	}

	public ModificationKind getKind() {
		return kind;
	}

	public Number getNewDefaultValue() {
		return newDefaultValue;
	}

	public double getSensitivityMultiplier() {
		return sensitivityMultiplier;
	}

	public String getDescription() {
		return description;
	}

	public List<String> getContributingAdapters() {
		return contributingAdapters;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof AdapterParameterModification)) {
			return false;
		}
		AdapterParameterModification that = (AdapterParameterModification) o;
		return Double.compare(sensitivityMultiplier, that.sensitivityMultiplier) == 0
				&& parameterName.equals(that.parameterName)
				&& kind == that.kind
				&& Objects.equals(newDefaultValue, that.newDefaultValue)
				&& Objects.equals(description, that.description)
				&& contributingAdapters.equals(that.contributingAdapters);
	}

	@Override
	public int hashCode() {
		return Objects.hash(parameterName, kind, newDefaultValue, sensitivityMultiplier, contributingAdapters);
	}

	@Override
	public String toString() {
		return "AdapterParameterModification{" + key() + ", default=" + newDefaultValue + ", multiplier=" + sensitivityMultiplier
				+ ", adapters=" + contributingAdapters + "}";
	}
}
