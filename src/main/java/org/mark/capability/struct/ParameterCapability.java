package org.mark.capability.struct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 	某个模型上一个参数实际能做到的事情：类型、取值范围、默认值以及几个标志位。
 * 	<p>
 * 	创建后不可修改，需要调整时通过{@link #toBuilder()}复制一份。
 */
public final class ParameterCapability {
	
	/**
	 * 	参数名，如temperature
	 */
	private final String name;
	
	/**
	 * 	取值类型
	 */
	private final ParameterType type;
	
	/**
	 * 	最小值
	 */
	private final Number minValue;
	
	/**
	 * 	最大值
	 */
	private final Number maxValue;
	
	/**
	 * 	枚举类型的可选值，非枚举为空列表。
	 */
	private final List<Number> allowedValues;
	
	/**
	 * 	默认值，始终在[min, max]内或者在可选值里。
	 */
	private final Number defaultValue;
	
	private final boolean modifiable;
	
	private final boolean recommended;
	
	private final boolean experimental;
	
	/**
	 * 	针对当前模型的说明。
	 */
	private final String note;
	
	
	private ParameterCapability(Builder b) {
		this.name = Objects.requireNonNull(b.name, "name");
		this.type = Objects.requireNonNull(b.type, "type");
		this.minValue = b.minValue;
		this.maxValue = b.maxValue;
		this.allowedValues = Collections.unmodifiableList(new ArrayList<>(b.allowedValues));
		this.defaultValue = b.defaultValue;
		this.modifiable = b.modifiable;
		this.recommended = b.recommended;
		this.experimental = b.experimental;
		this.note = b.note;
		
		if (this.defaultValue != null && !this.accepts(this.defaultValue.doubleValue())) {
			throw new IllegalArgumentException("参数" + this.name + "的默认值" + this.defaultValue + "超出了允许的范围");
		}
	}
	
	
	public static Builder builder(String name, ParameterType type) {
		return new Builder(name, type);
	}
	
	
	public Builder toBuilder() {
		Builder b = new Builder(this.name, this.type);
		b.minValue = this.minValue;
		b.maxValue = this.maxValue;
		b.allowedValues = new ArrayList<>(this.allowedValues);
		b.defaultValue = this.defaultValue;
		b.modifiable = this.modifiable;
		b.recommended = this.recommended;
		b.experimental = this.experimental;
		b.note = this.note;
		return b;
	}
	
	
	/**
	 * 	判断一个值是否合法。
	 * @param value
	 * @return
	 */
	public boolean accepts(double value) {
		if (!this.allowedValues.isEmpty()) {
			for (Number n : this.allowedValues) {
				if (Double.compare(n.doubleValue(), value) == 0) {
					return true;
				}
			}
			return false;
		}
		if (this.minValue != null && value < this.minValue.doubleValue()) {
			return false;
		}
		if (this.maxValue != null && value > this.maxValue.doubleValue()) {
			return false;
		}
		return true;
	}
	
	
	/**
	 * 	把一个值收敛到合法范围内，并转换成参数类型对应的数值。
	 * 	枚举类型取最接近的可选值。
	 * @param value
	 * @return
	 */
	public Number clamp(double value) {
		if (!this.allowedValues.isEmpty()) {
			Number best = this.allowedValues.get(0);
			for (Number n : this.allowedValues) {
				if (Math.abs(n.doubleValue() - value) < Math.abs(best.doubleValue() - value)) {
					best = n;
				}
			}
			return best;
		}
		double v = value;
		if (this.minValue != null) {
			v = Math.max(v, this.minValue.doubleValue());
		}
		if (this.maxValue != null) {
			v = Math.min(v, this.maxValue.doubleValue());
		}
		return this.type.coerce(v);
	}
	
	
	public String getName() {
		return name;
	}

	public ParameterType getType() {
		return type;
	}

	public Number getMinValue() {
		return minValue;
	}

	public Number getMaxValue() {
		return maxValue;
	}

	public List<Number> getAllowedValues() {
		return allowedValues;
	}

	public Number getDefaultValue() {
		return defaultValue;
	}

	public boolean isModifiable() {
		return modifiable;
	}

	public boolean isRecommended() {
		return recommended;
	}

	public boolean isExperimental() {
		return experimental;
	}

	public String getNote() {
		return note;
	}
	
	
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ParameterCapability)) {
			return false;
		}
		ParameterCapability that = (ParameterCapability) o;
		return modifiable == that.modifiable
				&& recommended == that.recommended
				&& experimental == that.experimental
				&& name.equals(that.name)
				&& type == that.type
				&& Objects.equals(minValue, that.minValue)
				&& Objects.equals(maxValue, that.maxValue)
				&& allowedValues.equals(that.allowedValues)
				&& Objects.equals(defaultValue, that.defaultValue)
				&& Objects.equals(note, that.note);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, minValue, maxValue, allowedValues, defaultValue, modifiable, recommended, experimental, note);
	}

	@Override
	public String toString() {
		return "ParameterCapability{" + name + " " + type + " [" + minValue + ", " + maxValue + "] default=" + defaultValue
				+ (allowedValues.isEmpty() ? "" : " allowed=" + allowedValues)
				+ ", modifiable=" + modifiable + ", recommended=" + recommended + ", experimental=" + experimental + "}";
	}
	
	
	public static final class Builder {
		private final String name;
		private final ParameterType type;
		private Number minValue;
		private Number maxValue;
		private List<Number> allowedValues = new ArrayList<>();
		private Number defaultValue;
		private boolean modifiable = true;
		private boolean recommended = true;
		private boolean experimental = false;
		private String note;
		
		private Builder(String name, ParameterType type) {
			this.name = name;
			this.type = type;
		}
		
		public Builder range(Number min, Number max) {
			this.minValue = min;
			this.maxValue = max;
			return this;
		}
		
		public Builder allowedValues(List<? extends Number> values) {
			this.allowedValues = values == null ? new ArrayList<>() : new ArrayList<>(values);
			return this;
		}
		
		public Builder defaultValue(Number defaultValue) {
			this.defaultValue = defaultValue;
			return this;
		}
		
		public Builder modifiable(boolean modifiable) {
			this.modifiable = modifiable;
			return this;
		}
		
		public Builder recommended(boolean recommended) {
			this.recommended = recommended;
			return this;
		}
		
		public Builder experimental(boolean experimental) {
			this.experimental = experimental;
			return this;
		}
		
		public Builder note(String note) {
			this.note = note;
			return this;
		}
		
		public ParameterCapability build() {
			return new ParameterCapability(this);
		}
	}
}
