package org.mark.capability.struct;

import java.util.Objects;

/**
 * 	参数之间的依赖：当trigger满足condition时，对affected执行action。
 */
public final class ParameterDependency {
	
	private final String triggerParameter;
	
	private final ComparisonType condition;
	
	private final double triggerValue;
	
	private final String affectedParameter;
	
	private final DependencyAction action;
	
	private final String warning;
	
	/**
	 * 	仅FORCE_VALUE时有值
	 */
	private final Number forcedValue;
	
	
	public ParameterDependency(String triggerParameter, ComparisonType condition, double triggerValue,
			String affectedParameter, DependencyAction action, String warning, Number forcedValue) {
		this.triggerParameter = Objects.requireNonNull(triggerParameter, "triggerParameter");
		this.condition = Objects.requireNonNull(condition, "condition");
		this.triggerValue = triggerValue;
		this.affectedParameter = Objects.requireNonNull(affectedParameter, "affectedParameter");
		this.action = Objects.requireNonNull(action, "action");
		this.warning = warning;
		this.forcedValue = forcedValue;
		if (action == DependencyAction.FORCE_VALUE && forcedValue == null) {
			throw new IllegalArgumentException("FORCE_VALUE规则必须提供forcedValue");
		}
	}
	
	
	public static ParameterDependency hide(String trigger, ComparisonType condition, double value, String affected, String warning) {
		return new ParameterDependency(trigger, condition, value, affected, DependencyAction.HIDE, warning, null);
	}
	
	
	public static ParameterDependency warn(String trigger, ComparisonType condition, double value, String affected, String warning) {
		return new ParameterDependency(trigger, condition, value, affected, DependencyAction.SHOW_WARNING, warning, null);
	}
	
	
	public static ParameterDependency force(String trigger, ComparisonType condition, double value, String affected, Number forced, String warning) {
		return new ParameterDependency(trigger, condition, value, affected, DependencyAction.FORCE_VALUE, warning, forced);
	}
	
	
	/**
	 * 	触发条件是否成立。
	 * @param actual
	 * @return
	 */
	public boolean isTriggeredBy(double actual) {
		return this.condition.test(actual, this.triggerValue);
	}
	

	public String getTriggerParameter() {
		return triggerParameter;
	}

	public ComparisonType getCondition() {
		return condition;
	}

	public double getTriggerValue() {
		return triggerValue;
	}

	public String getAffectedParameter() {
		return affectedParameter;
	}

	public DependencyAction getAction() {
		return action;
	}

	public String getWarning() {
		return warning;
	}

	public Number getForcedValue() {
		return forcedValue;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ParameterDependency)) {
			return false;
		}
		ParameterDependency that = (ParameterDependency) o;
		return Double.compare(triggerValue, that.triggerValue) == 0
				&& triggerParameter.equals(that.triggerParameter)
				&& condition == that.condition
				&& affectedParameter.equals(that.affectedParameter)
				&& action == that.action
				&& Objects.equals(warning, that.warning)
				&& Objects.equals(forcedValue, that.forcedValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(triggerParameter, condition, triggerValue, affectedParameter, action, warning, forcedValue);
	}

	@Override
	public String toString() {
		return triggerParameter + " " + condition + " " + triggerValue + " => " + action + " " + affectedParameter;
	}
}
