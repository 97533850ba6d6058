package org.mark.capability.struct;

/**
 * 	依赖规则里触发条件的比较方式。
 */
public enum ComparisonType {
	EQUALS,
	NOT_EQUALS,
	GREATER_THAN,
	LESS_THAN,
	GREATER_OR_EQUAL,
	LESS_OR_EQUAL;
	
	
	public boolean test(double actual, double threshold) {
		switch (this) {
		case EQUALS:
			return Double.compare(actual, threshold) == 0;
		case NOT_EQUALS:
			return Double.compare(actual, threshold) != 0;
		case GREATER_THAN:
			return actual > threshold;
		case LESS_THAN:
			return actual < threshold;
		case GREATER_OR_EQUAL:
			return actual >= threshold;
		case LESS_OR_EQUAL:
			return actual <= threshold;
		default:
			return false;
		}
	}
}
