package org.mark.capability.struct;

/**
 * 	适配器对参数的修改方式。
 */
public enum ModificationKind {
	/**
	 * 	修改推荐默认值
	 */
	RANGE_SHIFT,
	/**
	 * 	修改灵敏度倍数，多个适配器之间相乘
	 */
	SENSITIVITY_MULTIPLY
}
