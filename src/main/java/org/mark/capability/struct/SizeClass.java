package org.mark.capability.struct;

/**
 * 	按参数量划分的模型级别。
 */
public enum SizeClass {
	UNKNOWN,
	BASIC,
	STANDARD,
	ADVANCED,
	EXPERIMENTAL;
	
	
	/**
	 * 	按十亿参数量归类：小于1B、小于7B、小于30B、其余。
	 * @param billions
	 * @return
	 */
	public static SizeClass fromBillions(double billions) {
		if (billions <= 0) {
			return UNKNOWN;
		}
		if (billions < 1) {
			return BASIC;
		}
		if (billions < 7) {
			return STANDARD;
		}
		if (billions < 30) {
			return ADVANCED;
		}
		return EXPERIMENTAL;
	}
}
