package org.mark.capability.struct;

/**
 * 	参数的取值类型。
 */
public enum ParameterType {
	FLOAT,
	INTEGER,
	BOOLEAN,
	ENUMERATION;
	
	
	/**
	 * 	把计算出来的数值转换成这个类型对应的装箱类型，整数类会四舍五入。
	 * @param value
	 * @return
	 */
	public Number coerce(double value) {
		switch (this) {
		case INTEGER:
		case ENUMERATION:
			return Integer.valueOf((int) Math.round(value));
		case BOOLEAN:
			return Integer.valueOf(value != 0 ? 1 : 0);
		default:
			return Double.valueOf(value);
		}
	}
}
