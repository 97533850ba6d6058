package org.mark.capability.exception;


/**
 * 	连最保守的参数集合都无法给出时抛出，其余情况都会降级处理而不是抛异常。
 */
public class IntrospectionException extends Exception {

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
	
	
	public IntrospectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
