package org.mark.capability.exception;




/**
 * 	请求方式或请求体不符合接口要求的异常。
 */
public class RequestMethodException extends Exception {

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
	
	
	public RequestMethodException(String message) {
		super(message);
	}
	
}
