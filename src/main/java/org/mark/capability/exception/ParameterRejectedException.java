package org.mark.capability.exception;


/**
 * 	runner对请求返回了校验错误，说明请求里的某个参数不被接受。
 */
public class ParameterRejectedException extends ProbeException {

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
	
	/**
	 * 	runner返回的状态码，无法得知时为-1
	 */
	private final int statusCode;
	
	
	public ParameterRejectedException(String message) {
		this(message, -1);
	}
	
	
	public ParameterRejectedException(String message, int statusCode) {
		super(message);
		this.statusCode = statusCode;
	}
	
	
	public int getStatusCode() {
		return statusCode;
	}
}
