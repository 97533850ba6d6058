package org.mark.capability.exception;


/**
 * 	runner无法连接、超时或者返回了服务端错误。
 */
public class RunnerUnreachableException extends ProbeException {

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
	
	
	public RunnerUnreachableException(String message) {
		super(message);
	}
	
	
	public RunnerUnreachableException(String message, Throwable cause) {
		super(message, cause);
	}
}
