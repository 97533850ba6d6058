package org.mark.capability.exception;


/**
 * 	向runner发送试探请求失败。
 * 	具体是参数被拒绝还是runner不可达，由子类区分，两者对参数目录的影响不同。
 */
public abstract class ProbeException extends Exception {

	/**
	 * 
	 */
	private static final long serialVersionUID = 1L;
	
	
	protected ProbeException(String message) {
		super(message);
	}
	
	
	protected ProbeException(String message, Throwable cause) {
		super(message, cause);
	}
}
