package org.mark.capability.struct;

/**
 * API响应基础类
 */
public class ApiResponse {
	/**
	 * 请求是否成功
	 */
	private boolean success;
	
	/**
	 * 错误信息（可选）
	 */
	private String error;
	
	/**
	 * 响应数据（可选）
	 */
	private Object data;
	
	public ApiResponse() {
	}
	
	public ApiResponse(boolean success, String error, Object data) {
		this.success = success;
		this.error = error;
		this.data = data;
	}
	
	public static ApiResponse success(Object data) {
		return new ApiResponse(true, null, data);
	}
	
	public static ApiResponse error(String message) {
		return new ApiResponse(false, message, null);
	}
	
	public boolean isSuccess() {
		return success;
	}
	
	public String getError() {
		return error;
	}
	
	public Object getData() {
		return data;
	}
	
	@Override
	public String toString() {
		return "ApiResponse{success=" + success + ", error='" + error + "', data=" + data + "}";
	}
}
