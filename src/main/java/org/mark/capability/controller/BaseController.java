package org.mark.capability.controller;

import org.mark.capability.exception.RequestMethodException;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;


/**
 * 	基本的控制器接口
 */
public interface BaseController {

	/**
	 * 	处理请求
	 * @param uri 不含查询参数的路径
	 * @param ctx
	 * @param request
	 * @return 是否已经处理
	 * @throws RequestMethodException
	 */
	public boolean handleRequest(String uri, ChannelHandlerContext ctx, FullHttpRequest request) throws RequestMethodException;
	
	
	/**
	 * 	简单的断言。
	 * @param check
	 * @param message
	 * @throws RequestMethodException
	 */
	default public void assertRequestMethod(boolean check, String message) throws RequestMethodException {
		if (check)
			throw new RequestMethodException(message);
	}
}
