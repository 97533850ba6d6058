package org.mark.capability.channel;

import java.util.ArrayList;
import java.util.List;

import org.mark.capability.CapabilityServer;
import org.mark.capability.controller.BaseController;
import org.mark.capability.exception.RequestMethodException;
import org.mark.capability.struct.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * 	路由处理器，把请求依次交给各个控制器。
 */
public class CapabilityRouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

	private static final Logger logger = LoggerFactory.getLogger(CapabilityRouterHandler.class);
	
	private final List<BaseController> controllers;
	
	
	public CapabilityRouterHandler(List<BaseController> controllers) {
		this.controllers = new ArrayList<>(controllers);
	}
	
	
	@Override
	protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) throws Exception {
		if (!request.decoderResult().isSuccess()) {
			CapabilityServer.sendErrorResponse(ctx, HttpResponseStatus.BAD_REQUEST, "请求解析失败");
			return;
		}
		String uri = request.uri();
		logger.info("收到请求: {} {}", request.method().name(), uri);
		int qIdx = uri.indexOf('?');
		String path = qIdx >= 0 ? uri.substring(0, qIdx) : uri;
		
		try {
			for (BaseController controller : this.controllers) {
				if (controller.handleRequest(path, ctx, request)) {
					return;
				}
			}
		} catch (RequestMethodException e) {
			CapabilityServer.sendJsonResponse(ctx, ApiResponse.error(e.getMessage()));
			return;
		} catch (Exception e) {
			logger.error("处理请求时发生错误: {}", uri, e);
			CapabilityServer.sendErrorResponse(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR, "服务器内部错误");
			return;
		}
		CapabilityServer.sendErrorResponse(ctx, HttpResponseStatus.NOT_FOUND, "404 Not Found");
	}
	
	
	@Override
	public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
		logger.error("处理请求时发生异常", cause);
		ctx.close();
	}
}
