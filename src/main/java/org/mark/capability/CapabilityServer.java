package org.mark.capability;

import java.net.URI;
import java.nio.file.Files;
import java.time.Clock;
import java.util.List;

import org.mark.capability.channel.CapabilityRouterHandler;
import org.mark.capability.controller.BaseController;
import org.mark.capability.controller.CapabilityController;
import org.mark.capability.overlay.AdapterOverlayMapper;
import org.mark.capability.runner.LlamaServerRunner;
import org.mark.capability.struct.EngineConfig;
import org.mark.capability.tools.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;


/**
 * 	程序的入口。
 */
public class CapabilityServer {
	
	private static final Logger logger = LoggerFactory.getLogger(CapabilityServer.class);
	
	/**
	 * 	请求体上限，适配器列表不会太大
	 */
	private static final int MAX_CONTENT_LENGTH = 4 * 1024 * 1024;
	
	/**
	 * 	探测会阻塞数秒，不能放在IO线程上执行
	 */
	private static final int BUSINESS_THREADS = 16;
	
	
	public static void main(String[] args) {
		logger.info("正在加载配置...");
		ConfigManager configManager = ConfigManager.getInstance();
		EngineConfig config = configManager.loadEngineConfig();
		if (!Files.exists(configManager.getConfigFile())) {
			configManager.saveEngineConfig(config);
		}
		
		Clock clock = Clock.systemUTC();
		CapabilityEngine engine = CapabilityEngine.create(config, clock);
		List<BaseController> controllers = List.of(new CapabilityController(
				engine,
				new AdapterOverlayMapper(clock),
				baseUrl -> new LlamaServerRunner(baseUrl, URI.create(baseUrl)),
				config.getDefaultRunnerBaseUrl()));
		
		logger.info("系统初始化完成，启动Web服务器...");
		bind(config.getPort(), controllers);
	}
	
	
	private static void bind(int port, List<BaseController> controllers) {
		EventLoopGroup bossGroup = new NioEventLoopGroup(1);
		EventLoopGroup workerGroup = new NioEventLoopGroup();
		EventExecutorGroup businessGroup = new DefaultEventExecutorGroup(BUSINESS_THREADS);
		
		try {
			ServerBootstrap bootstrap = new ServerBootstrap();
			bootstrap.group(bossGroup, workerGroup)
					.channel(NioServerSocketChannel.class)
					.childHandler(new ChannelInitializer<SocketChannel>() {
						@Override
						protected void initChannel(SocketChannel ch) throws Exception {
							ch.pipeline()
									.addLast(new HttpServerCodec())
									.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
									.addLast(businessGroup, new CapabilityRouterHandler(controllers));
						}
						
						@Override
						public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
							logger.warn("Failed to initialize a channel. Closing: " + ctx.channel(), cause);
							ctx.close();
						}
					});
			
			ChannelFuture future = bootstrap.bind(port).sync();
			logger.info("CapabilityServer启动成功，端口: {}", port);
			logger.info("访问地址: http://localhost:{}", port);
			
			future.channel().closeFuture().sync();
		} catch (InterruptedException e) {
			logger.error("服务器被中断", e);
			Thread.currentThread().interrupt();
		} catch (Exception e) {
			logger.error("服务器启动失败", e);
		} finally {
			bossGroup.shutdownGracefully();
			workerGroup.shutdownGracefully();
			businessGroup.shutdownGracefully();
			
			logger.info("服务器已关闭");
		}
	}
	
	
	/**
	 * 	发送JSON响应。
	 * @param ctx
	 * @param data
	 */
	public static void sendJsonResponse(ChannelHandlerContext ctx, Object data) {
		String json = JsonUtil.toJson(data);
		byte[] content = json.getBytes(CharsetUtil.UTF_8);
	
		FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
		response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
		response.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.length);
		response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
		response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type");
		response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS");
		response.content().writeBytes(content);
	
		ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
	}
	
	
	/**
	 * 	发送纯文本的错误响应。
	 * @param ctx
	 * @param status
	 * @param message
	 */
	public static void sendErrorResponse(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
		FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status);

		byte[] content = message.getBytes(CharsetUtil.UTF_8);
		response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
		response.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.length);
		response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
		response.content().writeBytes(content);

		ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
	}
}
