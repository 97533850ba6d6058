package org.mark.capability.runner;

import java.time.Duration;

import org.mark.capability.exception.ProbeException;

/**
 * 	实际执行推理的进程（例如llama-server）的请求/响应接口。
 * 	<p>
 * 	实现类负责重试策略；引擎对每个试探请求只调用一次。
 */
public interface Runner {
	
	/**
	 * 	runner的名字，用于日志。
	 * @return
	 */
	public String getName();
	
	
	/**
	 * 	提交一次生成请求，返回生成的文本。
	 * @param request
	 * @param timeout 单次请求的超时时间
	 * @return 生成的文本，可能为空字符串
	 * @throws org.mark.capability.exception.ParameterRejectedException 请求中的参数被runner拒绝
	 * @throws org.mark.capability.exception.RunnerUnreachableException runner不可达、超时或内部错误
	 * @throws InterruptedException 调用方取消了请求
	 */
	public String submit(RunnerRequest request, Duration timeout) throws ProbeException, InterruptedException;
}
