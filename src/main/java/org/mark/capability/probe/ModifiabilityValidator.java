package org.mark.capability.probe;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

import org.mark.capability.exception.ProbeException;
import org.mark.capability.runner.Runner;
import org.mark.capability.runner.RunnerRequest;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.struct.SamplingParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	检查被runner接受、但修改后没有任何效果的参数。
 * 	<p>
 * 	同一个输入分别用低值和高值各请求一次，输出完全一致就认为参数被锁定，
 * 	从参数目录移到不支持集合。只是经验判断，有些runner即使固定种子也不确定，所以永远不会作为错误抛出。
 */
public class ModifiabilityValidator {
	
	private static final Logger logger = LoggerFactory.getLogger(ModifiabilityValidator.class);
	
	static final String PROMPT = "Say 'test' and nothing else.";
	
	static final int MAX_TOKENS = 10;
	
	private final List<Check> checks;
	
	private final Duration timeout;
	
	
	public ModifiabilityValidator(Duration timeout) {
		this(List.of(new Check(SamplingParameters.TEMPERATURE, 0.1, 1.5, RunnerRequest::setTemperature)), timeout);
	}
	
	
	public ModifiabilityValidator(List<Check> checks, Duration timeout) {
		this.checks = new ArrayList<>(checks);
		this.timeout = timeout;
	}
	
	
	/**
	 * 	对目录中存在的参数逐个检查。
	 * @param builder
	 * @param runner
	 * @return 被判定为锁定的参数名
	 * @throws InterruptedException
	 */
	public List<String> validate(ModelCapabilities.Builder builder, Runner runner) throws InterruptedException {
		List<String> locked = new ArrayList<>();
		for (Check check : this.checks) {
			if (!builder.hasParameter(check.name)) {
				continue;
			}
			String low;
			String high;
			try {
				low = runner.submit(check.request(builder.getModelName(), check.low), this.timeout);
				high = runner.submit(check.request(builder.getModelName(), check.high), this.timeout);
			} catch (ProbeException e) {
				logger.debug("参数 {} 的可修改性检查失败，保持原状: {}", check.name, e.getMessage());
				continue;
			}
			if (Objects.equals(nullToEmpty(low), nullToEmpty(high))) {
				logger.warn("参数 {} 似乎被锁定：{} 和 {} 的输出完全相同", check.name, check.low, check.high);
				builder.markUnsupported(check.name);
				builder.addWarning("参数 " + check.name + " 修改后输出没有变化，已视为不可修改");
				locked.add(check.name);
			}
		}
		return locked;
	}
	
	
	private static String nullToEmpty(String s) {
		return s == null ? "" : s;
	}
	
	
	/**
	 * 	一项检查：参数名、低值、高值和设置方法。
	 */
	public static final class Check {
		private final String name;
		private final double low;
		private final double high;
		private final BiConsumer<RunnerRequest, Double> setter;
		
		public Check(String name, double low, double high, BiConsumer<RunnerRequest, Double> setter) {
			this.name = name;
			this.low = low;
			this.high = high;
			this.setter = setter;
		}
		
		RunnerRequest request(String model, double value) {
			RunnerRequest request = new RunnerRequest(model, PROMPT, MAX_TOKENS);
			this.setter.accept(request, value);
			return request;
		}
		
		public String getName() {
			return name;
		}
	}
}
