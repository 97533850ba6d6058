package org.mark.capability.probe;

/**
 * 	一次探测的统计结果。
 */
public final class ProbeResult {
	
	/**
	 * 	实际发出的请求数
	 */
	private final int calls;
	
	private final boolean baselineAccepted;
	
	private final int accepted;
	
	private final int rejected;
	
	/**
	 * 	高级参数探测中途runner不可达，剩余参数没有试探。
	 */
	private final boolean aborted;
	
	
	public ProbeResult(int calls, boolean baselineAccepted, int accepted, int rejected, boolean aborted) {
		this.calls = calls;
		this.baselineAccepted = baselineAccepted;
		this.accepted = accepted;
		this.rejected = rejected;
		this.aborted = aborted;
	}
	

	public int getCalls() {
		return calls;
	}

	public boolean isBaselineAccepted() {
		return baselineAccepted;
	}

	public int getAccepted() {
		return accepted;
	}

	public int getRejected() {
		return rejected;
	}

	public boolean isAborted() {
		return aborted;
	}
	
	/**
	 * 	探测结果是否只能作为低置信度的参考。
	 * @return
	 */
	public boolean isLowConfidence() {
		return !baselineAccepted || aborted;
	}

	@Override
	public String toString() {
		return "ProbeResult{calls=" + calls + ", baseline=" + baselineAccepted + ", accepted=" + accepted + ", rejected=" + rejected
				+ (aborted ? ", aborted" : "") + "}";
	}
}
