package org.mark.capability.overlay;

import java.util.ArrayList;
import java.util.List;

import org.mark.capability.struct.AdapterOverlay;
import org.mark.capability.struct.AdapterParameterModification;
import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.struct.ModificationKind;
import org.mark.capability.struct.ParameterCapability;
import org.mark.capability.struct.SamplingParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	把LoRA适配器叠加到基础能力快照上，得到新的快照。
 * 	<p>
 * 	基础快照不会被修改。传入已经叠加过的快照时，以它叠加之前的快照为基础重新计算。
 * 	启用的适配器按列表顺序依次生效，
 * 	多个适配器对同一参数的灵敏度倍数按顺序相乘。
 */
public class LoraOverlayEngine {
	
	private static final Logger logger = LoggerFactory.getLogger(LoraOverlayEngine.class);
	
	static final double HIGH_TOTAL_WEIGHT = 2.0;
	
	static final double HIGH_ADAPTER_WEIGHT = 1.0;
	
	static final int LOW_RANK = 16;
	
	static final int HIGH_RANK = 64;
	
	static final double MIN_TEMPERATURE = 0.1;
	
	static final double MIN_REPEAT_PENALTY = 1.0;
	
	
	public ModelCapabilities applyOverlays(ModelCapabilities base, List<AdapterOverlay> adapters) {
		List<AdapterOverlay> list = adapters == null ? List.of() : adapters;
		logger.info("为模型 {} 叠加 {} 个适配器", base.getModelName(), list.size());
		
		// 总是从未叠加的快照开始，已经叠加过的快照不会被重复调整
		ModelCapabilities root = base.withoutOverlays();
		ModelCapabilities.Builder builder = root.toBuilder()
				.appliedAdapters(list)
				.clearModifications()
				.overlayBase(root);
		
		List<String> enabledNames = new ArrayList<>();
		double totalWeight = 0;
		for (AdapterOverlay adapter : list) {
			if (!adapter.isEnabled()) {
				continue;
			}
			enabledNames.add(adapter.getName());
			totalWeight += adapter.getWeight();
			this.fold(builder, adapter);
		}
		
		if (!enabledNames.isEmpty()) {
			builder.addWarning(String.format("当前启用了 %d 个适配器，总权重 %.2f", enabledNames.size(), totalWeight));
			if (totalWeight > HIGH_TOTAL_WEIGHT) {
				builder.addWarning("适配器总权重过高，可能导致输出不稳定或过拟合");
				this.lowerTemperature(builder, totalWeight, enabledNames);
			}
		}
		return builder.build();
	}
	
	
	private void fold(ModelCapabilities.Builder builder, AdapterOverlay adapter) {
		logger.debug("应用适配器: {} (权重: {})", adapter.getName(), adapter.getWeight());
		switch (adapter.getCategory()) {
		case STYLE:
			this.multiply(builder, SamplingParameters.TEMPERATURE, 1.2, adapter);
			this.multiply(builder, SamplingParameters.TOP_P, 0.9, adapter);
			break;
		case CHARACTER:
			this.lowerRepeatPenalty(builder, adapter);
			break;
		case CONCEPT:
			this.multiply(builder, SamplingParameters.TOP_K, 0.8, adapter);
			break;
		case POSE:
			this.multiply(builder, SamplingParameters.PRESENCE_PENALTY, 1.1, adapter);
			break;
		case OTHER:
		default:
			break;
		}
		
		if (adapter.getWeight() > HIGH_ADAPTER_WEIGHT) {
			builder.addWarning(String.format("适配器 '%s' 权重较高 (%.2f)，建议降低temperature", adapter.getName(), adapter.getWeight()));
		}
		if (adapter.getRank() < LOW_RANK) {
			builder.addWarning(String.format("适配器 '%s' 的rank较低 (%d)，表达能力可能有限", adapter.getName(), adapter.getRank()));
		} else if (adapter.getRank() > HIGH_RANK) {
			builder.addWarning(String.format("适配器 '%s' 的rank较高 (%d)，可能过拟合", adapter.getName(), adapter.getRank()));
		}
	}
	
	
	private void multiply(ModelCapabilities.Builder builder, String name, double multiplier, AdapterOverlay adapter) {
		if (!builder.hasParameter(name)) {
			return;
		}
		AdapterParameterModification existing = builder.getModification(name, ModificationKind.SENSITIVITY_MULTIPLY);
		if (existing == null) {
			builder.putModification(AdapterParameterModification.sensitivity(name, multiplier, "参数灵敏度受适配器影响", List.of(adapter.getName())));
		} else {
			builder.putModification(existing.multiply(multiplier, adapter.getName()));
		}
		builder.updateParameter(name, p -> p.toBuilder().note(appendNote(p.getNote(), "受适配器 " + adapter.getName() + " 影响")).build());
	}
	
	
	private void lowerRepeatPenalty(ModelCapabilities.Builder builder, AdapterOverlay adapter) {
		ParameterCapability p = builder.getParameter(SamplingParameters.REPEAT_PENALTY);
		if (p == null) {
			return;
		}
		Number current = builder.getRecommendedDefault(SamplingParameters.REPEAT_PENALTY);
		double before = current == null ? 1.1 : current.doubleValue();
		double floor = MIN_REPEAT_PENALTY;
		if (p.getMinValue() != null) {
			floor = Math.max(floor, p.getMinValue().doubleValue());
		}
		double after = Math.max(floor, before - adapter.getWeight() * 0.05);
		Number value = p.clamp(after);
		builder.putRecommendedDefault(SamplingParameters.REPEAT_PENALTY, value);
		
		String description = String.format("由 %.2f 调整为 %.2f", before, value.doubleValue());
		AdapterParameterModification existing = builder.getModification(SamplingParameters.REPEAT_PENALTY, ModificationKind.RANGE_SHIFT);
		if (existing == null) {
			builder.putModification(AdapterParameterModification.rangeShift(SamplingParameters.REPEAT_PENALTY, value, description, List.of(adapter.getName())));
		} else {
			builder.putModification(existing.shift(value, adapter.getName(), description));
		}
	}
	
	
	private void lowerTemperature(ModelCapabilities.Builder builder, double totalWeight, List<String> enabledNames) {
		ParameterCapability p = builder.getParameter(SamplingParameters.TEMPERATURE);
		Number current = builder.getRecommendedDefault(SamplingParameters.TEMPERATURE);
		if (p == null || current == null) {
			return;
		}
		double before = current.doubleValue();
		double after = Math.max(MIN_TEMPERATURE, before - totalWeight * 0.1);
		Number value = p.clamp(after);
		builder.putRecommendedDefault(SamplingParameters.TEMPERATURE, value);
		builder.putModification(AdapterParameterModification.rangeShift(SamplingParameters.TEMPERATURE, value,
				String.format("受适配器影响由 %.2f 降低", before), enabledNames));
	}
	
	
	private static String appendNote(String note, String extra) {
		if (note == null || note.isEmpty()) {
			return extra;
		}
		return note + "; " + extra;
	}
}
