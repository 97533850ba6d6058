package org.mark.capability.rules;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.mark.capability.struct.ModelCapabilities;
import org.mark.capability.struct.ParameterCapability;
import org.mark.capability.struct.ParameterDependency;

/**
 * 	用当前的参数值执行快照里的依赖规则。
 * 	<p>
 * 	没有给出的值先取推荐默认值，再取参数目录里的默认值。快照本身不会被修改。
 */
public class DependencyEvaluator {
	
	
	public EffectiveParameterView evaluate(ModelCapabilities capabilities, Map<String, ? extends Number> values) {
		Map<String, Number> current = values == null ? Map.of() : new LinkedHashMap<>(values);
		Set<String> hidden = new LinkedHashSet<>();
		List<String> warnings = new ArrayList<>();
		Map<String, Number> forced = new LinkedHashMap<>();
		
		for (ParameterDependency dependency : capabilities.getDependencies()) {
			Number actual = this.resolve(capabilities, current, dependency.getTriggerParameter());
			if (actual == null || !dependency.isTriggeredBy(actual.doubleValue())) {
				continue;
			}
			String affected = dependency.getAffectedParameter();
			switch (dependency.getAction()) {
			case HIDE:
				hidden.add(affected);
				break;
			case FORCE_VALUE:
				forced.put(affected, dependency.getForcedValue());
				break;
			case SHOW_WARNING:
			default:
				break;
			}
			if (dependency.getWarning() != null && !dependency.getWarning().isEmpty()) {
				warnings.add(dependency.getWarning());
			}
		}
		
		Map<String, ParameterCapability> visible = new LinkedHashMap<>();
		for (Map.Entry<String, ParameterCapability> e : capabilities.getParameters().entrySet()) {
			if (!hidden.contains(e.getKey())) {
				visible.put(e.getKey(), e.getValue());
			}
		}
		return new EffectiveParameterView(visible, hidden, warnings, forced);
	}
	
	
	private Number resolve(ModelCapabilities capabilities, Map<String, Number> current, String name) {
		Number value = current.get(name);
		if (value != null) {
			return value;
		}
		value = capabilities.getRecommendedDefaults().get(name);
		if (value != null) {
			return value;
		}
		ParameterCapability p = capabilities.getParameter(name);
		return p == null ? null : p.getDefaultValue();
	}
}
