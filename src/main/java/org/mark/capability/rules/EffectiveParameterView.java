package org.mark.capability.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.mark.capability.struct.ParameterCapability;

/**
 * 	依赖规则作用于当前参数值之后，界面应该看到的参数视图。
 */
public final class EffectiveParameterView {
	
	private final Map<String, ParameterCapability> visibleParameters;
	
	private final Set<String> hiddenParameters;
	
	private final List<String> warnings;
	
	private final Map<String, Number> forcedValues;
	
	
	EffectiveParameterView(Map<String, ParameterCapability> visibleParameters, Set<String> hiddenParameters,
			List<String> warnings, Map<String, Number> forcedValues) {
		this.visibleParameters = Collections.unmodifiableMap(new LinkedHashMap<>(visibleParameters));
		this.hiddenParameters = Collections.unmodifiableSet(new LinkedHashSet<>(hiddenParameters));
		this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
		this.forcedValues = Collections.unmodifiableMap(new LinkedHashMap<>(forcedValues));
	}
	

	public Map<String, ParameterCapability> getVisibleParameters() {
		return visibleParameters;
	}

	public Set<String> getHiddenParameters() {
		return hiddenParameters;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	public Map<String, Number> getForcedValues() {
		return forcedValues;
	}
	
	public boolean isVisible(String name) {
		return this.visibleParameters.containsKey(name);
	}
}
