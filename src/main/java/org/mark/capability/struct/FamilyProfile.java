package org.mark.capability.struct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 	模型家族的采样特性，只读数据，从family-profiles.json加载。
 */
public class FamilyProfile {
	
	/**
	 * 	家族名，如qwen、llama
	 */
	private String family;
	
	private Double defaultTemperature;
	
	private Double defaultTopP;
	
	/**
	 * 	在这个家族上容易出问题的参数
	 */
	private List<String> problematicParameters;
	
	/**
	 * 	在这个家族上效果很好的参数
	 */
	private List<String> excellentParameters;
	
	/**
	 * 	特殊行为的说明，会原样加入模型警告。
	 */
	private List<String> specialBehaviors;
	
	
	public FamilyProfile() {
		
	}
	
	
	public FamilyProfile(String family, Double defaultTemperature, Double defaultTopP, List<String> problematicParameters,
			List<String> excellentParameters, List<String> specialBehaviors) {
		this.family = family;
		this.defaultTemperature = defaultTemperature;
		this.defaultTopP = defaultTopP;
		this.problematicParameters = problematicParameters == null ? null : new ArrayList<>(problematicParameters);
		this.excellentParameters = excellentParameters == null ? null : new ArrayList<>(excellentParameters);
		this.specialBehaviors = specialBehaviors == null ? null : new ArrayList<>(specialBehaviors);
	}
	

	public String getFamily() {
		return family;
	}

	public Double getDefaultTemperature() {
		return defaultTemperature;
	}

	public Double getDefaultTopP() {
		return defaultTopP;
	}

	public Set<String> getProblematicParameters() {
		return problematicParameters == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(problematicParameters));
	}

	public Set<String> getExcellentParameters() {
		return excellentParameters == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(excellentParameters));
	}

	public List<String> getSpecialBehaviors() {
		return specialBehaviors == null ? Collections.emptyList() : Collections.unmodifiableList(specialBehaviors);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FamilyProfile)) {
			return false;
		}
		FamilyProfile that = (FamilyProfile) o;
		return Objects.equals(family, that.family)
				&& Objects.equals(defaultTemperature, that.defaultTemperature)
				&& Objects.equals(defaultTopP, that.defaultTopP)
				&& getProblematicParameters().equals(that.getProblematicParameters())
				&& getExcellentParameters().equals(that.getExcellentParameters())
				&& getSpecialBehaviors().equals(that.getSpecialBehaviors());
	}

	@Override
	public int hashCode() {
		return Objects.hash(family, defaultTemperature, defaultTopP);
	}

	@Override
	public String toString() {
		return "FamilyProfile{" + family + ", temperature=" + defaultTemperature + ", topP=" + defaultTopP + "}";
	}
}
