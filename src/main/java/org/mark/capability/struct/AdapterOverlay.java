package org.mark.capability.struct;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 	叠加在基础模型上的一个LoRA适配器。
 * 	由调用方根据适配器元数据创建，引擎只读取，不修改。
 */
public final class AdapterOverlay {
	
	public static final double DEFAULT_WEIGHT = 0.8;
	
	public static final int DEFAULT_RANK = 16;
	
	public static final int DEFAULT_ALPHA = 16;
	
	
	private final String id;
	
	private final String name;
	
	/**
	 * 	适配器文件的位置
	 */
	private final String filePath;
	
	private final AdapterCategory category;
	
	/**
	 * 	权重，一般在0到2之间
	 */
	private final double weight;
	
	private final boolean enabled;
	
	private final int rank;
	
	private final int alpha;
	
	private final List<String> targetModules;
	
	/**
	 * 	适配器训练时使用的基础模型
	 */
	private final String baseModel;
	
	private final String description;
	
	private final Instant appliedAt;
	
	
	private AdapterOverlay(Builder b) {
		this.id = b.id == null ? "" : b.id;
		this.name = b.name == null ? this.id : b.name;
		this.filePath = b.filePath == null ? "" : b.filePath;
		this.category = b.category == null ? AdapterCategory.OTHER : b.category;
		this.weight = b.weight;
		this.enabled = b.enabled;
		this.rank = b.rank;
		this.alpha = b.alpha;
		this.targetModules = Collections.unmodifiableList(new ArrayList<>(b.targetModules));
		this.baseModel = b.baseModel == null ? "" : b.baseModel;
		this.description = b.description == null ? "" : b.description;
		this.appliedAt = b.appliedAt;
	}
	
	
	public static Builder builder(String id) {
		return new Builder(id);
	}
	
	
	public String getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public String getFilePath() {
		return filePath;
	}

	public AdapterCategory getCategory() {
		return category;
	}

	public double getWeight() {
		return weight;
	}

	public boolean isEnabled() {
		return enabled;
	}

	public int getRank() {
		return rank;
	}

	public int getAlpha() {
		return alpha;
	}

	public List<String> getTargetModules() {
		return targetModules;
	}

	public String getBaseModel() {
		return baseModel;
	}

	public String getDescription() {
		return description;
	}

	public Instant getAppliedAt() {
		return appliedAt;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof AdapterOverlay)) {
			return false;
		}
		AdapterOverlay that = (AdapterOverlay) o;
		return Double.compare(weight, that.weight) == 0
				&& enabled == that.enabled
				&& rank == that.rank
				&& alpha == that.alpha
				&& id.equals(that.id)
				&& name.equals(that.name)
				&& filePath.equals(that.filePath)
				&& category == that.category
				&& targetModules.equals(that.targetModules)
				&& baseModel.equals(that.baseModel)
				&& description.equals(that.description)
				&& Objects.equals(appliedAt, that.appliedAt);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, name, category, weight, enabled, rank, alpha);
	}

	@Override
	public String toString() {
		return "AdapterOverlay{" + name + " " + category + " weight=" + weight + " rank=" + rank + (enabled ? "" : " disabled") + "}";
	}
	
	
	public static final class Builder {
		private final String id;
		private String name;
		private String filePath;
		private AdapterCategory category = AdapterCategory.OTHER;
		private double weight = DEFAULT_WEIGHT;
		private boolean enabled = true;
		private int rank = DEFAULT_RANK;
		private int alpha = DEFAULT_ALPHA;
		private List<String> targetModules = new ArrayList<>();
		private String baseModel;
		private String description;
		private Instant appliedAt;
		
		private Builder(String id) {
			this.id = id;
		}
		
		public Builder name(String name) {
			this.name = name;
			return this;
		}
		
		public Builder filePath(String filePath) {
			this.filePath = filePath;
			return this;
		}
		
		public Builder category(AdapterCategory category) {
			this.category = category;
			return this;
		}
		
		public Builder weight(double weight) {
			this.weight = weight;
			return this;
		}
		
		public Builder enabled(boolean enabled) {
			this.enabled = enabled;
			return this;
		}
		
		public Builder rank(int rank) {
			this.rank = rank;
			return this;
		}
		
		public Builder alpha(int alpha) {
			this.alpha = alpha;
			return this;
		}
		
		public Builder targetModules(List<String> targetModules) {
			this.targetModules = targetModules == null ? new ArrayList<>() : new ArrayList<>(targetModules);
			return this;
		}
		
		public Builder baseModel(String baseModel) {
			this.baseModel = baseModel;
			return this;
		}
		
		public Builder description(String description) {
			this.description = description;
			return this;
		}
		
		public Builder appliedAt(Instant appliedAt) {
			this.appliedAt = appliedAt;
			return this;
		}
		
		public AdapterOverlay build() {
			return new AdapterOverlay(this);
		}
	}
}
