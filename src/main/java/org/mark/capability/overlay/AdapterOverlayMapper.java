package org.mark.capability.overlay;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.mark.capability.struct.AdapterCategory;
import org.mark.capability.struct.AdapterOverlay;
import org.mark.capability.tools.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * 	把前端或适配器目录传来的松散JSON记录转换成{@link AdapterOverlay}。
 * 	缺少的字段使用默认值，任何一条记录都不会导致整体失败。
 */
public class AdapterOverlayMapper {
	
	private static final Logger logger = LoggerFactory.getLogger(AdapterOverlayMapper.class);
	
	private final Clock clock;
	
	
	public AdapterOverlayMapper(Clock clock) {
		this.clock = clock;
	}
	
	
	public List<AdapterOverlay> mapAll(JsonArray records) {
		List<AdapterOverlay> list = new ArrayList<>();
		if (records == null) {
			return list;
		}
		for (JsonElement el : records) {
			if (el == null || !el.isJsonObject()) {
				logger.warn("忽略无法识别的适配器记录: {}", el);
				continue;
			}
			list.add(this.map(el.getAsJsonObject()));
		}
		return list;
	}
	
	
	public AdapterOverlay map(JsonObject record) {
		String id = JsonUtil.getJsonString(record, "id", "");
		String filePath = JsonUtil.getJsonString(record, "filePath", "");
		String name = JsonUtil.getJsonString(record, "name", null);
		if (isBlank(name)) {
			name = !isBlank(id) ? id : fileName(filePath);
		}
		
		String type = JsonUtil.getJsonString(record, "type", null);
		if (type == null) {
			type = JsonUtil.getJsonString(record, "loraType", null);
		}
		Double weight = JsonUtil.getJsonDouble(record, "weight", null);
		if (weight == null) {
			weight = JsonUtil.getJsonDouble(record, "recommendedWeight", AdapterOverlay.DEFAULT_WEIGHT);
		}
		List<String> targetModules = JsonUtil.getJsonStringList(record.get("targetModules"));
		
		return AdapterOverlay.builder(id)
				.name(name)
				.filePath(filePath)
				.category(AdapterCategory.parse(type))
				.weight(weight)
				.enabled(JsonUtil.getJsonBoolean(record, "enabled", true))
				.rank(JsonUtil.getJsonInt(record, "rank", AdapterOverlay.DEFAULT_RANK))
				.alpha(JsonUtil.getJsonInt(record, "alpha", AdapterOverlay.DEFAULT_ALPHA))
				.targetModules(targetModules == null ? List.of() : targetModules)
				.baseModel(JsonUtil.getJsonString(record, "baseModel", ""))
				.description(JsonUtil.getJsonString(record, "description", ""))
				.appliedAt(this.clock.instant())
				.build();
	}
	
	
	private static String fileName(String filePath) {
		if (isBlank(filePath)) {
			return "";
		}
		String s = filePath.trim();
		int i = Math.max(s.lastIndexOf('/'), s.lastIndexOf('\\'));
		return i < 0 ? s : s.substring(i + 1);
	}
	
	
	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
