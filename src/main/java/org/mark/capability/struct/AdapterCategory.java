package org.mark.capability.struct;

import java.util.Locale;

/**
 * 	LoRA适配器的类别。
 */
public enum AdapterCategory {
	STYLE,
	CHARACTER,
	CONCEPT,
	POSE,
	OTHER;
	
	
	/**
	 * 	解析适配器元数据里的类型字符串，认不出来的一律当作OTHER。
	 * @param type
	 * @return
	 */
	public static AdapterCategory parse(String type) {
		if (type == null) {
			return OTHER;
		}
		switch (type.trim().toLowerCase(Locale.ROOT)) {
		case "style":
		case "aesthetic":
			return STYLE;
		case "character":
		case "persona":
			return CHARACTER;
		case "concept":
		case "subject":
			return CONCEPT;
		case "pose":
		case "composition":
			return POSE;
		default:
			return OTHER;
		}
	}
}
