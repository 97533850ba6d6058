package org.mark.capability.tools;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;

public class JsonUtil {
	
	
	/**
	 * 	java.time的类型不能反射访问，时间统一输出为ISO-8601字符串
	 */
	private static final Gson gson = new GsonBuilder()
			.registerTypeAdapter(Instant.class, (JsonSerializer<Instant>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
			.create();
	
	
	public static String toJson(Object obj) {
		return gson.toJson(obj);
	}
	
	
	public static <T> T fromJson(String json, Class<T> type) {
		return gson.fromJson(json, type);
	}
	
	
	public static String getJsonString(JsonObject o, String key, String fallback) {
		if (o == null || key == null || !o.has(key) || o.get(key) == null || o.get(key).isJsonNull())
			return fallback;
		try {
			return o.get(key).getAsString();
		} catch (Exception e) {
			return fallback;
		}
	}

	public static Integer getJsonInt(JsonObject o, String key, Integer fallback) {
		if (o == null || key == null || !o.has(key) || o.get(key) == null || o.get(key).isJsonNull())
			return fallback;
		try {
			return o.get(key).getAsInt();
		} catch (Exception e) {
			try {
				String s = o.get(key).getAsString();
				Integer v = parseInteger(s);
				return v == null ? fallback : v;
			} catch (Exception e2) {
				return fallback;
			}
		}
	}
	
	/**
	 * 	读取浮点数，非有限值（NaN、无穷大）也返回fallback。
	 */
	public static Double getJsonDouble(JsonObject o, String key, Double fallback) {
		if (o == null || key == null || !o.has(key) || o.get(key) == null || o.get(key).isJsonNull())
			return fallback;
		try {
			double v = o.get(key).getAsDouble();
			return Double.isFinite(v) ? v : fallback;
		} catch (Exception e) {
			return fallback;
		}
	}
	
	/**
	 * 	读取布尔值，兼容"true"、"1"、"yes"、"on"等字符串写法。
	 */
	public static boolean getJsonBoolean(JsonObject o, String key, boolean fallback) {
		if (o == null || key == null || key.isEmpty() || !o.has(key) || o.get(key) == null || o.get(key).isJsonNull()) {
			return fallback;
		}
		try {
			if (o.get(key).isJsonPrimitive() && o.get(key).getAsJsonPrimitive().isBoolean()) {
				return o.get(key).getAsBoolean();
			}
			String t = o.get(key).getAsString().trim().toLowerCase();
			if (t.isEmpty()) return fallback;
			if ("true".equals(t) || "1".equals(t) || "yes".equals(t) || "on".equals(t)) return true;
			if ("false".equals(t) || "0".equals(t) || "no".equals(t) || "off".equals(t)) return false;
			return fallback;
		} catch (Exception e) {
			return fallback;
		}
	}

	public static List<String> getJsonStringList(JsonElement el) {
		if (el == null || el.isJsonNull())
			return null;
		try {
			if (el.isJsonArray()) {
				JsonArray arr = el.getAsJsonArray();
				List<String> out = new ArrayList<>();
				for (int i = 0; i < arr.size(); i++) {
					JsonElement it = arr.get(i);
					if (it == null || it.isJsonNull())
						continue;
					String s = null;
					try {
						s = it.getAsString();
					} catch (Exception e) {
						s = it.toString();
					}
					if (s != null && !s.trim().isEmpty())
						out.add(s.trim());
				}
				return out;
			}
			String s = el.getAsString();
			if (s == null || s.trim().isEmpty())
				return null;
			return Arrays.asList(s.trim());
		} catch (Exception e) {
			return null;
		}
	}

	public static JsonObject tryParseObject(String s) {
		try {
			if (s == null || s.trim().isEmpty()) {
				return null;
			}
			JsonElement el = fromJson(s, JsonElement.class);
			return el != null && el.isJsonObject() ? el.getAsJsonObject() : null;
		} catch (Exception e) {
			return null;
		}
	}
	
	
	private static Integer parseInteger(String s) {
		if (s == null)
			return null;
		String t = s.trim();
		if (t.isEmpty())
			return null;
		try {
			return Integer.valueOf(Integer.parseInt(t, 10));
		} catch (Exception e) {
			return null;
		}
	}
}
