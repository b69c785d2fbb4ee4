package rpcgen.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

import org.json.JSONArray;
import org.json.JSONObject;

public class JsonUtil {

	public static <T> List<T> mapArr(JSONArray arr, BiFunction<JSONArray, Integer, T> mapper) {
		final List<T> ret = new ArrayList<>();
		final int len = arr.length();
		for (int i = 0; i < len; ++i) {
			ret.add(mapper.apply(arr, i));
		}
		return ret;
	}

	/**
	 * Like {@link #mapArr(JSONArray, BiFunction)}, but treats a missing key as an
	 * empty array.
	 */
	public static <T> List<T> mapOptArr(JSONObject obj, String key, BiFunction<JSONArray, Integer, T> mapper) {
		if (!obj.has(key)) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(mapArr(obj.getJSONArray(key), mapper));
	}

	public static String optString(JSONObject obj, String key) {
		return obj.has(key) ? obj.getString(key) : null;
	}
}
