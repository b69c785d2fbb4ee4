package rpcgen.model;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.List;

import org.json.JSONObject;

import rpcgen.util.JsonUtil;

/**
 * The full protocol description: requests, notifications, structures,
 * enumerations and type aliases.
 */
public class MetaModel {

	public final String version;
	public final List<Request> requests;
	public final List<Notification> notifications;
	public final List<Structure> structures;
	public final List<Enumeration> enumerations;
	public final List<TypeAlias> typeAliases;

	public MetaModel(String version, List<Request> requests, List<Notification> notifications,
			List<Structure> structures, List<Enumeration> enumerations, List<TypeAlias> typeAliases) {
		this.version = version;
		this.requests = Collections.unmodifiableList(requests);
		this.notifications = Collections.unmodifiableList(notifications);
		this.structures = Collections.unmodifiableList(structures);
		this.enumerations = Collections.unmodifiableList(enumerations);
		this.typeAliases = Collections.unmodifiableList(typeAliases);
	}

	public static MetaModel fromJSON(JSONObject obj) {
		final JSONObject metaData = obj.optJSONObject("metaData");
		return new MetaModel( //
				metaData != null ? metaData.getString("version") : null, //
				JsonUtil.mapOptArr(obj, "requests", (arr, idx) -> Request.fromJSON(arr.getJSONObject(idx))), //
				JsonUtil.mapOptArr(obj, "notifications", (arr, idx) -> Notification.fromJSON(arr.getJSONObject(idx))), //
				JsonUtil.mapOptArr(obj, "structures", (arr, idx) -> Structure.fromJSON(arr.getJSONObject(idx))), //
				JsonUtil.mapOptArr(obj, "enumerations", (arr, idx) -> Enumeration.fromJSON(arr.getJSONObject(idx))), //
				JsonUtil.mapOptArr(obj, "typeAliases", (arr, idx) -> TypeAlias.fromJSON(arr.getJSONObject(idx))));
	}

	public static MetaModel load(File file) throws IOException {
		final String text = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
		return fromJSON(new JSONObject(text));
	}
}
