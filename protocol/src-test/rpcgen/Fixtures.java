package rpcgen;

import java.io.IOException;
import java.io.InputStream;

import org.json.JSONObject;
import org.json.JSONTokener;

import rpcgen.model.MetaModel;

public class Fixtures {

	public static JSONObject loadMetaModelJSON() {
		try (InputStream in = Fixtures.class.getResourceAsStream("/metaModel.json")) {
			if (in == null) {
				throw new IllegalStateException("Missing test resource metaModel.json");
			}
			return new JSONObject(new JSONTokener(in));
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
	}

	public static MetaModel loadMetaModel() {
		return MetaModel.fromJSON(loadMetaModelJSON());
	}
}
