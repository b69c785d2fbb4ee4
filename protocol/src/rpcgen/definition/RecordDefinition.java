package rpcgen.definition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import rpcgen.compile.Field;
import rpcgen.compile.TypeExpr;

public class RecordDefinition extends Definition {

	/**
	 * Compiled <code>extends</code> list, in declared order. Empty means the
	 * record stands alone.
	 */
	public final List<TypeExpr> parents;

	/**
	 * Own properties followed by mixed-in properties.
	 */
	public final List<Field> fields;

	public RecordDefinition(String name, List<TypeExpr> parents, List<Field> fields, String documentation) {
		super(Kind.RECORD, name, documentation);
		this.parents = Collections.unmodifiableList(new ArrayList<>(parents));
		this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
	}

	public List<String> parentNames() {
		final List<String> ret = new ArrayList<>();
		for (TypeExpr parent : parents) {
			parent.collectNames(ret::add);
		}
		return ret;
	}

	@Override
	public List<TypeExpr> annotations() {
		final List<TypeExpr> ret = new ArrayList<>(parents);
		for (Field f : fields) {
			ret.add(f.type);
		}
		return ret;
	}
}
