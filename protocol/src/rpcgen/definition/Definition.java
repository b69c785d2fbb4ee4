package rpcgen.definition;

import rpcgen.compile.Annotated;

/**
 * A compiled, named output unit of the types artifact. Definitions are created
 * once by {@link DefinitionBuilder} and never modified afterwards.
 */
public abstract class Definition implements Annotated {

	public static enum Kind {
		RECORD, ALIAS, ENUMERATION
	}

	public final Kind kind;
	public final String name;
	public final String documentation;

	protected Definition(Kind kind, String name, String documentation) {
		this.kind = kind;
		this.name = name;
		this.documentation = documentation;
	}

	@Override
	public String toString() {
		return kind + "<" + name + ">";
	}
}
