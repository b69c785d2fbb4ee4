package rpcgen.message;

import rpcgen.compile.TypeExpr;

public class Argument {

	public final String name;
	public final TypeExpr type;

	public Argument(String name, TypeExpr type) {
		this.name = name;
		this.type = type;
	}

	@Override
	public String toString() {
		return name + ": " + type;
	}
}
