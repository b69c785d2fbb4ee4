package rpcgen.definition;

import java.util.Collections;
import java.util.List;

import rpcgen.compile.TypeExpr;

public class AliasDefinition extends Definition {

	public final TypeExpr bound;

	public AliasDefinition(String name, TypeExpr bound, String documentation) {
		super(Kind.ALIAS, name, documentation);
		this.bound = bound;
	}

	@Override
	public List<TypeExpr> annotations() {
		return Collections.singletonList(bound);
	}
}
