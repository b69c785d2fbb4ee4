package rpcgen;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import rpcgen.compile.TypeExprCompiler;
import rpcgen.definition.Definition;
import rpcgen.definition.DefinitionBuilder;
import rpcgen.imports.ImportResolver;
import rpcgen.message.CompiledDispatchers;
import rpcgen.message.MessageCompiler;
import rpcgen.model.MetaModel;
import rpcgen.order.DependencyOrderer;
import rpcgen.order.OrderedDefinitions;

/**
 * Runs the full compilation pipeline over a metamodel. Pure: reads nothing
 * but its argument and writes nothing.
 */
public class Generator {

	private final DefinitionBuilder definitionBuilder;
	private final MessageCompiler messageCompiler;
	private final DependencyOrderer orderer = new DependencyOrderer();

	public Generator(Set<String> forwardReferencedAliases) {
		final TypeExprCompiler compiler = new TypeExprCompiler();
		this.definitionBuilder = new DefinitionBuilder(compiler, forwardReferencedAliases);
		this.messageCompiler = new MessageCompiler(compiler);
	}

	public Generator() {
		this(DefinitionBuilder.DEFAULT_FORWARD_REFERENCED_ALIASES);
	}

	public GeneratedProtocol generate(MetaModel model) {
		// Base aliases first, so they win over any same-named declaration
		final List<Definition> all = new ArrayList<>(DefinitionBuilder.baseAliases());
		all.addAll(definitionBuilder.build(model));
		final OrderedDefinitions types = orderer.order(all);

		final CompiledDispatchers dispatchers = messageCompiler.compile(model);
		final ImportResolver resolver = new ImportResolver(types.names());
		return new GeneratedProtocol(model.version, types, dispatchers, resolver.resolve(dispatchers.initiator),
				resolver.resolve(dispatchers.responder));
	}
}
