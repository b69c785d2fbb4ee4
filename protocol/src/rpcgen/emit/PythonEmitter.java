package rpcgen.emit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import rpcgen.GeneratedProtocol;
import rpcgen.compile.Field;
import rpcgen.compile.TypeExpr;
import rpcgen.definition.AliasDefinition;
import rpcgen.definition.Definition;
import rpcgen.definition.EnumerationDefinition;
import rpcgen.definition.RecordDefinition;
import rpcgen.message.Argument;
import rpcgen.message.DispatcherArtifact;
import rpcgen.message.Method;
import rpcgen.message.Role;
import rpcgen.model.EnumerationEntry;
import rpcgen.order.ForwardReference;

/**
 * Renders generated artifacts as typed Python source.
 */
public class PythonEmitter {

	private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList( //
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue", "def",
			"del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda",
			"nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield",
			// Soft keywords
			"_", "case", "match", "type"));

	private static final List<String> TYPES_TYPING_IMPORTS = Arrays.asList("List", "Dict", "Union", "Tuple",
			"Literal", "TypeAlias", "TypedDict", "NotRequired");

	private static final String INDENT = "\t";

	private final String typesModule;

	public PythonEmitter(String typesModule) {
		this.typesModule = typesModule;
	}

	public static String getAutoGenDisclaimerLine(String version) {
		return "# Automatically generated by rpcgen" + (version != null ? " from protocol version " + version : "")
				+ ". Do not edit.";
	}

	public String emitTypes(GeneratedProtocol protocol) {
		final List<String> blocks = new ArrayList<>();
		blocks.add(getAutoGenDisclaimerLine(protocol.version));
		blocks.add(fromImport("__future__", Arrays.asList("annotations")));
		blocks.add(fromImport("enum", Arrays.asList("Enum")));
		blocks.add(fromImport("typing", TYPES_TYPING_IMPORTS));
		final Map<String, Set<String>> deferred = new HashMap<>();
		for (ForwardReference ref : protocol.types.forwardReferences) {
			deferred.computeIfAbsent(ref.from, k -> new HashSet<>()).add(ref.to);
		}
		for (Definition def : protocol.types.definitions) {
			blocks.add(emitDefinition(def, deferred.getOrDefault(def.name, Collections.emptySet())));
		}
		return String.join("\n\n", blocks) + "\n";
	}

	public String emitDispatcher(GeneratedProtocol protocol, Role role) {
		final DispatcherArtifact dispatcher = protocol.dispatcher(role);
		final List<String> blocks = new ArrayList<>();
		blocks.add(getAutoGenDisclaimerLine(protocol.version));

		final Set<String> typingNames = new LinkedHashSet<>(Arrays.asList("List", "Union"));
		for (TypeExpr annotation : dispatcher.annotations()) {
			collectTypingNames(annotation, typingNames);
		}
		blocks.add(fromImport("typing", new ArrayList<>(typingNames)));
		final List<String> imports = protocol.importsFor(role);
		if (!imports.isEmpty()) {
			blocks.add(fromImport("." + typesModule, imports));
		}
		blocks.add(emitDispatcherClass(dispatcher));
		return String.join("\n\n", blocks) + "\n";
	}

	public String emitDefinition(Definition def) {
		return emitDefinition(def, Collections.emptySet());
	}

	/**
	 * @param deferred names that are placed after <code>def</code> in the types
	 *                 artifact, and so must be quoted where <code>def</code>
	 *                 mentions them
	 */
	public String emitDefinition(Definition def, Set<String> deferred) {
		switch (def.kind) {
		case RECORD:
			return emitRecord((RecordDefinition) def, deferred);
		case ENUMERATION:
			return emitEnumeration((EnumerationDefinition) def);
		case ALIAS:
			return emitAlias((AliasDefinition) def, deferred);
		default:
			throw new IllegalArgumentException("Unknown definition kind " + def.kind);
		}
	}

	private String emitRecord(RecordDefinition rec, Set<String> deferred) {
		final List<String> parents = new ArrayList<>();
		for (TypeExpr parent : rec.parents) {
			parents.add(renderType(parent));
		}
		final Set<String> quoted = new HashSet<>(deferred);
		quoted.add(rec.name);
		if (parents.isEmpty()) {
			parents.add("TypedDict");
		}
		final List<String> variables = new ArrayList<>();
		for (Field f : rec.fields) {
			variables.add(variable(f.name, renderType(f.type, quoted), null, f.documentation));
		}
		return classDef(rec.name, parents, rec.documentation, variables, Collections.emptyList());
	}

	private String emitEnumeration(EnumerationDefinition enumeration) {
		final List<String> variables = new ArrayList<>();
		for (EnumerationEntry entry : enumeration.entries) {
			variables.add(variable(entry.name, null, literalValue(entry.value), entry.documentation));
		}
		return classDef(enumeration.name, Arrays.asList(renderType(enumeration.backingType()), "Enum"),
				enumeration.documentation, variables, Collections.emptyList());
	}

	private String emitAlias(AliasDefinition alias, Set<String> deferred) {
		return variable(alias.name, "TypeAlias", renderType(alias.bound, deferred), alias.documentation);
	}

	private String emitDispatcherClass(DispatcherArtifact dispatcher) {
		final List<String> methods = new ArrayList<>();
		for (Method m : dispatcher.methods) {
			methods.add(emitMethod(dispatcher, m));
		}
		return classDef(dispatcher.role.className, Collections.emptyList(), null, Collections.emptyList(), methods);
	}

	private String emitMethod(DispatcherArtifact dispatcher, Method m) {
		final StringBuilder body = new StringBuilder();
		final Consumer<String> println = line -> body.append(line + "\n");
		if (m.documentation != null) {
			println.accept(docstring(m.documentation));
		}
		switch (m.kind) {
		case REQUEST_SENDER:
			println.accept("self.request(method=" + pyRepr(m.wireMethod) + ", params=params)");
			break;
		case NOTIFICATION_SENDER:
			println.accept("self.notify(method=" + pyRepr(m.wireMethod) + ", params=params)");
			break;
		case ENTRY_POINT:
			println.accept("handle_map = {");
			for (String wireMethod : dispatcher.table.methods()) {
				println.accept(INDENT + pyRepr(wireMethod) + ": self." + dispatcher.table.handlerFor(wireMethod) + ",");
			}
			println.accept("}");
			println.accept("return handle_map[method]({}, payload)");
			break;
		default:
			// Stub: no behavior is generated
			println.accept("raise NotImplementedError(" + pyRepr(m.name) + ")");
			break;
		}

		final StringBuilder out = new StringBuilder();
		out.append("def " + m.name + "(self");
		for (Argument arg : m.arguments) {
			out.append(", " + arg.name + ": " + renderType(arg.type));
		}
		out.append(") -> " + (m.returns != null ? renderType(m.returns) : "None") + ":\n");
		out.append(indent(body.toString().trim()));
		return out.toString();
	}

	private String classDef(String name, List<String> parents, String documentation, List<String> variables,
			List<String> methods) {
		final StringBuilder out = new StringBuilder();
		out.append("class " + name);
		if (!parents.isEmpty()) {
			out.append("(" + String.join(", ", parents) + ")");
		}
		out.append(":\n");

		final List<String> body = new ArrayList<>();
		if (documentation != null) {
			body.add(docstring(documentation));
		}
		if (!variables.isEmpty()) {
			body.add(String.join("\n", variables) + "\n");
		}
		if (!methods.isEmpty()) {
			body.add(String.join("\n\n", methods) + "\n");
		}
		if (body.isEmpty()) {
			body.add(docstring(""));
		}
		out.append(indent(String.join("\n", body)));
		return out.toString();
	}

	private String variable(String name, String annotation, String value, String documentation) {
		final StringBuilder out = new StringBuilder(safeName(name));
		if (annotation != null) {
			out.append(": " + annotation);
		}
		if (value != null) {
			out.append(" = " + value);
		}
		if (documentation != null) {
			out.append("\n" + docstring(documentation));
		}
		return out.toString();
	}

	private static String fromImport(String module, List<String> names) {
		if (names.size() > 3) {
			return "from " + module + " import (\n" + INDENT + String.join(",\n" + INDENT, names) + "\n)";
		}
		return "from " + module + " import " + String.join(", ", names);
	}

	public static String safeName(String name) {
		return KEYWORDS.contains(name) ? name + "_" : name;
	}

	/**
	 * Raw when the text has backslashes and can be written raw. Otherwise
	 * backslashes are escaped, as are quotes that would end the literal early: any
	 * quote in a run of three or more, and a trailing quote.
	 */
	public static String docstring(String text) {
		final boolean rawSafe = !text.contains("\"\"\"") && !text.endsWith("\"") && !text.endsWith("\\");
		if (text.contains("\\") && rawSafe) {
			return "r\"\"\"" + text + "\"\"\"";
		}
		final StringBuilder body = new StringBuilder();
		for (int i = 0; i < text.length(); i++) {
			final char c = text.charAt(i);
			if (c == '\\') {
				body.append("\\\\");
			} else if (c == '"' && (i == text.length() - 1 || quoteRunLength(text, i) >= 3)) {
				body.append("\\\"");
			} else {
				body.append(c);
			}
		}
		return "\"\"\"" + body + "\"\"\"";
	}

	private static int quoteRunLength(String text, int pos) {
		int start = pos;
		while (start > 0 && text.charAt(start - 1) == '"') {
			--start;
		}
		int end = pos;
		while (end < text.length() && text.charAt(end) == '"') {
			++end;
		}
		return end - start;
	}

	private static String indent(String text) {
		return Arrays.stream(text.split("\n", -1)) //
				.map(line -> line.isEmpty() ? line : INDENT + line) //
				.collect(Collectors.joining("\n"));
	}

	public String renderType(TypeExpr type) {
		return renderType(type, Collections.emptySet());
	}

	/**
	 * @param quoteNames names that must be quoted where they appear, because they
	 *                   are not yet defined at that point
	 */
	public String renderType(TypeExpr type, Set<String> quoteNames) {
		switch (type.kind) {
		case PRIMITIVE:
			switch (((TypeExpr.Primitive) type).primitiveKind) {
			case STRING:
				return "str";
			case INTEGER:
				return "int";
			case FLOAT:
				return "float";
			case BOOLEAN:
				return "bool";
			case OBJECT:
				return "dict";
			case NULL:
			default:
				return "None";
			}
		case NAMED: {
			final String name = ((TypeExpr.Named) type).name;
			return quoteNames.contains(name) ? "\"" + name + "\"" : name;
		}
		case FORWARD_REFERENCE:
			return "\"" + ((TypeExpr.ForwardReference) type).name + "\"";
		case SEQUENCE:
			return "List[" + renderType(((TypeExpr.Sequence) type).element, quoteNames) + "]";
		case ASSOCIATIVE: {
			final TypeExpr.Associative assoc = (TypeExpr.Associative) type;
			return "Dict[" + renderType(assoc.key, quoteNames) + ", " + renderType(assoc.value, quoteNames) + "]";
		}
		case UNION:
			return "Union[" + renderAll(((TypeExpr.Union) type).items, quoteNames) + "]";
		case TUPLE:
			return "Tuple[" + renderAll(((TypeExpr.Tuple) type).items, quoteNames) + "]";
		case LITERAL:
			return "Literal[" + literalValue(((TypeExpr.Literal) type).value) + "]";
		case OPTIONAL_FIELD:
			return "NotRequired[" + renderType(((TypeExpr.OptionalField) type).inner, quoteNames) + "]";
		default:
			throw new IllegalArgumentException("Unknown type expression kind " + type.kind);
		}
	}

	private String renderAll(List<TypeExpr> items, Set<String> quoteNames) {
		return items.stream().map(item -> renderType(item, quoteNames)).collect(Collectors.joining(", "));
	}

	private static void collectTypingNames(TypeExpr type, Set<String> dst) {
		switch (type.kind) {
		case SEQUENCE:
			dst.add("List");
			break;
		case ASSOCIATIVE:
			dst.add("Dict");
			break;
		case UNION:
			dst.add("Union");
			break;
		case TUPLE:
			dst.add("Tuple");
			break;
		case LITERAL:
			dst.add("Literal");
			break;
		case OPTIONAL_FIELD:
			dst.add("NotRequired");
			break;
		default:
			break;
		}
		for (TypeExpr child : type.children()) {
			collectTypingNames(child, dst);
		}
	}

	public static String literalValue(Object value) {
		if (value instanceof String) {
			return pyRepr((String) value);
		}
		if (value instanceof Boolean) {
			return ((Boolean) value) ? "True" : "False";
		}
		return String.valueOf(value);
	}

	/**
	 * Python's <code>repr()</code> of a string: single quotes unless the text
	 * contains a single quote but no double quote.
	 */
	public static String pyRepr(String text) {
		final char quote = text.indexOf('\'') != -1 && text.indexOf('"') == -1 ? '"' : '\'';
		final StringBuilder out = new StringBuilder();
		out.append(quote);
		for (int i = 0; i < text.length(); i++) {
			final char c = text.charAt(i);
			if (c == quote || c == '\\') {
				out.append('\\').append(c);
			} else if (c == '\n') {
				out.append("\\n");
			} else if (c == '\r') {
				out.append("\\r");
			} else if (c == '\t') {
				out.append("\\t");
			} else if (c < 0x20 || c == 0x7f) {
				out.append(String.format("\\x%02x", (int) c));
			} else {
				out.append(c);
			}
		}
		out.append(quote);
		return out.toString();
	}
}
