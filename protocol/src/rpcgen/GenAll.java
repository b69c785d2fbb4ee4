package rpcgen;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;

import rpcgen.emit.PythonEmitter;
import rpcgen.message.Role;
import rpcgen.model.MetaModel;
import rpcgen.order.ForwardReference;

public class GenAll {

	public static final String TYPES_MODULE = "protocol";

	private static final boolean DEBUG = Boolean.getBoolean("rpcgen.debug");

	public static void main(String[] args) throws Exception {
		final File src = getMetaModelFile(args);
		final File dstDir = getDstDir();

		System.out.println("== GEN PY");
		final long start = System.nanoTime();
		final MetaModel model = MetaModel.load(src);
		final GeneratedProtocol protocol = new Generator().generate(model);
		if (DEBUG) {
			System.out.println("Loaded " + model.structures.size() + " structures, " + model.enumerations.size()
					+ " enumerations, " + model.typeAliases.size() + " aliases, " + model.requests.size()
					+ " requests, " + model.notifications.size() + " notifications");
			for (ForwardReference ref : protocol.types.forwardReferences) {
				System.out.println("Forward reference: " + ref);
			}
		}

		final PythonEmitter emitter = new PythonEmitter(TYPES_MODULE);
		write(new File(dstDir, "__init__.py"), "");
		write(new File(dstDir, TYPES_MODULE + ".py"), emitter.emitTypes(protocol));
		for (Role role : Role.values()) {
			write(new File(dstDir, role.className.toLowerCase() + ".py"), emitter.emitDispatcher(protocol, role));
		}
		if (DEBUG) {
			System.out.printf("Generated in %.1fms%n", (System.nanoTime() - start) / 1_000_000.0);
		}
		System.out.println("Done");
	}

	private static void write(File dst, String contents) throws Exception {
		Files.write(dst.toPath(), contents.getBytes(StandardCharsets.UTF_8), StandardOpenOption.CREATE,
				StandardOpenOption.TRUNCATE_EXISTING);
	}

	private static File getMetaModelFile(String[] args) throws Exception {
		final String path = args.length > 0 ? args[0] : System.getProperty("METAMODEL_FILE");
		if (path == null) {
			throw new Exception("Missing metamodel path, pass it as the first argument or via system property METAMODEL_FILE");
		}
		final File file = new File(path);
		if (!file.isFile()) {
			throw new Exception("No such metamodel file: " + file.getAbsolutePath());
		}
		return file;
	}

	private static File getDstDir() throws Exception {
		final String prop = System.getProperty("PY_DST_DIR");
		if (prop == null) {
			throw new Exception("Missing value for system property PY_DST_DIR");
		}
		final File dir = new File(prop);
		if (!dir.isDirectory()) {
			throw new Exception("PY_DST_DIR must be an existing directory, got " + dir.getAbsolutePath());
		}
		return dir;
	}
}
