package rpcgen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestGenAll {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Test
	public void testWritesPackage() throws Exception {
		final File src = new File(TestGenAll.class.getResource("/metaModel.json").toURI());
		final File dst = tmp.newFolder("lsp");
		System.setProperty("PY_DST_DIR", dst.getAbsolutePath());
		try {
			GenAll.main(new String[] { src.getAbsolutePath() });
		} finally {
			System.clearProperty("PY_DST_DIR");
		}

		assertEquals("", read(new File(dst, "__init__.py")));
		assertTrue(read(new File(dst, "protocol.py")).contains("class Hover(TypedDict):"));
		assertTrue(read(new File(dst, "initiator.py")).contains("class Initiator:"));
		assertTrue(read(new File(dst, "responder.py")).contains("class Responder:"));
	}

	@Test(expected = Exception.class)
	public void testDestinationMustExist() throws Exception {
		final File src = new File(TestGenAll.class.getResource("/metaModel.json").toURI());
		System.setProperty("PY_DST_DIR", new File(tmp.getRoot(), "missing").getAbsolutePath());
		try {
			GenAll.main(new String[] { src.getAbsolutePath() });
		} finally {
			System.clearProperty("PY_DST_DIR");
		}
	}

	@Test(expected = Exception.class)
	public void testMissingDestination() throws Exception {
		final File src = new File(TestGenAll.class.getResource("/metaModel.json").toURI());
		GenAll.main(new String[] { src.getAbsolutePath() });
	}

	private static String read(File f) throws Exception {
		return new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8);
	}
}
