package org.metricshub.dumblang.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.io.BufferedReader;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.dumblang.frontend.DslParser;
import org.metricshub.dumblang.frontend.ast.ParserException;

public class ScriptSourceTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testInlineSource() throws Exception {
		ScriptSource source = ScriptSource.inline("main() { }");
		assertEquals(ScriptSource.DESCRIPTION_INLINE_SCRIPT, source.getDescription());
		assertEquals("<inline-script>", source.toString());
		assertEquals("main() { }", new BufferedReader(source.getReader()).readLine());
	}

	@Test
	public void testFileSourceIsDescribedByItsPath() throws Exception {
		File file = folder.newFile("prog.dl");
		Files.write(file.toPath(), "main() {\n  x = ;\n}\n".getBytes(StandardCharsets.UTF_8));
		ScriptFileSource source = new ScriptFileSource(file.getPath());
		assertEquals(file.toPath(), source.getPath());
		assertEquals(file.getPath(), source.getDescription());

		ParserException e = assertThrows(ParserException.class, () -> new DslParser().parse(source));
		assertEquals(file.getPath(), e.getSourceDescription());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testMissingFileFailsWhenRead() {
		ScriptFileSource source = new ScriptFileSource(new File(folder.getRoot(), "missing.dl").toPath());
		assertThrows(NoSuchFileException.class, source::getReader);
	}
}
