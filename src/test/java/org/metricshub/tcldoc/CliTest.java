package org.metricshub.tcldoc;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CliTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path sources;

	private static void write(Path file, String content) throws IOException {
		Files.createDirectories(file.getParent());
		Files.write(file, content.getBytes(StandardCharsets.UTF_8));
	}

	@Before
	public void setUp() throws IOException {
		sources = folder.newFolder("src").toPath();
		write(sources.resolve("app.tcl"), "proc start {} {\n  helper 1\n}\n");
		write(sources.resolve("broken.tcl"), "puts {\n");
		write(sources.resolve("pkg").resolve("helper.tcl"), "proc helper {n} {return $n}\n");
	}

	@Test
	public void testParseOptions() {
		Cli cli = Cli
				.parseCommandLineArguments(
						new String[] {
								"-d",
								"2",
								"-o",
								"out",
								"-R",
								"--title",
								"My Index",
								"--max-depth",
								"64",
								"--encoding",
								"ISO-8859-1",
								"scripts" });
		assertEquals(2, cli.getSettings().getDebugLevel());
		assertEquals(Paths.get("out"), cli.getSettings().getOutputDirectory());
		assertTrue(cli.getSettings().isRecursive());
		assertEquals("My Index", cli.getSettings().getIndexTitle());
		assertEquals(64, cli.getSettings().getMaxNestingDepth());
		assertEquals(StandardCharsets.ISO_8859_1, cli.getSettings().getCharset());
		assertEquals(Paths.get("scripts"), cli.getSource());
	}

	@Test
	public void testBadArguments() {
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-d" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-d", "x", "a" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--nope", "a" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "a", "b" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-R" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--max-depth", "0", "a" }));
		assertThrows(
				IllegalArgumentException.class,
				() -> Cli.parseCommandLineArguments(new String[] { "--encoding", "no-such-charset", "a" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-h", "a" }));
	}

	@Test
	public void testUsage() throws IOException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		Cli.create(new String[] { "-h" }, new PrintStream(bytes, true, "UTF-8"));
		String usage = bytes.toString("UTF-8");
		assertTrue(usage, usage.startsWith("Usage:"));
		assertTrue(usage, usage.contains("--title"));
	}

	@Test
	public void testNoArgumentsPrintsUsage() throws IOException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		Cli.create(new String[0], new PrintStream(bytes, true, "UTF-8"));
		assertTrue(bytes.toString("UTF-8").startsWith("Usage:"));
	}

	@Test
	public void testMissingSource() {
		String missing = folder.getRoot().toPath().resolve("missing").toString();
		assertThrows(NoSuchFileException.class, () -> Cli.create(new String[] { missing }, new PrintStream(new ByteArrayOutputStream())));
	}

	@Test
	public void testParseOnly() throws IOException {
		Cli cli = Cli.create(new String[] { sources.toString() }, new PrintStream(new ByteArrayOutputStream()));
		assertEquals("broken.tcl is skipped", 1, cli.getTclDoc().getFailures().size());
		assertEquals(1, cli.getTclDoc().getProcedureIndex().size());
	}

	@Test
	public void testRecursiveDocumentation() throws IOException {
		Path out = folder.getRoot().toPath().resolve("html");
		Cli
				.create(
						new String[] { "-R", "-o", out.toString(), "--title", "Tcl & Co", sources.toString() },
						new PrintStream(new ByteArrayOutputStream()));

		assertTrue(Files.isRegularFile(out.resolve("tclcode.css")));
		assertTrue(Files.isRegularFile(out.resolve("app.html")));
		assertTrue(Files.isRegularFile(out.resolve("pkg").resolve("helper.html")));
		assertFalse("broken.tcl has no page", Files.exists(out.resolve("broken.html")));

		String master = new String(Files.readAllBytes(out.resolve("index.html")), StandardCharsets.UTF_8);
		assertTrue(master, master.contains("<h1>Tcl &amp; Co</h1>"));
		assertTrue(master, master.contains("<a href=\"pkg/helper.html#helper\">helper</a>"));
		assertTrue(master, master.contains("<a href=\"app.html#start\">start</a>"));

		String helper = new String(Files.readAllBytes(out.resolve("pkg").resolve("helper.html")), StandardCharsets.UTF_8);
		assertTrue(helper, helper.contains("<base href=\"../\">"));
	}

	@Test
	public void testDumpSyntax() throws IOException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		Cli.create(new String[] { "--dump-syntax", sources.resolve("app.tcl").toString() }, new PrintStream(bytes, true, "UTF-8"));
		String dump = bytes.toString("UTF-8");
		assertTrue(dump, dump.startsWith("=== app.tcl\nScript\n"));
		assertTrue(dump, dump.contains("WORD(start)@1#start"));
	}
}
