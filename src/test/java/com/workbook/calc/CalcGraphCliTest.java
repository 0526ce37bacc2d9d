package com.workbook.calc;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

public class CalcGraphCliTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private ByteArrayOutputStream buffer;
    private PrintStream out;
    private String workbook;

    @Before
    public void setUp() throws Exception {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        workbook = Paths.get(getClass().getResource("/workbooks/superstore.json").toURI()).toString();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testDefaultCommandPrintsDependencies() {
        assertEquals(CalcGraphCli.OK, CalcGraphCli.run(new String[] { workbook }, out));
        assertTrue(output().contains("\"totalCalculations\""));
        assertTrue(output().contains("Profit Ratio"));
    }

    @Test
    public void testCommands() {
        assertEquals(CalcGraphCli.OK, CalcGraphCli.run(new String[] { workbook, "lod" }, out));
        assertTrue(output().contains("customerCohort"));

        buffer.reset();
        assertEquals(CalcGraphCli.OK, CalcGraphCli.run(new String[] { workbook, "fields" }, out));
        assertTrue(output().contains("Growth Rate"));

        buffer.reset();
        assertEquals(CalcGraphCli.OK, CalcGraphCli.run(new String[] { workbook, "tree" }, out));
        assertTrue(output().contains("(leaf calculation)"));

        buffer.reset();
        assertEquals(CalcGraphCli.OK, CalcGraphCli.run(new String[] { workbook, "mermaid" }, out));
        assertTrue(output().startsWith("graph TD;"));
    }

    @Test
    public void testOptionsFile() throws Exception {
        File options = tmp.newFile("options.json");
        Files.writeString(options.toPath(), "{\"maxTreeRoots\": 1}");
        assertEquals(CalcGraphCli.OK,
                CalcGraphCli.run(new String[] { workbook, "tree", "--options", options.getPath() }, out));
        assertTrue(output().contains("(+5 more leaf calculations)"));
    }

    @Test
    public void testUsageErrors() {
        assertEquals(CalcGraphCli.USAGE, CalcGraphCli.run(new String[0], out));
        assertEquals(CalcGraphCli.USAGE, CalcGraphCli.run(new String[] { workbook, "bogus" }, out));
        assertEquals(CalcGraphCli.USAGE, CalcGraphCli.run(new String[] { workbook, "--options" }, out));
        assertEquals("", output());
    }

    @Test
    public void testFailures() throws Exception {
        File missing = new File(tmp.getRoot(), "missing.json");
        assertEquals(CalcGraphCli.FAILED, CalcGraphCli.run(new String[] { missing.getPath() }, out));

        File broken = tmp.newFile("broken.json");
        Files.writeString(broken.toPath(), "{\"notAWorkbook\": true}");
        assertEquals(CalcGraphCli.FAILED, CalcGraphCli.run(new String[] { broken.getPath() }, out));
    }
}
