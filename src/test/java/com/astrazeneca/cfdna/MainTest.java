package com.astrazeneca.cfdna;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class MainTest {
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private PrintStream originalErr;
    private File output;

    @BeforeMethod
    public void setUp() throws Exception {
        errContent.reset();
        originalErr = System.err;
        System.setErr(new PrintStream(errContent, true));
        output = File.createTempFile("cfdna-report", ".csv");
    }

    @AfterMethod
    public void tearDown() {
        System.setErr(originalErr);
        output.delete();
    }

    private String resource(String name) throws Exception {
        return new File(getClass().getResource("/com/astrazeneca/cfdna/" + name).toURI()).getPath();
    }

    @Test
    public void fusionRawReport() throws Exception {
        int exitCode = Main.run(new String[] {"fusion", "-r", "-o", output.getPath(),
                resource("Sample2_RNA_Fusion_filtered.vcf")});

        assertEquals(exitCode, 0);
        List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
        assertEquals(lines.size(), 2);
        assertEquals(lines.get(0), "Sample,Fusion,ID,Read_Count,Driver_Gene,Partner_Gene");
        assertEquals(lines.get(1), "Sample2,EML4-ALK.E13A20,COSF408,85,ALK,EML4");
    }

    @Test
    public void cnvCopyNumberReport() throws Exception {
        int exitCode = Main.run(new String[] {"cnv", "--copy_amp", "4", "--copy_loss", "1", "-f", "csv",
                "-o", output.getPath(), resource("cnv.vcf")});

        assertEquals(exitCode, 0);
        List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
        assertEquals(lines.get(0), "::: CNV Data For Sample1 (Gender: Female, Cellularity: 0.3, MAPD: 0.121) :::");
        assertEquals(lines.get(2), "chr10,RET,43609004,43614004,5000,6,5.0,2.1,1.0E-6,1200,300");
        assertEquals(lines.get(3), "");
    }

    @Test
    public void conflictingThresholdsExitWithError() throws Exception {
        int exitCode = Main.run(new String[] {"cnv", "--copy_amp", "4", "--copy_loss", "1", "--fold_amp", "1.5",
                "--fold_loss", "0.8", resource("cnv.vcf")});

        assertEquals(exitCode, 1);
        assertTrue(errContent.toString().contains("ERROR: You can not use both"));
    }

    @Test
    public void missingFilesExitWithError() {
        assertEquals(Main.run(new String[] {"snv"}), 1);
        assertTrue(errContent.toString().contains("No VCF files"));
        assertTrue(errContent.toString().contains("USAGE: " + CmdParser.USAGE));
    }

    @Test
    public void unknownDriverKeepsCsvColumns() throws Exception {
        int exitCode = Main.run(new String[] {"fusion", "-r", "-o", output.getPath(),
                resource("Sample9_RNA_Fusion_filtered.vcf")});

        assertEquals(exitCode, 0);
        List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
        assertEquals(lines.size(), 2);
        assertEquals(lines.get(1), "Sample9,FOO-BAR.F1B2,COSF1,10,UNKNOWN,FOO/BAR");
        assertEquals(lines.get(1).split(",").length, lines.get(0).split(",").length);
    }

    @Test
    public void fixheaderWritesFixedFile() throws Exception {
        int exitCode = Main.run(new String[] {"fixheader", "-o", output.getPath(), resource("header.vcf")});

        assertEquals(exitCode, 0);
        List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
        assertEquals(lines.size(), 5);
        assertTrue(lines.get(1).endsWith("Description=\"Molecular ratio to wild type.\">"));
    }
}
