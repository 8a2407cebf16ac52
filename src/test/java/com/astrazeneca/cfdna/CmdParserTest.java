package com.astrazeneca.cfdna;

import com.astrazeneca.cfdna.data.FilterCriteria;
import com.astrazeneca.cfdna.data.ThresholdMode;
import com.astrazeneca.cfdna.exception.ConfigurationException;
import com.astrazeneca.cfdna.printers.OutputFormat;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashSet;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class CmdParserTest {
    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final CmdParser parser = new CmdParser(new PrintStream(outContent, true));

    @AfterMethod
    public void clearOutContent() {
        outContent.reset();
    }

    @Test
    public void parsesCnvOptions() {
        Configuration config = parser.parseParams(new String[] {"cnv", "--copy_amp", "4", "--copy_loss", "1",
                "-g", "MET,EGFR", "-t", "3", "-f", "csv", "a.vcf", "b.vcf"});

        assertEquals(config.reportType, ReportType.CNV);
        assertEquals(config.files.size(), 2);
        assertEquals(config.format, OutputFormat.CSV);
        assertEquals(config.tiles, 3);
        assertEquals(config.threads, Configuration.DEFAULT_THREADS);
        assertEquals(config.genes, new LinkedHashSet<>(Arrays.asList("MET", "EGFR")));

        FilterCriteria criteria = config.toFilterCriteria();
        assertEquals(criteria.thresholdMode, ThresholdMode.COPY_NUMBER);
        assertEquals(criteria.copyAmp, 4.0);
        assertTrue(criteria.includeNoCalls);
    }

    @Test
    public void nocallFlagMeaningDependsOnReport() {
        Configuration cnv = parser.parseParams(new String[] {"cnv", "-N", "a.vcf"});
        assertFalse(cnv.toFilterCriteria().includeNoCalls);

        Configuration fusion = parser.parseParams(new String[] {"fusion", "-N", "a.vcf"});
        assertTrue(fusion.toFilterCriteria().includeNoCalls);

        Configuration snv = parser.parseParams(new String[] {"snv", "a.vcf"});
        assertTrue(snv.toAnnotatorOptions().excludeNoCalls);
    }

    @Test
    public void parsesFusionOptions() {
        Configuration config = parser.parseParams(new String[] {"fusion", "-t", "10", "-R", "-n", "-th", "4", "f.vcf"});

        assertEquals(config.threshold, 10);
        assertTrue(config.ref);
        assertTrue(config.novel);
        assertEquals(config.threads, 4);
    }

    @Test
    public void fusionThresholdDefault() {
        Configuration config = parser.parseParams(new String[] {"fusion", "f.vcf"});
        assertEquals(config.threshold, Configuration.DEFAULT_FUSION_THRESHOLD);
        assertEquals(config.format, OutputFormat.PP);
    }

    @Test
    public void parsesSnvOptions() {
        Configuration config = parser.parseParams(new String[] {"snv", "--vaf", "0.5", "--mol-cov", "10",
                "--extractor", "/opt/bin/vcfExtractor.pl", "s.vcf"});

        assertEquals(config.vaf, 0.5);
        assertEquals(config.molCov, 10.0);
        assertEquals(config.extractor, "/opt/bin/vcfExtractor.pl");
    }

    @DataProvider(name = "wrongArguments")
    public Object[][] wrongArguments() {
        return new Object[][] {
                {new String[] {}},
                {new String[] {"cnx", "a.vcf"}},
                {new String[] {"cnv"}},
                {new String[] {"cnv", "-f", "xls", "a.vcf"}},
                {new String[] {"cnv", "--fold_amp", "1.5", "--fold_loss", "0.8", "--copy_amp", "4",
                        "--copy_loss", "1", "a.vcf"}},
                {new String[] {"cnv", "--copy_amp", "four", "a.vcf"}},
                {new String[] {"fusion", "--vaf", "1", "a.vcf"}},
        };
    }

    @Test(dataProvider = "wrongArguments", expectedExceptions = ConfigurationException.class)
    public void wrongArgumentsAreRejected(String[] args) {
        parser.parseParams(args);
    }

    @Test
    public void helpAndVersionReturnNoConfiguration() {
        assertNull(parser.parseParams(new String[] {"fusion", "-v"}));
        assertEquals(outContent.toString().trim(), "cfdna_fusion_report - v0.3.121817");

        outContent.reset();
        assertNull(parser.parseParams(new String[] {"cnv", "-h"}));
        assertTrue(outContent.toString().contains("--copy_amp"));

        outContent.reset();
        assertNull(parser.parseParams(new String[] {"--help"}));
        assertTrue(outContent.toString().contains("fixheader"));
    }

    @Test
    public void fixheaderTakesOutput() {
        Configuration config = parser.parseParams(new String[] {"fixheader", "-o", "fixed.vcf", "in.vcf"});
        assertEquals(config.reportType, ReportType.FIXHEADER);
        assertEquals(config.output, "fixed.vcf");
    }

    @Test(expectedExceptions = ConfigurationException.class,
            expectedExceptionsMessageRegExp = "Output file can be set for a single VCF only.*")
    public void fixheaderRejectsOneOutputForManyFiles() {
        parser.parseParams(new String[] {"fixheader", "-o", "fixed.vcf", "a.vcf", "b.vcf"});
    }
}
