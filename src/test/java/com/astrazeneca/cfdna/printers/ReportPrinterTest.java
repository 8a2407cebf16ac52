package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.annotation.SnvIndelSchema;
import com.astrazeneca.cfdna.annotation.SnvIndelSchema.Column;
import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleReport;
import com.astrazeneca.cfdna.exception.ConfigurationException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class ReportPrinterTest {
    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();

    @AfterMethod
    public void clearOutContent() {
        outContent.reset();
    }

    private String print(OutputFormat format, boolean raw, ReportLayout layout, List<SampleReport> reports) {
        ReportPrinter printer = ReportPrinter.createPrinter(format, raw, layout);
        printer.setOut(new PrintStream(outContent, true));
        printer.print(reports);
        return outContent.toString();
    }

    private static SampleIdentity cnvSample(String name) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("Gender", "Female");
        metadata.put("MAPD", "0.121");
        metadata.put("Cellularity", "0.3");
        return new SampleIdentity(name, metadata);
    }

    private static final ReportRow RET = new ReportRow("chr10", "RET", "43609004", "43614004", "5000", "6", "5.0",
            "2.1", "1.0E-6", "1200", "300");

    @Test
    public void createsPrinterForFormat() {
        CnvReportLayout layout = new CnvReportLayout();
        assertTrue(ReportPrinter.createPrinter(OutputFormat.PP, false, layout) instanceof PrettyReportPrinter);
        assertTrue(ReportPrinter.createPrinter(OutputFormat.CSV, false, layout) instanceof DelimitedReportPrinter);
        assertTrue(ReportPrinter.createPrinter(OutputFormat.TSV, true, layout) instanceof RawReportPrinter);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void unknownFormatIsRejected() {
        OutputFormat.fromOption("xls");
    }

    @Test
    public void rawOutputHasOneGlobalHeader() {
        List<SampleReport> reports = Arrays.asList(
                new SampleReport(cnvSample("Sample1"), Collections.singletonList(RET)),
                new SampleReport(cnvSample("Sample2"), Collections.emptyList()),
                new SampleReport(cnvSample("Sample3"), Collections.singletonList(RET)));

        String[] lines = print(OutputFormat.PP, true, new CnvReportLayout(), reports).split("\\R");

        assertEquals(lines.length, 3);
        assertEquals(lines[0], "Sample,Gender,MAPD,Cellularity,Chr,Gene,Start,End,Length,Tiles,CN,FD,p-val,"
                + "Med_Mol_Cov,Med_Read_Cov");
        assertEquals(lines[1], "Sample1,Female,0.121,0.3,chr10,RET,43609004,43614004,5000,6,5.0,2.1,1.0E-6,1200,300");
        assertTrue(lines[2].startsWith("Sample3,"));
    }

    @Test
    public void rawOutputWithoutRecordsIsHeaderOnly() {
        String output = print(OutputFormat.CSV, true, new FusionReportLayout(Collections.emptySet(), false),
                Collections.singletonList(new SampleReport(SampleIdentity.ofName("S"), Collections.emptyList())));

        assertEquals(output.split("\\R").length, 1);
        assertTrue(output.startsWith("Sample,Fusion,ID,Read_Count,Driver_Gene,Partner_Gene"));
    }

    @Test
    public void prettyOutputHasBannerAndEmptyMarker() {
        List<SampleReport> reports = Arrays.asList(
                new SampleReport(cnvSample("Sample1"), Collections.singletonList(RET)),
                new SampleReport(cnvSample("Sample2"), Collections.emptyList()));

        String[] lines = print(OutputFormat.PP, false, new CnvReportLayout(), reports).split("\\R");

        assertEquals(lines[0], "::: CNV Data For Sample1 (Gender: Female, Cellularity: 0.3, MAPD: 0.121) :::");
        assertTrue(lines[1].startsWith("Chr      Gene     Start       End"));
        assertTrue(lines[2].startsWith("chr10    RET      43609004    43614004"));
        assertEquals(lines[6], ">>>>  No Reportable CNVs Found in Sample  <<<<");
    }

    @Test
    public void delimitedOutputHasHeaderPerSample() {
        List<SampleReport> reports = Collections.singletonList(
                new SampleReport(cnvSample("Sample1"), Collections.singletonList(RET)));

        String[] lines = print(OutputFormat.TSV, false, new CnvReportLayout(), reports).split("\\R");

        assertEquals(lines[1], "Chr\tGene\tStart\tEnd\tLength\tTiles\tCN\tFD\tp-val\tMed_Mol_Cov\tMed_Read_Cov");
        assertEquals(lines[2], String.join("\t", RET.values()));
    }

    @Test
    public void snvWidthsAreSharedByAllSamples() {
        List<String> longRef = new ArrayList<>(Collections.nCopies(SnvIndelSchema.titles().size(), "x"));
        longRef.set(Column.REF.ordinal(), "ACGTACGTAC");
        List<String> shortRef = new ArrayList<>(Collections.nCopies(SnvIndelSchema.titles().size(), "x"));
        SampleReport first = new SampleReport(SampleIdentity.ofName("A"), Collections.singletonList(new ReportRow(longRef)));
        SampleReport second = new SampleReport(SampleIdentity.ofName("B"), Collections.singletonList(new ReportRow(shortRef)));
        List<SampleReport> reports = Arrays.asList(first, second);

        SnvIndelReportLayout layout = new SnvIndelReportLayout();
        int[] firstWidths = layout.columnWidths(reports, first);
        int[] secondWidths = layout.columnWidths(reports, second);

        assertEquals(firstWidths[Column.REF.ordinal()], 12);
        assertEquals(secondWidths[Column.REF.ordinal()], 12);
        assertEquals(firstWidths[Column.ALT.ordinal()], SnvIndelReportLayout.MIN_WIDTH);
        assertEquals(firstWidths[Column.POSITION.ordinal()], 17);
    }

    @Test
    public void fusionReportShowsGenesAndControls() {
        Map<String, Integer> controls = new LinkedHashMap<>();
        controls.put("TBP", 900);
        controls.put("GAPDH", 2500);
        SampleReport sample = new SampleReport(SampleIdentity.ofName("Sample2"),
                Collections.singletonList(new ReportRow("EML4-ALK.E13A20", "COSF408", "85", "ALK", "EML4")),
                controls);
        FusionReportLayout layout = new FusionReportLayout(Collections.singleton("ALK"), true);

        String[] lines = print(OutputFormat.PP, false, layout, Collections.singletonList(sample)).split("\\R");

        assertEquals(lines[0], "::: ALK Fusions in Sample2 :::");
        assertTrue(lines[2].startsWith("EML4-ALK.E13A20   COSF408"));
        assertEquals(lines[3], "Controls:");
        assertTrue(lines[4].trim().startsWith("GAPDH"));
        assertEquals(layout.columnWidths(Collections.singletonList(sample), sample)[0], 17);
    }
}
