package com.astrazeneca.cfdna.modes;

import com.astrazeneca.cfdna.Configuration;
import com.astrazeneca.cfdna.collection.DirectThreadExecutor;
import com.astrazeneca.cfdna.data.FilterCriteria;
import com.astrazeneca.cfdna.data.ResultSet;
import com.astrazeneca.cfdna.data.SampleRecords;
import com.astrazeneca.cfdna.data.SampleReport;
import com.astrazeneca.cfdna.data.scopedata.Scope;
import com.astrazeneca.cfdna.modules.RecordExtractor;
import com.astrazeneca.cfdna.modules.VcfFileReader;
import com.astrazeneca.cfdna.postprocessmodules.PostProcessModule;
import com.astrazeneca.cfdna.printers.ReportLayout;
import com.astrazeneca.cfdna.printers.ReportPrinter;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Abstract mode of the report. Provides not-parallel and parallel processing of the input files and the typical
 * pipeline: each file is read and its records are extracted by a worker, the results of all workers are merged
 * once, filtered and printed.
 */
public abstract class AbstractReportMode {
    private static final Log LOG = Log.getInstance(AbstractReportMode.class);

    protected final Configuration conf;
    protected final FilterCriteria criteria;

    public AbstractReportMode(Configuration conf) {
        this.conf = conf;
        this.criteria = conf.toFilterCriteria();
    }

    /**
     * Starts the typical pipeline on one file: reads the VCF lines and extracts the records of the report type.
     * @param vcf input file
     * @param executor current Executor for parallel/single mode
     * @return records of the file
     */
    public CompletableFuture<Scope<SampleRecords>> pipeline(File vcf, Executor executor) {
        Scope<File> initialScope = new Scope<>(vcf.getPath(), vcf);
        return CompletableFuture.supplyAsync(
                () -> new VcfFileReader().process(initialScope), executor)
                .thenApply(extractor()::process);
    }

    /**
     * Builds the report and prints it with the printer.
     * @param printer printer for the chosen output format
     */
    public void report(ReportPrinter printer) {
        checkPreconditions();
        ResultSet results = threads() > 1 ? parallel() : notParallel();
        List<SampleReport> reports = postProcessModule().apply(results);
        for (SampleReport report : reports) {
            LOG.debug("Sample ", report.identity.name(), " ", report.identity.metadata(), ": ",
                    report.rows.size(), " reportable records");
        }
        printer.print(reports);
    }

    /**
     * Creates printer for the output format of configuration.
     * @param out stream for the report
     */
    public ReportPrinter createPrinter(PrintStream out) {
        ReportPrinter printer = ReportPrinter.createPrinter(conf.format, conf.raw, layout());
        printer.setOut(out);
        return printer;
    }

    /**
     * Number of workers: threads option capped by the number of files
     */
    int threads() {
        return Math.min(conf.threads, conf.files.size());
    }

    /**
     * In not parallel mode files are processed in sequence on the calling thread.
     * @return merged records of all files which were read
     */
    public ResultSet notParallel() {
        List<SampleRecords> fragments = new ArrayList<>();
        for (File vcf : conf.files) {
            try {
                fragments.add(pipeline(vcf, new DirectThreadExecutor()).join().data);
            } catch (CompletionException ex) {
                logWorkerFailure(vcf.getPath(), ex.getCause());
            }
        }
        return ResultSet.merge(fragments);
    }

    /**
     * In parallel mode a worker is created for each file. Results are collected in completion order and merged
     * after all workers finished.
     * @return merged records of all files which were read
     */
    public ResultSet parallel() {
        ExecutorService executor = Executors.newFixedThreadPool(threads());
        CompletionService<SampleRecords> completionService = new ExecutorCompletionService<>(executor);
        List<SampleRecords> fragments = new ArrayList<>();
        try {
            for (File vcf : conf.files) {
                completionService.submit(new ReportWorker(vcf));
            }
            for (int i = 0; i < conf.files.size(); i++) {
                try {
                    fragments.add(completionService.take().get());
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() instanceof CompletionException ? ex.getCause().getCause() : ex.getCause();
                    logWorkerFailure(null, cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } finally {
            executor.shutdown();
        }
        return ResultSet.merge(fragments);
    }

    private void logWorkerFailure(String vcf, Throwable ex) {
        if (vcf == null) {
            LOG.error(ex, ex.getMessage());
        } else {
            LOG.error(ex, "Processing of ", vcf, " failed: ", ex.getMessage());
        }
    }

    /**
     * Class needed for parallel mode. Each worker will process pipeline for one file.
     */
    private class ReportWorker implements Callable<SampleRecords> {
        private final File vcf;

        ReportWorker(File vcf) {
            this.vcf = vcf;
        }

        @Override
        public SampleRecords call() {
            return pipeline(vcf, new DirectThreadExecutor()).join().data;
        }
    }

    /**
     * Checks the resources needed by the mode before any file is read.
     */
    protected void checkPreconditions() {
    }

    protected abstract RecordExtractor extractor();

    protected abstract PostProcessModule postProcessModule();

    protected abstract ReportLayout layout();
}
