package com.astrazeneca.cfdna.modules;

import com.astrazeneca.cfdna.data.scopedata.Scope;
import com.astrazeneca.cfdna.data.scopedata.VcfLines;
import com.astrazeneca.cfdna.exception.VcfReadException;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * First step of the per-file pipeline: reads the VCF file to lines.
 */
public class VcfFileReader implements Module<File, VcfLines> {

    /**
     * @throws VcfReadException if the file can't be opened or read
     */
    @Override
    public Scope<VcfLines> process(Scope<File> scope) {
        try {
            return new Scope<>(scope, readVcf(scope.data));
        } catch (IOException e) {
            throw new VcfReadException(scope.source, e);
        }
    }

    /**
     * Reads VCF file line by line. Empty lines are skipped.
     * @param vcf VCF file
     * @return meta header, column header and data lines of the file
     * @throws IOException if file can't be read
     */
    public static VcfLines readVcf(File vcf) throws IOException {
        List<String> metaLines = new ArrayList<>();
        List<String> dataLines = new ArrayList<>();
        String columnHeader = null;
        try (BufferedReader vcfReader = new BufferedReader(new FileReader(vcf, StandardCharsets.UTF_8))) {
            String line;
            while ((line = vcfReader.readLine()) != null) {
                if (line.trim().isEmpty()) {
                    continue;
                }
                if (line.startsWith("##")) {
                    metaLines.add(line);
                } else if (line.startsWith("#")) {
                    columnHeader = line;
                } else {
                    dataLines.add(line);
                }
            }
        }
        return new VcfLines(metaLines, columnHeader, dataLines);
    }
}
