package com.astrazeneca.cfdna;

import com.astrazeneca.cfdna.exception.ConfigurationException;
import com.astrazeneca.cfdna.exception.ExternalToolException;

public class Main {
    /**
     * Builds the report chosen by the first command line argument
     * @param args array of arguments from command line
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * @param args array of arguments from command line
     * @return exit code: 0 on success, help or version, 1 on configuration or external tool error
     */
    static int run(String[] args) {
        try {
            Configuration config = new CmdParser().parseParams(args);
            if (config != null) {
                new ReportLauncher().start(config);
            }
            return 0;
        } catch (ConfigurationException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.err.println("USAGE: " + CmdParser.USAGE);
            System.err.println("Run 'cfdna-report <report type> -h' to see the options of the report.");
            return 1;
        } catch (ExternalToolException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 1;
        }
    }
}
