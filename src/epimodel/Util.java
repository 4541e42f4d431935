package epimodel;

import java.io.*;
import java.util.Locale;

class Util {
    static PrintStream openBufferedPrintStream(String path) throws FileNotFoundException {
        FileOutputStream fileStream = new FileOutputStream(path);
        BufferedOutputStream bufStream = new BufferedOutputStream(fileStream);
        return new PrintStream(bufStream);
    }

    static String runFilename(String base, String extension, Integer runNum) {
        if(runNum == null) {
            return base + "." + extension;
        }
        else {
            return String.format("%s.%d.%s", base, runNum, extension);
        }
    }

    static String formatNumber(double x) {
        if(Double.isFinite(x)) {
            return String.format(Locale.ROOT, "%f", x);
        }
        else {
            return "";
        }
    }
}
