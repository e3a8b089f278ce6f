package tripod.curvefit.core;

import java.io.*;
import java.util.logging.Logger;

/**
 * Reads a sample from a text stream; the first non-blank line holds
 * the x values and the next one the y values, each delimited as
 * accepted by {@link NumberParser}. Lines starting with # are ignored.
 */
public class SampleReader implements Closeable {
    private static final Logger logger = 
        Logger.getLogger(SampleReader.class.getName());

    static int DEBUG = Integer.getInteger("reader.debug", 0);

    private int lines;
    private BufferedReader reader;

    public SampleReader (InputStream is) throws IOException {
        this (new InputStreamReader (is, "UTF-8"));
    }

    public SampleReader (Reader reader) {
        this.reader = new BufferedReader (reader);
    }

    /**
     * @return the next sample or null if the stream is exhausted
     * @throws IOException if there's an x line without a y line or a
     *  line that doesn't parse
     */
    public Sample read () throws IOException {
        String xs = nextLine ();
        if (xs == null) {
            return null;
        }
        int xline = lines;

        String ys = nextLine ();
        if (ys == null) {
            throw new IOException ("Line "+xline+": x values without y values");
        }

        try {
            Sample sample = Sample.parse(xs, ys);
            sample.setName("sample@"+xline);
            if (DEBUG > 0) {
                logger.info("** Read "+sample.size()+" pair(s) at line "+xline);
            }
            return sample;
        }
        catch (NumberParseException ex) {
            throw new IOException ("Lines "+xline+"-"+lines+": "
                                   +ex.getMessage(), ex);
        }
        catch (IllegalArgumentException ex) {
            throw new IOException ("Lines "+xline+"-"+lines+": "
                                   +ex.getMessage(), ex);
        }
    }

    String nextLine () throws IOException {
        for (String line; (line = reader.readLine()) != null; ) {
            ++lines;
            String s = line.trim();
            if (s.length() > 0 && !s.startsWith("#")) {
                return s;
            }
        }
        return null;
    }

    public int getLineCount () { return lines; }

    public void close () throws IOException {
        reader.close();
    }
}
