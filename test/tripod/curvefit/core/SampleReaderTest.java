package tripod.curvefit.core;

import java.io.IOException;
import java.io.StringReader;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SampleReaderTest {

    @Test
    void readsConsecutiveSamples () throws Exception {
        SampleReader reader = new SampleReader (new StringReader
            ("# x then y\n1, 2, 3\n4;5;6\n\n0.5 1.5\n2 4\n"));
        Sample first = reader.read();
        assertArrayEquals(new double[]{1, 2, 3}, first.getX());
        assertArrayEquals(new double[]{4, 5, 6}, first.getY());
        assertEquals("sample@2", first.getName());

        Sample second = reader.read();
        assertArrayEquals(new double[]{0.5, 1.5}, second.getX());
        assertArrayEquals(new double[]{2, 4}, second.getY());

        assertNull(reader.read());
        reader.close();
    }

    @Test
    void missingYLineIsAnError () {
        SampleReader reader = new SampleReader (new StringReader ("1 2 3\n"));
        IOException ex = assertThrows(IOException.class, () -> reader.read());
        assertTrue(ex.getMessage().contains("without y"));
    }

    @Test
    void badTokenIsAnError () {
        SampleReader reader = new SampleReader 
            (new StringReader ("1 2 3\n4 five 6\n"));
        IOException ex = assertThrows(IOException.class, () -> reader.read());
        assertTrue(ex.getCause() instanceof NumberParseException);
        assertEquals("five", ((NumberParseException)ex.getCause()).getToken());
    }

    @Test
    void mismatchedLinesAreAnError () {
        SampleReader reader = new SampleReader 
            (new StringReader ("1 2 3\n4 5\n"));
        IOException ex = assertThrows(IOException.class, () -> reader.read());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }
}
