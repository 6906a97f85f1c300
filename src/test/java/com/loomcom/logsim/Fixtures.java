package com.loomcom.logsim;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads the definition files under src/test/resources/circuits.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String circuit(String name) {
        String resource = "/circuits/" + name;
        try (InputStream in = Fixtures.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + resource);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[4096];
            int n;
            while ((n = in.read(buffer)) > 0) {
                out.write(buffer, 0, n);
            }
            return new String(out.toByteArray(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * A definition with the three blocks around the given list contents.
     */
    public static String definition(String devices, String connections, String monitors) {
        return "DEVICES [\n" + devices + "\n];\nCONNECTIONS [\n" + connections + "\n];\nMONITORS [\n" + monitors + "\n];\n";
    }
}
