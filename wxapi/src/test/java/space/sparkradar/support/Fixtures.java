package space.sparkradar.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

public final class Fixtures {
    private static final ObjectMapper OM = new ObjectMapper();

    private Fixtures() {
    }

    public static JsonNode json(String name) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            if (in == null)
                throw new IllegalArgumentException("Fixture not found: " + name);
            return OM.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read fixture " + name, e);
        }
    }
}
