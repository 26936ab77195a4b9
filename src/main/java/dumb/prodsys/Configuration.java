package dumb.prodsys;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.prodsys.util.Json;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Per-run settings. Missing JSON properties fall back to the defaults.
 */
public record Configuration(
        @JsonProperty("strategy") Strategy strategy,
        @JsonProperty("trace") boolean trace
) {
    static final Strategy DEFAULT_STRATEGY = Strategy.PRIORITY;
    static final boolean DEFAULT_TRACE = false;
    public static final String DEFAULT_RESOURCE = "prodsys.json";

    public Configuration {
        requireNonNull(strategy);
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("strategy") Strategy strategy,
            @JsonProperty("trace") Boolean trace
    ) {
        this(
                strategy != null ? strategy : DEFAULT_STRATEGY,
                trace != null ? trace : DEFAULT_TRACE
        );
    }

    public Configuration() {
        this(DEFAULT_STRATEGY, DEFAULT_TRACE);
    }

    public Configuration(Strategy strategy) {
        this(strategy, DEFAULT_TRACE);
    }

    public Configuration withStrategy(Strategy s) {
        return new Configuration(s, trace);
    }

    public static Configuration parse(String json) throws IOException {
        return Json.obj(json, Configuration.class);
    }

    public static Configuration load(Path file) throws IOException {
        return Json.obj(file, Configuration.class);
    }

    /** Reads a classpath resource, or returns the defaults when it is absent. */
    public static Configuration resource(String name) {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(name)) {
            return in == null ? new Configuration() : Json.obj(in, Configuration.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read configuration resource " + name, e);
        }
    }
}
