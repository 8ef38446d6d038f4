package nl.nfi.djcyk.serialize;

public final class Config {

    public static final String SERIALIZED_FORMAT_VERSION = "0.1.0";

    private Config() {
    }
}
