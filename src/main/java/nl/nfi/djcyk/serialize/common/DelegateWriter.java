package nl.nfi.djcyk.serialize.common;

import java.io.IOException;

public interface DelegateWriter<T> {

    void write(final T value) throws IOException;
}
