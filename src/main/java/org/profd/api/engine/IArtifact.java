package org.profd.api.engine;

import java.io.IOException;
import java.io.OutputStream;

/**
 * A single unit of output produced by a sampling round.
 * <p>
 * The session controller and the delivery sink never interpret the contents of an artifact.
 * They only need its serialized size, to pick a delivery route, and a way to write it out.
 */
public interface IArtifact {

    /**
     * Returns the number of bytes {@link #writeTo(OutputStream)} will produce.
     *
     * @return The serialized size in bytes.
     */
    int serializedSize();

    /**
     * Serializes the artifact into the given stream. The stream is not closed.
     *
     * @param out The destination stream.
     * @throws IOException if the artifact cannot be serialized or the stream fails.
     */
    void writeTo(OutputStream out) throws IOException;
}
