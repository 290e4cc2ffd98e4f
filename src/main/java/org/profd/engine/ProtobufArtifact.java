package org.profd.engine;

import com.google.protobuf.MessageLite;
import org.profd.api.engine.IArtifact;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Adapts a Protocol Buffers message to {@link IArtifact}.
 */
public final class ProtobufArtifact implements IArtifact {

    private final MessageLite message;

    public ProtobufArtifact(final MessageLite message) {
        this.message = Objects.requireNonNull(message, "message cannot be null");
    }

    @Override
    public int serializedSize() {
        return message.getSerializedSize();
    }

    @Override
    public void writeTo(final OutputStream out) throws IOException {
        message.writeTo(out);
    }

    public MessageLite message() {
        return message;
    }
}
