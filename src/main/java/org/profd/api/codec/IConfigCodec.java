package org.profd.api.codec;

import org.profd.api.contracts.ProfilingConfig;
import org.profd.api.errors.ConfigDecodeException;
import org.profd.session.SessionConfiguration;

/**
 * Converts between the encoded structured configuration and its field representation.
 * Decoded messages keep field presence, so callers can tell an explicit zero from an absent field.
 */
public interface IConfigCodec {

    /**
     * Decodes an encoded configuration blob.
     *
     * @param blob The encoded bytes.
     * @return The decoded message with presence information.
     * @throws ConfigDecodeException if the blob is malformed.
     */
    ProfilingConfig decode(byte[] blob) throws ConfigDecodeException;

    /**
     * Encodes every field of the given configuration.
     *
     * @param configuration The configuration to encode.
     * @return The encoded bytes.
     */
    byte[] encode(SessionConfiguration configuration);
}
