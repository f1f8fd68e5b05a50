package io.providerbridge.json.spi;

/**
 * {@link java.util.ServiceLoader} SPI for contributing a {@link JsonCodec}.
 */
public interface JsonCodecProvider {
    JsonCodec codec();
}
