package org.imagebatch.plugin;

/**
 * Creates the codec a worker uses. Called once per worker when the worker pool is built,
 * so any expensive setup (locating binaries, registering decoders) happens there and not
 * on the conversion path.
 */
@FunctionalInterface
public interface CodecFactory {

    /**
     * @throws IllegalStateException if the codec cannot be initialized in this environment
     */
    ImageCodec create();
}
