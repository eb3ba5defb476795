package io.lapse4j.spi;

import java.io.IOException;

public interface ImageFetcher {

    /**
     * Fetch the current image of a camera.
     *
     * @param source camera location, e.g. a snapshot URL
     * @return encoded image bytes
     */
    byte[] fetch(String source) throws IOException;
}
