package io.lapse4j.spi;

import io.lapse4j.filter.TimedItem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface ImageCatalog {

    /**
     * Every image of a collection with its capture time, in any order.
     */
    List<TimedItem<Path>> list(String collection) throws IOException;
}
