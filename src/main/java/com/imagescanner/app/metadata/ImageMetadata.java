package com.imagescanner.app.metadata;

import java.util.Map;

public record ImageMetadata(int width, int height, Map<String, String> tags) {

    public ImageMetadata {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }
}
