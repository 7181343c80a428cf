package com.tundrafire.server.pipeline;

public enum RoiMode {
    /** A user-drawn polygon, exported as a single region. */
    DRAWN_POLYGON,
    /** The configured study region, exported tile by tile. */
    DEFAULT_REGION
}
