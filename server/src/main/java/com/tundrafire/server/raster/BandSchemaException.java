package com.tundrafire.server.raster;

/**
 * Raised when a raster does not carry the bands a processing step requires.
 */
public class BandSchemaException extends RuntimeException {

    public BandSchemaException(String message) {
        super(message);
    }
}
