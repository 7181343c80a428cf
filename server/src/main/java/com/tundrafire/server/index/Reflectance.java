package com.tundrafire.server.index;

/**
 * Surface reflectance of one pixel. Mutable so a single instance can be reused across a raster scan.
 */
public final class Reflectance {
    public double blue;
    public double green;
    public double red;
    public double nir;
    public double sswir;
    public double lswir;

    public Reflectance() {
    }

    public Reflectance(double blue, double green, double red, double nir, double sswir, double lswir) {
        this.blue = blue;
        this.green = green;
        this.red = red;
        this.nir = nir;
        this.sswir = sswir;
        this.lswir = lswir;
    }
}
