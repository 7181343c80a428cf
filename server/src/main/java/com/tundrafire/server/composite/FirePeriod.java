package com.tundrafire.server.composite;

import com.tundrafire.server.index.IndexBand;

public enum FirePeriod {
    PRE("pre_", -1),
    POST("post_", 1);

    private final String prefix;
    private final int yearOffset;

    FirePeriod(String prefix, int yearOffset) {
        this.prefix = prefix;
        this.yearOffset = yearOffset;
    }

    public int getYearOffset() {
        return yearOffset;
    }

    public String bandName(IndexBand band) {
        return prefix + band.getBandName();
    }
}
