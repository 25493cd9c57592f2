package com.ymcmp.arkade.ast;

public enum IoSource {
    INPUTS("inputs", "Inputs"),
    OUTPUTS("outputs", "Outputs");

    public final String path;
    public final String suffix;

    private IoSource(String path, String suffix) {
        this.path = path;
        this.suffix = suffix;
    }
}
