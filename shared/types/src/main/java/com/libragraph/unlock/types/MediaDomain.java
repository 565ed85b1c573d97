package com.libragraph.unlock.types;

public enum MediaDomain {
    AUDIO("audio"),
    IMAGE("image");

    private final String label;

    MediaDomain(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
