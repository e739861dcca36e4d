package com.gt.chamlang.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.chamlang.serialization.SrAlgorithmSerializer;

@JsonSerialize(using = SrAlgorithmSerializer.class)
public enum SrAlgorithm {
    Sm2("sm2"),
    ModifiedSm2("modifiedsm2"),
    Simple("simple");

    private final String tag;

    SrAlgorithm(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static SrAlgorithm fromTag(String tag) {
        if (tag == null) {
            return null;
        }

        for (SrAlgorithm srAlgorithm : values()) {
            if (srAlgorithm.tag.equalsIgnoreCase(tag.trim())) {
                return srAlgorithm;
            }
        }

        return null;
    }
}
